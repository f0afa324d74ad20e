/**
 * Immutable extraction configuration.
 *
 * <p>Each class is built with a fluent builder and converts to the snake_case map form used in
 * JSON, YAML and TOML configuration files.</p>
 */
package dev.quarry.config;
