package dev.quarry.plugins;

import dev.quarry.ProcessingStage;
import java.util.Objects;
import java.util.Set;

/**
 * One named plugin in a {@link PluginNamespace}.
 *
 * @param name trimmed, non-blank plugin name
 * @param plugin the plugin instance
 * @param priority higher runs (or wins) first
 * @param stage pipeline stage, only meaningful for post-processors
 * @param mimeTypes canonical MIME types, only meaningful for document extractors
 * @param <T> plugin type
 */
public record PluginRegistration<T>(String name, T plugin, int priority, ProcessingStage stage, Set<String> mimeTypes) {
    public PluginRegistration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(plugin, "plugin must not be null");
        mimeTypes = mimeTypes != null ? Set.copyOf(mimeTypes) : Set.of();
    }

    public static <T> PluginRegistration<T> of(String name, T plugin, int priority) {
        return new PluginRegistration<>(name, plugin, priority, null, Set.of());
    }
}
