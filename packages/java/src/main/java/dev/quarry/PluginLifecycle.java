package dev.quarry;

/**
 * Lifecycle hooks shared by every plugin kind.
 *
 * <p>The registry calls {@link #initialize()} once when the plugin is registered and
 * {@link #shutdown()} once when it is unregistered, replaced or cleared. Both default to no-ops
 * so plugins can still be written as lambdas.</p>
 */
public interface PluginLifecycle {
    /**
     * Prepare the plugin for use.
     *
     * @throws QuarryException if the plugin cannot start; registration then fails
     */
    default void initialize() throws QuarryException {
    }

    /**
     * Release resources held by the plugin.
     *
     * @throws QuarryException if cleanup fails; the registry logs and continues
     */
    default void shutdown() throws QuarryException {
    }
}
