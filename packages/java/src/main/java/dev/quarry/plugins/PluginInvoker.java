package dev.quarry.plugins;

import dev.quarry.FaultGuard;
import dev.quarry.QuarryException;
import java.util.concurrent.Callable;

/**
 * Calls into plugin code and converts what escapes it.
 *
 * <p>Typed {@link QuarryException}s (including validation failures) pass through unchanged.
 * Any other throwable becomes a {@link QuarryException.Plugin} naming the plugin, except
 * {@link VirtualMachineError}s, which are captured as a fault and rethrown.</p>
 */
public final class PluginInvoker {
    private PluginInvoker() {
    }

    /**
     * Invoke plugin code.
     *
     * @param kind namespace of the plugin
     * @param name plugin name
     * @param body the call into the plugin
     * @param <T> result type
     * @return the plugin's return value
     * @throws QuarryException typed failure from the plugin, or {@code Plugin} for anything else
     */
    public static <T> T invoke(PluginKind kind, String name, Callable<T> body) throws QuarryException {
        try {
            return body.call();
        } catch (QuarryException e) {
            throw e;
        } catch (VirtualMachineError e) {
            FaultGuard.convert(kind.displayName() + " '" + name + "'", e);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QuarryException.Plugin(name, kind.displayName() + " '" + name + "' was interrupted", e);
        } catch (Throwable e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new QuarryException.Plugin(name, kind.displayName() + " '" + name + "' failed: " + message, e);
        }
    }
}
