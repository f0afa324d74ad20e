package dev.quarry.batch;

import dev.quarry.QuarryException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to work running on the worker pool.
 *
 * <p>Waiting with a bound never loses the computation: after {@link #await(Duration)} times out, a
 * later {@link #getResult()} still returns the result. Dropping a handle does not stop the work.
 * {@link #cancel()} is best-effort: it interrupts the worker, but an extraction already inside a
 * parser or an OCR backend may run to completion.</p>
 *
 * @param <T> result type
 */
public final class DeferredExtraction<T> {
    private final CompletableFuture<T> result;
    private final Future<?> worker;

    DeferredExtraction(CompletableFuture<T> result, Future<?> worker) {
        this.result = Objects.requireNonNull(result, "result must not be null");
        this.worker = worker;
    }

    /**
     * Whether the work has finished, successfully or not.
     *
     * @return true once a result or failure is available
     */
    public boolean isReady() {
        return result.isDone();
    }

    /**
     * Non-blocking poll.
     *
     * @return the result, or empty while the work is pending
     * @throws QuarryException the work's failure, if it failed
     */
    public Optional<T> tryGetResult() throws QuarryException {
        if (!result.isDone()) {
            return Optional.empty();
        }
        return Optional.ofNullable(getResult());
    }

    /**
     * Blocks until the work finishes.
     *
     * @return the result
     * @throws QuarryException the work's failure
     */
    public T getResult() throws QuarryException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw Futures.unwrap(e);
        } catch (InterruptedException e) {
            throw Futures.interrupted(e);
        } catch (CancellationException e) {
            throw Futures.cancelled(e);
        }
    }

    /**
     * Blocks for at most {@code timeout}.
     *
     * @param timeout maximum wait; zero polls
     * @return the result, or empty if the work is still running when the wait ends
     * @throws QuarryException the work's failure
     */
    public Optional<T> await(Duration timeout) throws QuarryException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        try {
            return Optional.ofNullable(result.get(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw Futures.unwrap(e);
        } catch (InterruptedException e) {
            throw Futures.interrupted(e);
        } catch (CancellationException e) {
            throw Futures.cancelled(e);
        }
    }

    /**
     * Best-effort cancellation.
     *
     * @return true if the handle moved to the cancelled state
     */
    public boolean cancel() {
        if (worker != null) {
            worker.cancel(true);
        }
        return result.cancel(false);
    }

    public boolean isCancelled() {
        return result.isCancelled();
    }

    /**
     * A future view of this handle; completing it does not affect the handle.
     *
     * @return a dependent copy of the underlying future
     */
    public CompletableFuture<T> toCompletableFuture() {
        return result.copy();
    }
}
