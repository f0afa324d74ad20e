package dev.quarry.batch;

import dev.quarry.BatchItemResult;
import dev.quarry.ErrorCode;
import dev.quarry.ErrorUtils;
import dev.quarry.ExtractionResult;
import dev.quarry.FaultGuard;
import dev.quarry.QuarryException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs extractions on a bounded pool of daemon workers.
 *
 * <p>Batch items are isolated: each failure becomes a {@link BatchItemResult} carrying its
 * {@code ErrorDetails}, and results always come back in input order. A batch started from inside a
 * worker runs its items on that worker, so nested batches cannot starve the pool.</p>
 */
public final class BatchOrchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final ThreadPoolExecutor executor;
    private final int poolSize;

    public BatchOrchestrator() {
        this(defaultPoolSize());
    }

    public BatchOrchestrator(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be positive, got " + poolSize);
        }
        this.poolSize = poolSize;
        AtomicInteger threadIds = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(poolSize, poolSize, 60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(), runnable -> {
                Worker worker = new Worker(this, runnable,
                    "quarry-worker-" + threadIds.incrementAndGet());
                worker.setDaemon(true);
                return worker;
            });
        this.executor.allowCoreThreadTimeOut(true);
    }

    public static int defaultPoolSize() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public int poolSize() {
        return poolSize;
    }

    /**
     * One labelled batch input.
     *
     * @param source path, or a {@code bytes[i]} label
     * @param task the extraction
     */
    public record BatchItem(String source, Task<ExtractionResult> task) {
        public BatchItem {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(task, "task must not be null");
        }
    }

    /**
     * Runs every item and waits for all of them.
     *
     * @param items inputs, in order
     * @param maxConcurrent per-batch parallelism cap, or null for the pool size
     * @return one result per item, in input order
     * @throws QuarryException if the calling thread is interrupted while dispatching or waiting
     */
    public List<BatchItemResult> extractAll(List<BatchItem> items, Integer maxConcurrent) throws QuarryException {
        Objects.requireNonNull(items, "items must not be null");
        List<BatchItemResult> results = new ArrayList<>(items.size());
        if (items.isEmpty()) {
            return results;
        }
        if (isOwnWorker()) {
            for (int i = 0; i < items.size(); i++) {
                results.add(runItem(i, items.get(i)));
            }
            return results;
        }
        int limit = Math.max(1, Math.min(items.size(), maxConcurrent != null ? maxConcurrent : poolSize));
        LOG.debug("Dispatching batch of {} with parallelism {}", items.size(), limit);
        Semaphore permits = new Semaphore(limit);
        List<CompletableFuture<BatchItemResult>> futures = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            int index = i;
            BatchItem item = items.get(i);
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(false));
                throw Futures.interrupted(e);
            }
            CompletableFuture<BatchItemResult> future;
            try {
                future = CompletableFuture.supplyAsync(() -> runItem(index, item), executor);
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.completedFuture(BatchItemResult.failure(index, item.source(),
                    QuarryException.of(ErrorCode.INTERNAL, "Worker pool is shut down", e).toErrorDetails()));
            }
            futures.add(future.whenComplete((r, e) -> permits.release()));
        }
        for (CompletableFuture<BatchItemResult> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                throw Futures.interrupted(e);
            } catch (ExecutionException e) {
                throw Futures.unwrap(e);
            }
        }
        return results;
    }

    /**
     * Runs {@code task} on the pool.
     *
     * @param operation name recorded if the task faults
     * @param task the work
     * @param <T> result type
     * @return a future completed with the result, or exceptionally with a {@link QuarryException}
     */
    public <T> CompletableFuture<T> submit(String operation, Task<T> task) {
        return defer(operation, task).toCompletableFuture();
    }

    /**
     * Runs {@code task} on the pool behind a pollable handle.
     *
     * @param operation name recorded if the task faults
     * @param task the work
     * @param <T> result type
     * @return the handle
     */
    public <T> DeferredExtraction<T> defer(String operation, Task<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> worker;
        try {
            worker = executor.submit(() -> {
                try {
                    result.complete(FaultGuard.call(operation, task::call));
                } catch (QuarryException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(QuarryException.of(ErrorCode.INTERNAL, "Worker pool is shut down", e));
            worker = null;
        }
        return new DeferredExtraction<>(result, worker);
    }

    private static BatchItemResult runItem(int index, BatchItem item) {
        try {
            return BatchItemResult.success(index, item.source(), FaultGuard.call("batch_item", item.task()::call));
        } catch (QuarryException e) {
            LOG.debug("Batch item {} ({}) failed: {}", index, item.source(), e.getMessage());
            return BatchItemResult.failure(index, item.source(), ErrorUtils.toErrorDetails(e));
        }
    }

    private boolean isOwnWorker() {
        Thread current = Thread.currentThread();
        return current instanceof Worker && ((Worker) current).owner == this;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not stop within 5s, interrupting {} running tasks",
                    executor.getActiveCount());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    private static final class Worker extends Thread {
        private final BatchOrchestrator owner;

        Worker(BatchOrchestrator owner, Runnable runnable, String name) {
            super(runnable, name);
            this.owner = owner;
        }
    }
}
