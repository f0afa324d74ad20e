package dev.quarry.batch;

import dev.quarry.QuarryException;

/**
 * Unit of work run on the worker pool.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface Task<T> {
    T call() throws QuarryException;
}
