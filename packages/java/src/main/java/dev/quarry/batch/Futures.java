package dev.quarry.batch;

import dev.quarry.ErrorCode;
import dev.quarry.QuarryException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

final class Futures {
    private Futures() {
    }

    static QuarryException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof QuarryException) {
            return (QuarryException) cause;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return QuarryException.of(ErrorCode.INTERNAL, "Task failed: " + cause, cause);
    }

    static QuarryException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        return QuarryException.of(ErrorCode.INTERNAL, "Interrupted while waiting for extraction", e);
    }

    static QuarryException cancelled(CancellationException e) {
        return QuarryException.of(ErrorCode.INTERNAL, "Extraction was cancelled", e);
    }
}
