package dev.quarry;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervising boundary for public entry points.
 *
 * <p>Typed failures pass through unchanged. Anything unexpected, including {@link Error}s such as
 * {@link StackOverflowError}, is converted into a {@link QuarryException} whose
 * {@link ErrorDetails} carry the captured source location, stack trace and operation context.
 * The result is also stored as the process-wide last fault.</p>
 *
 * @since 1.0.0
 */
public final class FaultGuard {
    private static final Logger LOG = LoggerFactory.getLogger(FaultGuard.class);
    private static final int MAX_TRACE_CHARS = 16_384;

    private FaultGuard() {
    }

    /**
     * Runs {@code body}, converting every failure into a typed {@link QuarryException}.
     *
     * @param operation name recorded in the fault context
     * @param body work to run
     * @param <T> result type
     * @return the body's result
     * @throws QuarryException typed failure
     */
    public static <T> T call(String operation, Callable<T> body) throws QuarryException {
        try {
            return body.call();
        } catch (Throwable t) {
            throw convert(operation, t);
        }
    }

    /**
     * Runs {@code body} without a result.
     *
     * @param operation name recorded in the fault context
     * @param body work to run
     * @throws QuarryException typed failure
     */
    public static void run(String operation, CheckedRunnable body) throws QuarryException {
        call(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Converts a throwable into the typed exception the boundary reports.
     *
     * @param operation name recorded in the fault context
     * @param error the failure
     * @return typed exception, already recorded as the thread's last error
     */
    public static QuarryException convert(String operation, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ThreadDeath) {
            throw (ThreadDeath) cause;
        }
        QuarryException converted;
        if (cause instanceof QuarryException) {
            converted = (QuarryException) cause;
            ErrorUtils.recordError(converted.toErrorDetails());
            return converted;
        }
        if (cause instanceof IOException) {
            converted = new QuarryException.Io(ErrorUtils.messageOf(cause), cause);
        } else if (cause instanceof UncheckedIOException) {
            converted = new QuarryException.Io(ErrorUtils.messageOf(cause.getCause()), cause);
        } else if (cause instanceof IllegalArgumentException) {
            converted = new ValidationException(ErrorUtils.messageOf(cause), cause);
        } else if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            converted = new QuarryException("Interrupted during " + operation, cause);
        } else {
            return captureFault(operation, cause);
        }
        ErrorUtils.recordError(converted.toErrorDetails());
        return converted;
    }

    private static QuarryException captureFault(String operation, Throwable fault) {
        String message = ErrorUtils.messageOf(fault);
        ErrorCode kind = ErrorUtils.classifyError(message);
        String summary = fault.getClass().getSimpleName() + " during " + operation + ": " + message;
        ErrorDetails details = ErrorDetails.builder(kind)
            .message(summary)
            .source(sourceOf(fault))
            .trace(traceOf(fault))
            .contextValue("operation", operation)
            .contextValue("thread", Thread.currentThread().getName())
            .contextValue("exception", fault.getClass().getName())
            .fault(true)
            .build();
        ErrorUtils.recordFault(details);
        LOG.warn("Captured fault in {}: {}", operation, summary);
        return QuarryException.of(kind, summary, fault).withDetails(details);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String sourceOf(Throwable fault) {
        StackTraceElement[] frames = fault.getStackTrace();
        if (frames == null || frames.length == 0) {
            return null;
        }
        StackTraceElement top = frames[0];
        return top.getClassName() + "#" + top.getMethodName() + ":" + top.getLineNumber();
    }

    private static String traceOf(Throwable fault) {
        StringWriter writer = new StringWriter();
        try (PrintWriter printer = new PrintWriter(writer)) {
            fault.printStackTrace(printer);
        }
        String trace = writer.toString();
        return trace.length() > MAX_TRACE_CHARS ? trace.substring(0, MAX_TRACE_CHARS) : trace;
    }

    /**
     * Runnable that may throw.
     */
    @FunctionalInterface
    public interface CheckedRunnable {
        void run() throws Exception;
    }
}
