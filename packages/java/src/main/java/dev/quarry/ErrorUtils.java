package dev.quarry;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Utility functions for error handling and classification.
 *
 * <p>Provides access to error details, error code classification, error code metadata and the
 * captured-fault slot used for post-mortem diagnostics.</p>
 *
 * @since 1.0.0
 */
public final class ErrorUtils {
    private static final AtomicReference<ErrorDetails> LAST_FAULT = new AtomicReference<>();
    private static final ThreadLocal<ErrorDetails> LAST_ERROR = new ThreadLocal<>();

    private static final String[] VALIDATION_HINTS = {
        "validation", "invalid argument", "schema", "required field",
    };
    private static final String[] UNSUPPORTED_HINTS = {
        "unsupported", "unknown format", "mime type",
    };
    private static final String[] PARSING_HINTS = {
        "parse", "parsing", "unexpected token", "corrupt", "malformed", "decode", "invalid format",
    };
    private static final String[] OCR_HINTS = {"ocr", "tesseract", "recognition"};
    private static final String[] DEPENDENCY_HINTS = {
        "not installed", "missing dependency", "dependency", "not available",
    };
    private static final String[] CACHE_HINTS = {"cache"};
    private static final String[] IMAGE_HINTS = {"image processing", "image decode", "resize"};
    private static final String[] PLUGIN_HINTS = {"plugin", "processor", "validator"};
    private static final String[] IO_HINTS = {
        "permission denied", "no such file", "not found", "i/o", "io error", "disk", "access denied",
    };

    private ErrorUtils() {
    }

    /**
     * Classify an error message into the taxonomy.
     *
     * <p>A best-effort heuristic for failures that do not already carry a kind. Categories are
     * checked in a fixed order so the result is deterministic; e.g. "unsupported" wins over
     * "parse".</p>
     *
     * @param message the error message to classify
     * @return matching code, {@link ErrorCode#INTERNAL} when nothing matches
     * @throws NullPointerException if message is null
     */
    public static ErrorCode classifyError(String message) {
        Objects.requireNonNull(message, "message must not be null");
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.isBlank()) {
            return ErrorCode.INTERNAL;
        }
        if (containsAny(lower, VALIDATION_HINTS)) {
            return ErrorCode.VALIDATION;
        }
        if (containsAny(lower, UNSUPPORTED_HINTS)) {
            return ErrorCode.UNSUPPORTED_FORMAT;
        }
        if (containsAny(lower, PARSING_HINTS)) {
            return ErrorCode.PARSING;
        }
        if (containsAny(lower, OCR_HINTS)) {
            return ErrorCode.OCR;
        }
        if (containsAny(lower, DEPENDENCY_HINTS)) {
            return ErrorCode.MISSING_DEPENDENCY;
        }
        if (containsAny(lower, CACHE_HINTS)) {
            return ErrorCode.CACHE;
        }
        if (containsAny(lower, IMAGE_HINTS)) {
            return ErrorCode.IMAGE_PROCESSING;
        }
        if (containsAny(lower, PLUGIN_HINTS)) {
            return ErrorCode.PLUGIN;
        }
        if (containsAny(lower, IO_HINTS)) {
            return ErrorCode.IO;
        }
        return ErrorCode.INTERNAL;
    }

    /**
     * Get the human-readable name of an error code.
     *
     * @param code the numeric code
     * @return wire name (e.g. "ocr"), or "unknown" if code is invalid
     */
    public static String getErrorCodeName(int code) {
        for (ErrorCode value : ErrorCode.values()) {
            if (value.getCode() == code) {
                return value.wireName();
            }
        }
        return "unknown";
    }

    /**
     * Get the human-readable description of an error code.
     *
     * @param code the numeric code
     * @return description suitable for user-facing messages
     */
    public static String getErrorCodeDescription(int code) {
        for (ErrorCode value : ErrorCode.values()) {
            if (value.getCode() == code) {
                return value.getDescription();
            }
        }
        return "Unknown error";
    }

    /**
     * Map error code integer to ErrorCode enum.
     *
     * @param code the error code
     * @return the ErrorCode enum value
     */
    public static ErrorCode mapErrorCode(int code) {
        return ErrorCode.fromCode(code);
    }

    /**
     * Describe any throwable as {@link ErrorDetails}.
     *
     * <p>Typed {@link QuarryException}s keep their kind; anything else is classified from its
     * message.</p>
     *
     * @param error the failure
     * @return structured details
     */
    public static ErrorDetails toErrorDetails(Throwable error) {
        Objects.requireNonNull(error, "error must not be null");
        if (error instanceof QuarryException) {
            return ((QuarryException) error).toErrorDetails();
        }
        String message = messageOf(error);
        return ErrorDetails.builder(classifyError(message)).message(message).build();
    }

    /**
     * Details of the last failure raised on the calling thread by a Quarry entry point.
     *
     * @return last error details, or empty if the thread has not seen a failure
     */
    public static Optional<ErrorDetails> getErrorDetails() {
        return Optional.ofNullable(LAST_ERROR.get());
    }

    /**
     * The last runtime fault captured anywhere in the process.
     *
     * <p>Faults are unexpected throwables (runtime exceptions, stack overflows, out of memory)
     * converted by the fault guard. The slot holds only the most recent one.</p>
     *
     * @return captured fault, or empty
     */
    public static Optional<ErrorDetails> getLastFault() {
        return Optional.ofNullable(LAST_FAULT.get());
    }

    /**
     * Release the captured fault slot.
     *
     * @return the released details, or empty if nothing was captured
     */
    public static Optional<ErrorDetails> releaseLastFault() {
        return Optional.ofNullable(LAST_FAULT.getAndSet(null));
    }

    static void recordError(ErrorDetails details) {
        LAST_ERROR.set(details);
    }

    static void recordFault(ErrorDetails details) {
        LAST_FAULT.set(details);
        LAST_ERROR.set(details);
    }

    static String messageOf(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static boolean containsAny(String haystack, String[] needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
