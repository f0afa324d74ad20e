package dev.quarry;

/**
 * The validation kind: a validator rejected a result, or an argument or configuration value was
 * out of range.
 */
public final class ValidationException extends QuarryException {
    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION, message, cause);
    }
}
