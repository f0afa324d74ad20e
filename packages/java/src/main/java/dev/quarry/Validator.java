package dev.quarry;

import java.util.Objects;

/**
 * Final check on a finished extraction result.
 *
 * <p>Validators run once per extraction, after every post-processing stage, highest registration
 * priority first. The first one to throw {@link ValidationException} fails the extraction with the
 * validation kind. Any other exception is reported as a plugin failure naming the validator.</p>
 *
 * <pre>{@code
 * Quarry.registerValidator("non-empty", result -> {
 *     if (result.getContent().isBlank()) {
 *         throw new ValidationException("no text extracted from " + result.getMimeType());
 *     }
 * }, 10);
 * }</pre>
 */
@FunctionalInterface
public interface Validator extends PluginLifecycle {
    /**
     * @param result the result the caller would receive
     * @throws ValidationException to reject it
     */
    void validate(ExtractionResult result) throws ValidationException;

    /**
     * Runs this validator, then {@code after}. The composite stops at the first rejection.
     */
    default Validator andThen(Validator after) {
        Objects.requireNonNull(after, "after validator must not be null");
        return result -> {
            validate(result);
            after.validate(result);
        };
    }
}
