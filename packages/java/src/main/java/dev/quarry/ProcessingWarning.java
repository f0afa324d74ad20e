package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A non-fatal problem recorded while producing a result.
 *
 * @param source stage that produced the warning (e.g. "ocr", "embedding", "mime")
 * @param message human-readable description
 */
public record ProcessingWarning(
    @JsonProperty("source") String source,
    @JsonProperty("message") String message
) {
    @JsonCreator
    public ProcessingWarning {
        Objects.requireNonNull(source, "source must not be null");
        message = message != null ? message : "";
    }
}
