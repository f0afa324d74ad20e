package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A recognized text element (word or line) with its confidence and geometry.
 *
 * @param text recognized text
 * @param confidence confidence in [0, 1]
 * @param geometry bounding box, may be null if the backend does not report geometry
 */
public record OcrElement(
    @JsonProperty("text") String text,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("geometry") BoundingBox geometry
) {
    @JsonCreator
    public OcrElement {
        Objects.requireNonNull(text, "text must not be null");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
    }
}
