package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of an OCR backend for one image.
 *
 * @param text full recognized text
 * @param elements per-element confidence and geometry, possibly empty
 * @param rotation detected page rotation in degrees, null when unknown
 */
public record OcrResult(
    @JsonProperty("text") String text,
    @JsonProperty("elements") List<OcrElement> elements,
    @JsonProperty("rotation") Double rotation
) {
    @JsonCreator
    public OcrResult {
        text = text != null ? text : "";
        elements = elements != null ? List.copyOf(elements) : List.of();
    }

    /**
     * Result carrying only text, for backends that report nothing else.
     *
     * @param text recognized text
     * @return OCR result without elements
     */
    public static OcrResult ofText(String text) {
        return new OcrResult(Objects.requireNonNull(text, "text must not be null"), List.of(), null);
    }

    /**
     * Mean element confidence.
     *
     * @return mean confidence, empty when the backend reported no elements
     */
    @JsonIgnore
    public Optional<Double> meanConfidence() {
        if (elements.isEmpty()) {
            return Optional.empty();
        }
        double sum = 0.0;
        for (OcrElement element : elements) {
            sum += element.confidence();
        }
        return Optional.of(sum / elements.size());
    }
}
