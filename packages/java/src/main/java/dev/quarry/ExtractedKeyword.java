package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * A keyword or keyphrase with its relevance score.
 *
 * @param text the keyword text
 * @param score relevance in (0, 1], higher is more relevant
 * @param algorithm the algorithm that produced it ("yake" or "rake")
 * @param positions character offsets of the occurrences in the content
 */
public record ExtractedKeyword(
    @JsonProperty("text") String text,
    @JsonProperty("score") double score,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("positions") List<Integer> positions
) {
    @JsonCreator
    public ExtractedKeyword {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        positions = positions != null ? List.copyOf(positions) : List.of();
    }
}
