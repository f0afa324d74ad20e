package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Text of a single page, slide or sheet.
 *
 * @param pageNumber 1-indexed page number
 * @param content page text
 * @param hasVisualContent whether the page carries images or drawings
 * @param textCoverage fraction of the page area covered by text, in [0, 1]
 */
public record PageContent(
    @JsonProperty("page_number") int pageNumber,
    @JsonProperty("content") String content,
    @JsonProperty("has_visual_content") boolean hasVisualContent,
    @JsonProperty("text_coverage") double textCoverage
) {
    @JsonCreator
    public PageContent {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("page number must be positive");
        }
        Objects.requireNonNull(content, "content must not be null");
        textCoverage = Math.max(0.0, Math.min(1.0, textCoverage));
    }

    public PageContent withContent(String newContent) {
        return new PageContent(pageNumber, newContent, hasVisualContent, textCoverage);
    }
}
