package dev.quarry.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import dev.quarry.ExtractedKeyword;
import dev.quarry.config.KeywordConfig;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

final class KeywordExtractorTest {
    private static final String TEXT = "Neural networks are fast. The neural networks and deep learning are popular.";

    private final KeywordExtractor extractor = new KeywordExtractor();

    @Test
    void shouldRankRakePhrasesByDegree() {
        KeywordConfig config = KeywordConfig.builder().algorithm("rake").maxKeywords(2).ngramRange(1, 3).build();

        List<ExtractedKeyword> keywords = extractor.extract(TEXT, config, "en");

        assertThat(keywords).extracting(k -> k.text().toLowerCase(Locale.ROOT))
            .containsExactlyInAnyOrder("neural networks", "deep learning");
        assertThat(keywords).allSatisfy(k -> {
            assertThat(k.score()).isEqualTo(1.0);
            assertThat(k.algorithm()).isEqualTo(KeywordConfig.RAKE);
        });
        assertThat(keywords.stream().filter(k -> k.text().equalsIgnoreCase("neural networks")).findFirst())
            .hasValueSatisfying(k -> assertThat(k.positions()).hasSize(2));
    }

    @Test
    void shouldScoreYakeCandidatesWithinUnitRange() {
        KeywordConfig config = KeywordConfig.builder().maxKeywords(5).build();

        List<ExtractedKeyword> keywords = extractor.extract(TEXT, config, null);

        assertThat(keywords).isNotEmpty().hasSizeLessThanOrEqualTo(5);
        assertThat(keywords).allSatisfy(k -> {
            assertThat(k.score()).isBetween(0.0, 1.0);
            assertThat(k.text().toLowerCase(Locale.ROOT)).doesNotStartWith("the ").doesNotStartWith("and ");
        });
        assertThat(keywords).isSortedAccordingTo((a, b) -> Double.compare(b.score(), a.score()));
    }

    @Test
    void shouldApplyMinimumScore() {
        KeywordConfig config = KeywordConfig.builder().algorithm("rake").minScore(0.9).build();

        assertThat(extractor.extract(TEXT, config, "en"))
            .isNotEmpty()
            .allSatisfy(k -> assertThat(k.score()).isGreaterThanOrEqualTo(0.9));
    }

    @Test
    void shouldReturnNothingForBlankText() {
        assertThat(extractor.extract(" ", KeywordConfig.builder().build(), null)).isEmpty();
    }
}
