package dev.quarry.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import org.junit.jupiter.api.Test;

final class QualityScorerTest {
    private static final String PROSE = "# Report\n\nThe committee met on Tuesday and reviewed the budget.\n\n"
        + "All members agreed that the plan should go ahead next quarter.";

    private final QualityScorer scorer = new QualityScorer();

    @Test
    void shouldPreferCleanProseOverGarbage() {
        double clean = scorer.score(PROSE);
        double garbage = scorer.score("\u0001\u0002#$%^ ~~~~|||| \u0003\u0004 ^^^^ @@@@");

        assertThat(clean).isBetween(0.0, 1.0);
        assertThat(garbage).isBetween(0.0, 1.0);
        assertThat(clean).isGreaterThan(garbage);
    }

    @Test
    void shouldScoreBlankContentAsZero() {
        assertThat(scorer.score("  \n")).isZero();
    }

    @Test
    void shouldHalveDegradedResults() {
        ExtractionResult degraded = ExtractionResult.builder("application/pdf")
            .content(PROSE)
            .metadata(Metadata.builder().additional("ocr_degraded", true).build())
            .build();

        assertThat(scorer.score(degraded)).isCloseTo(scorer.score(PROSE) * 0.5, within(1e-9));
    }
}
