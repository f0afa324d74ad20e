package dev.quarry.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import dev.quarry.config.TokenReductionConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class TokenReducerTest {
    private static final String MESSY = "The  report is   READY.\r\n\n\n\nIt covers 42 items, as of 2024.  "
        + "It covers 42 items, as of 2024. Go -- on to the next page!\n\tIn my view we are ok.";

    private final TokenReducer reducer = new TokenReducer();

    private static TokenReductionConfig mode(String mode, boolean preserve) {
        return TokenReductionConfig.builder().mode(mode).preserveImportantWords(preserve).build();
    }

    @Test
    void shouldLeaveContentAloneWhenOff() {
        assertThat(reducer.reduce(MESSY, mode("off", true), null)).isSameAs(MESSY);
    }

    @Test
    void shouldCollapseWhitespaceInLightMode() {
        assertThat(reducer.reduce("a   b\n\n\n\nc  ", mode("light", true), null)).isEqualTo("a b\n\nc");
    }

    @Test
    void shouldDropStopWordsInModerateMode() {
        assertThat(reducer.reduce("The cat is on the mat", mode("moderate", false), "en"))
            .isEqualTo("cat mat");
        assertThat(reducer.reduce("The cat is on the mat", mode("moderate", true), "eng"))
            .isEqualTo("The cat mat");
    }

    @Test
    void shouldDropPunctuationAndRepeatsInAggressiveMode() {
        assertThat(reducer.reduce("Stop now. Stop now. Go -- on", mode("aggressive", false), null))
            .isEqualTo("Stop now. Go");
    }

    @Test
    void shouldDropShortWordsInMaximumMode() {
        assertThat(reducer.reduce("We go to 42 km", mode("maximum", false), null)).isEqualTo("42");
    }

    @ParameterizedTest
    @ValueSource(strings = {"light", "moderate", "aggressive", "maximum"})
    void shouldBeIdempotent(String severity) {
        for (boolean preserve : new boolean[] {true, false}) {
            TokenReductionConfig config = mode(severity, preserve);
            String once = reducer.reduce(MESSY, config, "en");

            assertThat(reducer.reduce(once, config, "en")).isEqualTo(once);
        }
    }
}
