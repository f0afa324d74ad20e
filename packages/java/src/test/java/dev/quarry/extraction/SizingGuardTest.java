package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

final class SizingGuardTest {
    private final SizingGuard guard = SizingGuard.defaults();

    @Test
    void shouldAllowCompactGrid() {
        assertThat(guard.allowsDense(10, 10, 100)).isTrue();
        assertThat(guard.allowsDense(10, 10, 25)).isTrue();
    }

    @Test
    void shouldAllowSmallGridRegardlessOfDensity() {
        assertThat(guard.allowsDense(10, 10, 24)).isTrue();
        assertThat(guard.allowsDense(11, 8, 5)).isTrue();
        assertThat(guard.allowsDense(1_000, 1_000, 1)).isTrue();
    }

    @Test
    void shouldRejectLargeGridMuchLargerThanItsContent() {
        assertThat(guard.allowsDense(2_000, 1_000, 499_999)).isFalse();
        assertThat(guard.allowsDense(2_000, 1_000, 500_000)).isTrue();
        assertThat(guard.allowsDense(1_048_576, 16_384, 26)).isFalse();
    }

    @Test
    void shouldRejectGridOverCeilingEvenWhenFull() {
        assertThat(guard.exceeds(100_000, 1_001)).isTrue();
        assertThat(guard.allowsDense(100_000, 1_001, 100_100_000)).isFalse();
    }

    @Test
    void shouldTreatOverflowAndNegativeExtentsAsOversized() {
        assertThat(guard.exceeds(Long.MAX_VALUE, 2)).isTrue();
        assertThat(guard.exceeds(-1, 5)).isTrue();
    }

    @Test
    void shouldHonorCustomCeiling() {
        SizingGuard small = new SizingGuard(50);

        assertThat(small.exceeds(5, 10)).isFalse();
        assertThat(small.exceeds(6, 10)).isTrue();
    }

    @Test
    void shouldRejectNonPositiveCeiling() {
        assertThatThrownBy(() -> new SizingGuard(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
