package com.trading.adaptive.drift;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PageHinkleyDetector Tests")
class PageHinkleyDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private PageHinkleyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new PageHinkleyDetector(0.5, 0.1);
    }

    @ParameterizedTest
    @DisplayName("Should never fire on a stream at or below lambda")
    @ValueSource(doubles = {0.5, 0.4, 0.0, -1.0})
    void shouldNotFireBelowLambda(double value) {
        for (int i = 0; i < 1000; i++) {
            assertThat(detector.update(value, NOW)).isFalse();
        }
        assertThat(detector.driftCount()).isZero();
        assertThat(detector.magnitude()).isLessThanOrEqualTo(0.1);
    }

    @Test
    @DisplayName("Should fire once the sum rises more than delta above its minimum")
    void shouldFireAfterSustainedShift() {
        // +0.03 per observation: 0.09 after three, 0.12 after four
        assertThat(detector.update(0.53, NOW)).isFalse();
        assertThat(detector.update(0.53, NOW)).isFalse();
        assertThat(detector.update(0.53, NOW)).isFalse();
        assertThat(detector.update(0.53, NOW)).isTrue();

        assertThat(detector.driftCount()).isEqualTo(1);
        assertThat(detector.lastDriftTime()).isEqualTo(NOW);
        assertThat(detector.lastMagnitude()).isCloseTo(0.12, within(1e-9));
    }

    @Test
    @DisplayName("Should fire on the first step that clears a small delta")
    void shouldFireImmediatelyWithSmallDelta() {
        PageHinkleyDetector sensitive = new PageHinkleyDetector(0.5, 0.02);

        assertThat(sensitive.update(0.6, NOW)).isTrue();
        assertThat(sensitive.driftCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should restart the sums after firing")
    void shouldResetAfterFiring() {
        assertThat(detector.update(1.0, NOW)).isTrue();

        assertThat(detector.sum()).isZero();
        assertThat(detector.minSum()).isZero();
        assertThat(detector.update(0.53, NOW)).isFalse();
    }

    @Test
    @DisplayName("Should measure the rise from the running minimum")
    void shouldTrackRunningMinimum() {
        detector.update(0.3, NOW);
        detector.update(0.3, NOW);
        assertThat(detector.minSum()).isCloseTo(-0.4, within(1e-9));

        assertThat(detector.update(0.55, NOW)).isFalse();
        assertThat(detector.magnitude()).isCloseTo(0.05, within(1e-9));
        assertThat(detector.update(0.6, NOW)).isTrue();
    }

    @Test
    @DisplayName("Should restore persisted state")
    void shouldRestoreState() {
        detector.update(0.3, NOW);
        detector.update(1.0, NOW);
        PageHinkleyDetector.State state = detector.state();

        PageHinkleyDetector restored = new PageHinkleyDetector(0.5, 0.1);
        restored.restore(state);

        assertThat(restored.state()).isEqualTo(state);
        assertThat(restored.driftCount()).isEqualTo(detector.driftCount());
    }
}
