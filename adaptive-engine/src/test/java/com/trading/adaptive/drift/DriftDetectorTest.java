package com.trading.adaptive.drift;

import com.trading.adaptive.MutableClock;
import com.trading.adaptive.config.DriftSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DriftDetector Tests")
class DriftDetectorTest {

    @TempDir
    Path stateDir;

    private MutableClock clock;
    private DriftDetector detector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        detector = new DriftDetector(DriftSettings.defaults(), stateDir, clock);
    }

    @Nested
    @DisplayName("Prudent mode")
    class PrudentMode {

        @Test
        @DisplayName("Should enter prudent mode on a penalty drift")
        void shouldEnterOnDrift() {
            var event = detector.updatePenalty(1.0);

            assertThat(event).isPresent();
            assertThat(event.get().metric()).isEqualTo(DriftMetric.PENALTY);
            assertThat(detector.isPrudentModeActive()).isTrue();
            assertThat(detector.prudentCyclesRemaining()).isEqualTo(40);
            assertThat(detector.prudentAdjustments()).isEqualTo(new PrudentAdjustments(0.05, 0.5));
        }

        @Test
        @DisplayName("Should not drift on ordinary returns")
        void shouldIgnoreOrdinaryReturns() {
            for (int i = 0; i < 200; i++) {
                assertThat(detector.updateReturn(i % 2 == 0 ? 3.0 : -2.0)).isEmpty();
            }
            assertThat(detector.isPrudentModeActive()).isFalse();
            assertThat(detector.prudentAdjustments()).isEqualTo(PrudentAdjustments.NONE);
        }

        @Test
        @DisplayName("Should use the tighter delta for calibration error")
        void shouldUseCalibrationDelta() {
            // |0.9 - 0| - 0.5 = 0.4
            assertThat(detector.updateCalibrationError(0.9, false)).isPresent();
            assertThat(detector.summary().driftCounts()).containsEntry(DriftMetric.CALIBRATION_ERROR, 1);
        }

        @Test
        @DisplayName("Should leave prudent mode after the countdown")
        void shouldLeaveAfterCountdown() {
            detector.updatePenalty(1.0);

            for (int i = 0; i < 39; i++) {
                detector.decrementPrudentMode();
            }
            assertThat(detector.isPrudentModeActive()).isTrue();
            assertThat(detector.prudentCyclesRemaining()).isEqualTo(1);

            detector.decrementPrudentMode();
            assertThat(detector.isPrudentModeActive()).isFalse();
            assertThat(detector.prudentAdjustments().isActive()).isFalse();
        }

        @Test
        @DisplayName("Should restart the countdown on a new drift")
        void shouldRestartCountdown() {
            detector.updatePenalty(1.0);
            for (int i = 0; i < 5; i++) {
                detector.decrementPrudentMode();
            }
            assertThat(detector.prudentCyclesRemaining()).isEqualTo(35);

            detector.updatePenalty(1.0);
            assertThat(detector.prudentCyclesRemaining()).isEqualTo(40);
            assertThat(detector.history()).hasSize(2);
        }
    }

    @Test
    @DisplayName("Should keep history bounded")
    void shouldBoundHistory() {
        for (int i = 0; i < 80; i++) {
            detector.updatePenalty(1.0);
        }
        assertThat(detector.history()).hasSize(50);
        assertThat(detector.summary().totalDrifts()).isEqualTo(80);
    }

    @Test
    @DisplayName("Should restore prudent mode and detector sums after restart")
    void shouldPersistState() {
        detector.updatePenalty(1.0);
        detector.decrementPrudentMode();
        detector.updateReturn(-5.0);
        detector.save();

        DriftDetector restored = new DriftDetector(DriftSettings.defaults(), stateDir, clock);
        assertThat(restored.load()).isTrue();

        assertThat(restored.isPrudentModeActive()).isTrue();
        assertThat(restored.prudentCyclesRemaining()).isEqualTo(39);
        assertThat(restored.history()).hasSize(1);
        assertThat(restored.detectorState(DriftMetric.RETURN))
            .isEqualTo(detector.detectorState(DriftMetric.RETURN));
    }

    @Test
    @DisplayName("Should start fresh without a state file")
    void shouldStartFresh() {
        assertThat(detector.load()).isFalse();
        assertThat(detector.isPrudentModeActive()).isFalse();
    }
}
