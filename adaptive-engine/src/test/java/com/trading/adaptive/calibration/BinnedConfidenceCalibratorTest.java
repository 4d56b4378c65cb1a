package com.trading.adaptive.calibration;

import com.trading.adaptive.MutableClock;
import com.trading.adaptive.config.CalibrationSettings;
import com.trading.adaptive.model.CalibrationSample;
import com.trading.adaptive.model.Side;
import com.trading.adaptive.persistence.OutcomeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("BinnedConfidenceCalibrator Tests")
class BinnedConfidenceCalibratorTest {

    @TempDir
    Path stateDir;

    private MutableClock clock;
    private BinnedConfidenceCalibrator calibrator;
    private OutcomeStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        calibrator = new BinnedConfidenceCalibrator(CalibrationSettings.defaults(), stateDir, clock);
        store = mock(OutcomeStore.class);
        when(store.distinctTimeframes()).thenReturn(List.of("15m"));
        when(store.calibrationSamples(Side.LONG, "15m", 1000)).thenReturn(longSamples());
    }

    /** 50% wins around 0.65, 80% around 0.75, 70% around 0.85. */
    private static List<CalibrationSample> longSamples() {
        List<CalibrationSample> samples = new ArrayList<>();
        addBin(samples, 0.65, 20, 10);
        addBin(samples, 0.75, 20, 16);
        addBin(samples, 0.85, 20, 14);
        return samples;
    }

    private static void addBin(List<CalibrationSample> samples, double confidence, int count, int wins) {
        for (int i = 0; i < count; i++) {
            samples.add(new CalibrationSample(confidence, i < wins));
        }
    }

    @Test
    @DisplayName("Should map confidence through identity before any fit")
    void shouldStartAsIdentity() {
        assertThat(calibrator.calibrate(0.73, Side.LONG, "15m")).isEqualTo(0.73);
        assertThat(calibrator.info().bucketCount()).isZero();
    }

    @Test
    @DisplayName("Should keep identity output within [0, 1]")
    void shouldBoundIdentityOutput() {
        assertThat(calibrator.calibrate(1.4, Side.LONG, "15m")).isEqualTo(1.0);
        assertThat(calibrator.calibrate(-0.2, Side.SHORT, "1h")).isEqualTo(0.0);

        calibrator.recalibrateAll(store);

        assertThat(calibrator.calibrate(1.4, Side.SHORT, "15m")).isEqualTo(1.0);
        assertThat(calibrator.calibrate(1.4, Side.LONG, "15m")).isEqualTo(1.0);
        assertThat(calibrator.calibrate(-0.2, Side.LONG, "15m")).isEqualTo(0.0);
        assertThat(ConfidenceMapping.IDENTITY.apply(-3.0, Side.LONG, "15m")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should map each bin to its monotone win rate")
    void shouldFitMonotoneCurve() {
        CalibrationSummary summary = calibrator.recalibrateAll(store);

        assertThat(summary.refitBuckets()).containsExactly("LONG_15m");
        assertThat(summary.skippedBuckets()).containsExactly("SHORT_15m");

        assertThat(calibrator.calibrate(0.65, Side.LONG, "15m")).isCloseTo(0.50, within(1e-9));
        assertThat(calibrator.calibrate(0.75, Side.LONG, "15m")).isCloseTo(0.75, within(1e-9));
        assertThat(calibrator.calibrate(0.85, Side.LONG, "15m")).isCloseTo(0.75, within(1e-9));
    }

    @Test
    @DisplayName("Should keep identity for sparse bins and unfitted buckets")
    void shouldKeepIdentityWhereDataIsThin() {
        calibrator.recalibrateAll(store);

        assertThat(calibrator.calibrate(0.95, Side.LONG, "15m")).isEqualTo(0.95);
        assertThat(calibrator.calibrate(0.30, Side.LONG, "15m")).isEqualTo(0.30);
        assertThat(calibrator.calibrate(0.75, Side.SHORT, "15m")).isEqualTo(0.75);
        assertThat(calibrator.calibrate(0.75, Side.LONG, "1h")).isEqualTo(0.75);
    }

    @Test
    @DisplayName("Should keep a published mapping unchanged by later refits")
    void shouldPublishImmutableSnapshots() {
        ConfidenceMapping before = calibrator.mapping();

        calibrator.recalibrateAll(store);

        assertThat(before.apply(0.65, Side.LONG, "15m")).isEqualTo(0.65);
        assertThat(calibrator.mapping().apply(0.65, Side.LONG, "15m")).isCloseTo(0.50, within(1e-9));
    }

    @Test
    @DisplayName("Should pool adjacent violators by weight")
    void shouldPoolAdjacentViolators() {
        double[] result = BinnedConfidenceCalibrator.poolAdjacentViolators(
            new double[]{0.5, 0.9, 0.6, 0.7}, new double[]{1, 1, 2, 1});

        // 0.9 and 0.6 pool to (0.9 + 1.2) / 3 = 0.7, which no longer violates 0.7
        assertThat(result).containsExactly(new double[]{0.5, 0.7, 0.7, 0.7}, within(1e-9));
    }

    @Test
    @DisplayName("Should restore curves after restart")
    void shouldPersistCurves() {
        calibrator.recalibrateAll(store);
        calibrator.save();

        var restored = new BinnedConfidenceCalibrator(CalibrationSettings.defaults(), stateDir, clock);
        assertThat(restored.load()).isTrue();

        assertThat(restored.calibrate(0.85, Side.LONG, "15m")).isCloseTo(0.75, within(1e-9));
        assertThat(restored.calibrate(0.95, Side.LONG, "15m")).isEqualTo(0.95);
        assertThat(restored.lastFit()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Should discard stored curves built on different bin edges")
    void shouldDiscardMismatchedEdges() {
        calibrator.recalibrateAll(store);
        calibrator.save();

        var settings = new CalibrationSettings(List.of(0.0, 0.5, 1.0), 50, 10, 1000);
        var restored = new BinnedConfidenceCalibrator(settings, stateDir, clock);

        assertThat(restored.load()).isFalse();
        assertThat(restored.calibrate(0.85, Side.LONG, "15m")).isEqualTo(0.85);
    }
}
