package com.trading.adaptive.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Page-Hinkley parameters and prudent-mode behaviour.
 *
 * @param lambda tolerance subtracted from every observation
 * @param delta detection threshold on the cumulative deviation
 * @param calibrationDeltaFactor scales {@code delta} for the calibration-error test
 * @param prudentCycles adaptation cycles prudent mode lasts after a drift
 * @param historyLimit drift events kept in memory and on disk
 * @param thresholdBump added to every effective threshold while prudent
 * @param kellyMultiplier applied to every Kelly fraction while prudent
 */
public record DriftSettings(
    double lambda,
    @DecimalMin(value = "0.0", inclusive = false) double delta,
    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") double calibrationDeltaFactor,
    @Min(1) int prudentCycles,
    @Min(1) int historyLimit,
    @PositiveOrZero double thresholdBump,
    @DecimalMin("0.0") @DecimalMax("1.0") double kellyMultiplier
) {
    public static DriftSettings defaults() {
        return new DriftSettings(0.5, 0.02, 0.5, 40, 50, 0.05, 0.5);
    }

    public double calibrationDelta() {
        return delta * calibrationDeltaFactor;
    }
}
