package com.trading.adaptive.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Weights and cooldown rules for per-trade penalty scoring.
 *
 * @param confidenceWeight weight of the squared confidence term, applied to losses only
 * @param stopLossWeight added when the stop-loss was hit
 * @param fastExitWeight added when the trade closed faster than {@code fastExitSeconds}
 * @param maeWeight weight of the adverse excursion (per 100 bp)
 * @param cooldownThreshold symbol EWMA above which a cooldown starts
 * @param cooldownCycles adaptation cycles a triggered cooldown lasts
 * @param ewmaAlpha smoothing factor of the penalty EWMA
 * @param clusterCooldownFactor multiplier on {@code cooldownThreshold} for clusters
 * @param fastExitSeconds holding time under which an exit counts as fast
 */
public record PenaltySettings(
    @PositiveOrZero double confidenceWeight,
    @PositiveOrZero double stopLossWeight,
    @PositiveOrZero double fastExitWeight,
    @PositiveOrZero double maeWeight,
    @DecimalMin(value = "0.0", inclusive = false) double cooldownThreshold,
    @Min(1) int cooldownCycles,
    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") double ewmaAlpha,
    @DecimalMin("1.0") double clusterCooldownFactor,
    @Min(1) long fastExitSeconds
) {
    public static PenaltySettings defaults() {
        return new PenaltySettings(1.0, 1.5, 0.5, 0.3, 1.2, 3, 0.15, 1.25, 300);
    }

    public double clusterCooldownThreshold() {
        return cooldownThreshold * clusterCooldownFactor;
    }
}
