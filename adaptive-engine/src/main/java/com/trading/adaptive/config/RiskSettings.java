package com.trading.adaptive.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Kelly sizing bounds and the daily-loss throttle.
 *
 * @param kFactor fraction of full Kelly actually used
 * @param maxFraction hard cap on the wallet fraction of one position
 * @param targetSigma return volatility at which no variance haircut applies
 * @param minPositionUsd lower bound of one position in quote currency
 * @param maxPositionUsd upper bound of one position in quote currency
 * @param defaultDailyLossCap cap used until enough losing trades exist
 * @param refitRecentTrades how many recent outcomes decide which buckets get refit
 * @param refitWindow trades per bucket used to estimate Kelly parameters
 * @param lossLookbackDays days of losses feeding the daily cap
 * @param minLossSamples losing trades required before the cap is derived from history
 */
public record RiskSettings(
    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") double kFactor,
    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") double maxFraction,
    @Positive double targetSigma,
    @PositiveOrZero double minPositionUsd,
    @Positive double maxPositionUsd,
    @Positive double defaultDailyLossCap,
    @Min(1) int refitRecentTrades,
    @Min(1) int refitWindow,
    @Min(1) int lossLookbackDays,
    @Min(1) int minLossSamples
) {
    public static RiskSettings defaults() {
        return new RiskSettings(0.25, 0.01, 1.0, 15.0, 150.0, 100.0, 200, 100, 10, 5);
    }

    @AssertTrue(message = "minPositionUsd must not exceed maxPositionUsd")
    public boolean isPositionRangeConsistent() {
        return minPositionUsd <= maxPositionUsd;
    }
}
