package com.trading.adaptive.risk;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Persisted form of the risk optimizer.
 */
public record RiskState(
    Map<String, BucketParameters> kellyParams,
    double dailyLossCap,
    double currentDailyLoss,
    LocalDate dailyResetDate,
    Instant lastUpdate
) {
    /**
     * Cached sizing inputs of one bucket.
     */
    public record BucketParameters(double rewardRisk, double sigma) {
    }
}
