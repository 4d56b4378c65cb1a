package com.trading.adaptive.risk;

/**
 * Monitoring view of the risk optimizer.
 */
public record KellyInfo(
    double kFactor,
    double maxFraction,
    double targetSigma,
    int bucketCount,
    double dailyLossCap,
    double currentDailyLoss,
    boolean capActive
) {
}
