package com.trading.adaptive.model;

/**
 * Reward/risk ratio, win probability and PnL standard deviation for one bucket.
 */
public record KellyParameters(
    double rewardRisk,
    double winProbability,
    double sigma
) {
    public static final KellyParameters DEFAULT = new KellyParameters(2.0, 0.70, 1.0);
}
