package com.trading.adaptive.model;

/**
 * Thresholds that were in force when a trade was accepted.
 */
public record ThresholdSnapshot(
    double global,
    double side,
    double timeframe,
    double cluster
) {
    public static final ThresholdSnapshot DEFAULT = new ThresholdSnapshot(0.70, 0.70, 0.70, 0.70);
}
