package com.trading.adaptive.drift;

/**
 * Streams watched for a shift in mean.
 */
public enum DriftMetric {
    /** Per-trade return, ROE% / 100. */
    RETURN,
    /** |calibrated confidence - actual outcome|. */
    CALIBRATION_ERROR,
    /** Raw penalty score. */
    PENALTY
}
