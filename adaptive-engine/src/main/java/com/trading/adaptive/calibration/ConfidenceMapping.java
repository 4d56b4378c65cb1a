package com.trading.adaptive.calibration;

import com.trading.adaptive.model.Side;

/**
 * Immutable view of a calibration at one point in time.
 */
@FunctionalInterface
public interface ConfidenceMapping {

    ConfidenceMapping IDENTITY = (raw, side, timeframe) -> clamp(raw);

    double apply(double rawConfidence, Side side, String timeframe);

    /** Confidence bounded to [0, 1]. */
    static double clamp(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
