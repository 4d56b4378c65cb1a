package com.trading.adaptive.calibration;

import com.trading.adaptive.model.Side;
import com.trading.adaptive.persistence.OutcomeStore;
import com.trading.adaptive.persistence.Persistable;

/**
 * Maps raw model confidence to an empirical win probability per (side, timeframe).
 *
 * <p>{@link #calibrate} sits on the signal hot path: it must be a lock-free lookup and must return the raw
 * value unchanged for any bucket that has no fit yet.
 */
public interface ConfidenceCalibrator extends Persistable {

    default double calibrate(double rawConfidence, Side side, String timeframe) {
        return mapping().apply(rawConfidence, side, timeframe);
    }

    /**
     * Current mapping. The returned object never changes; a refit publishes a new one.
     */
    ConfidenceMapping mapping();

    /**
     * Refit every bucket from stored history. Called only from inside an adaptation cycle.
     */
    CalibrationSummary recalibrateAll(OutcomeStore store);

    CalibrationInfo info();

    record CalibrationInfo(int bucketCount) {
    }
}
