package com.trading.adaptive.core;

import com.trading.adaptive.calibration.ConfidenceMapping;
import com.trading.adaptive.threshold.ThresholdSet;

import java.time.Instant;

/**
 * Thresholds and calibration published together at the end of each adaptation cycle.
 * Every filter call works against exactly one snapshot.
 */
public record DecisionSnapshot(ThresholdSet thresholds, ConfidenceMapping calibration, Instant publishedAt) {
}
