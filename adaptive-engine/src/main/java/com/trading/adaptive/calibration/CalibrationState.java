package com.trading.adaptive.calibration;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted calibration curves. A null bin value means that bin maps to identity.
 */
public record CalibrationState(
    List<Double> binEdges,
    Map<String, List<Double>> curves,
    Instant lastFit
) {
}
