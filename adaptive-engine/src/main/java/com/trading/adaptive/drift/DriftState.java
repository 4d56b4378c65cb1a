package com.trading.adaptive.drift;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted form of the drift detector.
 */
public record DriftState(
    Map<DriftMetric, PageHinkleyDetector.State> detectors,
    boolean prudentModeActive,
    int prudentCyclesRemaining,
    List<DriftEvent> history,
    Instant lastUpdate
) {
}
