package com.trading.adaptive.drift;

import java.util.Map;

/**
 * Monitoring view of the drift detector.
 */
public record DriftSummary(
    boolean prudentModeActive,
    int prudentCyclesRemaining,
    int totalDrifts,
    Map<DriftMetric, Integer> driftCounts,
    int recentEvents,
    DriftEvent lastEvent
) {
}
