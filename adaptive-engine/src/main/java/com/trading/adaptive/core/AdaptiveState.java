package com.trading.adaptive.core;

import com.trading.adaptive.drift.DriftSummary;
import com.trading.adaptive.health.AdaptiveHealthMonitor.HealthStatus;
import com.trading.adaptive.risk.KellyInfo;
import com.trading.adaptive.threshold.ThresholdSet;

import java.time.Instant;
import java.util.List;

/**
 * Monitoring snapshot of the whole adaptive layer.
 */
public record AdaptiveState(
    boolean enabled,
    CycleState cycleState,
    ThresholdSet thresholds,
    int tradesSinceThresholdUpdate,
    KellyInfo kelly,
    DriftSummary drift,
    int calibratedBuckets,
    int totalTrades,
    int tradesSinceAdaptation,
    List<String> activeCooldowns,
    Instant lastAdaptation,
    HealthStatus health
) {
}
