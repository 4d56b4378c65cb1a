package com.trading.adaptive.threshold;

import com.trading.adaptive.model.Side;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted form of the threshold controller.
 */
public record ThresholdState(
    double global,
    Map<Side, Double> side,
    Map<String, Double> timeframe,
    Map<String, Double> cluster,
    int tradesSinceUpdate,
    Instant lastUpdateTime
) {
}
