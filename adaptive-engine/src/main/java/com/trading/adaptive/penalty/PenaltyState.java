package com.trading.adaptive.penalty;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persisted form of the penalty tracker.
 */
public record PenaltyState(
    Map<String, Double> symbolEwma,
    Map<String, Double> clusterEwma,
    Map<String, Integer> symbolCooldowns,
    Map<String, Integer> clusterCooldowns,
    Instant lastUpdate
) {
    public PenaltyState {
        symbolEwma = symbolEwma == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(symbolEwma));
        clusterEwma = clusterEwma == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(clusterEwma));
        symbolCooldowns = symbolCooldowns == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(symbolCooldowns));
        clusterCooldowns = clusterCooldowns == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(clusterCooldowns));
    }
}
