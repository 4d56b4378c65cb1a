package com.trading.adaptive.threshold;

import java.util.Map;

/**
 * Outcome of one threshold update.
 *
 * @param changes human-readable description per changed level, e.g. {@code side:LONG -> "0.70 -> 0.73 (WR=60.0%)"}
 */
public record ThresholdUpdate(double previousGlobal, double newGlobal, Map<String, String> changes) {
    public ThresholdUpdate {
        changes = Map.copyOf(changes);
    }

    public boolean changed() {
        return !changes.isEmpty();
    }
}
