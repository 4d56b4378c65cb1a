package com.trading.adaptive.drift;

import java.time.Instant;

/**
 * One detected drift.
 *
 * @param magnitude cumulative deviation that crossed the threshold
 * @param prudentCycles cycles of prudent mode started by this event
 */
public record DriftEvent(DriftMetric metric, Instant timestamp, double magnitude, int prudentCycles) {
}
