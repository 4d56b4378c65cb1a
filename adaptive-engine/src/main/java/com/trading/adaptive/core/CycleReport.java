package com.trading.adaptive.core;

import com.trading.adaptive.calibration.CalibrationSummary;
import com.trading.adaptive.threshold.ThresholdUpdate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * What one adaptation cycle changed.
 *
 * @param failures step name to error message, for steps that failed and kept their previous state
 */
public record CycleReport(
    Instant startedAt,
    Duration duration,
    ThresholdUpdate thresholds,
    CalibrationSummary calibration,
    Map<String, String> kellyChanges,
    List<String> activeCooldowns,
    boolean prudentModeActive,
    int prudentCyclesRemaining,
    Map<String, String> failures
) {
    public CycleReport {
        kellyChanges = kellyChanges == null ? Map.of() : Map.copyOf(kellyChanges);
        activeCooldowns = activeCooldowns == null ? List.of() : List.copyOf(activeCooldowns);
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }

    public boolean successful() {
        return failures.isEmpty();
    }
}
