package com.trading.adaptive.config;

import com.trading.adaptive.model.Side;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Initial thresholds, bounds and update cadence of the threshold hierarchy.
 */
public record ThresholdSettings(
    @DecimalMin("0.0") @DecimalMax("1.0") double globalInitial,
    @NotNull Map<Side, Double> sideInitial,
    @NotNull Map<String, Double> timeframeInitial,
    @DecimalMin("0.0") @DecimalMax("1.0") double min,
    @DecimalMin("0.0") @DecimalMax("1.0") double max,
    @Min(1) int minTradesForUpdate,
    @Min(1) int minTradesPerBucket,
    @NotNull Duration updateInterval
) {
    public ThresholdSettings {
        sideInitial = sideInitial == null ? Map.of() : Map.copyOf(sideInitial);
        timeframeInitial = timeframeInitial == null ? Map.of() : Map.copyOf(timeframeInitial);
    }

    public static ThresholdSettings defaults() {
        Map<Side, Double> sides = new EnumMap<>(Side.class);
        sides.put(Side.LONG, 0.70);
        sides.put(Side.SHORT, 0.72);

        Map<String, Double> timeframes = new LinkedHashMap<>();
        timeframes.put("15m", 0.70);
        timeframes.put("30m", 0.71);
        timeframes.put("1h", 0.71);

        return new ThresholdSettings(0.70, sides, timeframes, 0.60, 0.85, 200, 50, Duration.ofHours(12));
    }

    @AssertTrue(message = "threshold min must not exceed max, and the initial global threshold must lie between them")
    public boolean isRangeConsistent() {
        return min <= max && globalInitial >= min && globalInitial <= max;
    }
}
