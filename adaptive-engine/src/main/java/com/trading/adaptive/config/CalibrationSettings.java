package com.trading.adaptive.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Bin layout and sample requirements of the confidence calibrator.
 */
public record CalibrationSettings(
    @NotNull @Size(min = 2) List<Double> binEdges,
    @Min(1) int minSamples,
    @Min(1) int minBinSamples,
    @Min(1) int sampleLimit
) {
    public CalibrationSettings {
        binEdges = binEdges == null ? List.of() : List.copyOf(binEdges);
    }

    public static CalibrationSettings defaults() {
        return new CalibrationSettings(List.of(0.0, 0.6, 0.7, 0.8, 0.9, 1.0), 50, 10, 1000);
    }

    @AssertTrue(message = "bin edges must be strictly increasing within [0, 1]")
    public boolean isBinEdgesOrdered() {
        if (binEdges.isEmpty()) {
            return true;
        }
        if (binEdges.get(0) < 0.0 || binEdges.get(binEdges.size() - 1) > 1.0) {
            return false;
        }
        for (int i = 1; i < binEdges.size(); i++) {
            if (binEdges.get(i) <= binEdges.get(i - 1)) {
                return false;
            }
        }
        return true;
    }
}
