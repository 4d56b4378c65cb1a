package com.trading.adaptive.calibration;

import java.util.List;

/**
 * Result of one recalibration pass.
 *
 * @param refitBuckets buckets that received a new curve
 * @param skippedBuckets buckets left on their previous mapping for lack of samples
 */
public record CalibrationSummary(List<String> refitBuckets, List<String> skippedBuckets) {
    public static final CalibrationSummary NONE = new CalibrationSummary(List.of(), List.of());

    public CalibrationSummary {
        refitBuckets = List.copyOf(refitBuckets);
        skippedBuckets = List.copyOf(skippedBuckets);
    }

    public boolean changed() {
        return !refitBuckets.isEmpty();
    }
}
