package com.trading.adaptive.calibration;

import com.trading.adaptive.model.Side;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Piecewise-constant calibration curves keyed by {@code SIDE_timeframe}.
 * A NaN bin value maps to identity, bounded to [0, 1].
 */
final class CalibrationTable implements ConfidenceMapping {
    private final double[] edges;
    private final Map<String, double[]> curves;

    CalibrationTable(double[] edges, Map<String, double[]> curves) {
        this.edges = edges.clone();
        Map<String, double[]> copy = new LinkedHashMap<>();
        curves.forEach((key, values) -> copy.put(key, values.clone()));
        this.curves = Collections.unmodifiableMap(copy);
    }

    static CalibrationTable empty(List<Double> edges) {
        return new CalibrationTable(toArray(edges), Map.of());
    }

    static String key(Side side, String timeframe) {
        return (side != null ? side.name() : "UNKNOWN") + "_" + timeframe;
    }

    @Override
    public double apply(double rawConfidence, Side side, String timeframe) {
        double[] curve = curves.get(key(side, timeframe));
        if (curve == null) {
            return ConfidenceMapping.clamp(rawConfidence);
        }
        double value = curve[binIndex(rawConfidence)];
        return Double.isNaN(value) ? ConfidenceMapping.clamp(rawConfidence) : value;
    }

    int binIndex(double raw) {
        int bins = edges.length - 1;
        for (int i = 0; i < bins; i++) {
            if (raw < edges[i + 1]) {
                return i;
            }
        }
        return bins - 1;
    }

    int binCount() {
        return edges.length - 1;
    }

    double[] edges() {
        return edges.clone();
    }

    Map<String, double[]> curves() {
        return curves;
    }

    int bucketCount() {
        return curves.size();
    }

    CalibrationTable with(String key, double[] curve) {
        Map<String, double[]> next = new LinkedHashMap<>(curves);
        next.put(key, curve);
        return new CalibrationTable(edges, next);
    }

    static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("CalibrationTable{edges=").append(Arrays.toString(edges));
        curves.forEach((key, curve) -> sb.append(", ").append(key).append('=').append(Arrays.toString(curve)));
        return sb.append('}').toString();
    }
}
