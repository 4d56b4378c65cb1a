package com.trading.adaptive.threshold;

import com.trading.adaptive.model.Side;
import com.trading.adaptive.model.ThresholdSnapshot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable threshold hierarchy. The effective threshold is the maximum of the four levels, so it is never
 * below the global one. Levels without an entry fall back to the global threshold.
 */
public record ThresholdSet(
    double global,
    Map<Side, Double> side,
    Map<String, Double> timeframe,
    Map<String, Double> cluster
) {
    public ThresholdSet {
        Map<Side, Double> sides = new EnumMap<>(Side.class);
        if (side != null) {
            sides.putAll(side);
        }
        side = Collections.unmodifiableMap(sides);
        timeframe = timeframe == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(timeframe));
        cluster = cluster == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(cluster));
    }

    public double sideThreshold(Side s) {
        return s == null ? global : side.getOrDefault(s, global);
    }

    public double timeframeThreshold(String tf) {
        return tf == null ? global : timeframe.getOrDefault(tf, global);
    }

    public double clusterThreshold(String c) {
        return c == null ? global : cluster.getOrDefault(c, global);
    }

    public double effective(Side s, String tf, String c) {
        return Math.max(Math.max(global, sideThreshold(s)), Math.max(timeframeThreshold(tf), clusterThreshold(c)));
    }

    /** The four levels in force for one signal, as recorded on its outcome. */
    public ThresholdSnapshot snapshotFor(Side s, String tf, String c) {
        return new ThresholdSnapshot(global, sideThreshold(s), timeframeThreshold(tf), clusterThreshold(c));
    }
}
