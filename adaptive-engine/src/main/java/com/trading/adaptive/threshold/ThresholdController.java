package com.trading.adaptive.threshold;

import com.trading.adaptive.config.ThresholdSettings;
import com.trading.adaptive.model.Side;
import com.trading.adaptive.model.TradeFilter;
import com.trading.adaptive.model.TradeStatistics;
import com.trading.adaptive.persistence.OutcomeStore;
import com.trading.adaptive.persistence.Persistable;
import com.trading.adaptive.persistence.StateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the global / side / timeframe / cluster acceptance thresholds and nudges them toward a target
 * win-rate band.
 *
 * <p>Win-rate bands: global 70-80%, side 65-82%, timeframe 68-80%. Cluster thresholds follow the cluster
 * penalty EWMA instead. Every level is clamped to [min, max]; clusters never drop below global.
 *
 * Thread-Safety: the threshold set is immutable and published through an AtomicReference, so readers
 * never see a partially updated hierarchy.
 */
public class ThresholdController implements Persistable {
    private static final Logger logger = LoggerFactory.getLogger(ThresholdController.class);
    private static final int SCHEMA_VERSION = 1;

    static final double CLUSTER_HIGH_PENALTY = 1.5;
    static final double CLUSTER_LOW_PENALTY = 0.8;

    private final ThresholdSettings settings;
    private final StateFile<ThresholdState> stateFile;
    private final Clock clock;

    private final AtomicReference<ThresholdSet> current;
    private final AtomicInteger tradesSinceUpdate = new AtomicInteger();
    private volatile Instant lastUpdateTime;

    public ThresholdController(ThresholdSettings settings, Path stateDirectory, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.stateFile = new StateFile<>(stateDirectory, stateName(), SCHEMA_VERSION, ThresholdState.class, clock);
        this.current = new AtomicReference<>(initialSet());
        this.lastUpdateTime = Instant.now(clock);
    }

    private ThresholdSet initialSet() {
        return new ThresholdSet(settings.globalInitial(), settings.sideInitial(), settings.timeframeInitial(), Map.of());
    }

    /**
     * Recompute every level from recent outcomes and cluster penalties, then publish the new set.
     */
    public ThresholdUpdate update(OutcomeStore store, Map<String, Double> clusterPenalties) {
        ThresholdSet before = current.get();
        Map<String, String> changes = new LinkedHashMap<>();

        double global = updateGlobal(store, before.global(), changes);
        Map<Side, Double> sides = updateSides(store, before, global, changes);
        Map<String, Double> timeframes = updateTimeframes(store, before, global, changes);
        Map<String, Double> clusters = updateClusters(clusterPenalties, before, global, changes);

        ThresholdSet after = new ThresholdSet(global, sides, timeframes, clusters);
        current.set(after);
        tradesSinceUpdate.set(0);
        lastUpdateTime = Instant.now(clock);

        if (!changes.isEmpty()) {
            logger.atInfo()
                .addKeyValue("global", String.format("%.2f", global))
                .addKeyValue("changes", changes.size())
                .log("🎚️ Thresholds updated: {}", changes);
        } else {
            logger.debug("Thresholds unchanged (global={})", String.format("%.2f", global));
        }
        return new ThresholdUpdate(before.global(), global, changes);
    }

    private double updateGlobal(OutcomeStore store, double old, Map<String, String> changes) {
        TradeStatistics stats = store.statistics(settings.minTradesForUpdate(), TradeFilter.NONE);
        if (stats.count() < settings.minTradesForUpdate()) {
            logger.debug("Insufficient trades for global update: {}", stats.count());
            return old;
        }
        double next = old;
        if (stats.winRate() < 0.70) {
            next = old + 0.02;
        } else if (stats.winRate() > 0.80) {
            next = old - 0.01;
        }
        next = clamp(next);
        record(changes, "global", old, next, stats.winRate());
        return next;
    }

    private Map<Side, Double> updateSides(OutcomeStore store, ThresholdSet before, double global,
                                          Map<String, String> changes) {
        Map<Side, Double> sides = new EnumMap<>(Side.class);
        sides.putAll(before.side());
        for (Side side : Side.values()) {
            TradeStatistics stats = store.statistics(settings.minTradesForUpdate(), TradeFilter.bySide(side));
            if (stats.count() < settings.minTradesPerBucket()) {
                logger.debug("Insufficient trades for {} update: {}", side, stats.count());
                continue;
            }
            double old = sides.getOrDefault(side, global);
            double next = old;
            if (stats.winRate() < 0.65) {
                next = old + 0.03;
            } else if (stats.winRate() > 0.82) {
                next = old - 0.02;
            }
            next = clamp(next);
            sides.put(side, next);
            record(changes, "side:" + side, old, next, stats.winRate());
        }
        return sides;
    }

    private Map<String, Double> updateTimeframes(OutcomeStore store, ThresholdSet before, double global,
                                                 Map<String, String> changes) {
        Map<String, Double> timeframes = new LinkedHashMap<>(before.timeframe());
        Set<String> candidates = new LinkedHashSet<>(settings.timeframeInitial().keySet());
        candidates.addAll(store.distinctTimeframes());

        for (String tf : candidates) {
            TradeStatistics stats = store.statistics(settings.minTradesForUpdate(), TradeFilter.byTimeframe(tf));
            if (stats.count() < settings.minTradesPerBucket()) {
                logger.debug("Insufficient trades for {} update: {}", tf, stats.count());
                continue;
            }
            double old = timeframes.getOrDefault(tf, global);
            double next = old;
            if (stats.winRate() < 0.68) {
                next = old + 0.02;
            } else if (stats.winRate() > 0.80) {
                next = old - 0.01;
            }
            next = clamp(next);
            timeframes.put(tf, next);
            record(changes, "timeframe:" + tf, old, next, stats.winRate());
        }
        return timeframes;
    }

    private Map<String, Double> updateClusters(Map<String, Double> clusterPenalties, ThresholdSet before,
                                               double global, Map<String, String> changes) {
        Map<String, Double> clusters = new LinkedHashMap<>(before.cluster());
        if (clusterPenalties == null) {
            return clusters;
        }
        clusterPenalties.forEach((cluster, penalty) -> {
            double old = clusters.getOrDefault(cluster, global);
            if (penalty > CLUSTER_HIGH_PENALTY) {
                double next = Math.min(settings.max(), old + 0.05);
                clusters.put(cluster, next);
                if (next != old) {
                    changes.put("cluster:" + cluster,
                        String.format("%.2f -> %.2f (penalty=%.2f)", old, next, penalty));
                }
            } else if (penalty < CLUSTER_LOW_PENALTY) {
                double next = Math.max(global, old - 0.02);
                clusters.put(cluster, next);
                if (next != old) {
                    changes.put("cluster:" + cluster,
                        String.format("%.2f -> %.2f (penalty=%.2f)", old, next, penalty));
                }
            }
        });
        return clusters;
    }

    private static void record(Map<String, String> changes, String level, double old, double next, double winRate) {
        if (next != old) {
            changes.put(level, String.format("%.2f -> %.2f (WR=%.1f%%)", old, next, winRate * 100));
        }
    }

    private double clamp(double value) {
        return Math.max(settings.min(), Math.min(settings.max(), value));
    }

    public double effectiveThreshold(Side side, String timeframe, String cluster) {
        return current.get().effective(side, timeframe, cluster);
    }

    public double globalThreshold() {
        return current.get().global();
    }

    /** Current immutable hierarchy. */
    public ThresholdSet allThresholds() {
        return current.get();
    }

    public void incrementTradeCount() {
        tradesSinceUpdate.incrementAndGet();
    }

    public int tradesSinceUpdate() {
        return tradesSinceUpdate.get();
    }

    public Instant lastUpdateTime() {
        return lastUpdateTime;
    }

    public boolean shouldUpdate() {
        if (tradesSinceUpdate.get() >= settings.minTradesForUpdate()) {
            return true;
        }
        return Duration.between(lastUpdateTime, Instant.now(clock)).compareTo(settings.updateInterval()) >= 0;
    }

    public void reset() {
        current.set(initialSet());
        tradesSinceUpdate.set(0);
        lastUpdateTime = Instant.now(clock);
        logger.info("Thresholds reset to defaults");
    }

    @Override
    public void save() {
        ThresholdSet set = current.get();
        stateFile.write(new ThresholdState(set.global(), set.side(), set.timeframe(), set.cluster(),
            tradesSinceUpdate.get(), lastUpdateTime));
    }

    @Override
    public boolean load() {
        var restored = stateFile.read();
        if (restored.isEmpty()) {
            return false;
        }
        ThresholdState state = restored.get();
        ThresholdSet defaults = initialSet();
        current.set(new ThresholdSet(
            clamp(state.global()),
            state.side() != null ? state.side() : defaults.side(),
            state.timeframe() != null ? state.timeframe() : defaults.timeframe(),
            state.cluster()));
        tradesSinceUpdate.set(Math.max(0, state.tradesSinceUpdate()));
        if (state.lastUpdateTime() != null) {
            lastUpdateTime = state.lastUpdateTime();
        }
        logger.info("Thresholds loaded: global={} trades since update={}",
            String.format("%.2f", current.get().global()), tradesSinceUpdate.get());
        return true;
    }

    @Override
    public String stateName() {
        return "threshold_state";
    }
}
