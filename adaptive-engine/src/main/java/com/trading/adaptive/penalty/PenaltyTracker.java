package com.trading.adaptive.penalty;

import com.trading.adaptive.config.PenaltySettings;
import com.trading.adaptive.model.TradeOutcome;
import com.trading.adaptive.persistence.Persistable;
import com.trading.adaptive.persistence.StateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scores trade quality and keeps an EWMA of penalties per symbol and per cluster.
 *
 * <p>A symbol whose EWMA exceeds the cooldown threshold, with no cooldown already running, is put on
 * cooldown for a fixed number of adaptation cycles. Clusters use a higher threshold. A re-trigger while a
 * cooldown is running leaves the remaining count untouched.
 *
 * Thread-Safety: mutations are serialized by a lock; {@link #isCoolingDown} reads concurrent maps
 * without locking.
 */
public class PenaltyTracker implements Persistable {
    private static final Logger logger = LoggerFactory.getLogger(PenaltyTracker.class);
    private static final int SCHEMA_VERSION = 1;

    private final PenaltySettings settings;
    private final StateFile<PenaltyState> stateFile;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Double> symbolEwma = new ConcurrentHashMap<>();
    private final Map<String, Double> clusterEwma = new ConcurrentHashMap<>();
    private final Map<String, Integer> symbolCooldowns = new ConcurrentHashMap<>();
    private final Map<String, Integer> clusterCooldowns = new ConcurrentHashMap<>();
    private volatile Instant lastUpdate;

    public PenaltyTracker(PenaltySettings settings, Path stateDirectory, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.stateFile = new StateFile<>(stateDirectory, stateName(), SCHEMA_VERSION, PenaltyState.class, clock);
        this.lastUpdate = Instant.now(clock);
    }

    /**
     * Penalty of one closed trade. Higher is worse.
     */
    public double score(TradeOutcome outcome) {
        double penalty = 0.0;

        // Confident losses hurt most
        if (!outcome.win()) {
            double confidence = outcome.effectiveConfidence();
            penalty += settings.confidenceWeight() * confidence * confidence;
        }
        if (outcome.stopHit()) {
            penalty += settings.stopLossWeight();
        }
        if (outcome.hasDuration() && outcome.durationSeconds() < settings.fastExitSeconds()) {
            penalty += settings.fastExitWeight();
        }
        penalty += settings.maeWeight() * (Math.abs(outcome.maeBp()) / 100.0);

        logger.debug("Penalty for {}: {} (win={}, stopHit={}, maeBp={})",
            outcome.symbol(), String.format("%.3f", penalty), outcome.win(), outcome.stopHit(), outcome.maeBp());
        return penalty;
    }

    /**
     * Fold a penalty into the symbol and cluster EWMAs and start cooldowns where warranted.
     */
    public void updateEwma(String symbol, String cluster, double penalty) {
        lock.lock();
        try {
            double alpha = settings.ewmaAlpha();
            double symbolValue = symbolEwma.merge(symbol, penalty,
                (prev, value) -> alpha * value + (1 - alpha) * prev);
            double clusterValue = clusterEwma.merge(cluster, penalty,
                (prev, value) -> alpha * value + (1 - alpha) * prev);
            lastUpdate = Instant.now(clock);

            logger.debug("EWMA updated: {}={} {}={}", symbol, String.format("%.3f", symbolValue),
                cluster, String.format("%.3f", clusterValue));

            checkTrigger(symbolCooldowns, "symbol", symbol, symbolValue, settings.cooldownThreshold());
            checkTrigger(clusterCooldowns, "cluster", cluster, clusterValue, settings.clusterCooldownThreshold());
        } finally {
            lock.unlock();
        }
    }

    private void checkTrigger(Map<String, Integer> cooldowns, String scope, String key, double ewma, double threshold) {
        if (ewma <= threshold || cooldowns.getOrDefault(key, 0) > 0) {
            return;
        }
        cooldowns.put(key, settings.cooldownCycles());
        logger.atWarn()
            .addKeyValue("scope", scope)
            .addKeyValue("key", key)
            .addKeyValue("ewma", ewma)
            .addKeyValue("cycles", settings.cooldownCycles())
            .log("🧊 Cooldown triggered");
    }

    public boolean isCoolingDown(String symbol, String cluster) {
        return symbolCooldowns.getOrDefault(symbol, 0) > 0
            || (cluster != null && clusterCooldowns.getOrDefault(cluster, 0) > 0);
    }

    public boolean isCoolingDown(String symbol) {
        return isCoolingDown(symbol, null);
    }

    /**
     * Count every running cooldown down by one cycle, dropping the ones that reach zero.
     *
     * @return cooldowns still active afterwards, as {@code Symbol:X} / {@code Cluster:Y}
     */
    public List<String> tickCooldowns() {
        lock.lock();
        try {
            tick(symbolCooldowns, "symbol");
            tick(clusterCooldowns, "cluster");
            return activeCooldowns();
        } finally {
            lock.unlock();
        }
    }

    private void tick(Map<String, Integer> cooldowns, String scope) {
        for (String key : new ArrayList<>(cooldowns.keySet())) {
            int remaining = cooldowns.get(key) - 1;
            if (remaining <= 0) {
                cooldowns.remove(key);
                logger.atInfo()
                    .addKeyValue("scope", scope)
                    .addKeyValue("key", key)
                    .log("Cooldown expired");
            } else {
                cooldowns.put(key, remaining);
            }
        }
    }

    public List<String> activeCooldowns() {
        List<String> active = new ArrayList<>();
        new TreeMap<>(symbolCooldowns).keySet().forEach(s -> active.add("Symbol:" + s));
        new TreeMap<>(clusterCooldowns).keySet().forEach(c -> active.add("Cluster:" + c));
        return active;
    }

    public int remainingCooldown(String symbol) {
        return symbolCooldowns.getOrDefault(symbol, 0);
    }

    public double symbolPenalty(String symbol) {
        return symbolEwma.getOrDefault(symbol, 0.0);
    }

    public double clusterPenalty(String cluster) {
        return clusterEwma.getOrDefault(cluster, 0.0);
    }

    /** Copy of the cluster EWMA map. */
    public Map<String, Double> clusterPenalties() {
        return Map.copyOf(clusterEwma);
    }

    /** Symbols with the highest penalty EWMA, highest first. */
    public List<Map.Entry<String, Double>> topPenalties(int n) {
        return symbolEwma.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(n)
            .map(e -> Map.entry(e.getKey(), e.getValue()))
            .toList();
    }

    public PenaltyState snapshot() {
        return new PenaltyState(symbolEwma, clusterEwma, symbolCooldowns, clusterCooldowns, lastUpdate);
    }

    public void reset() {
        lock.lock();
        try {
            symbolEwma.clear();
            clusterEwma.clear();
            symbolCooldowns.clear();
            clusterCooldowns.clear();
            lastUpdate = Instant.now(clock);
            logger.info("Penalty state reset");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save() {
        stateFile.write(snapshot());
    }

    @Override
    public boolean load() {
        var restored = stateFile.read();
        if (restored.isEmpty()) {
            return false;
        }
        PenaltyState state = restored.get();
        lock.lock();
        try {
            symbolEwma.clear();
            symbolEwma.putAll(state.symbolEwma());
            clusterEwma.clear();
            clusterEwma.putAll(state.clusterEwma());
            symbolCooldowns.clear();
            symbolCooldowns.putAll(state.symbolCooldowns());
            clusterCooldowns.clear();
            clusterCooldowns.putAll(state.clusterCooldowns());
            if (state.lastUpdate() != null) {
                lastUpdate = state.lastUpdate();
            }
        } finally {
            lock.unlock();
        }
        logger.info("Penalty state loaded: {} symbols, {} clusters, {} active cooldowns",
            symbolEwma.size(), clusterEwma.size(), symbolCooldowns.size() + clusterCooldowns.size());
        return true;
    }

    @Override
    public String stateName() {
        return "penalty_state";
    }
}
