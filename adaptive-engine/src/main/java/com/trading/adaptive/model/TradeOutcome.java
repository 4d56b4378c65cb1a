package com.trading.adaptive.model;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of one closed position, as handed over by the execution layer.
 *
 * <p>Missing identity fields are replaced by sentinels and missing numeric fields default to zero;
 * the names of the defaulted required fields are kept in {@link #defaultedFields()} so callers can log them.
 * The penalty score is filled in by the adaptive layer via {@link #withPenaltyScore(double)}.
 */
public final class TradeOutcome {
    public static final String UNKNOWN_SYMBOL = "UNKNOWN";
    public static final String DEFAULT_CLUSTER = Signal.DEFAULT_CLUSTER;
    public static final String DEFAULT_TIMEFRAME = Signal.DEFAULT_TIMEFRAME;
    public static final String DEFAULT_STRATEGY_VERSION = "v1.0";

    private static final DateTimeFormatter SESSION_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    // Identity
    private final Long id;
    private final Instant timestamp;
    private final String sessionId;
    private final String strategyVersion;

    // Context
    private final String symbol;
    private final Side side;
    private final String timeframe;
    private final String cluster;

    // Prediction
    private final double rawConfidence;
    private final Double calibratedConfidence;
    private final String predictedDirection;
    private final String modelVersion;

    // Entry / exit
    private final double entryPrice;
    private final Instant entryTime;
    private final double exitPrice;
    private final Instant exitTime;
    private final double positionSize;
    private final double margin;
    private final Long durationSeconds;
    private final String closeReason;

    private final Map<String, Double> technical;

    // Outcome
    private final double roePct;
    private final double pnlUsd;
    private final boolean win;
    private final boolean stopHit;
    private final boolean targetHit;

    // Execution quality
    private final double feesUsd;
    private final double slippageBp;
    private final double spreadBp;
    private final long latencyMs;

    // Excursion
    private final double mfeBp;
    private final double maeBp;

    // Adaptive state at decision time
    private final ThresholdSnapshot thresholds;
    private final double kellyFraction;
    private final boolean cooldownApplied;

    private final double penaltyScore;

    private final List<String> defaultedFields;

    private TradeOutcome(Builder b, List<String> defaulted) {
        this.id = b.id;
        this.timestamp = b.timestamp;
        this.sessionId = b.sessionId;
        this.strategyVersion = b.strategyVersion;
        this.symbol = b.symbol;
        this.side = b.side;
        this.timeframe = b.timeframe;
        this.cluster = b.cluster;
        this.rawConfidence = b.rawConfidence;
        this.calibratedConfidence = b.calibratedConfidence;
        this.predictedDirection = b.predictedDirection;
        this.modelVersion = b.modelVersion;
        this.entryPrice = b.entryPrice;
        this.entryTime = b.entryTime;
        this.exitPrice = b.exitPrice;
        this.exitTime = b.exitTime;
        this.positionSize = b.positionSize;
        this.margin = b.margin;
        this.durationSeconds = b.durationSeconds;
        this.closeReason = b.closeReason;
        this.technical = Collections.unmodifiableMap(new LinkedHashMap<>(b.technical));
        this.roePct = b.roePct;
        this.pnlUsd = b.pnlUsd;
        this.win = b.win;
        this.stopHit = b.stopHit;
        this.targetHit = b.targetHit;
        this.feesUsd = b.feesUsd;
        this.slippageBp = b.slippageBp;
        this.spreadBp = b.spreadBp;
        this.latencyMs = b.latencyMs;
        this.mfeBp = b.mfeBp;
        this.maeBp = b.maeBp;
        this.thresholds = b.thresholds;
        this.kellyFraction = b.kellyFraction;
        this.cooldownApplied = b.cooldownApplied;
        this.penaltyScore = b.penaltyScore;
        this.defaultedFields = List.copyOf(defaulted);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.timestamp = timestamp;
        b.sessionId = sessionId;
        b.strategyVersion = strategyVersion;
        b.symbol = symbol;
        b.side = side;
        b.timeframe = timeframe;
        b.cluster = cluster;
        b.rawConfidence = rawConfidence;
        b.rawConfidenceSet = true;
        b.calibratedConfidence = calibratedConfidence;
        b.predictedDirection = predictedDirection;
        b.modelVersion = modelVersion;
        b.entryPrice = entryPrice;
        b.entryPriceSet = true;
        b.entryTime = entryTime;
        b.exitPrice = exitPrice;
        b.exitPriceSet = true;
        b.exitTime = exitTime;
        b.positionSize = positionSize;
        b.positionSizeSet = true;
        b.margin = margin;
        b.marginSet = true;
        b.durationSeconds = durationSeconds;
        b.closeReason = closeReason;
        b.technical.putAll(technical);
        b.roePct = roePct;
        b.roePctSet = true;
        b.pnlUsd = pnlUsd;
        b.pnlUsdSet = true;
        b.win = win;
        b.winSet = true;
        b.stopHit = stopHit;
        b.targetHit = targetHit;
        b.feesUsd = feesUsd;
        b.slippageBp = slippageBp;
        b.spreadBp = spreadBp;
        b.latencyMs = latencyMs;
        b.mfeBp = mfeBp;
        b.maeBp = maeBp;
        b.thresholds = thresholds;
        b.kellyFraction = kellyFraction;
        b.cooldownApplied = cooldownApplied;
        b.penaltyScore = penaltyScore;
        return b;
    }

    public TradeOutcome withPenaltyScore(double penalty) {
        return toBuilder().penaltyScore(penalty).build();
    }

    public TradeOutcome withId(long newId) {
        return toBuilder().id(newId).build();
    }

    public Long id() { return id; }
    public Instant timestamp() { return timestamp; }
    public String sessionId() { return sessionId; }
    public String strategyVersion() { return strategyVersion; }
    public String symbol() { return symbol; }
    /** Null when the execution layer did not report a usable side. */
    public Side side() { return side; }
    public String timeframe() { return timeframe; }
    public String cluster() { return cluster; }
    public double rawConfidence() { return rawConfidence; }
    public Double calibratedConfidence() { return calibratedConfidence; }
    public String predictedDirection() { return predictedDirection; }
    public String modelVersion() { return modelVersion; }
    public double entryPrice() { return entryPrice; }
    public Instant entryTime() { return entryTime; }
    public double exitPrice() { return exitPrice; }
    public Instant exitTime() { return exitTime; }
    public double positionSize() { return positionSize; }
    public double margin() { return margin; }
    public String closeReason() { return closeReason; }
    public Map<String, Double> technical() { return technical; }
    public double roePct() { return roePct; }
    public double pnlUsd() { return pnlUsd; }
    public boolean win() { return win; }
    public int result() { return win ? 1 : 0; }
    public boolean stopHit() { return stopHit; }
    public boolean targetHit() { return targetHit; }
    public double feesUsd() { return feesUsd; }
    public double slippageBp() { return slippageBp; }
    public double spreadBp() { return spreadBp; }
    public long latencyMs() { return latencyMs; }
    public double mfeBp() { return mfeBp; }
    public double maeBp() { return maeBp; }
    public ThresholdSnapshot thresholds() { return thresholds; }
    public double kellyFraction() { return kellyFraction; }
    public boolean cooldownApplied() { return cooldownApplied; }
    public double penaltyScore() { return penaltyScore; }
    public List<String> defaultedFields() { return defaultedFields; }

    /**
     * Holding time in seconds, or 0 when neither reported nor derivable.
     */
    public long durationSeconds() {
        return durationSeconds != null ? durationSeconds : 0L;
    }

    public boolean hasDuration() {
        return durationSeconds != null;
    }

    /**
     * Calibrated confidence when present, raw confidence otherwise.
     */
    public double effectiveConfidence() {
        return calibratedConfidence != null ? calibratedConfidence : rawConfidence;
    }

    @Override
    public String toString() {
        return "TradeOutcome{id=" + id + ", symbol=" + symbol + ", side=" + side + ", timeframe=" + timeframe
            + ", cluster=" + cluster + ", roePct=" + roePct + ", pnlUsd=" + pnlUsd + ", win=" + win
            + ", penalty=" + penaltyScore + "}";
    }

    public static final class Builder {
        private Long id;
        private Instant timestamp;
        private String sessionId;
        private String strategyVersion;
        private String symbol;
        private Side side;
        private String timeframe;
        private String cluster;
        private double rawConfidence;
        private boolean rawConfidenceSet;
        private Double calibratedConfidence;
        private String predictedDirection;
        private String modelVersion;
        private double entryPrice;
        private boolean entryPriceSet;
        private Instant entryTime;
        private double exitPrice;
        private boolean exitPriceSet;
        private Instant exitTime;
        private double positionSize;
        private boolean positionSizeSet;
        private double margin;
        private boolean marginSet;
        private Long durationSeconds;
        private String closeReason;
        private final Map<String, Double> technical = new LinkedHashMap<>();
        private double roePct;
        private boolean roePctSet;
        private double pnlUsd;
        private boolean pnlUsdSet;
        private boolean win;
        private boolean winSet;
        private boolean stopHit;
        private boolean targetHit;
        private double feesUsd;
        private double slippageBp;
        private double spreadBp;
        private long latencyMs;
        private double mfeBp;
        private double maeBp;
        private ThresholdSnapshot thresholds;
        private double kellyFraction;
        private boolean cooldownApplied;
        private double penaltyScore;

        private Builder() {
        }

        public Builder id(Long id) { this.id = id; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder strategyVersion(String strategyVersion) { this.strategyVersion = strategyVersion; return this; }
        public Builder symbol(String symbol) { this.symbol = symbol; return this; }
        public Builder side(Side side) { this.side = side; return this; }
        public Builder side(String side) { this.side = Side.parse(side); return this; }
        public Builder timeframe(String timeframe) { this.timeframe = timeframe; return this; }
        public Builder cluster(String cluster) { this.cluster = cluster; return this; }

        public Builder rawConfidence(double rawConfidence) {
            this.rawConfidence = rawConfidence;
            this.rawConfidenceSet = true;
            return this;
        }

        public Builder calibratedConfidence(Double calibratedConfidence) {
            this.calibratedConfidence = calibratedConfidence;
            return this;
        }

        public Builder predictedDirection(String predictedDirection) { this.predictedDirection = predictedDirection; return this; }
        public Builder modelVersion(String modelVersion) { this.modelVersion = modelVersion; return this; }

        public Builder entryPrice(double entryPrice) {
            this.entryPrice = entryPrice;
            this.entryPriceSet = true;
            return this;
        }

        public Builder entryTime(Instant entryTime) { this.entryTime = entryTime; return this; }

        public Builder exitPrice(double exitPrice) {
            this.exitPrice = exitPrice;
            this.exitPriceSet = true;
            return this;
        }

        public Builder exitTime(Instant exitTime) { this.exitTime = exitTime; return this; }

        public Builder positionSize(double positionSize) {
            this.positionSize = positionSize;
            this.positionSizeSet = true;
            return this;
        }

        public Builder margin(double margin) {
            this.margin = margin;
            this.marginSet = true;
            return this;
        }

        public Builder durationSeconds(Long durationSeconds) { this.durationSeconds = durationSeconds; return this; }
        public Builder closeReason(String closeReason) { this.closeReason = closeReason; return this; }

        public Builder technical(String name, double value) {
            this.technical.put(name, value);
            return this;
        }

        public Builder technical(Map<String, Double> values) {
            if (values != null) {
                this.technical.putAll(values);
            }
            return this;
        }

        public Builder roePct(double roePct) {
            this.roePct = roePct;
            this.roePctSet = true;
            return this;
        }

        public Builder pnlUsd(double pnlUsd) {
            this.pnlUsd = pnlUsd;
            this.pnlUsdSet = true;
            return this;
        }

        public Builder win(boolean win) {
            this.win = win;
            this.winSet = true;
            return this;
        }

        public Builder stopHit(boolean stopHit) { this.stopHit = stopHit; return this; }
        public Builder targetHit(boolean targetHit) { this.targetHit = targetHit; return this; }
        public Builder feesUsd(double feesUsd) { this.feesUsd = feesUsd; return this; }
        public Builder slippageBp(double slippageBp) { this.slippageBp = slippageBp; return this; }
        public Builder spreadBp(double spreadBp) { this.spreadBp = spreadBp; return this; }
        public Builder latencyMs(long latencyMs) { this.latencyMs = latencyMs; return this; }
        public Builder mfeBp(double mfeBp) { this.mfeBp = mfeBp; return this; }
        public Builder maeBp(double maeBp) { this.maeBp = maeBp; return this; }
        public Builder thresholds(ThresholdSnapshot thresholds) { this.thresholds = thresholds; return this; }
        public Builder kellyFraction(double kellyFraction) { this.kellyFraction = kellyFraction; return this; }
        public Builder cooldownApplied(boolean cooldownApplied) { this.cooldownApplied = cooldownApplied; return this; }
        public Builder penaltyScore(double penaltyScore) { this.penaltyScore = penaltyScore; return this; }

        /**
         * Build the outcome, defaulting anything the execution layer left out.
         */
        public TradeOutcome build() {
            List<String> defaulted = new ArrayList<>();

            if (symbol == null || symbol.isBlank()) {
                symbol = UNKNOWN_SYMBOL;
                defaulted.add("symbol");
            }
            if (side == null) {
                defaulted.add("side");
            }
            if (timeframe == null || timeframe.isBlank()) {
                timeframe = DEFAULT_TIMEFRAME;
                defaulted.add("timeframe");
            }
            if (cluster == null || cluster.isBlank()) {
                cluster = DEFAULT_CLUSTER;
            }
            if (timestamp == null) {
                timestamp = exitTime != null ? exitTime : Instant.now();
            }
            if (sessionId == null || sessionId.isBlank()) {
                sessionId = SESSION_FORMAT.format(timestamp);
            }
            if (strategyVersion == null) {
                strategyVersion = DEFAULT_STRATEGY_VERSION;
            }
            if (thresholds == null) {
                thresholds = ThresholdSnapshot.DEFAULT;
            }
            if (durationSeconds == null && entryTime != null && exitTime != null) {
                durationSeconds = Math.max(0L, Duration.between(entryTime, exitTime).getSeconds());
            }

            markIfMissing(defaulted, rawConfidenceSet, "rawConfidence");
            markIfMissing(defaulted, entryPriceSet, "entryPrice");
            markIfMissing(defaulted, entryTime != null, "entryTime");
            markIfMissing(defaulted, positionSizeSet, "positionSize");
            markIfMissing(defaulted, marginSet, "margin");
            markIfMissing(defaulted, exitPriceSet, "exitPrice");
            markIfMissing(defaulted, exitTime != null, "exitTime");
            markIfMissing(defaulted, durationSeconds != null, "durationSeconds");
            markIfMissing(defaulted, roePctSet, "roePct");
            markIfMissing(defaulted, pnlUsdSet, "pnlUsd");
            markIfMissing(defaulted, winSet, "result");

            return new TradeOutcome(this, defaulted);
        }

        private static void markIfMissing(List<String> defaulted, boolean present, String field) {
            if (!present) {
                defaulted.add(field);
            }
        }
    }
}
