package com.trading.adaptive.core;

import com.trading.adaptive.calibration.CalibrationSummary;
import com.trading.adaptive.calibration.ConfidenceCalibrator;
import com.trading.adaptive.config.AdaptationSettings;
import com.trading.adaptive.config.RiskSettings;
import com.trading.adaptive.drift.DriftDetector;
import com.trading.adaptive.drift.DriftEvent;
import com.trading.adaptive.drift.PrudentAdjustments;
import com.trading.adaptive.error.StorageException;
import com.trading.adaptive.error.ValidationException;
import com.trading.adaptive.health.AdaptiveHealthMonitor;
import com.trading.adaptive.metrics.AdaptiveMetrics;
import com.trading.adaptive.model.FilteredSignal;
import com.trading.adaptive.model.Signal;
import com.trading.adaptive.model.ThresholdSnapshot;
import com.trading.adaptive.model.TradeFilter;
import com.trading.adaptive.model.TradeOutcome;
import com.trading.adaptive.model.TradeStatistics;
import com.trading.adaptive.penalty.PenaltyTracker;
import com.trading.adaptive.persistence.OutcomeStore;
import com.trading.adaptive.persistence.Persistable;
import com.trading.adaptive.risk.RiskOptimizer;
import com.trading.adaptive.threshold.ThresholdController;
import com.trading.adaptive.threshold.ThresholdUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates the adaptive layer: records outcomes, filters and sizes signals, and runs adaptation cycles.
 *
 * <p>Nothing thrown by a component reaches a trading caller. Failures are logged, surfaced through
 * {@link AdaptiveHealthMonitor} and metrics, and replaced by a conservative default.
 *
 * Thread-Safety:
 * <ul>
 *   <li>{@link #logOutcome} calls are serialized by an ingest lock and complete synchronously</li>
 *   <li>adaptation cycles run on a single worker; a trigger while a cycle is running is dropped</li>
 *   <li>filtering reads one {@link DecisionSnapshot}, published whole at the end of each cycle</li>
 * </ul>
 */
public class AdaptationCore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AdaptationCore.class);

    static final String OUTCOME_STORE = "outcome_store";

    private final AdaptationSettings settings;
    private final RiskSettings riskSettings;
    private final OutcomeStore store;
    private final PenaltyTracker penalties;
    private final ConfidenceCalibrator calibrator;
    private final DriftDetector drift;
    private final ThresholdController thresholds;
    private final RiskOptimizer risk;
    private final AdaptiveMetrics metrics;
    private final AdaptiveHealthMonitor health;
    private final BaselineSizer baselineSizer;
    private final Clock clock;

    private final ReentrantLock ingestLock = new ReentrantLock();
    private final AtomicReference<CycleState> cycleState = new AtomicReference<>(CycleState.IDLE);
    private final AtomicReference<DecisionSnapshot> decision = new AtomicReference<>();
    private final AtomicInteger tradesSinceAdaptation = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final ExecutorService worker;

    private volatile boolean enabled = true;
    private volatile Instant lastAdaptation;
    private volatile CycleReport lastReport;
    private volatile Future<?> pendingCycle;

    public AdaptationCore(AdaptationSettings settings,
                          RiskSettings riskSettings,
                          OutcomeStore store,
                          PenaltyTracker penalties,
                          ConfidenceCalibrator calibrator,
                          DriftDetector drift,
                          ThresholdController thresholds,
                          RiskOptimizer risk,
                          AdaptiveMetrics metrics,
                          AdaptiveHealthMonitor health,
                          BaselineSizer baselineSizer,
                          Clock clock) {
        this.settings = settings;
        this.riskSettings = riskSettings;
        this.store = store;
        this.penalties = penalties;
        this.calibrator = calibrator;
        this.drift = drift;
        this.thresholds = thresholds;
        this.risk = risk;
        this.metrics = metrics;
        this.health = health;
        this.baselineSizer = baselineSizer;
        this.clock = clock;
        this.lastAdaptation = Instant.now(clock);
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "adaptation-worker");
            t.setDaemon(true);
            return t;
        });
        publishSnapshot();
    }

    /**
     * Restore persisted component state and apply retention to the outcome log.
     *
     * @return true if every component either loaded state or started fresh without error
     */
    public boolean initialize() {
        boolean ok = true;
        for (Persistable component : components()) {
            try {
                boolean loaded = component.load();
                logger.debug("{}: {}", component.stateName(), loaded ? "state restored" : "starting fresh");
            } catch (RuntimeException e) {
                ok = false;
                logger.error("❌ Failed to load {}: {}", component.stateName(), e.getMessage(), e);
            }
        }
        publishSnapshot();

        try {
            int removed = store.retentionSweep(settings.retentionMaxTrades(), settings.retentionMaxDays());
            health.recordSuccess(OUTCOME_STORE);
            if (removed > 0) {
                logger.info("Retention sweep removed {} outcome(s)", removed);
            }
        } catch (StorageException e) {
            ok = false;
            health.recordFailure(OUTCOME_STORE, e);
            metrics.incrementStorageFailure(OUTCOME_STORE);
        }

        AdaptiveState state = currentState();
        logger.atInfo()
            .addKeyValue("global", String.format("%.2f", state.thresholds().global()))
            .addKeyValue("trades", state.totalTrades())
            .addKeyValue("prudent", state.drift().prudentModeActive())
            .addKeyValue("cooldowns", state.activeCooldowns().size())
            .log("🧠 Adaptive learning initialized");
        return ok;
    }

    /**
     * Record a closed trade and update every online component. Runs synchronously: once this returns, the
     * next filter or sizing call sees the effects. May schedule an adaptation cycle.
     *
     * @return the stored row id, or empty if the outcome was rejected or could not be persisted
     */
    public OptionalLong logOutcome(TradeOutcome outcome) {
        if (outcome == null) {
            logger.warn("⚠️ Ignoring null trade outcome");
            return OptionalLong.empty();
        }
        if (!outcome.defaultedFields().isEmpty()) {
            logger.warn("⚠️ Outcome for {} missing fields, defaults applied: {}",
                outcome.symbol(), outcome.defaultedFields());
        }

        long id;
        ingestLock.lock();
        try {
            double penalty;
            try {
                penalty = penalties.score(outcome);
            } catch (RuntimeException e) {
                logger.error("❌ Penalty scoring failed for {}: {}", outcome.symbol(), e.getMessage(), e);
                penalty = 0.0;
            }
            TradeOutcome scored = outcome.withPenaltyScore(penalty);

            try {
                id = store.append(scored);
                health.recordSuccess(OUTCOME_STORE);
            } catch (StorageException e) {
                health.recordFailure(OUTCOME_STORE, e);
                metrics.incrementStorageFailure(OUTCOME_STORE);
                return OptionalLong.empty();
            }

            try {
                updateOnline(scored, penalty);
            } catch (RuntimeException e) {
                logger.error("❌ Online update failed for {}: {}", scored.symbol(), e.getMessage(), e);
            }

            tradesSinceAdaptation.incrementAndGet();
            thresholds.incrementTradeCount();
            metrics.incrementOutcomesLogged();

            logger.atInfo()
                .addKeyValue("symbol", scored.symbol())
                .addKeyValue("win", scored.win())
                .addKeyValue("roePct", String.format("%.2f", scored.roePct()))
                .addKeyValue("penalty", String.format("%.3f", penalty))
                .log("📝 Trade outcome logged");
        } finally {
            ingestLock.unlock();
        }

        if (shouldRunAdaptation()) {
            triggerCycle();
        }
        return OptionalLong.of(id);
    }

    private void updateOnline(TradeOutcome outcome, double penalty) {
        penalties.updateEwma(outcome.symbol(), outcome.cluster(), penalty);

        List<DriftEvent> events = new ArrayList<>(3);
        drift.updateReturn(outcome.roePct()).ifPresent(events::add);
        if (outcome.calibratedConfidence() != null) {
            drift.updateCalibrationError(outcome.calibratedConfidence(), outcome.win()).ifPresent(events::add);
        }
        drift.updatePenalty(penalty).ifPresent(events::add);

        risk.recordOutcome(outcome.pnlUsd());

        if (!events.isEmpty()) {
            events.forEach(e -> metrics.incrementDrift(e.metric()));
            save(drift);
        }
    }

    boolean shouldRunAdaptation() {
        if (tradesSinceAdaptation.get() >= settings.minTradesForUpdate()) {
            return true;
        }
        return Duration.between(lastAdaptation, Instant.now(clock)).compareTo(settings.updateInterval()) >= 0;
    }

    /**
     * Schedule a cycle on the adaptation worker.
     *
     * @return false if a cycle is already running (the trigger is dropped) or the core is closed
     */
    public boolean triggerCycle() {
        if (!cycleState.compareAndSet(CycleState.IDLE, CycleState.RUNNING)) {
            logger.debug("Adaptation cycle already running, trigger dropped");
            return false;
        }
        try {
            pendingCycle = worker.submit(() -> {
                try {
                    runCycle();
                } finally {
                    cycleState.set(CycleState.IDLE);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            cycleState.set(CycleState.IDLE);
            logger.warn("⚠️ Adaptation worker unavailable, cycle not scheduled");
            return false;
        }
    }

    /**
     * Run one adaptation cycle on the calling thread.
     *
     * @return the cycle report, or empty if another cycle was already running
     */
    public Optional<CycleReport> runAdaptationCycle() {
        if (!cycleState.compareAndSet(CycleState.IDLE, CycleState.RUNNING)) {
            logger.debug("Adaptation cycle already running, skipping");
            return Optional.empty();
        }
        try {
            return Optional.of(runCycle());
        } finally {
            cycleState.set(CycleState.IDLE);
        }
    }

    private CycleReport runCycle() {
        Instant started = Instant.now(clock);
        long startNanos = System.nanoTime();
        Map<String, String> failures = new LinkedHashMap<>();
        logger.info("🔄 Adaptation cycle started ({} trades since last)", tradesSinceAdaptation.get());

        ThresholdUpdate thresholdUpdate = null;
        try {
            thresholdUpdate = thresholds.update(store, penalties.clusterPenalties());
        } catch (RuntimeException e) {
            failed(failures, thresholds.stateName(), e);
        }

        CalibrationSummary calibration = CalibrationSummary.NONE;
        try {
            calibration = calibrator.recalibrateAll(store);
        } catch (RuntimeException e) {
            failed(failures, calibrator.stateName(), e);
        }

        Map<String, String> kellyChanges = Map.of();
        try {
            kellyChanges = risk.refit(store);
        } catch (RuntimeException e) {
            failed(failures, risk.stateName(), e);
        }

        List<String> cooldowns = List.of();
        try {
            cooldowns = penalties.tickCooldowns();
        } catch (RuntimeException e) {
            failed(failures, penalties.stateName(), e);
        }

        try {
            drift.decrementPrudentMode();
        } catch (RuntimeException e) {
            failed(failures, drift.stateName(), e);
        }

        tradesSinceAdaptation.set(0);
        lastAdaptation = Instant.now(clock);
        publishSnapshot();
        saveAll();

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        CycleReport report = new CycleReport(started, duration, thresholdUpdate, calibration, kellyChanges,
            cooldowns, drift.isPrudentModeActive(), drift.prudentCyclesRemaining(), failures);
        lastReport = report;

        metrics.recordCycle(duration);
        metrics.incrementCycles(report.successful() ? "completed" : "partial");

        logger.atInfo()
            .addKeyValue("durationMs", duration.toMillis())
            .addKeyValue("global", thresholdUpdate != null ? String.format("%.2f", thresholdUpdate.newGlobal()) : "-")
            .addKeyValue("calibrated", calibration.refitBuckets().size())
            .addKeyValue("kellyChanges", kellyChanges.size())
            .addKeyValue("cooldowns", cooldowns.size())
            .addKeyValue("prudent", report.prudentModeActive())
            .log(report.successful() ? "✅ Adaptation cycle complete" : "⚠️ Adaptation cycle completed with failures");
        return report;
    }

    private static void failed(Map<String, String> failures, String step, RuntimeException e) {
        failures.put(step, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        logger.error("❌ Adaptation step {} failed, keeping previous state: {}", step, e.getMessage(), e);
    }

    private void publishSnapshot() {
        decision.set(new DecisionSnapshot(thresholds.allThresholds(), calibrator.mapping(), Instant.now(clock)));
    }

    /**
     * Calibrate each signal, drop cooled-down symbols and clusters, and keep signals whose calibrated
     * confidence reaches the effective threshold (plus the prudent-mode bump). Disabled or failing, every
     * signal passes with its raw confidence.
     */
    public List<FilteredSignal> filter(List<Signal> signals) {
        if (signals == null || signals.isEmpty()) {
            return List.of();
        }
        if (!enabled) {
            return passThrough(signals);
        }

        try {
            DecisionSnapshot snapshot = decision.get();
            PrudentAdjustments adjustments = drift.prudentAdjustments();
            List<FilteredSignal> accepted = new ArrayList<>();

            for (Signal signal : signals) {
                try {
                    evaluate(signal, snapshot, adjustments, accepted);
                } catch (RuntimeException e) {
                    logger.warn("⚠️ Rejecting signal {} that could not be evaluated: {}", signal, e.getMessage());
                    metrics.incrementSignals("rejected");
                }
            }

            logger.info("🧠 Adaptive filter: {} → {} signals{}", signals.size(), accepted.size(),
                adjustments.isActive() ? " (prudent)" : "");
            return accepted;
        } catch (RuntimeException e) {
            logger.error("❌ Adaptive filtering failed, passing signals unfiltered: {}", e.getMessage(), e);
            return passThrough(signals);
        }
    }

    private void evaluate(Signal signal, DecisionSnapshot snapshot, PrudentAdjustments adjustments,
                          List<FilteredSignal> accepted) {
        if (signal == null) {
            throw new ValidationException("signal is null");
        }
        double calibrated = snapshot.calibration()
            .apply(signal.rawConfidence(), signal.side(), signal.timeframe());

        if (penalties.isCoolingDown(signal.symbol(), signal.cluster())) {
            logger.debug("{} rejected: cooling down", signal.symbol());
            metrics.incrementSignals("cooled");
            return;
        }

        double threshold = snapshot.thresholds().effective(signal.side(), signal.timeframe(), signal.cluster())
            + adjustments.thresholdBump();
        if (calibrated >= threshold) {
            accepted.add(new FilteredSignal(signal, calibrated, threshold));
            metrics.incrementSignals("accepted");
        } else {
            logger.debug("{} rejected: {} < {}", signal.symbol(),
                String.format("%.3f", calibrated), String.format("%.3f", threshold));
            metrics.incrementSignals("rejected");
        }
    }

    private static List<FilteredSignal> passThrough(List<Signal> signals) {
        List<FilteredSignal> result = new ArrayList<>(signals.size());
        for (Signal signal : signals) {
            if (signal != null) {
                result.add(new FilteredSignal(signal, signal.rawConfidence(), 0.0));
            }
        }
        return result;
    }

    /**
     * Thresholds that apply to a signal right now, for recording on the eventual outcome.
     */
    public ThresholdSnapshot thresholdsFor(Signal signal) {
        return decision.get().thresholds().snapshotFor(signal.side(), signal.timeframe(), signal.cluster());
    }

    public List<Double> sizeAll(List<FilteredSignal> signals, double walletBalance) {
        return sizeAll(signals, walletBalance, baselineSizer);
    }

    /**
     * Margin in USD for each signal, in input order. If adaptive sizing fails for any signal the whole
     * batch is sized by {@code baseline}.
     */
    public List<Double> sizeAll(List<FilteredSignal> signals, double walletBalance, BaselineSizer baseline) {
        if (signals == null || signals.isEmpty()) {
            return List.of();
        }
        if (!enabled) {
            return baseline(signals, walletBalance, baseline);
        }
        if (!(walletBalance > 0)) {
            return zeros(signals.size());
        }

        try {
            double multiplier = drift.prudentAdjustments().kellyMultiplier();
            List<Double> margins = new ArrayList<>(signals.size());
            for (FilteredSignal signal : signals) {
                double fraction = risk.kellyFraction(signal.calibratedConfidence(), signal.symbol(), walletBalance)
                    * multiplier;
                double margin = Math.max(riskSettings.minPositionUsd(),
                    Math.min(riskSettings.maxPositionUsd(), fraction * walletBalance));
                margins.add(margin);
                logger.debug("Margin {}: fraction={} -> ${}", signal.symbol(),
                    String.format("%.4f", fraction), String.format("%.2f", margin));
            }
            return margins;
        } catch (RuntimeException e) {
            logger.error("❌ Adaptive sizing failed, using baseline for {} signal(s): {}",
                signals.size(), e.getMessage(), e);
            metrics.incrementSizingFallback();
            return baseline(signals, walletBalance, baseline);
        }
    }

    private static List<Double> baseline(List<FilteredSignal> signals, double wallet, BaselineSizer baseline) {
        try {
            List<Double> margins = baseline.size(signals, wallet);
            if (margins != null && margins.size() == signals.size()) {
                return margins;
            }
            logger.error("❌ Baseline sizer returned {} margins for {} signals",
                margins == null ? "no" : margins.size(), signals.size());
        } catch (RuntimeException e) {
            logger.error("❌ Baseline sizing failed: {}", e.getMessage(), e);
        }
        return zeros(signals.size());
    }

    private static List<Double> zeros(int n) {
        return Collections.nCopies(n, 0.0);
    }

    public AdaptiveState currentState() {
        return new AdaptiveState(
            enabled,
            cycleState.get(),
            thresholds.allThresholds(),
            thresholds.tradesSinceUpdate(),
            risk.kellyInfo(),
            drift.summary(),
            calibrator.info().bucketCount(),
            store.count(),
            tradesSinceAdaptation.get(),
            penalties.activeCooldowns(),
            lastAdaptation,
            health.status());
    }

    public TradeStatistics recentPerformance(int window) {
        return store.statistics(window, TradeFilter.NONE);
    }

    public Optional<CycleReport> lastCycleReport() {
        return Optional.ofNullable(lastReport);
    }

    public CycleState cycleState() {
        return cycleState.get();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void enable() {
        enabled = true;
        logger.info("🧠 Adaptive learning enabled");
    }

    public void disable() {
        enabled = false;
        logger.warn("⚠️ Adaptive learning disabled, using baseline filtering and sizing");
    }

    /**
     * Wait for the most recently scheduled cycle, if any.
     *
     * @return false on timeout
     */
    public boolean awaitPendingCycle(Duration timeout) throws InterruptedException {
        Future<?> pending = pendingCycle;
        if (pending == null) {
            return true;
        }
        try {
            pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            logger.error("❌ Adaptation cycle failed: {}", e.getCause().getMessage(), e.getCause());
            return true;
        }
    }

    public AdaptiveHealthMonitor health() {
        return health;
    }

    private List<Persistable> components() {
        return List.of(thresholds, penalties, calibrator, drift, risk);
    }

    private void saveAll() {
        components().forEach(this::save);
    }

    private void save(Persistable component) {
        try {
            component.save();
            health.recordSuccess(component.stateName());
        } catch (RuntimeException e) {
            health.recordFailure(component.stateName(), e);
            metrics.incrementStorageFailure(component.stateName());
        }
    }

    /**
     * Stop the adaptation worker, persist every component and close the outcome log.
     */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down adaptive learning");
        worker.shutdown();
        try {
            if (!worker.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("⚠️ Adaptation cycle still running after 30s, forcing shutdown");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }

        saveAll();
        try {
            store.close();
        } catch (Exception e) {
            logger.error("❌ Failed to close outcome store: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
