package com.trading.adaptive.drift;

import com.trading.adaptive.config.DriftSettings;
import com.trading.adaptive.persistence.Persistable;
import com.trading.adaptive.persistence.StateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a Page-Hinkley test on return, calibration error and penalty, and owns the prudent-mode flag.
 *
 * <p>Any test firing (re)starts prudent mode for a full {@code prudentCycles} countdown, overwriting any
 * countdown in progress. The countdown moves once per adaptation cycle.
 *
 * Thread-Safety: updates and the countdown are serialized by a lock; the prudent flag is volatile so the
 * signal path reads it without locking.
 */
public class DriftDetector implements Persistable {
    private static final Logger logger = LoggerFactory.getLogger(DriftDetector.class);
    private static final int SCHEMA_VERSION = 1;

    private final DriftSettings settings;
    private final StateFile<DriftState> stateFile;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<DriftMetric, PageHinkleyDetector> detectors = new EnumMap<>(DriftMetric.class);
    private final Deque<DriftEvent> history = new ArrayDeque<>();

    private volatile boolean prudentModeActive;
    private volatile int prudentCyclesRemaining;
    private Instant lastUpdate;

    public DriftDetector(DriftSettings settings, Path stateDirectory, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.stateFile = new StateFile<>(stateDirectory, stateName(), SCHEMA_VERSION, DriftState.class, clock);
        initDetectors();
        this.lastUpdate = Instant.now(clock);
    }

    private void initDetectors() {
        detectors.put(DriftMetric.RETURN, new PageHinkleyDetector(settings.lambda(), settings.delta()));
        detectors.put(DriftMetric.CALIBRATION_ERROR,
            new PageHinkleyDetector(settings.lambda(), settings.calibrationDelta()));
        detectors.put(DriftMetric.PENALTY, new PageHinkleyDetector(settings.lambda(), settings.delta()));
    }

    /**
     * @param roePct return on equity in percent
     */
    public Optional<DriftEvent> updateReturn(double roePct) {
        return observe(DriftMetric.RETURN, roePct / 100.0);
    }

    public Optional<DriftEvent> updateCalibrationError(double calibratedConfidence, boolean win) {
        double actual = win ? 1.0 : 0.0;
        return observe(DriftMetric.CALIBRATION_ERROR, Math.abs(calibratedConfidence - actual));
    }

    public Optional<DriftEvent> updatePenalty(double penalty) {
        return observe(DriftMetric.PENALTY, penalty);
    }

    private Optional<DriftEvent> observe(DriftMetric metric, double value) {
        lock.lock();
        try {
            Instant now = Instant.now(clock);
            lastUpdate = now;
            PageHinkleyDetector detector = detectors.get(metric);
            if (!detector.update(value, now)) {
                return Optional.empty();
            }
            return Optional.of(onDrift(metric, detector.lastMagnitude(), now));
        } finally {
            lock.unlock();
        }
    }

    private DriftEvent onDrift(DriftMetric metric, double magnitude, Instant now) {
        boolean wasActive = prudentModeActive;
        prudentCyclesRemaining = settings.prudentCycles();
        prudentModeActive = true;

        DriftEvent event = new DriftEvent(metric, now, magnitude, settings.prudentCycles());
        history.addLast(event);
        while (history.size() > settings.historyLimit()) {
            history.removeFirst();
        }

        logger.atWarn()
            .addKeyValue("metric", metric)
            .addKeyValue("magnitude", magnitude)
            .addKeyValue("prudentCycles", settings.prudentCycles())
            .log("🌊 Drift detected");
        if (!wasActive) {
            logger.atWarn()
                .addKeyValue("cycles", settings.prudentCycles())
                .log("🛡️ Prudent mode entered");
        }
        return event;
    }

    /**
     * Move the prudent-mode countdown by one cycle, clearing the flag at zero.
     */
    public void decrementPrudentMode() {
        lock.lock();
        try {
            if (!prudentModeActive) {
                return;
            }
            int remaining = Math.max(0, prudentCyclesRemaining - 1);
            prudentCyclesRemaining = remaining;
            if (remaining == 0) {
                prudentModeActive = false;
                logger.atInfo().log("✅ Prudent mode left");
            } else {
                logger.debug("Prudent mode: {} cycles remaining", remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isPrudentModeActive() {
        return prudentModeActive;
    }

    public int prudentCyclesRemaining() {
        return prudentCyclesRemaining;
    }

    public PrudentAdjustments prudentAdjustments() {
        if (prudentModeActive) {
            return new PrudentAdjustments(settings.thresholdBump(), settings.kellyMultiplier());
        }
        return PrudentAdjustments.NONE;
    }

    public DriftSummary summary() {
        lock.lock();
        try {
            Map<DriftMetric, Integer> counts = new EnumMap<>(DriftMetric.class);
            int total = 0;
            for (var entry : detectors.entrySet()) {
                counts.put(entry.getKey(), entry.getValue().driftCount());
                total += entry.getValue().driftCount();
            }
            return new DriftSummary(prudentModeActive, prudentCyclesRemaining, total, Map.copyOf(counts),
                history.size(), history.peekLast());
        } finally {
            lock.unlock();
        }
    }

    public PageHinkleyDetector.State detectorState(DriftMetric metric) {
        lock.lock();
        try {
            return detectors.get(metric).state();
        } finally {
            lock.unlock();
        }
    }

    public List<DriftEvent> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            detectors.clear();
            initDetectors();
            history.clear();
            prudentModeActive = false;
            prudentCyclesRemaining = 0;
            lastUpdate = Instant.now(clock);
            logger.info("Drift state reset");
        } finally {
            lock.unlock();
        }
    }

    public DriftState snapshot() {
        lock.lock();
        try {
            Map<DriftMetric, PageHinkleyDetector.State> states = new EnumMap<>(DriftMetric.class);
            detectors.forEach((metric, detector) -> states.put(metric, detector.state()));
            return new DriftState(states, prudentModeActive, prudentCyclesRemaining,
                new ArrayList<>(history), lastUpdate);
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
        DriftState state = restored.get();
        lock.lock();
        try {
            if (state.detectors() != null) {
                state.detectors().forEach((metric, detectorState) -> {
                    if (metric != null && detectorState != null) {
                        detectors.get(metric).restore(detectorState);
                    }
                });
            }
            history.clear();
            if (state.history() != null) {
                state.history().stream()
                    .skip(Math.max(0, state.history().size() - settings.historyLimit()))
                    .forEach(history::addLast);
            }
            prudentCyclesRemaining = Math.max(0, state.prudentCyclesRemaining());
            prudentModeActive = state.prudentModeActive() && prudentCyclesRemaining > 0;
            if (state.lastUpdate() != null) {
                lastUpdate = state.lastUpdate();
            }
        } finally {
            lock.unlock();
        }
        logger.info("Drift state loaded: prudent={} ({} cycles), {} events in history",
            prudentModeActive, prudentCyclesRemaining, history.size());
        return true;
    }

    @Override
    public String stateName() {
        return "drift_state";
    }
}
