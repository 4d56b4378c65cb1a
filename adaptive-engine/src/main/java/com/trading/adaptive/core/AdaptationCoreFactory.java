package com.trading.adaptive.core;

import com.trading.adaptive.calibration.BinnedConfidenceCalibrator;
import com.trading.adaptive.config.AdaptiveConfig;
import com.trading.adaptive.drift.DriftDetector;
import com.trading.adaptive.health.AdaptiveHealthMonitor;
import com.trading.adaptive.metrics.AdaptiveMetrics;
import com.trading.adaptive.penalty.PenaltyTracker;
import com.trading.adaptive.persistence.SqliteOutcomeStore;
import com.trading.adaptive.risk.RiskOptimizer;
import com.trading.adaptive.threshold.ThresholdController;
import io.micrometer.core.instrument.MeterRegistry;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the adaptive components from configuration.
 */
public final class AdaptationCoreFactory {

    private AdaptationCoreFactory() {
    }

    public static AdaptationCore create(AdaptiveConfig config, MeterRegistry registry) {
        return create(config, registry, Clock.systemUTC(),
            BaselineSizer.fixed(config.risk().minPositionUsd()));
    }

    public static AdaptationCore create(AdaptiveConfig config, MeterRegistry registry, Clock clock,
                                        BaselineSizer baseline) {
        config.logSummary();
        Path stateDir = config.adaptation().stateDirectory();

        var store = new SqliteOutcomeStore(config.adaptation().databasePath(), clock);
        var penalties = new PenaltyTracker(config.penalty(), stateDir, clock);
        var calibrator = new BinnedConfidenceCalibrator(config.calibration(), stateDir, clock);
        var drift = new DriftDetector(config.drift(), stateDir, clock);
        var thresholds = new ThresholdController(config.threshold(), stateDir, clock);
        var risk = new RiskOptimizer(config.risk(), stateDir, clock);

        var metrics = new AdaptiveMetrics(registry);
        metrics.bindGauges(thresholds, drift, penalties);

        return new AdaptationCore(config.adaptation(), config.risk(), store, penalties, calibrator, drift,
            thresholds, risk, metrics, new AdaptiveHealthMonitor(clock), baseline, clock);
    }
}
