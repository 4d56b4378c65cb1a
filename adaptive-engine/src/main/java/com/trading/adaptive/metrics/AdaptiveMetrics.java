package com.trading.adaptive.metrics;

import com.trading.adaptive.drift.DriftDetector;
import com.trading.adaptive.drift.DriftMetric;
import com.trading.adaptive.penalty.PenaltyTracker;
import com.trading.adaptive.threshold.ThresholdController;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Micrometer meters of the adaptive layer.
 *
 * Usage:
 *   var metrics = new AdaptiveMetrics(AdaptiveMetrics.prometheusRegistry());
 *   metrics.incrementOutcomesLogged();
 *   metrics.recordCycle(duration);
 */
public final class AdaptiveMetrics {
    private static final Logger logger = LoggerFactory.getLogger(AdaptiveMetrics.class);

    private final MeterRegistry registry;
    private final Timer cycleTimer;

    public AdaptiveMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.cycleTimer = Timer.builder("adaptive.cycle.duration")
            .description("Duration of one adaptation cycle")
            .register(registry);
        logger.debug("AdaptiveMetrics bound to {}", registry.getClass().getSimpleName());
    }

    public static PrometheusMeterRegistry prometheusRegistry() {
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Prometheus-formatted metrics, or an empty string when the registry is not a Prometheus one.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    /**
     * Register gauges that read live component state.
     */
    public void bindGauges(ThresholdController thresholds, DriftDetector drift, PenaltyTracker penalties) {
        Gauge.builder("adaptive.threshold.global", thresholds, ThresholdController::globalThreshold)
            .description("Global acceptance threshold")
            .register(registry);
        Gauge.builder("adaptive.prudent.active", drift, d -> d.isPrudentModeActive() ? 1.0 : 0.0)
            .description("1 while prudent mode is active")
            .register(registry);
        Gauge.builder("adaptive.prudent.cycles.remaining", drift, DriftDetector::prudentCyclesRemaining)
            .register(registry);
        Gauge.builder("adaptive.cooldowns.active", penalties, p -> p.activeCooldowns().size())
            .description("Symbols and clusters currently cooling down")
            .register(registry);
    }

    public void incrementOutcomesLogged() {
        registry.counter("adaptive.outcomes.logged").increment();
    }

    public void incrementSignals(String decision) {
        registry.counter("adaptive.signals", "decision", decision).increment();
    }

    public void incrementCycles(String status) {
        registry.counter("adaptive.cycles", "status", status).increment();
    }

    public void incrementDrift(DriftMetric metric) {
        registry.counter("adaptive.drift.events", "metric", metric.name().toLowerCase()).increment();
    }

    public void incrementStorageFailure(String component) {
        registry.counter("adaptive.storage.failures", "component", component).increment();
    }

    public void incrementSizingFallback() {
        registry.counter("adaptive.sizing.fallback").increment();
    }

    public void recordCycle(Duration duration) {
        cycleTimer.record(duration);
    }

    public double count(String name, String... tags) {
        var counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0.0 : counter.count();
    }
}
