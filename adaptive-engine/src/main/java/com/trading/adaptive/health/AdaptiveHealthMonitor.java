package com.trading.adaptive.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing health signal for state persistence.
 *
 * <p>A component turns unhealthy when a save fails and healthy again on its next successful save. Failure
 * counts are cumulative.
 */
public class AdaptiveHealthMonitor {
    private static final Logger logger = LoggerFactory.getLogger(AdaptiveHealthMonitor.class);

    private final Clock clock;
    private final Map<String, ComponentHealth> components = new ConcurrentHashMap<>();

    public AdaptiveHealthMonitor(Clock clock) {
        this.clock = clock;
    }

    public void recordFailure(String component, Throwable error) {
        Instant now = Instant.now(clock);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        ComponentHealth updated = components.merge(component,
            new ComponentHealth(false, 1, now, message),
            (prev, next) -> new ComponentHealth(false, prev.failureCount() + 1, now, message));

        logger.error("❌ HEALTH: {} persistence failed ({} total): {}", component, updated.failureCount(), message);
    }

    public void recordSuccess(String component) {
        components.compute(component, (key, prev) -> {
            if (prev == null) {
                return new ComponentHealth(true, 0, null, null);
            }
            if (!prev.healthy()) {
                logger.info("✅ HEALTH: {} persistence recovered", component);
            }
            return new ComponentHealth(true, prev.failureCount(), prev.lastFailure(), prev.lastMessage());
        });
    }

    public boolean isHealthy() {
        return components.values().stream().allMatch(ComponentHealth::healthy);
    }

    public boolean isHealthy(String component) {
        ComponentHealth health = components.get(component);
        return health == null || health.healthy();
    }

    public HealthStatus status() {
        Map<String, ComponentHealth> snapshot = new TreeMap<>(components);
        boolean healthy = snapshot.values().stream().allMatch(ComponentHealth::healthy);
        return new HealthStatus(healthy, Map.copyOf(snapshot));
    }

    /**
     * Persistence health of one component.
     */
    public record ComponentHealth(boolean healthy, int failureCount, Instant lastFailure, String lastMessage) {
    }

    public record HealthStatus(boolean healthy, Map<String, ComponentHealth> components) {
    }
}
