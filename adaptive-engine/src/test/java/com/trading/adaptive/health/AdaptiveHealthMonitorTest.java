package com.trading.adaptive.health;

import com.trading.adaptive.MutableClock;
import com.trading.adaptive.error.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AdaptiveHealthMonitor Tests")
class AdaptiveHealthMonitorTest {

    private MutableClock clock;
    private AdaptiveHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        monitor = new AdaptiveHealthMonitor(clock);
    }

    @Test
    @DisplayName("Should be healthy before anything is recorded")
    void shouldStartHealthy() {
        assertThat(monitor.isHealthy()).isTrue();
        assertThat(monitor.isHealthy("risk_state")).isTrue();
        assertThat(monitor.status().components()).isEmpty();
    }

    @Test
    @DisplayName("Should turn unhealthy on a persistence failure")
    void shouldRecordFailure() {
        monitor.recordFailure("risk_state", new StorageException("disk full"));

        assertThat(monitor.isHealthy()).isFalse();
        assertThat(monitor.isHealthy("risk_state")).isFalse();
        assertThat(monitor.isHealthy("drift_state")).isTrue();

        var health = monitor.status().components().get("risk_state");
        assertThat(health.failureCount()).isEqualTo(1);
        assertThat(health.lastFailure()).isEqualTo(clock.instant());
        assertThat(health.lastMessage()).isEqualTo("disk full");
    }

    @Test
    @DisplayName("Should recover on the next successful save and keep the failure count")
    void shouldRecover() {
        monitor.recordFailure("risk_state", new StorageException("disk full"));
        monitor.recordFailure("risk_state", new IllegalStateException());
        monitor.recordSuccess("risk_state");

        assertThat(monitor.isHealthy()).isTrue();
        assertThat(monitor.status().healthy()).isTrue();
        assertThat(monitor.status().components().get("risk_state").failureCount()).isEqualTo(2);
    }
}
