package com.trading.adaptive.risk;

import com.trading.adaptive.MutableClock;
import com.trading.adaptive.TestOutcomes;
import com.trading.adaptive.config.RiskSettings;
import com.trading.adaptive.model.KellyParameters;
import com.trading.adaptive.persistence.OutcomeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("RiskOptimizer Tests")
class RiskOptimizerTest {

    @TempDir
    Path stateDir;

    private MutableClock clock;
    private RiskOptimizer optimizer;
    private OutcomeStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        optimizer = new RiskOptimizer(RiskSettings.defaults(), stateDir, clock);
        store = mock(OutcomeStore.class);
        when(store.kellyParameters(anyString(), anyInt())).thenReturn(KellyParameters.DEFAULT);
        when(store.recent(anyInt())).thenReturn(List.of());
        when(store.lossesSince(any(Instant.class))).thenReturn(List.of());
    }

    @Nested
    @DisplayName("Kelly sizing")
    class Sizing {

        @Test
        @DisplayName("Should walk through the Kelly chain with default parameters")
        void shouldComputeBreakdown() {
            KellyBreakdown k = optimizer.kellyBreakdown(0.70, "BTC/USD", 10_000);

            assertThat(k.rawKelly()).isCloseTo(0.55, within(1e-9));
            assertThat(k.volRatio()).isEqualTo(1.0);
            assertThat(k.conservative()).isCloseTo(0.1375, within(1e-9));
            assertThat(k.capped()).isEqualTo(0.01);
            assertThat(k.positionUsd()).isCloseTo(100.0, within(1e-9));
            assertThat(k.fraction()).isCloseTo(0.01, within(1e-9));
            assertThat(k.dailyCapApplied()).isFalse();
        }

        @Test
        @DisplayName("Should cap a strong edge at the maximum fraction")
        void shouldCapStrongEdge() {
            KellyBreakdown k = optimizer.kellyBreakdown(0.80, "BTC/USD", 10_000);

            assertThat(k.rawKelly()).isCloseTo(0.70, within(1e-9));
            assertThat(k.conservative()).isCloseTo(0.175, within(1e-9));
            assertThat(k.capped()).isEqualTo(0.01);
        }

        @Test
        @DisplayName("Should return zero for an empty wallet")
        void shouldReturnZeroForEmptyWallet() {
            assertThat(optimizer.kellyFraction(0.9, "BTC/USD", 0)).isZero();
            assertThat(optimizer.kellyFraction(0.9, "BTC/USD", -50)).isZero();
        }

        @Test
        @DisplayName("Should floor a negative edge at zero Kelly and size at the minimum position")
        void shouldFloorNegativeEdge() {
            KellyBreakdown k = optimizer.kellyBreakdown(0.30, "BTC/USD", 10_000);

            assertThat(k.rawKelly()).isZero();
            assertThat(k.positionUsd()).isEqualTo(15.0);
        }

        @ParameterizedTest
        @DisplayName("Should keep the position between the configured bounds")
        @CsvSource({
            "0.95, 100000",
            "0.95, 500",
            "0.55, 20000",
            "0.70, 1000",
            "0.10, 50"
        })
        void shouldStayWithinBounds(double p, double wallet) {
            double position = optimizer.kellyFraction(p, "ETH/USD", wallet) * wallet;

            assertThat(position).isBetween(15.0 - 1e-9, 150.0 + 1e-9);
        }
    }

    @Nested
    @DisplayName("Daily loss cap")
    class DailyLossCap {

        @Test
        @DisplayName("Should halve sizing once today's losses exceed the cap")
        void shouldHalveWhenExceeded() {
            optimizer.recordOutcome(-60);
            assertThat(optimizer.isDailyCapExceeded()).isFalse();

            optimizer.recordOutcome(-50);
            assertThat(optimizer.isDailyCapExceeded()).isTrue();
            assertThat(optimizer.maxFraction()).isEqualTo(0.005);

            KellyBreakdown k = optimizer.kellyBreakdown(0.70, "BTC/USD", 10_000);
            assertThat(k.dailyCapApplied()).isTrue();
            assertThat(k.positionUsd()).isCloseTo(50.0, within(1e-9));
        }

        @Test
        @DisplayName("Should ignore winning trades")
        void shouldIgnoreWins() {
            optimizer.recordOutcome(500);
            assertThat(optimizer.currentDailyLoss()).isZero();
        }

        @Test
        @DisplayName("Should reset on the next UTC day")
        void shouldResetOnNewDay() {
            optimizer.recordOutcome(-150);
            assertThat(optimizer.isDailyCapExceeded()).isTrue();

            clock.advance(Duration.ofDays(1));
            assertThat(optimizer.currentDailyLoss()).isZero();
            assertThat(optimizer.isDailyCapExceeded()).isFalse();

            optimizer.recordOutcome(-10);
            assertThat(optimizer.currentDailyLoss()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("Should set the cap to twice the median recent loss")
        void shouldDeriveCapFromLosses() {
            when(store.lossesSince(any(Instant.class))).thenReturn(List.of(-10.0, -50.0, -30.0, -20.0, -40.0));

            optimizer.refit(store);

            assertThat(optimizer.dailyLossCap()).isEqualTo(60.0);
        }

        @Test
        @DisplayName("Should keep the default cap with too few losses")
        void shouldKeepDefaultCap() {
            when(store.lossesSince(any(Instant.class))).thenReturn(List.of(-10.0, -20.0));

            optimizer.refit(store);

            assertThat(optimizer.dailyLossCap()).isEqualTo(100.0);
        }
    }

    @Nested
    @DisplayName("Refit")
    class Refit {

        @Test
        @DisplayName("Should fit every bucket touched by recent outcomes")
        void shouldFitRecentBuckets() {
            when(store.recent(200)).thenReturn(List.of(TestOutcomes.win("BTC/USD", clock.instant())));
            when(store.kellyParameters(anyString(), anyInt())).thenReturn(new KellyParameters(3.0, 0.6, 2.0));

            Map<String, String> changes = optimizer.refit(store);

            assertThat(optimizer.bucketParameters()).containsOnlyKeys("BTC/USD", "MAJORS", "15m");
            assertThat(changes).containsKey("BTC/USD");

            KellyBreakdown k = optimizer.kellyBreakdown(0.70, "BTC/USD", 10_000);
            assertThat(k.rewardRisk()).isEqualTo(3.0);
            assertThat(k.volRatio()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Should fit a bucket that missed the cache at the next refit")
        void shouldFitMissedBucket() {
            optimizer.kellyFraction(0.7, "DOGE/USD", 1_000);
            assertThat(optimizer.bucketParameters()).isEmpty();

            optimizer.refit(store);

            assertThat(optimizer.bucketParameters()).containsOnlyKeys("DOGE/USD");
        }

        @Test
        @DisplayName("Should not fit placeholder buckets")
        void shouldSkipUnknownBucket() {
            optimizer.kellyFraction(0.7, "UNKNOWN", 1_000);
            optimizer.kellyFraction(0.7, null, 1_000);

            optimizer.refit(store);

            assertThat(optimizer.bucketParameters()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should restore buckets and today's losses after restart")
    void shouldPersistState() {
        when(store.recent(200)).thenReturn(List.of(TestOutcomes.win("BTC/USD", clock.instant())));
        optimizer.refit(store);
        optimizer.recordOutcome(-40);
        optimizer.save();

        RiskOptimizer restored = new RiskOptimizer(RiskSettings.defaults(), stateDir, clock);
        assertThat(restored.load()).isTrue();

        assertThat(restored.bucketParameters()).isEqualTo(optimizer.bucketParameters());
        assertThat(restored.currentDailyLoss()).isEqualTo(40.0);
        assertThat(restored.kellyInfo().bucketCount()).isEqualTo(3);
    }
}
