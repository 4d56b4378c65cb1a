package com.trading.adaptive.threshold;

import com.trading.adaptive.MutableClock;
import com.trading.adaptive.config.ThresholdSettings;
import com.trading.adaptive.model.Side;
import com.trading.adaptive.model.TradeFilter;
import com.trading.adaptive.model.TradeStatistics;
import com.trading.adaptive.persistence.OutcomeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ThresholdController Tests")
class ThresholdControllerTest {

    @TempDir
    Path stateDir;

    @Mock
    OutcomeStore store;

    private MutableClock clock;
    private ThresholdController controller;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        controller = new ThresholdController(ThresholdSettings.defaults(), stateDir, clock);
        when(store.statistics(anyInt(), any())).thenReturn(TradeStatistics.EMPTY);
        when(store.distinctTimeframes()).thenReturn(List.of());
    }

    private static TradeStatistics stats(int count, double winRate) {
        int wins = (int) Math.round(count * winRate);
        return new TradeStatistics(count, wins, count - wins, winRate, 0.5, 2.0, 1.0, 1.5, 2.0, 60.0);
    }

    @Nested
    @DisplayName("Global threshold")
    class Global {

        @Test
        @DisplayName("Should raise on a low win rate")
        void shouldRaiseOnLowWinRate() {
            when(store.statistics(200, TradeFilter.NONE)).thenReturn(stats(200, 0.60));

            ThresholdUpdate update = controller.update(store, Map.of());

            assertThat(update.newGlobal()).isCloseTo(0.72, within(1e-9));
            assertThat(update.changes()).containsKey("global");
            assertThat(controller.globalThreshold()).isCloseTo(0.72, within(1e-9));
        }

        @Test
        @DisplayName("Should lower on a high win rate")
        void shouldLowerOnHighWinRate() {
            when(store.statistics(200, TradeFilter.NONE)).thenReturn(stats(200, 0.85));

            assertThat(controller.update(store, Map.of()).newGlobal()).isCloseTo(0.69, within(1e-9));
        }

        @Test
        @DisplayName("Should hold inside the target band")
        void shouldHoldInsideBand() {
            when(store.statistics(200, TradeFilter.NONE)).thenReturn(stats(200, 0.75));

            ThresholdUpdate update = controller.update(store, Map.of());

            assertThat(update.changed()).isFalse();
            assertThat(controller.globalThreshold()).isEqualTo(0.70);
        }

        @Test
        @DisplayName("Should not move with too few trades")
        void shouldIgnoreSmallSample() {
            when(store.statistics(200, TradeFilter.NONE)).thenReturn(stats(150, 0.30));

            controller.update(store, Map.of());

            assertThat(controller.globalThreshold()).isEqualTo(0.70);
        }

        @Test
        @DisplayName("Should stay within the configured range")
        void shouldClampToRange() {
            when(store.statistics(200, TradeFilter.NONE)).thenReturn(stats(200, 0.10));
            for (int i = 0; i < 20; i++) {
                controller.update(store, Map.of());
            }
            assertThat(controller.globalThreshold()).isEqualTo(0.85);

            when(store.statistics(200, TradeFilter.NONE)).thenReturn(stats(200, 0.99));
            for (int i = 0; i < 50; i++) {
                controller.update(store, Map.of());
            }
            assertThat(controller.globalThreshold()).isEqualTo(0.60);
        }
    }

    @Test
    @DisplayName("Should move a side with enough trades")
    void shouldUpdateSide() {
        when(store.statistics(200, TradeFilter.bySide(Side.SHORT))).thenReturn(stats(60, 0.60));

        ThresholdUpdate update = controller.update(store, Map.of());

        assertThat(controller.allThresholds().sideThreshold(Side.SHORT)).isCloseTo(0.75, within(1e-9));
        assertThat(controller.allThresholds().sideThreshold(Side.LONG)).isEqualTo(0.70);
        assertThat(update.changes()).containsKey("side:SHORT");
    }

    @Test
    @DisplayName("Should pick up timeframes seen in the log and never go below global")
    void shouldUpdateDiscoveredTimeframe() {
        when(store.distinctTimeframes()).thenReturn(List.of("4h"));
        when(store.statistics(200, TradeFilter.byTimeframe("4h"))).thenReturn(stats(60, 0.90));

        controller.update(store, Map.of());

        ThresholdSet set = controller.allThresholds();
        assertThat(set.timeframeThreshold("4h")).isCloseTo(0.69, within(1e-9));
        assertThat(set.effective(Side.LONG, "4h", "DEFAULT")).isEqualTo(set.global());
    }

    @Test
    @DisplayName("Should tighten penalized clusters and relax clean ones down to global")
    void shouldFollowClusterPenalties() {
        controller.update(store, Map.of("ALTS", 2.0));
        assertThat(controller.allThresholds().clusterThreshold("ALTS")).isCloseTo(0.75, within(1e-9));
        assertThat(controller.effectiveThreshold(Side.LONG, "15m", "ALTS")).isCloseTo(0.75, within(1e-9));

        for (int i = 0; i < 10; i++) {
            controller.update(store, Map.of("ALTS", 0.5));
        }
        assertThat(controller.allThresholds().clusterThreshold("ALTS")).isEqualTo(0.70);
    }

    @Test
    @DisplayName("Should request an update after enough trades or enough time")
    void shouldTriggerUpdates() {
        assertThat(controller.shouldUpdate()).isFalse();

        for (int i = 0; i < 200; i++) {
            controller.incrementTradeCount();
        }
        assertThat(controller.shouldUpdate()).isTrue();

        controller.update(store, Map.of());
        assertThat(controller.tradesSinceUpdate()).isZero();
        assertThat(controller.shouldUpdate()).isFalse();

        clock.advance(Duration.ofHours(12));
        assertThat(controller.shouldUpdate()).isTrue();
    }

    @Test
    @DisplayName("Should restore thresholds after restart")
    void shouldPersistState() {
        when(store.statistics(200, TradeFilter.NONE)).thenReturn(stats(200, 0.60));
        controller.update(store, Map.of("ALTS", 2.0));
        controller.incrementTradeCount();
        controller.save();

        ThresholdController restored = new ThresholdController(ThresholdSettings.defaults(), stateDir, clock);
        assertThat(restored.load()).isTrue();

        assertThat(restored.allThresholds()).isEqualTo(controller.allThresholds());
        assertThat(restored.tradesSinceUpdate()).isEqualTo(1);
    }
}
