package com.trading.adaptive.config;

import com.trading.adaptive.model.Side;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AdaptiveConfig Tests")
class AdaptiveConfigTest {

    private static AdaptiveConfig configWith(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return AdaptiveConfig.forTest(props);
    }

    @Test
    @DisplayName("Should use built-in defaults without properties")
    void shouldUseDefaults() {
        AdaptiveConfig config = AdaptiveConfig.defaults();

        assertThat(config.threshold()).isEqualTo(ThresholdSettings.defaults());
        assertThat(config.penalty()).isEqualTo(PenaltySettings.defaults());
        assertThat(config.drift()).isEqualTo(DriftSettings.defaults());
        assertThat(config.risk()).isEqualTo(RiskSettings.defaults());
        assertThat(config.calibration()).isEqualTo(CalibrationSettings.defaults());
        assertThat(config.adaptation().minTradesForUpdate()).isEqualTo(200);
        assertThat(config.adaptation().updateInterval()).isEqualTo(Duration.ofHours(12));
        assertThat(config.adaptation().databasePath()).isEqualTo(Path.of("adaptive_state", "trades.db"));
    }

    @Test
    @DisplayName("Should read overrides")
    void shouldReadOverrides() {
        AdaptiveConfig config = configWith(
            "threshold.global", "0.75",
            "threshold.side.SHORT", "0.78",
            "threshold.timeframe.4h", "0.73",
            "penalty.cooldown.cycles", "5",
            "adaptation.update-interval-hours", "1.5",
            "calibration.bin-edges", "0, 0.5, 1.0",
            "adaptation.state-dir", "/tmp/adaptive");

        assertThat(config.threshold().globalInitial()).isEqualTo(0.75);
        assertThat(config.threshold().sideInitial()).containsEntry(Side.SHORT, 0.78).containsEntry(Side.LONG, 0.70);
        assertThat(config.threshold().timeframeInitial()).containsEntry("4h", 0.73).containsEntry("15m", 0.70);
        assertThat(config.penalty().cooldownCycles()).isEqualTo(5);
        assertThat(config.adaptation().updateInterval()).isEqualTo(Duration.ofMinutes(90));
        assertThat(config.calibration().binEdges()).containsExactly(0.0, 0.5, 1.0);
        assertThat(config.adaptation().databasePath()).isEqualTo(Path.of("/tmp/adaptive", "trades.db"));
    }

    @Test
    @DisplayName("Should keep the default for malformed values")
    void shouldFallBackOnMalformedValues() {
        AdaptiveConfig config = configWith(
            "risk.k-factor", "quarter",
            "drift.prudent-cycles", "forty",
            "calibration.bin-edges", "0,a,1");

        assertThat(config.risk().kFactor()).isEqualTo(0.25);
        assertThat(config.drift().prudentCycles()).isEqualTo(40);
        assertThat(config.calibration().binEdges()).isEqualTo(List.of(0.0, 0.6, 0.7, 0.8, 0.9, 1.0));
    }

    @Test
    @DisplayName("Should reject an inverted threshold range")
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> configWith("threshold.min", "0.9", "threshold.max", "0.8"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Configuration validation failed");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> configWith("penalty.ewma.alpha", "1.5"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("penalty.ewmaAlpha");
    }

    @Test
    @DisplayName("Should reject unordered bin edges")
    void shouldRejectUnorderedBinEdges() {
        assertThatThrownBy(() -> configWith("calibration.bin-edges", "0, 0.8, 0.5, 1.0"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("calibration");
    }

    @Test
    @DisplayName("Should expose raw properties")
    void shouldExposeProperties() {
        assertThat(configWith("custom.key", "x").getProperty("custom.key", "y")).isEqualTo("x");
        assertThat(AdaptiveConfig.defaults().getProperty("custom.key", "y")).isEqualTo("y");
    }
}
