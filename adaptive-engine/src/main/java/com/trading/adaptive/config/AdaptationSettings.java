package com.trading.adaptive.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Cycle triggers, storage locations and retention of the orchestrator.
 */
public record AdaptationSettings(
    @Min(1) int minTradesForUpdate,
    @NotNull Duration updateInterval,
    @NotNull Path stateDirectory,
    @NotNull Path databasePath,
    @Min(1) int retentionMaxTrades,
    @Min(1) int retentionMaxDays
) {
    public static AdaptationSettings defaults() {
        Path stateDir = Path.of("adaptive_state");
        return new AdaptationSettings(200, Duration.ofHours(12), stateDir, stateDir.resolve("trades.db"), 5000, 180);
    }

    public AdaptationSettings withStateDirectory(Path dir) {
        return new AdaptationSettings(minTradesForUpdate, updateInterval, dir, dir.resolve("trades.db"),
            retentionMaxTrades, retentionMaxDays);
    }
}
