package com.trading.adaptive.model;

/**
 * Rolling statistics over a window of stored outcomes. ROE figures are percentages.
 */
public record TradeStatistics(
    int count,
    int winCount,
    int lossCount,
    double winRate,
    double avgReturn,
    double avgWin,
    double avgLoss,
    double profitFactor,
    double rewardRiskRatio,
    double avgDurationMinutes
) {
    public static final TradeStatistics EMPTY = new TradeStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public boolean isEmpty() {
        return count == 0;
    }
}
