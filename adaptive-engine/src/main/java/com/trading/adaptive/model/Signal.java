package com.trading.adaptive.model;

/**
 * Candidate trade signal produced by the predictive model.
 */
public record Signal(
    String symbol,
    Side side,
    double rawConfidence,
    String timeframe,
    String cluster
) {
    public static final String DEFAULT_CLUSTER = "DEFAULT";
    public static final String DEFAULT_TIMEFRAME = "15m";

    public Signal {
        if (symbol == null || symbol.isBlank()) {
            symbol = TradeOutcome.UNKNOWN_SYMBOL;
        }
        if (cluster == null || cluster.isBlank()) {
            cluster = DEFAULT_CLUSTER;
        }
        if (timeframe == null || timeframe.isBlank()) {
            timeframe = DEFAULT_TIMEFRAME;
        }
        if (side == null) {
            side = Side.LONG;
        }
    }

    public Signal(String symbol, Side side, double rawConfidence, String timeframe) {
        this(symbol, side, rawConfidence, timeframe, DEFAULT_CLUSTER);
    }
}
