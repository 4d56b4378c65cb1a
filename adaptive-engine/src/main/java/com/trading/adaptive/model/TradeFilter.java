package com.trading.adaptive.model;

/**
 * Optional equality filters for outcome queries. Null fields are ignored.
 */
public record TradeFilter(
    String symbol,
    Side side,
    String timeframe,
    String cluster,
    String sessionId
) {
    public static final TradeFilter NONE = new TradeFilter(null, null, null, null, null);

    public static TradeFilter bySymbol(String symbol) {
        return new TradeFilter(symbol, null, null, null, null);
    }

    public static TradeFilter bySide(Side side) {
        return new TradeFilter(null, side, null, null, null);
    }

    public static TradeFilter byTimeframe(String timeframe) {
        return new TradeFilter(null, null, timeframe, null, null);
    }

    public static TradeFilter byCluster(String cluster) {
        return new TradeFilter(null, null, null, cluster, null);
    }

    public static TradeFilter bySession(String sessionId) {
        return new TradeFilter(null, null, null, null, sessionId);
    }
}
