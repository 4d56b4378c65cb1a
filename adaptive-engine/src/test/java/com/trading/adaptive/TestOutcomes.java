package com.trading.adaptive;

import com.trading.adaptive.model.Side;
import com.trading.adaptive.model.TradeOutcome;

import java.time.Instant;

/**
 * Fully populated outcomes for tests.
 */
public final class TestOutcomes {

    private TestOutcomes() {
    }

    public static TradeOutcome.Builder closed(String symbol, boolean win, Instant exitTime) {
        double roe = win ? 2.0 : -1.0;
        return TradeOutcome.builder()
            .symbol(symbol)
            .side(Side.LONG)
            .timeframe("15m")
            .cluster("MAJORS")
            .rawConfidence(0.75)
            .entryPrice(100.0)
            .entryTime(exitTime.minusSeconds(3600))
            .exitPrice(win ? 102.0 : 99.0)
            .exitTime(exitTime)
            .timestamp(exitTime)
            .positionSize(1.0)
            .margin(50.0)
            .roePct(roe)
            .pnlUsd(win ? 1.0 : -0.5)
            .win(win);
    }

    public static TradeOutcome win(String symbol, Instant exitTime) {
        return closed(symbol, true, exitTime).build();
    }

    public static TradeOutcome loss(String symbol, Instant exitTime) {
        return closed(symbol, false, exitTime).build();
    }
}
