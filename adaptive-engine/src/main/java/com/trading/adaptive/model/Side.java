package com.trading.adaptive.model;

import java.util.Locale;

/**
 * Position direction.
 */
public enum Side {
    LONG,
    SHORT;

    /**
     * Parse a side from exchange or strategy vocabulary.
     * BUY/LONG map to LONG, SELL/SHORT to SHORT; anything else yields null.
     */
    public static Side parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "BUY", "LONG" -> LONG;
            case "SELL", "SHORT" -> SHORT;
            default -> null;
        };
    }
}
