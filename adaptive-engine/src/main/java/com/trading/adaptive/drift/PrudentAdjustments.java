package com.trading.adaptive.drift;

/**
 * Risk adjustments applied while prudent mode is active.
 */
public record PrudentAdjustments(double thresholdBump, double kellyMultiplier) {
    public static final PrudentAdjustments NONE = new PrudentAdjustments(0.0, 1.0);

    public boolean isActive() {
        return thresholdBump != 0.0 || kellyMultiplier != 1.0;
    }
}
