package com.trading.adaptive.model;

/**
 * A signal that passed the adaptive filter, annotated with its calibrated confidence
 * and the threshold it was compared against.
 */
public record FilteredSignal(
    Signal signal,
    double calibratedConfidence,
    double effectiveThreshold
) {
    public String symbol() {
        return signal.symbol();
    }

    public Side side() {
        return signal.side();
    }

    public String timeframe() {
        return signal.timeframe();
    }

    public String cluster() {
        return signal.cluster();
    }

    public double rawConfidence() {
        return signal.rawConfidence();
    }
}
