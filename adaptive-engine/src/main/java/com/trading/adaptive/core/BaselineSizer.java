package com.trading.adaptive.core;

import com.trading.adaptive.model.FilteredSignal;

import java.util.List;

/**
 * Static sizing used when adaptive sizing is disabled or fails for a batch.
 */
@FunctionalInterface
public interface BaselineSizer {

    /**
     * @return one margin per signal, in input order
     */
    List<Double> size(List<FilteredSignal> signals, double walletBalance);

    /**
     * The same fixed margin for every signal, or zero when the wallet is empty.
     */
    static BaselineSizer fixed(double marginUsd) {
        return (signals, wallet) -> signals.stream()
            .map(s -> wallet > 0 ? Math.min(marginUsd, wallet) : 0.0)
            .toList();
    }
}
