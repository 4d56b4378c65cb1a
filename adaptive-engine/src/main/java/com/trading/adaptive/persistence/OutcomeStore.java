package com.trading.adaptive.persistence;

import com.trading.adaptive.error.StorageException;
import com.trading.adaptive.model.CalibrationSample;
import com.trading.adaptive.model.KellyParameters;
import com.trading.adaptive.model.Side;
import com.trading.adaptive.model.TradeFilter;
import com.trading.adaptive.model.TradeOutcome;
import com.trading.adaptive.model.TradeStatistics;

import java.time.Instant;
import java.util.List;

/**
 * Durable, queryable log of closed trades.
 *
 * <p>Only {@link #append} and {@link #retentionSweep} write. Every read tolerates an empty log and
 * returns zero-valued results rather than failing; read failures are logged and resolved to the same
 * empty results.
 */
public interface OutcomeStore extends AutoCloseable {

    /** Minimum symbol rows before Kelly parameters are estimated per symbol. */
    int KELLY_MIN_SYMBOL_SAMPLES = 30;

    /** Minimum rows in the cluster/timeframe fallback before the global default is used. */
    int KELLY_MIN_FALLBACK_SAMPLES = 10;

    /**
     * Persist one outcome.
     *
     * @return generated row id
     * @throws StorageException if the write fails after retries
     */
    long append(TradeOutcome outcome);

    /**
     * Statistics over the most recent {@code window} outcomes matching {@code filter}.
     */
    TradeStatistics statistics(int window, TradeFilter filter);

    /**
     * Reward/risk, win probability and ROE standard deviation for a bucket, falling back from symbol
     * rows to cluster/timeframe rows to {@link KellyParameters#DEFAULT}.
     */
    KellyParameters kellyParameters(String bucket, int window);

    /** Most recent outcomes, newest first. */
    List<TradeOutcome> recent(int n);

    int count();

    /**
     * Delete the oldest rows beyond {@code maxCount}, then rows older than {@code maxAgeDays}.
     *
     * @return rows deleted
     */
    int retentionSweep(int maxCount, int maxAgeDays);

    /** Most recent (raw confidence, result) pairs for one side and timeframe, newest first. */
    List<CalibrationSample> calibrationSamples(Side side, String timeframe, int limit);

    /** PnL of every losing trade at or after {@code since}, in quote currency (negative values). */
    List<Double> lossesSince(Instant since);

    List<String> distinctTimeframes();

    default TradeStatistics symbolPerformance(String symbol, int window) {
        return statistics(window, TradeFilter.bySymbol(symbol));
    }

    @Override
    void close();
}
