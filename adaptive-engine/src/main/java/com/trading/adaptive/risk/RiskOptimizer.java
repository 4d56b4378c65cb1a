package com.trading.adaptive.risk;

import com.trading.adaptive.config.RiskSettings;
import com.trading.adaptive.model.KellyParameters;
import com.trading.adaptive.model.TradeOutcome;
import com.trading.adaptive.persistence.OutcomeStore;
import com.trading.adaptive.persistence.Persistable;
import com.trading.adaptive.persistence.StateFile;
import com.trading.adaptive.risk.RiskState.BucketParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Variance-adjusted fractional Kelly sizing with a daily-loss throttle.
 *
 * <p>Per-bucket reward/risk and volatility come from the outcome store and are cached here; sizing itself
 * never touches storage. A bucket not yet in the cache sizes with {@link KellyParameters#DEFAULT} and is
 * fitted at the next refit.
 *
 * Thread-Safety: the bucket cache is an immutable map behind an AtomicReference; the daily-loss counter is
 * guarded by a lock and published through volatile fields.
 */
public class RiskOptimizer implements Persistable {
    private static final Logger logger = LoggerFactory.getLogger(RiskOptimizer.class);
    private static final int SCHEMA_VERSION = 1;
    private static final Set<String> IGNORED_BUCKETS = Set.of(TradeOutcome.UNKNOWN_SYMBOL, "");

    private final RiskSettings settings;
    private final StateFile<RiskState> stateFile;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicReference<Map<String, BucketParameters>> kellyParams = new AtomicReference<>(Collections.emptyMap());
    private final Set<String> missedBuckets = ConcurrentHashMap.newKeySet();

    private volatile double dailyLossCap;
    private volatile double currentDailyLoss;
    private volatile LocalDate dailyResetDate;
    private volatile Instant lastUpdate;

    public RiskOptimizer(RiskSettings settings, Path stateDirectory, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.stateFile = new StateFile<>(stateDirectory, stateName(), SCHEMA_VERSION, RiskState.class, clock);
        this.dailyLossCap = settings.defaultDailyLossCap();
        this.dailyResetDate = today();
        this.lastUpdate = Instant.now(clock);
    }

    /**
     * Wallet fraction to commit to a signal with win probability {@code p}.
     */
    public double kellyFraction(double p, String bucket, double walletBalance) {
        return kellyBreakdown(p, bucket, walletBalance).fraction();
    }

    public KellyBreakdown kellyBreakdown(double p, String bucket, double walletBalance) {
        BucketParameters params = parameters(bucket);
        double r = params.rewardRisk();
        double sigma = params.sigma();

        double rawKelly = r > 0 ? Math.max(0.0, (p * r - (1 - p)) / r) : 0.0;
        double volRatio = settings.targetSigma() / Math.max(sigma, settings.targetSigma());
        double adjusted = rawKelly * volRatio;
        double conservative = settings.kFactor() * adjusted;
        double capped = Math.min(conservative, settings.maxFraction());

        boolean capApplied = isDailyCapExceeded();
        if (capApplied) {
            capped *= 0.5;
        }

        double positionUsd = 0.0;
        double fraction = 0.0;
        if (walletBalance > 0) {
            positionUsd = Math.max(settings.minPositionUsd(),
                Math.min(settings.maxPositionUsd(), capped * walletBalance));
            fraction = positionUsd / walletBalance;
        }

        logger.debug("Kelly {}: p={} R={} sigma={} -> f={} -> adj={} -> final={} (${})",
            bucket, fmt(p), fmt(r), fmt(sigma), fmt(rawKelly), fmt(adjusted), fmt(fraction), fmt(positionUsd));

        return new KellyBreakdown(bucket, p, r, sigma, rawKelly, volRatio, adjusted, conservative, capped,
            capApplied, positionUsd, fraction);
    }

    private BucketParameters parameters(String bucket) {
        BucketParameters cached = bucket != null ? kellyParams.get().get(bucket) : null;
        if (cached != null) {
            return cached;
        }
        if (bucket != null && !IGNORED_BUCKETS.contains(bucket)) {
            missedBuckets.add(bucket);
        }
        return new BucketParameters(KellyParameters.DEFAULT.rewardRisk(), KellyParameters.DEFAULT.sigma());
    }

    /**
     * Refit every bucket touched by recent outcomes (plus any that missed the cache), then the daily cap.
     *
     * @return significant parameter changes per bucket
     */
    public Map<String, String> refit(OutcomeStore store) {
        Set<String> buckets = new LinkedHashSet<>();
        for (TradeOutcome outcome : store.recent(settings.refitRecentTrades())) {
            buckets.add(outcome.symbol());
            buckets.add(outcome.cluster());
            buckets.add(outcome.timeframe());
        }
        buckets.addAll(missedBuckets);
        buckets.remove(null);
        buckets.removeAll(IGNORED_BUCKETS);

        Map<String, BucketParameters> previous = kellyParams.get();
        Map<String, BucketParameters> next = new LinkedHashMap<>(previous);
        Map<String, String> changes = new LinkedHashMap<>();
        for (String bucket : buckets) {
            KellyParameters fitted = store.kellyParameters(bucket, settings.refitWindow());
            BucketParameters old = previous.getOrDefault(bucket,
                new BucketParameters(KellyParameters.DEFAULT.rewardRisk(), KellyParameters.DEFAULT.sigma()));
            next.put(bucket, new BucketParameters(fitted.rewardRisk(), fitted.sigma()));

            if (Math.abs(fitted.rewardRisk() - old.rewardRisk()) > 0.5 || Math.abs(fitted.sigma() - old.sigma()) > 0.3) {
                changes.put(bucket, String.format("R: %.2f -> %.2f, sigma: %.2f -> %.2f",
                    old.rewardRisk(), fitted.rewardRisk(), old.sigma(), fitted.sigma()));
            }
        }
        kellyParams.set(Collections.unmodifiableMap(next));
        missedBuckets.removeAll(buckets);

        updateDailyLossCap(store);
        lastUpdate = Instant.now(clock);

        if (!changes.isEmpty()) {
            logger.info("💰 Kelly parameters updated for {} bucket(s)", changes.size());
        }
        return changes;
    }

    private void updateDailyLossCap(OutcomeStore store) {
        Instant since = Instant.now(clock).minus(Duration.ofDays(settings.lossLookbackDays()));
        List<Double> losses = new ArrayList<>();
        for (double pnl : store.lossesSince(since)) {
            losses.add(Math.abs(pnl));
        }

        double cap;
        if (losses.size() >= settings.minLossSamples()) {
            Collections.sort(losses);
            cap = 2.0 * losses.get(losses.size() / 2);
        } else {
            cap = settings.defaultDailyLossCap();
        }
        dailyLossCap = cap;
        logger.debug("Daily loss cap: ${} from {} losses", fmt(cap), losses.size());
    }

    /**
     * Track realized losses for the current UTC day.
     */
    public void recordOutcome(double pnlUsd) {
        lock.lock();
        try {
            LocalDate today = today();
            if (dailyResetDate == null || today.isAfter(dailyResetDate)) {
                currentDailyLoss = 0.0;
                dailyResetDate = today;
                logger.debug("Daily loss counter reset for {}", today);
            }
            if (pnlUsd >= 0) {
                return;
            }
            boolean wasExceeded = currentDailyLoss > dailyLossCap;
            currentDailyLoss += Math.abs(pnlUsd);
            if (!wasExceeded && currentDailyLoss > dailyLossCap) {
                logger.atWarn()
                    .addKeyValue("dailyLoss", currentDailyLoss)
                    .addKeyValue("cap", dailyLossCap)
                    .log("⚠️ Daily loss cap exceeded, halving position sizes");
            }
        } finally {
            lock.unlock();
        }
    }

    /** Loss accumulated today; zero once the UTC date has moved past the last recorded day. */
    public double currentDailyLoss() {
        LocalDate resetDate = dailyResetDate;
        if (resetDate == null || today().isAfter(resetDate)) {
            return 0.0;
        }
        return currentDailyLoss;
    }

    public double dailyLossCap() {
        return dailyLossCap;
    }

    public boolean isDailyCapExceeded() {
        return currentDailyLoss() > dailyLossCap;
    }

    public double maxFraction() {
        return isDailyCapExceeded() ? settings.maxFraction() * 0.5 : settings.maxFraction();
    }

    public KellyInfo kellyInfo() {
        double loss = currentDailyLoss();
        return new KellyInfo(settings.kFactor(), settings.maxFraction(), settings.targetSigma(),
            kellyParams.get().size(), dailyLossCap, loss, loss > dailyLossCap);
    }

    /** Cached parameters, sorted by bucket. */
    public Map<String, BucketParameters> bucketParameters() {
        return Collections.unmodifiableMap(new TreeMap<>(kellyParams.get()));
    }

    public void reset() {
        lock.lock();
        try {
            kellyParams.set(Collections.emptyMap());
            missedBuckets.clear();
            dailyLossCap = settings.defaultDailyLossCap();
            currentDailyLoss = 0.0;
            dailyResetDate = today();
            lastUpdate = Instant.now(clock);
            logger.info("Risk state reset");
        } finally {
            lock.unlock();
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(Instant.now(clock), ZoneOffset.UTC);
    }

    private static String fmt(double value) {
        return String.format("%.3f", value);
    }

    @Override
    public void save() {
        RiskState state;
        lock.lock();
        try {
            state = new RiskState(bucketParameters(), dailyLossCap, currentDailyLoss, dailyResetDate, lastUpdate);
        } finally {
            lock.unlock();
        }
        stateFile.write(state);
    }

    @Override
    public boolean load() {
        var restored = stateFile.read();
        if (restored.isEmpty()) {
            return false;
        }
        RiskState state = restored.get();
        lock.lock();
        try {
            Map<String, BucketParameters> params = new LinkedHashMap<>();
            if (state.kellyParams() != null) {
                state.kellyParams().forEach((bucket, p) -> {
                    if (p != null) {
                        params.put(bucket, p);
                    }
                });
            }
            kellyParams.set(Collections.unmodifiableMap(params));
            dailyLossCap = state.dailyLossCap() > 0 ? state.dailyLossCap() : settings.defaultDailyLossCap();
            currentDailyLoss = Math.max(0.0, state.currentDailyLoss());
            dailyResetDate = state.dailyResetDate() != null ? state.dailyResetDate() : today();
            if (state.lastUpdate() != null) {
                lastUpdate = state.lastUpdate();
            }
        } finally {
            lock.unlock();
        }
        logger.info("Risk state loaded: {} buckets, daily loss ${} / cap ${}",
            kellyParams.get().size(), fmt(currentDailyLoss), fmt(dailyLossCap));
        return true;
    }

    @Override
    public String stateName() {
        return "risk_state";
    }
}
