package com.trading.adaptive.calibration;

import com.trading.adaptive.config.CalibrationSettings;
import com.trading.adaptive.model.CalibrationSample;
import com.trading.adaptive.model.Side;
import com.trading.adaptive.persistence.OutcomeStore;
import com.trading.adaptive.persistence.StateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Histogram calibrator: each confidence bin maps to the win rate observed in it.
 *
 * <p>Bin win rates are made non-decreasing with weighted pool-adjacent-violators, so a higher raw confidence
 * never calibrates lower than a smaller one. Bins with fewer than {@code minBinSamples} trades, and buckets
 * with fewer than {@code minSamples}, keep the identity mapping.
 */
public class BinnedConfidenceCalibrator implements ConfidenceCalibrator {
    private static final Logger logger = LoggerFactory.getLogger(BinnedConfidenceCalibrator.class);
    private static final int SCHEMA_VERSION = 1;

    private final CalibrationSettings settings;
    private final StateFile<CalibrationState> stateFile;
    private final Clock clock;
    private final AtomicReference<CalibrationTable> table;
    private volatile Instant lastFit;

    public BinnedConfidenceCalibrator(CalibrationSettings settings, Path stateDirectory, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.stateFile = new StateFile<>(stateDirectory, stateName(), SCHEMA_VERSION, CalibrationState.class, clock);
        this.table = new AtomicReference<>(CalibrationTable.empty(settings.binEdges()));
    }

    @Override
    public ConfidenceMapping mapping() {
        return table.get();
    }

    @Override
    public CalibrationSummary recalibrateAll(OutcomeStore store) {
        Set<String> timeframes = new LinkedHashSet<>(store.distinctTimeframes());
        CalibrationTable next = table.get();
        List<String> refit = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Side side : Side.values()) {
            for (String timeframe : timeframes) {
                String key = CalibrationTable.key(side, timeframe);
                List<CalibrationSample> samples = store.calibrationSamples(side, timeframe, settings.sampleLimit());
                if (samples.size() < settings.minSamples()) {
                    logger.debug("Insufficient calibration data for {}: {} < {}", key, samples.size(), settings.minSamples());
                    skipped.add(key);
                    continue;
                }
                double[] curve = fit(next, samples);
                next = next.with(key, curve);
                refit.add(key);
                logger.debug("Calibration curve {}: {}", key, Arrays.toString(curve));
            }
        }

        table.set(next);
        if (!refit.isEmpty()) {
            lastFit = Instant.now(clock);
            logger.info("🎯 Recalibrated {} bucket(s): {}", refit.size(), refit);
        }
        return new CalibrationSummary(refit, skipped);
    }

    /**
     * Win rate per bin, monotone across the bins that have enough samples; NaN elsewhere.
     */
    double[] fit(CalibrationTable layout, List<CalibrationSample> samples) {
        int bins = layout.binCount();
        int[] counts = new int[bins];
        int[] wins = new int[bins];
        for (CalibrationSample sample : samples) {
            int bin = layout.binIndex(sample.rawConfidence());
            counts[bin]++;
            if (sample.win()) {
                wins[bin]++;
            }
        }

        List<Integer> eligible = new ArrayList<>();
        for (int i = 0; i < bins; i++) {
            if (counts[i] >= settings.minBinSamples()) {
                eligible.add(i);
            }
        }

        double[] curve = new double[bins];
        Arrays.fill(curve, Double.NaN);
        if (eligible.isEmpty()) {
            return curve;
        }

        double[] rates = new double[eligible.size()];
        double[] weights = new double[eligible.size()];
        for (int j = 0; j < eligible.size(); j++) {
            int bin = eligible.get(j);
            rates[j] = (double) wins[bin] / counts[bin];
            weights[j] = counts[bin];
        }
        double[] monotone = poolAdjacentViolators(rates, weights);
        for (int j = 0; j < eligible.size(); j++) {
            curve[eligible.get(j)] = Math.max(0.0, Math.min(1.0, monotone[j]));
        }
        return curve;
    }

    /**
     * Weighted isotonic (non-decreasing) regression.
     */
    static double[] poolAdjacentViolators(double[] values, double[] weights) {
        int n = values.length;
        double[] blockValue = new double[n];
        double[] blockWeight = new double[n];
        int[] blockSize = new int[n];
        int blocks = 0;

        for (int i = 0; i < n; i++) {
            blockValue[blocks] = values[i];
            blockWeight[blocks] = weights[i];
            blockSize[blocks] = 1;
            blocks++;
            while (blocks > 1 && blockValue[blocks - 2] > blockValue[blocks - 1]) {
                double w = blockWeight[blocks - 2] + blockWeight[blocks - 1];
                blockValue[blocks - 2] = (blockValue[blocks - 2] * blockWeight[blocks - 2]
                    + blockValue[blocks - 1] * blockWeight[blocks - 1]) / w;
                blockWeight[blocks - 2] = w;
                blockSize[blocks - 2] += blockSize[blocks - 1];
                blocks--;
            }
        }

        double[] result = new double[n];
        int index = 0;
        for (int b = 0; b < blocks; b++) {
            for (int k = 0; k < blockSize[b]; k++) {
                result[index++] = blockValue[b];
            }
        }
        return result;
    }

    @Override
    public CalibrationInfo info() {
        return new CalibrationInfo(table.get().bucketCount());
    }

    public Instant lastFit() {
        return lastFit;
    }

    public void reset() {
        table.set(CalibrationTable.empty(settings.binEdges()));
        lastFit = null;
        logger.info("Calibration reset to identity");
    }

    @Override
    public void save() {
        CalibrationTable current = table.get();
        Map<String, List<Double>> curves = new LinkedHashMap<>();
        current.curves().forEach((key, curve) -> {
            List<Double> values = new ArrayList<>(curve.length);
            for (double v : curve) {
                values.add(Double.isNaN(v) ? null : v);
            }
            curves.put(key, values);
        });
        stateFile.write(new CalibrationState(settings.binEdges(), curves, lastFit));
    }

    @Override
    public boolean load() {
        var restored = stateFile.read();
        if (restored.isEmpty()) {
            return false;
        }
        CalibrationState state = restored.get();
        if (state.binEdges() == null || !state.binEdges().equals(settings.binEdges())) {
            logger.warn("⚠️ Stored calibration uses bin edges {} (configured {}), starting fresh",
                state.binEdges(), settings.binEdges());
            return false;
        }

        int bins = settings.binEdges().size() - 1;
        Map<String, double[]> curves = new LinkedHashMap<>();
        if (state.curves() != null) {
            state.curves().forEach((key, values) -> {
                if (values == null || values.size() != bins) {
                    logger.warn("⚠️ Skipping malformed calibration curve {}", key);
                    return;
                }
                double[] curve = new double[bins];
                for (int i = 0; i < bins; i++) {
                    Double v = values.get(i);
                    curve[i] = v == null ? Double.NaN : v;
                }
                curves.put(key, curve);
            });
        }
        table.set(new CalibrationTable(CalibrationTable.toArray(settings.binEdges()), curves));
        lastFit = state.lastFit();
        logger.info("Calibration loaded: {} bucket(s)", curves.size());
        return true;
    }

    @Override
    public String stateName() {
        return "calibration_state";
    }
}
