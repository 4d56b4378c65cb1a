package com.trading.adaptive.config;

import com.trading.adaptive.model.Side;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration of the adaptive layer, loaded from {@code adaptive.properties}.
 *
 * <p>Lookup order: working directory, then classpath, then built-in defaults. Every key is optional;
 * a malformed value logs a warning and keeps the default. The resulting settings are validated with
 * Bean Validation and an invalid combination fails fast.
 */
public final class AdaptiveConfig {
    private static final Logger logger = LoggerFactory.getLogger(AdaptiveConfig.class);
    public static final String CONFIG_FILE = "adaptive.properties";

    private final Properties properties;

    private final PenaltySettings penalty;
    private final ThresholdSettings threshold;
    private final DriftSettings drift;
    private final RiskSettings risk;
    private final CalibrationSettings calibration;
    private final AdaptationSettings adaptation;

    private AdaptiveConfig(Properties props) {
        this.properties = props;

        var pd = PenaltySettings.defaults();
        this.penalty = new PenaltySettings(
            parseDouble("penalty.weight.confidence", pd.confidenceWeight()),
            parseDouble("penalty.weight.stop-loss", pd.stopLossWeight()),
            parseDouble("penalty.weight.fast-exit", pd.fastExitWeight()),
            parseDouble("penalty.weight.mae", pd.maeWeight()),
            parseDouble("penalty.cooldown.threshold", pd.cooldownThreshold()),
            parseInt("penalty.cooldown.cycles", pd.cooldownCycles()),
            parseDouble("penalty.ewma.alpha", pd.ewmaAlpha()),
            parseDouble("penalty.cooldown.cluster-factor", pd.clusterCooldownFactor()),
            parseLong("penalty.fast-exit.seconds", pd.fastExitSeconds()));

        var td = ThresholdSettings.defaults();
        int minTrades = parseInt("threshold.min-trades-for-update", td.minTradesForUpdate());
        Duration interval = Duration.ofMinutes(
            Math.round(parseDouble("adaptation.update-interval-hours", td.updateInterval().toMinutes() / 60.0) * 60));
        this.threshold = new ThresholdSettings(
            parseDouble("threshold.global", td.globalInitial()),
            parseSideMap("threshold.side.", td.sideInitial()),
            parseStringMap("threshold.timeframe.", td.timeframeInitial()),
            parseDouble("threshold.min", td.min()),
            parseDouble("threshold.max", td.max()),
            minTrades,
            parseInt("threshold.min-trades-per-bucket", td.minTradesPerBucket()),
            interval);

        var dd = DriftSettings.defaults();
        this.drift = new DriftSettings(
            parseDouble("drift.lambda", dd.lambda()),
            parseDouble("drift.delta", dd.delta()),
            parseDouble("drift.calibration-delta-factor", dd.calibrationDeltaFactor()),
            parseInt("drift.prudent-cycles", dd.prudentCycles()),
            parseInt("drift.history-limit", dd.historyLimit()),
            parseDouble("drift.prudent.threshold-bump", dd.thresholdBump()),
            parseDouble("drift.prudent.kelly-multiplier", dd.kellyMultiplier()));

        var rd = RiskSettings.defaults();
        this.risk = new RiskSettings(
            parseDouble("risk.k-factor", rd.kFactor()),
            parseDouble("risk.max-fraction", rd.maxFraction()),
            parseDouble("risk.target-sigma", rd.targetSigma()),
            parseDouble("risk.min-position-usd", rd.minPositionUsd()),
            parseDouble("risk.max-position-usd", rd.maxPositionUsd()),
            parseDouble("risk.daily-loss-cap.default", rd.defaultDailyLossCap()),
            parseInt("risk.refit.recent-trades", rd.refitRecentTrades()),
            parseInt("risk.refit.window", rd.refitWindow()),
            parseInt("risk.daily-loss-cap.lookback-days", rd.lossLookbackDays()),
            parseInt("risk.daily-loss-cap.min-losses", rd.minLossSamples()));

        var cd = CalibrationSettings.defaults();
        this.calibration = new CalibrationSettings(
            parseDoubleList("calibration.bin-edges", cd.binEdges()),
            parseInt("calibration.min-samples", cd.minSamples()),
            parseInt("calibration.min-bin-samples", cd.minBinSamples()),
            parseInt("calibration.sample-limit", cd.sampleLimit()));

        var ad = AdaptationSettings.defaults();
        Path stateDir = Path.of(properties.getProperty("adaptation.state-dir", ad.stateDirectory().toString()).trim());
        String dbPath = properties.getProperty("adaptation.database");
        this.adaptation = new AdaptationSettings(
            minTrades,
            interval,
            stateDir,
            dbPath == null || dbPath.isBlank() ? stateDir.resolve("trades.db") : Path.of(dbPath.trim()),
            parseInt("retention.max-trades", ad.retentionMaxTrades()),
            parseInt("retention.max-days", ad.retentionMaxDays()));

        validate();
    }

    /**
     * Load from the working directory, then the classpath, then defaults.
     */
    public static AdaptiveConfig load() {
        return new AdaptiveConfig(loadProperties());
    }

    public static AdaptiveConfig defaults() {
        return new AdaptiveConfig(new Properties());
    }

    /**
     * Create a config from explicit properties (for testing).
     */
    public static AdaptiveConfig forTest(Properties testProps) {
        return new AdaptiveConfig(testProps);
    }

    private static Properties loadProperties() {
        var props = new Properties();
        Path local = Path.of(CONFIG_FILE);
        if (Files.isRegularFile(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                props.load(in);
                logger.info("Loaded adaptive configuration from {}", local.toAbsolutePath());
                return props;
            } catch (IOException e) {
                logger.warn("Could not read {}, trying classpath: {}", local, e.getMessage());
            }
        }
        try (InputStream in = AdaptiveConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (in != null) {
                props.load(in);
                logger.info("Loaded adaptive configuration from classpath:{}", CONFIG_FILE);
            } else {
                logger.info("No {} found, using built-in defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.warn("Could not read classpath {}, using built-in defaults: {}", CONFIG_FILE, e.getMessage());
        }
        return props;
    }

    /**
     * Validate every settings group using Bean Validation.
     * Throws IllegalStateException listing all violations.
     */
    private void validate() {
        List<String> errors = new ArrayList<>();
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        try {
            Validator validator = factory.getValidator();
            collect(errors, "penalty", validator.validate(penalty));
            collect(errors, "threshold", validator.validate(threshold));
            collect(errors, "drift", validator.validate(drift));
            collect(errors, "risk", validator.validate(risk));
            collect(errors, "calibration", validator.validate(calibration));
            collect(errors, "adaptation", validator.validate(adaptation));
        } finally {
            factory.close();
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }
    }

    private static <T> void collect(List<String> errors, String group, Set<ConstraintViolation<T>> violations) {
        violations.stream()
            .map(v -> group + "." + v.getPropertyPath() + ": " + v.getMessage())
            .sorted()
            .forEach(errors::add);
    }

    private double parseDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private int parseInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private List<Double> parseDoubleList(String key, List<Double> defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            List<Double> parsed = new ArrayList<>();
            for (String part : value.split(",")) {
                parsed.add(Double.parseDouble(part.trim()));
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private Map<Side, Double> parseSideMap(String prefix, Map<Side, Double> defaults) {
        Map<Side, Double> result = new EnumMap<>(Side.class);
        result.putAll(defaults);
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(prefix)) {
                continue;
            }
            Side side = Side.parse(key.substring(prefix.length()));
            if (side == null) {
                logger.warn("Unknown side in key {}, ignoring", key);
                continue;
            }
            result.put(side, parseDouble(key, result.getOrDefault(side, 0.70)));
        }
        return result;
    }

    private Map<String, Double> parseStringMap(String prefix, Map<String, Double> defaults) {
        Map<String, Double> result = new LinkedHashMap<>(defaults);
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                String name = key.substring(prefix.length());
                result.put(name, parseDouble(key, result.getOrDefault(name, 0.70)));
            }
        }
        return result;
    }

    public PenaltySettings penalty() {
        return penalty;
    }

    public ThresholdSettings threshold() {
        return threshold;
    }

    public DriftSettings drift() {
        return drift;
    }

    public RiskSettings risk() {
        return risk;
    }

    public CalibrationSettings calibration() {
        return calibration;
    }

    public AdaptationSettings adaptation() {
        return adaptation;
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void logSummary() {
        logger.info("🧠 Adaptive configuration:");
        logger.info("   Thresholds: global={} range=[{}, {}] update every {} trades or {}",
            threshold.globalInitial(), threshold.min(), threshold.max(),
            threshold.minTradesForUpdate(), threshold.updateInterval());
        logger.info("   Penalty: alpha={} cooldown>{} for {} cycles",
            penalty.ewmaAlpha(), penalty.cooldownThreshold(), penalty.cooldownCycles());
        logger.info("   Drift: lambda={} delta={} prudent={} cycles",
            drift.lambda(), drift.delta(), drift.prudentCycles());
        logger.info("   Risk: k={} fMax={} targetSigma={} position=[{}, {}] USD",
            risk.kFactor(), risk.maxFraction(), risk.targetSigma(), risk.minPositionUsd(), risk.maxPositionUsd());
        logger.info("   State: {} (db {}), retention {} trades / {} days",
            adaptation.stateDirectory(), adaptation.databasePath(),
            adaptation.retentionMaxTrades(), adaptation.retentionMaxDays());
    }
}
