package com.trading.adaptive.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.adaptive.error.StorageException;
import com.trading.adaptive.model.CalibrationSample;
import com.trading.adaptive.model.KellyParameters;
import com.trading.adaptive.model.Side;
import com.trading.adaptive.model.ThresholdSnapshot;
import com.trading.adaptive.model.TradeFilter;
import com.trading.adaptive.model.TradeOutcome;
import com.trading.adaptive.model.TradeStatistics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite-backed outcome log.
 *
 * Thread-Safety: a StampedLock guards the single connection. Writes take the write lock, queries the
 * read lock, and the row count uses an optimistic read.
 */
public final class SqliteOutcomeStore implements OutcomeStore {
    private static final Logger logger = LoggerFactory.getLogger(SqliteOutcomeStore.class);
    private static final TypeReference<Map<String, Double>> TECHNICAL_TYPE = new TypeReference<>() {};
    private static final String UNKNOWN_SIDE = "UNKNOWN";

    private final Connection connection;
    private final StampedLock lock = new StampedLock();
    private final Clock clock;
    private final Retry appendRetry;
    private final ObjectMapper mapper = Json.mapper();

    public SqliteOutcomeStore(Path dbPath, Clock clock) {
        this.clock = clock;
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            createTables();
            logger.info("Outcome store initialized: {}", dbPath);
        } catch (SQLException | IOException e) {
            throw new StorageException("Failed to initialize outcome store at " + dbPath, e);
        }

        var retryConfig = RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(50))
            .retryOnException(SqliteOutcomeStore::isBusy)
            .build();
        this.appendRetry = Retry.of("outcome-append", retryConfig);
        appendRetry.getEventPublisher()
            .onRetry(event -> logger.warn("Outcome append busy, retry #{}: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    private void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS trades (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                timestamp INTEGER NOT NULL,
                session_id TEXT NOT NULL,
                strategy_version TEXT DEFAULT 'v1.0',

                symbol TEXT NOT NULL,
                side TEXT NOT NULL,
                timeframe TEXT NOT NULL,
                cluster TEXT DEFAULT 'DEFAULT',

                confidence_raw REAL NOT NULL,
                confidence_calibrated REAL,
                predicted_direction TEXT,
                model_version TEXT,

                entry_price REAL NOT NULL,
                entry_time TEXT,
                position_size REAL NOT NULL,
                margin REAL NOT NULL,
                technical_json TEXT,

                exit_price REAL NOT NULL,
                exit_time TEXT,
                duration_seconds INTEGER,
                close_reason TEXT,

                roe_pct REAL NOT NULL,
                pnl_usd REAL NOT NULL,
                result INTEGER NOT NULL,
                stop_hit INTEGER DEFAULT 0,
                tp_hit INTEGER DEFAULT 0,

                fees_usd REAL DEFAULT 0,
                slippage_bp REAL DEFAULT 0,
                spread_bp REAL DEFAULT 0,
                latency_ms INTEGER DEFAULT 0,

                mfe_bp REAL DEFAULT 0,
                mae_bp REAL DEFAULT 0,

                tau_global REAL DEFAULT 0.70,
                tau_side REAL DEFAULT 0.70,
                tau_tf REAL DEFAULT 0.70,
                tau_cluster REAL DEFAULT 0.70,
                kelly_fraction REAL DEFAULT 0,
                cooldown_applied INTEGER DEFAULT 0,

                penalty_score REAL DEFAULT 0
            )
            """;

        List<String> indexes = List.of(
            "CREATE INDEX IF NOT EXISTS idx_symbol ON trades(symbol)",
            "CREATE INDEX IF NOT EXISTS idx_timestamp ON trades(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_cluster ON trades(cluster)",
            "CREATE INDEX IF NOT EXISTS idx_result ON trades(result)",
            "CREATE INDEX IF NOT EXISTS idx_side_tf ON trades(side, timeframe)",
            "CREATE INDEX IF NOT EXISTS idx_session ON trades(session_id)");

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
            for (String index : indexes) {
                stmt.execute(index);
            }
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public long append(TradeOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        try {
            long id = Retry.decorateSupplier(appendRetry, () -> insert(outcome)).get();

            logger.atDebug()
                .addKeyValue("id", id)
                .addKeyValue("symbol", outcome.symbol())
                .addKeyValue("roePct", outcome.roePct())
                .addKeyValue("win", outcome.win())
                .log("Trade outcome stored");
            return id;
        } catch (StorageException e) {
            logger.error("Failed to store outcome for {}", outcome.symbol(), e);
            throw e;
        }
    }

    private long insert(TradeOutcome o) {
        String sql = """
            INSERT INTO trades (
                timestamp, session_id, strategy_version,
                symbol, side, timeframe, cluster,
                confidence_raw, confidence_calibrated, predicted_direction, model_version,
                entry_price, entry_time, position_size, margin, technical_json,
                exit_price, exit_time, duration_seconds, close_reason,
                roe_pct, pnl_usd, result, stop_hit, tp_hit,
                fees_usd, slippage_bp, spread_bp, latency_ms,
                mfe_bp, mae_bp,
                tau_global, tau_side, tau_tf, tau_cluster, kelly_fraction, cooldown_applied,
                penalty_score
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?,
                      ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            int i = 1;
            stmt.setLong(i++, o.timestamp().toEpochMilli());
            stmt.setString(i++, o.sessionId());
            stmt.setString(i++, o.strategyVersion());
            stmt.setString(i++, o.symbol());
            stmt.setString(i++, o.side() != null ? o.side().name() : UNKNOWN_SIDE);
            stmt.setString(i++, o.timeframe());
            stmt.setString(i++, o.cluster());
            stmt.setDouble(i++, o.rawConfidence());
            setNullableDouble(stmt, i++, o.calibratedConfidence());
            stmt.setString(i++, o.predictedDirection());
            stmt.setString(i++, o.modelVersion());
            stmt.setDouble(i++, o.entryPrice());
            stmt.setString(i++, o.entryTime() != null ? o.entryTime().toString() : null);
            stmt.setDouble(i++, o.positionSize());
            stmt.setDouble(i++, o.margin());
            stmt.setString(i++, o.technical().isEmpty() ? null : mapper.writeValueAsString(o.technical()));
            stmt.setDouble(i++, o.exitPrice());
            stmt.setString(i++, o.exitTime() != null ? o.exitTime().toString() : null);
            if (o.hasDuration()) {
                stmt.setLong(i++, o.durationSeconds());
            } else {
                stmt.setNull(i++, Types.INTEGER);
            }
            stmt.setString(i++, o.closeReason());
            stmt.setDouble(i++, o.roePct());
            stmt.setDouble(i++, o.pnlUsd());
            stmt.setInt(i++, o.result());
            stmt.setInt(i++, o.stopHit() ? 1 : 0);
            stmt.setInt(i++, o.targetHit() ? 1 : 0);
            stmt.setDouble(i++, o.feesUsd());
            stmt.setDouble(i++, o.slippageBp());
            stmt.setDouble(i++, o.spreadBp());
            stmt.setLong(i++, o.latencyMs());
            stmt.setDouble(i++, o.mfeBp());
            stmt.setDouble(i++, o.maeBp());
            ThresholdSnapshot t = o.thresholds();
            stmt.setDouble(i++, t.global());
            stmt.setDouble(i++, t.side());
            stmt.setDouble(i++, t.timeframe());
            stmt.setDouble(i++, t.cluster());
            stmt.setDouble(i++, o.kellyFraction());
            stmt.setInt(i++, o.cooldownApplied() ? 1 : 0);
            stmt.setDouble(i, o.penaltyScore());
            stmt.executeUpdate();

            try (var idStmt = connection.createStatement();
                 var rs = idStmt.executeQuery("SELECT last_insert_rowid()")) {
                return rs.next() ? rs.getLong(1) : -1L;
            }
        } catch (SQLException e) {
            throw new StorageException("Outcome write failed for " + o.symbol(), e);
        } catch (JsonProcessingException e) {
            throw new StorageException("Could not serialize technical snapshot for " + o.symbol(), e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    private static boolean isBusy(Throwable t) {
        Throwable cause = t instanceof StorageException ? t.getCause() : t;
        if (cause instanceof SQLiteException sqlite) {
            SQLiteErrorCode code = sqlite.getResultCode();
            return code == SQLiteErrorCode.SQLITE_BUSY || code == SQLiteErrorCode.SQLITE_LOCKED;
        }
        return cause instanceof SQLException sql && sql.getMessage() != null
            && (sql.getMessage().contains("SQLITE_BUSY") || sql.getMessage().contains("database is locked"));
    }

    @Override
    public TradeStatistics statistics(int window, TradeFilter filter) {
        var where = new StringBuilder("WHERE 1=1");
        List<Object> params = new ArrayList<>();
        TradeFilter f = filter != null ? filter : TradeFilter.NONE;
        if (f.symbol() != null) {
            where.append(" AND symbol = ?");
            params.add(f.symbol());
        }
        if (f.side() != null) {
            where.append(" AND side = ?");
            params.add(f.side().name());
        }
        if (f.timeframe() != null) {
            where.append(" AND timeframe = ?");
            params.add(f.timeframe());
        }
        if (f.cluster() != null) {
            where.append(" AND cluster = ?");
            params.add(f.cluster());
        }
        if (f.sessionId() != null) {
            where.append(" AND session_id = ?");
            params.add(f.sessionId());
        }
        String sql = "SELECT roe_pct, result, duration_seconds FROM trades " + where
            + " ORDER BY id DESC LIMIT ?";
        params.add(window);

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            bind(stmt, params);
            List<double[]> rows = new ArrayList<>();
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(new double[]{rs.getDouble("roe_pct"), rs.getInt("result"), rs.getLong("duration_seconds")});
                }
            }
            return summarize(rows);
        } catch (SQLException e) {
            logger.error("Failed to compute statistics for {}", f, e);
            return TradeStatistics.EMPTY;
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private static TradeStatistics summarize(List<double[]> rows) {
        if (rows.isEmpty()) {
            return TradeStatistics.EMPTY;
        }
        int total = rows.size();
        int wins = 0;
        double sumRoe = 0;
        double sumWins = 0;
        double sumLosses = 0;
        double sumDuration = 0;
        for (double[] row : rows) {
            double roe = row[0];
            sumRoe += roe;
            sumDuration += row[2];
            if (row[1] == 1) {
                wins++;
                sumWins += roe;
            } else {
                sumLosses += roe;
            }
        }
        int losses = total - wins;
        double avgWin = wins > 0 ? sumWins / wins : 0.0;
        double avgLoss = losses > 0 ? sumLosses / losses : 0.0;
        double profitFactor = Math.abs(sumLosses) > 0 ? sumWins / Math.abs(sumLosses) : 0.0;
        double rewardRisk = avgLoss != 0 ? Math.abs(avgWin / avgLoss) : 0.0;

        return new TradeStatistics(
            total, wins, losses,
            (double) wins / total,
            sumRoe / total,
            avgWin, avgLoss,
            profitFactor, rewardRisk,
            sumDuration / total / 60.0);
    }

    @Override
    public KellyParameters kellyParameters(String bucket, int window) {
        String symbolSql = "SELECT roe_pct, result FROM trades WHERE symbol = ? ORDER BY id DESC LIMIT ?";
        String fallbackSql = """
            SELECT roe_pct, result FROM trades
            WHERE cluster = ? OR timeframe = ?
            ORDER BY id DESC LIMIT ?
            """;

        long stamp = lock.readLock();
        try {
            List<double[]> rows = new ArrayList<>();
            try (var stmt = connection.prepareStatement(symbolSql)) {
                stmt.setString(1, bucket);
                stmt.setInt(2, window);
                readRoeRows(stmt, rows);
            }
            if (rows.size() < KELLY_MIN_SYMBOL_SAMPLES) {
                rows.clear();
                try (var stmt = connection.prepareStatement(fallbackSql)) {
                    stmt.setString(1, bucket);
                    stmt.setString(2, bucket);
                    stmt.setInt(3, window);
                    readRoeRows(stmt, rows);
                }
            }
            if (rows.size() < KELLY_MIN_FALLBACK_SAMPLES) {
                logger.debug("Insufficient data for Kelly bucket {} ({} rows), using defaults", bucket, rows.size());
                return KellyParameters.DEFAULT;
            }
            return estimateKelly(rows);
        } catch (SQLException e) {
            logger.error("Failed to load Kelly parameters for {}", bucket, e);
            return KellyParameters.DEFAULT;
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private static void readRoeRows(PreparedStatement stmt, List<double[]> rows) throws SQLException {
        try (var rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(new double[]{rs.getDouble("roe_pct"), rs.getInt("result")});
            }
        }
    }

    static KellyParameters estimateKelly(List<double[]> rows) {
        int n = rows.size();
        int wins = 0;
        double sumWins = 0;
        double sumLosses = 0;
        double sum = 0;
        for (double[] row : rows) {
            sum += row[0];
            if (row[1] == 1) {
                wins++;
                sumWins += row[0];
            } else {
                sumLosses += row[0];
            }
        }
        int losses = n - wins;
        double avgWin = wins > 0 ? Math.abs(sumWins / wins) : 1.0;
        double avgLoss = losses > 0 ? Math.abs(sumLosses / losses) : 1.0;
        double rewardRisk = avgLoss > 0 ? avgWin / avgLoss : 2.0;

        double mean = sum / n;
        double squares = 0;
        for (double[] row : rows) {
            squares += (row[0] - mean) * (row[0] - mean);
        }
        double sigma = n > 1 ? Math.sqrt(squares / (n - 1)) : 0.0;

        return new KellyParameters(rewardRisk, (double) wins / n, sigma);
    }

    @Override
    public List<TradeOutcome> recent(int n) {
        String sql = "SELECT * FROM trades ORDER BY id DESC LIMIT ?";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, n);
            List<TradeOutcome> result = new ArrayList<>();
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            logger.error("Failed to load recent outcomes", e);
            return Collections.emptyList();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private TradeOutcome mapRow(ResultSet rs) throws SQLException {
        long duration = rs.getLong("duration_seconds");
        Long durationSeconds = rs.wasNull() ? null : duration;
        double calibrated = rs.getDouble("confidence_calibrated");
        Double calibratedConfidence = rs.wasNull() ? null : calibrated;

        return TradeOutcome.builder()
            .id(rs.getLong("id"))
            .timestamp(Instant.ofEpochMilli(rs.getLong("timestamp")))
            .sessionId(rs.getString("session_id"))
            .strategyVersion(rs.getString("strategy_version"))
            .symbol(rs.getString("symbol"))
            .side(rs.getString("side"))
            .timeframe(rs.getString("timeframe"))
            .cluster(rs.getString("cluster"))
            .rawConfidence(rs.getDouble("confidence_raw"))
            .calibratedConfidence(calibratedConfidence)
            .predictedDirection(rs.getString("predicted_direction"))
            .modelVersion(rs.getString("model_version"))
            .entryPrice(rs.getDouble("entry_price"))
            .entryTime(parseInstant(rs.getString("entry_time")))
            .positionSize(rs.getDouble("position_size"))
            .margin(rs.getDouble("margin"))
            .technical(parseTechnical(rs.getString("technical_json")))
            .exitPrice(rs.getDouble("exit_price"))
            .exitTime(parseInstant(rs.getString("exit_time")))
            .durationSeconds(durationSeconds)
            .closeReason(rs.getString("close_reason"))
            .roePct(rs.getDouble("roe_pct"))
            .pnlUsd(rs.getDouble("pnl_usd"))
            .win(rs.getInt("result") == 1)
            .stopHit(rs.getInt("stop_hit") == 1)
            .targetHit(rs.getInt("tp_hit") == 1)
            .feesUsd(rs.getDouble("fees_usd"))
            .slippageBp(rs.getDouble("slippage_bp"))
            .spreadBp(rs.getDouble("spread_bp"))
            .latencyMs(rs.getLong("latency_ms"))
            .mfeBp(rs.getDouble("mfe_bp"))
            .maeBp(rs.getDouble("mae_bp"))
            .thresholds(new ThresholdSnapshot(
                rs.getDouble("tau_global"), rs.getDouble("tau_side"),
                rs.getDouble("tau_tf"), rs.getDouble("tau_cluster")))
            .kellyFraction(rs.getDouble("kelly_fraction"))
            .cooldownApplied(rs.getInt("cooldown_applied") == 1)
            .penaltyScore(rs.getDouble("penalty_score"))
            .build();
    }

    private static Instant parseInstant(String value) {
        return value == null ? null : Instant.parse(value);
    }

    private Map<String, Double> parseTechnical(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, TECHNICAL_TYPE);
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable technical snapshot, ignoring: {}", e.getMessage());
            return Map.of();
        }
    }

    /**
     * Row count with an optimistic read.
     */
    @Override
    public int count() {
        long stamp = lock.tryOptimisticRead();
        int result = queryCount();

        if (!lock.validate(stamp)) {
            stamp = lock.readLock();
            try {
                result = queryCount();
            } finally {
                lock.unlockRead(stamp);
            }
        }
        return result;
    }

    private int queryCount() {
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT COUNT(*) AS count FROM trades")) {
            return rs.next() ? rs.getInt("count") : 0;
        } catch (SQLException e) {
            logger.error("Failed to count outcomes", e);
            return 0;
        }
    }

    @Override
    public int retentionSweep(int maxCount, int maxAgeDays) {
        long cutoff = Instant.now(clock).minus(Duration.ofDays(maxAgeDays)).toEpochMilli();
        int deleted = 0;

        long stamp = lock.writeLock();
        try {
            int current;
            try (var stmt = connection.createStatement();
                 var rs = stmt.executeQuery("SELECT COUNT(*) FROM trades")) {
                current = rs.next() ? rs.getInt(1) : 0;
            }
            if (current > maxCount) {
                try (var stmt = connection.prepareStatement(
                    "DELETE FROM trades WHERE id IN (SELECT id FROM trades ORDER BY id ASC LIMIT ?)")) {
                    stmt.setInt(1, current - maxCount);
                    int removed = stmt.executeUpdate();
                    deleted += removed;
                    logger.info("🗑️ Retention removed {} oldest trades (limit {})", removed, maxCount);
                }
            }
            try (var stmt = connection.prepareStatement("DELETE FROM trades WHERE timestamp < ?")) {
                stmt.setLong(1, cutoff);
                int removed = stmt.executeUpdate();
                if (removed > 0) {
                    deleted += removed;
                    logger.info("🗑️ Retention removed {} trades older than {} days", removed, maxAgeDays);
                }
            }
            if (deleted > 0) {
                try (var stmt = connection.createStatement()) {
                    stmt.execute("VACUUM");
                }
            }
            return deleted;
        } catch (SQLException e) {
            throw new StorageException("Retention sweep failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public List<CalibrationSample> calibrationSamples(Side side, String timeframe, int limit) {
        String sql = """
            SELECT confidence_raw, result FROM trades
            WHERE side = ? AND timeframe = ?
            ORDER BY id DESC LIMIT ?
            """;

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, side.name());
            stmt.setString(2, timeframe);
            stmt.setInt(3, limit);
            List<CalibrationSample> samples = new ArrayList<>();
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    samples.add(new CalibrationSample(rs.getDouble("confidence_raw"), rs.getInt("result") == 1));
                }
            }
            return samples;
        } catch (SQLException e) {
            logger.error("Failed to load calibration samples for {} {}", side, timeframe, e);
            return Collections.emptyList();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public List<Double> lossesSince(Instant since) {
        String sql = "SELECT pnl_usd FROM trades WHERE timestamp >= ? AND pnl_usd < 0";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, since.toEpochMilli());
            List<Double> losses = new ArrayList<>();
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    losses.add(rs.getDouble("pnl_usd"));
                }
            }
            return losses;
        } catch (SQLException e) {
            logger.error("Failed to load losses since {}", since, e);
            return Collections.emptyList();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public List<String> distinctTimeframes() {
        long stamp = lock.readLock();
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT DISTINCT timeframe FROM trades ORDER BY timeframe")) {
            List<String> timeframes = new ArrayList<>();
            while (rs.next()) {
                timeframes.add(rs.getString(1));
            }
            return timeframes;
        } catch (SQLException e) {
            logger.error("Failed to list timeframes", e);
            return Collections.emptyList();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value instanceof Integer intValue) {
                stmt.setInt(i + 1, intValue);
            } else {
                stmt.setString(i + 1, String.valueOf(value));
            }
        }
    }

    private static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }

    @Override
    public void close() {
        long stamp = lock.writeLock();
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                logger.info("Outcome store closed");
            }
        } catch (SQLException e) {
            logger.error("Error closing outcome store", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }
}
