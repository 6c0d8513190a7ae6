package com.analytics.trend.storage;

import com.analytics.trend.core.TrendRepository;
import com.analytics.trend.exception.PersistenceException;
import com.analytics.trend.model.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 基于SQLite的趋势仓库实现。
 *
 * 单库单连接，所有方法串行执行。
 * 时间戳以毫秒整数存储，列表和映射字段以 JSON 文本存储。
 */
public class SQLiteTrendRepository implements TrendRepository {

    private static final Logger log = LoggerFactory.getLogger(SQLiteTrendRepository.class);

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, Double>> DOUBLE_MAP = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Double>> DOUBLE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<List<Double>>> INTERVAL_LIST = new TypeReference<>() {};

    private final String dbPath;
    private final Connection connection;
    private final ObjectMapper mapper;

    public SQLiteTrendRepository(String dbPath) {
        this.dbPath = dbPath;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // 确保存储目录存在
        File parent = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new PersistenceException("Failed to create storage directory: " + parent);
        }

        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            connection.setAutoCommit(true);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
            }
            initSchema();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize trend database at " + dbPath, e);
        }
        log.info("SQLiteTrendRepository initialized at: {}", dbPath);
    }

    private void initSchema() throws SQLException {
        String[] ddl = {
                "CREATE TABLE IF NOT EXISTS data_points ("
                        + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                        + "timestamp INTEGER NOT NULL, "
                        + "value REAL NOT NULL, "
                        + "source TEXT, "
                        + "category TEXT NOT NULL, "
                        + "metadata TEXT)",
                "CREATE TABLE IF NOT EXISTS detected_trends ("
                        + "id TEXT PRIMARY KEY, "
                        + "name TEXT, "
                        + "type TEXT NOT NULL, "
                        + "direction TEXT NOT NULL, "
                        + "strength TEXT NOT NULL, "
                        + "impact TEXT NOT NULL, "
                        + "confidence REAL, "
                        + "start_date INTEGER, "
                        + "detection_date INTEGER, "
                        + "supporting_point_count INTEGER, "
                        + "key_indicators TEXT, "
                        + "correlation_factors TEXT, "
                        + "metadata TEXT)",
                "CREATE TABLE IF NOT EXISTS trend_patterns ("
                        + "id TEXT PRIMARY KEY, "
                        + "trend_id TEXT NOT NULL, "
                        + "type TEXT NOT NULL, "
                        + "start_date INTEGER, "
                        + "end_date INTEGER, "
                        + "duration_days INTEGER, "
                        + "strength REAL, "
                        + "confidence REAL, "
                        + "parameters TEXT, "
                        + "detected_at INTEGER)",
                "CREATE TABLE IF NOT EXISTS trend_alerts ("
                        + "id TEXT PRIMARY KEY, "
                        + "trend_id TEXT NOT NULL, "
                        + "type TEXT NOT NULL, "
                        + "severity TEXT NOT NULL, "
                        + "message TEXT, "
                        + "recommendations TEXT, "
                        + "triggered_at INTEGER, "
                        + "expires_at INTEGER)",
                "CREATE TABLE IF NOT EXISTS trend_forecasts ("
                        + "id TEXT PRIMARY KEY, "
                        + "trend_id TEXT NOT NULL, "
                        + "horizon INTEGER, "
                        + "predicted_values TEXT, "
                        + "confidence_intervals TEXT, "
                        + "accuracy REAL, "
                        + "methodology TEXT, "
                        + "created_at INTEGER)",
                "CREATE INDEX IF NOT EXISTS idx_points_timestamp ON data_points(timestamp)",
                "CREATE INDEX IF NOT EXISTS idx_points_category ON data_points(category)",
                "CREATE INDEX IF NOT EXISTS idx_trends_detection ON detected_trends(detection_date)",
                "CREATE INDEX IF NOT EXISTS idx_patterns_trend ON trend_patterns(trend_id)",
                "CREATE INDEX IF NOT EXISTS idx_alerts_trend ON trend_alerts(trend_id)",
                "CREATE INDEX IF NOT EXISTS idx_forecasts_trend ON trend_forecasts(trend_id)"
        };
        try (Statement stmt = connection.createStatement()) {
            for (String sql : ddl) {
                stmt.execute(sql);
            }
        }
    }

    // ==================== 写入 ====================

    @Override
    public synchronized void savePoint(DataPoint point) {
        String sql = "INSERT INTO data_points (timestamp, value, source, category, metadata) VALUES (?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, point.getTimestamp().toEpochMilli());
            stmt.setDouble(2, point.getValue());
            stmt.setString(3, point.getSource());
            stmt.setString(4, point.getCategory());
            stmt.setString(5, toJson(point.getMetadata()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save data point " + point, e);
        }
    }

    @Override
    public synchronized void saveTrend(DetectedTrend trend) {
        String sql = "INSERT OR REPLACE INTO detected_trends (id, name, type, direction, strength, impact, "
                + "confidence, start_date, detection_date, supporting_point_count, key_indicators, "
                + "correlation_factors, metadata) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, trend.getId());
            stmt.setString(2, trend.getName());
            stmt.setString(3, trend.getType().getCode());
            stmt.setString(4, trend.getDirection().getCode());
            stmt.setString(5, trend.getStrength().getCode());
            stmt.setString(6, trend.getImpact().getCode());
            stmt.setDouble(7, trend.getConfidence());
            stmt.setLong(8, trend.getStartDate().toEpochMilli());
            stmt.setLong(9, trend.getDetectionDate().toEpochMilli());
            stmt.setInt(10, trend.getSupportingPointCount());
            stmt.setString(11, toJson(trend.getKeyIndicators()));
            stmt.setString(12, toJson(trend.getCorrelationFactors()));
            stmt.setString(13, toJson(trend.getMetadata()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save trend " + trend.getId(), e);
        }
    }

    @Override
    public synchronized void savePattern(TrendPattern pattern) {
        String sql = "INSERT OR REPLACE INTO trend_patterns (id, trend_id, type, start_date, end_date, "
                + "duration_days, strength, confidence, parameters, detected_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, pattern.getId());
            stmt.setString(2, pattern.getTrendId());
            stmt.setString(3, pattern.getType().getCode());
            stmt.setLong(4, pattern.getStartDate().toEpochMilli());
            stmt.setLong(5, pattern.getEndDate().toEpochMilli());
            stmt.setLong(6, pattern.getDurationDays());
            stmt.setDouble(7, pattern.getStrength());
            stmt.setDouble(8, pattern.getConfidence());
            stmt.setString(9, toJson(pattern.getParameters()));
            stmt.setLong(10, pattern.getDetectedAt().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save pattern " + pattern.getId(), e);
        }
    }

    @Override
    public synchronized void saveForecast(TrendForecast forecast) {
        List<List<Double>> intervals = new ArrayList<>(forecast.getHorizon());
        for (TrendForecast.Interval interval : forecast.getConfidenceIntervals()) {
            intervals.add(List.of(interval.getLow(), interval.getHigh()));
        }

        String sql = "INSERT OR REPLACE INTO trend_forecasts (id, trend_id, horizon, predicted_values, "
                + "confidence_intervals, accuracy, methodology, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, forecast.getId());
            stmt.setString(2, forecast.getTrendId());
            stmt.setInt(3, forecast.getHorizon());
            stmt.setString(4, toJson(forecast.getPredictedValues()));
            stmt.setString(5, toJson(intervals));
            stmt.setDouble(6, forecast.getAccuracy());
            stmt.setString(7, forecast.getMethodology());
            stmt.setLong(8, forecast.getCreatedAt().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save forecast " + forecast.getId(), e);
        }
    }

    @Override
    public synchronized void saveAlert(TrendAlert alert) {
        String sql = "INSERT OR REPLACE INTO trend_alerts (id, trend_id, type, severity, message, "
                + "recommendations, triggered_at, expires_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, alert.getId());
            stmt.setString(2, alert.getTrendId());
            stmt.setString(3, alert.getType().getCode());
            stmt.setString(4, alert.getSeverity().getCode());
            stmt.setString(5, alert.getMessage());
            stmt.setString(6, toJson(alert.getRecommendations()));
            stmt.setLong(7, alert.getTriggeredAt().toEpochMilli());
            stmt.setLong(8, alert.getExpiresAt().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save alert " + alert.getId(), e);
        }
    }

    // ==================== 读取 ====================

    @Override
    public synchronized List<DataPoint> loadRecentPoints(Instant since) {
        String sql = "SELECT timestamp, value, source, category, metadata FROM data_points "
                + "WHERE timestamp >= ? ORDER BY timestamp ASC";
        List<DataPoint> points = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, since.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    points.add(new DataPoint(
                            Instant.ofEpochMilli(rs.getLong("timestamp")),
                            rs.getDouble("value"),
                            rs.getString("source"),
                            rs.getString("category"),
                            fromJson(rs.getString("metadata"), OBJECT_MAP, Collections.emptyMap())));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load data points since " + since, e);
        }
        return points;
    }

    @Override
    public synchronized List<DetectedTrend> loadRecentTrends(Instant since) {
        String sql = "SELECT * FROM detected_trends WHERE detection_date >= ? ORDER BY detection_date DESC";
        List<DetectedTrend> trends = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, since.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    trends.add(mapTrend(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load trends since " + since, e);
        }
        return trends;
    }

    @Override
    public synchronized List<TrendPattern> loadPatternsForTrend(String trendId) {
        String sql = "SELECT * FROM trend_patterns WHERE trend_id = ? ORDER BY start_date ASC";
        List<TrendPattern> patterns = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, trendId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    patterns.add(new TrendPattern(
                            rs.getString("id"),
                            rs.getString("trend_id"),
                            PatternType.fromCode(rs.getString("type")),
                            Instant.ofEpochMilli(rs.getLong("start_date")),
                            Instant.ofEpochMilli(rs.getLong("end_date")),
                            rs.getDouble("strength"),
                            rs.getDouble("confidence"),
                            fromJson(rs.getString("parameters"), DOUBLE_MAP, Collections.emptyMap()),
                            Instant.ofEpochMilli(rs.getLong("detected_at"))));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load patterns for trend " + trendId, e);
        }
        return patterns;
    }

    @Override
    public synchronized List<TrendAlert> loadAlertsForTrend(String trendId) {
        String sql = "SELECT * FROM trend_alerts WHERE trend_id = ? ORDER BY triggered_at ASC";
        List<TrendAlert> alerts = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, trendId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    alerts.add(new TrendAlert(
                            rs.getString("id"),
                            rs.getString("trend_id"),
                            AlertType.fromCode(rs.getString("type")),
                            TrendImpact.fromCode(rs.getString("severity")),
                            rs.getString("message"),
                            fromJson(rs.getString("recommendations"), STRING_LIST, Collections.emptyList()),
                            Instant.ofEpochMilli(rs.getLong("triggered_at")),
                            Instant.ofEpochMilli(rs.getLong("expires_at"))));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load alerts for trend " + trendId, e);
        }
        return alerts;
    }

    @Override
    public synchronized List<TrendForecast> loadForecastsForTrend(String trendId) {
        String sql = "SELECT * FROM trend_forecasts WHERE trend_id = ? ORDER BY created_at ASC";
        List<TrendForecast> forecasts = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, trendId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    List<TrendForecast.Interval> intervals = new ArrayList<>();
                    for (List<Double> pair : fromJson(rs.getString("confidence_intervals"),
                            INTERVAL_LIST, Collections.<List<Double>>emptyList())) {
                        intervals.add(new TrendForecast.Interval(pair.get(0), pair.get(1)));
                    }
                    forecasts.add(new TrendForecast(
                            rs.getString("id"),
                            rs.getString("trend_id"),
                            rs.getInt("horizon"),
                            fromJson(rs.getString("predicted_values"), DOUBLE_LIST, Collections.emptyList()),
                            intervals,
                            rs.getDouble("accuracy"),
                            rs.getString("methodology"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load forecasts for trend " + trendId, e);
        }
        return forecasts;
    }

    // ==================== 内部工具方法 ====================

    private DetectedTrend mapTrend(ResultSet rs) throws SQLException {
        return DetectedTrend.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .type(TrendType.fromCode(rs.getString("type")))
                .direction(TrendDirection.fromCode(rs.getString("direction")))
                .strength(TrendStrength.fromCode(rs.getString("strength")))
                .impact(TrendImpact.fromCode(rs.getString("impact")))
                .confidence(rs.getDouble("confidence"))
                .startDate(Instant.ofEpochMilli(rs.getLong("start_date")))
                .detectionDate(Instant.ofEpochMilli(rs.getLong("detection_date")))
                .supportingPointCount(rs.getInt("supporting_point_count"))
                .keyIndicators(fromJson(rs.getString("key_indicators"), STRING_LIST, Collections.emptyList()))
                .correlationFactors(fromJson(rs.getString("correlation_factors"), DOUBLE_MAP, Collections.emptyMap()))
                .metadata(fromJson(rs.getString("metadata"), OBJECT_MAP, Collections.emptyMap()))
                .build();
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize column value", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T empty) {
        if (json == null || json.isEmpty()) {
            return empty;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to parse column value: " + json, e);
        }
    }

    /** 关闭连接 */
    @Override
    public synchronized void close() {
        try {
            if (!connection.isClosed()) {
                connection.close();
            }
            log.info("SQLiteTrendRepository closed.");
        } catch (SQLException e) {
            log.warn("Failed to close trend database {}: {}", dbPath, e.getMessage());
        }
    }
}
