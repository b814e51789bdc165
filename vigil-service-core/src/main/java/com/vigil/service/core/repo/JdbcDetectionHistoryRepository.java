package com.vigil.service.core.repo;

import com.vigil.metric.model.Sensitivity;
import com.vigil.metric.model.StreamKey;
import java.sql.Timestamp;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public class JdbcDetectionHistoryRepository implements DetectionHistoryRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcDetectionHistoryRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void record(DetectionHistoryEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("resource_id", entry.resourceId())
                .addValue("metric_name", entry.metricName())
                .addValue("method", entry.method())
                .addValue("sensitivity", entry.sensitivity().configValue())
                .addValue("total_points", entry.totalPoints())
                .addValue("anomaly_count", entry.anomalyCount())
                .addValue("anomaly_percentage", entry.anomalyPercentage())
                .addValue("detection_time_ms", entry.detectionTimeMs())
                .addValue("created_at", Timestamp.from(entry.createdAt()));

        jdbc.update(
                """
            insert into vigil.detection_history(
                resource_id, metric_name, method, sensitivity, total_points, anomaly_count,
                anomaly_percentage, detection_time_ms, created_at)
            values (
                :resource_id, :metric_name, :method, :sensitivity, :total_points, :anomaly_count,
                :anomaly_percentage, :detection_time_ms, :created_at)
            """,
                params);
    }

    @Override
    public List<DetectionHistoryEntry> findRecent(StreamKey key, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("resource_id", key.resourceId())
                .addValue("metric_name", key.metricName())
                .addValue("limit", limit);
        return jdbc.query(
                """
            select resource_id, metric_name, method, sensitivity, total_points, anomaly_count,
                   anomaly_percentage, detection_time_ms, created_at
            from vigil.detection_history
            where resource_id = :resource_id
              and metric_name = :metric_name
            order by created_at desc, id desc
            limit :limit
            """,
                params,
                (rs, rowNum) -> new DetectionHistoryEntry(
                        rs.getString("resource_id"),
                        rs.getString("metric_name"),
                        rs.getString("method"),
                        Sensitivity.fromValue(rs.getString("sensitivity")),
                        rs.getInt("total_points"),
                        rs.getInt("anomaly_count"),
                        rs.getDouble("anomaly_percentage"),
                        rs.getLong("detection_time_ms"),
                        rs.getTimestamp("created_at").toInstant()));
    }
}
