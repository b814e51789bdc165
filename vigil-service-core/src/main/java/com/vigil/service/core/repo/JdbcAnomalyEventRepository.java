package com.vigil.service.core.repo;

import com.vigil.metric.model.StreamKey;
import com.vigil.service.core.event.AnomalyEvent;
import com.vigil.service.core.event.Priority;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** PostgreSQL-backed event store over {@code vigil.anomaly_events}. */
public class JdbcAnomalyEventRepository implements AnomalyEventRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcAnomalyEventRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(AnomalyEvent event) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", event.getId())
                .addValue("resource_id", event.getResourceId())
                .addValue("metric_name", event.getMetricName())
                .addValue("start_time", Timestamp.from(event.getStartTime()))
                .addValue("end_time", Timestamp.from(event.getEndTime()))
                .addValue("duration_seconds", event.getDuration().toMillis() / 1000.0)
                .addValue("peak_score", event.getPeakScore())
                .addValue("peak_time", Timestamp.from(event.getPeakTime()))
                .addValue("peak_value", event.getPeakValue())
                .addValue("average_score", event.getAverageScore())
                .addValue("point_count", event.getPointCount())
                .addValue("method", event.getContributingMethod())
                .addValue("priority_score", event.getPriorityScore())
                .addValue("priority", event.getPriority() == null ? null : event.getPriority().name());

        jdbc.update(
                """
            insert into vigil.anomaly_events(
                id, resource_id, metric_name, start_time, end_time, duration_seconds, peak_score, peak_time,
                peak_value, average_score, point_count, method, priority_score, priority)
            values (
                :id, :resource_id, :metric_name, :start_time, :end_time, :duration_seconds, :peak_score, :peak_time,
                :peak_value, :average_score, :point_count, :method, :priority_score, :priority)
            on conflict (id) do update set
                end_time = excluded.end_time,
                duration_seconds = excluded.duration_seconds,
                peak_score = excluded.peak_score,
                peak_time = excluded.peak_time,
                peak_value = excluded.peak_value,
                average_score = excluded.average_score,
                point_count = excluded.point_count,
                priority_score = excluded.priority_score,
                priority = excluded.priority,
                updated_at = now()
            """,
                params);
    }

    @Override
    public long countSince(StreamKey key, Instant since) {
        Long count = jdbc.queryForObject(
                """
            select count(*)
            from vigil.anomaly_events
            where resource_id = :resource_id
              and metric_name = :metric_name
              and start_time >= :since
            """,
                streamParams(key).addValue("since", Timestamp.from(since)),
                Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public Set<UUID> findIdsStartedBetween(StreamKey key, Instant from, Instant to) {
        List<UUID> ids = jdbc.query(
                """
            select id
            from vigil.anomaly_events
            where resource_id = :resource_id
              and metric_name = :metric_name
              and start_time >= :from_ts
              and start_time < :to_ts
            """,
                streamParams(key).addValue("from_ts", Timestamp.from(from)).addValue("to_ts", Timestamp.from(to)),
                (rs, rowNum) -> rs.getObject("id", UUID.class));
        return new LinkedHashSet<>(ids);
    }

    @Override
    public List<AnomalyEvent> findByStream(StreamKey key) {
        return jdbc.query(
                """
            select id, resource_id, metric_name, start_time, end_time, peak_score, peak_time, peak_value,
                   average_score, point_count, method, priority_score, priority
            from vigil.anomaly_events
            where resource_id = :resource_id
              and metric_name = :metric_name
            order by start_time
            """,
                streamParams(key),
                (rs, rowNum) -> mapEvent(rs));
    }

    private static MapSqlParameterSource streamParams(StreamKey key) {
        return new MapSqlParameterSource()
                .addValue("resource_id", key.resourceId())
                .addValue("metric_name", key.metricName());
    }

    private static AnomalyEvent mapEvent(ResultSet rs) throws SQLException {
        String priority = rs.getString("priority");
        double priorityScore = rs.getDouble("priority_score");
        boolean scored = !rs.wasNull();
        return AnomalyEvent.builder()
                .id(rs.getObject("id", UUID.class))
                .resourceId(rs.getString("resource_id"))
                .metricName(rs.getString("metric_name"))
                .startTime(rs.getTimestamp("start_time").toInstant())
                .endTime(rs.getTimestamp("end_time").toInstant())
                .peakScore(rs.getDouble("peak_score"))
                .peakTime(rs.getTimestamp("peak_time").toInstant())
                .peakValue(rs.getDouble("peak_value"))
                .averageScore(rs.getDouble("average_score"))
                .pointCount(rs.getInt("point_count"))
                .contributingMethod(rs.getString("method"))
                .priorityScore(scored ? priorityScore : null)
                .priority(priority == null ? null : Priority.valueOf(priority))
                .build();
    }
}
