package com.edgewatch.service.storage.impl;

import com.edgewatch.service.core.store.TelemetryQueryRepository;
import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricKind;
import com.edgewatch.telemetry.model.MetricSample;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.TreeMap;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTelemetryQueryRepository implements TelemetryQueryRepository {

    private static final String SAMPLES_SQL =
            """
            select cluster_id, series_key, metric_name, labels::text as labels, ts, kind, value
              from metric_samples
             where cluster_id = :cluster_id
               and series_key = :series_key
               and ts between :from and :to
             order by ts, sort_key
             limit :limit
            """;

    private static final String SERIES_KEYS_SQL =
            """
            select distinct series_key
              from metric_samples
             where cluster_id = :cluster_id
             order by series_key
             limit :limit
            """;

    private static final String LOGS_SQL =
            """
            select cluster_id, ts, body, attributes::text as attributes
              from log_records
             where cluster_id = :cluster_id
               and ts between :from and :to
             order by ts, sort_key
             limit :limit
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public JdbcTelemetryQueryRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public List<MetricSample> findSamples(String clusterId, String seriesKey, Instant from, Instant to, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("cluster_id", clusterId)
                .addValue("series_key", seriesKey)
                .addValue("from", Timestamp.from(from), Types.TIMESTAMP)
                .addValue("to", Timestamp.from(to), Types.TIMESTAMP)
                .addValue("limit", limit);
        return jdbc.query(SAMPLES_SQL, params, sampleMapper());
    }

    @Override
    public List<String> findSeriesKeys(String clusterId, int limit) {
        MapSqlParameterSource params =
                new MapSqlParameterSource().addValue("cluster_id", clusterId).addValue("limit", limit);
        return jdbc.queryForList(SERIES_KEYS_SQL, params, String.class);
    }

    @Override
    public List<LogRecord> findLogs(String clusterId, Instant from, Instant to, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("cluster_id", clusterId)
                .addValue("from", Timestamp.from(from), Types.TIMESTAMP)
                .addValue("to", Timestamp.from(to), Types.TIMESTAMP)
                .addValue("limit", limit);
        return jdbc.query(
                LOGS_SQL,
                params,
                (rs, rowNum) -> new LogRecord(
                        rs.getString("cluster_id"),
                        rs.getTimestamp("ts").toInstant().toEpochMilli(),
                        rs.getString("body"),
                        json.read(rs.getString("attributes"))));
    }

    private RowMapper<MetricSample> sampleMapper() {
        return (rs, rowNum) -> new MetricSample(
                rs.getString("cluster_id"),
                rs.getString("series_key"),
                rs.getString("metric_name"),
                new TreeMap<>(json.read(rs.getString("labels"))),
                rs.getTimestamp("ts").toInstant().toEpochMilli(),
                rs.getDouble("value"),
                MetricKind.valueOf(rs.getString("kind")));
    }
}
