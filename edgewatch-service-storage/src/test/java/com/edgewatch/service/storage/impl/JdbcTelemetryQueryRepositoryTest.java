package com.edgewatch.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricKind;
import com.edgewatch.telemetry.model.MetricSample;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcTelemetryQueryRepositoryTest {

    private static final Instant FROM = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2026-01-01T01:00:00Z");

    private final NamedParameterJdbcTemplate jdbc = mock(NamedParameterJdbcTemplate.class);
    private final JdbcTelemetryQueryRepository repository = new JdbcTelemetryQueryRepository(jdbc, new ObjectMapper());

    @Test
    @SuppressWarnings("unchecked")
    void mapsSampleRowsWithLabels() throws Exception {
        ArgumentCaptor<RowMapper<MetricSample>> mapper = ArgumentCaptor.forClass(RowMapper.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        when(jdbc.query(anyString(), params.capture(), mapper.capture())).thenReturn(List.of());

        repository.findSamples("c1", "cpu{core=\"0\"}", FROM, TO, 500);

        assertThat(params.getValue().getValue("series_key")).isEqualTo("cpu{core=\"0\"}");
        assertThat(params.getValue().getValue("limit")).isEqualTo(500);
        assertThat(params.getValue().getValue("from")).isEqualTo(Timestamp.from(FROM));

        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("cluster_id")).thenReturn("c1");
        when(rs.getString("series_key")).thenReturn("cpu{core=\"0\"}");
        when(rs.getString("metric_name")).thenReturn("cpu");
        when(rs.getString("labels")).thenReturn("{\"core\": \"0\"}");
        when(rs.getTimestamp("ts")).thenReturn(Timestamp.from(FROM));
        when(rs.getDouble("value")).thenReturn(0.75);
        when(rs.getString("kind")).thenReturn("COUNTER");

        MetricSample sample = mapper.getValue().mapRow(rs, 0);

        assertThat(sample.labels()).containsEntry("core", "0");
        assertThat(sample.timestamp()).isEqualTo(FROM.toEpochMilli());
        assertThat(sample.kind()).isEqualTo(MetricKind.COUNTER);
        assertThat(sample.value()).isEqualTo(0.75);
    }

    @Test
    @SuppressWarnings("unchecked")
    void mapsLogRowsWithEmptyAttributes() throws Exception {
        ArgumentCaptor<RowMapper<LogRecord>> mapper = ArgumentCaptor.forClass(RowMapper.class);
        when(jdbc.query(anyString(), any(SqlParameterSource.class), mapper.capture())).thenReturn(List.of());

        repository.findLogs("c1", FROM, TO, 50);

        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("cluster_id")).thenReturn("c1");
        when(rs.getTimestamp("ts")).thenReturn(Timestamp.from(TO));
        when(rs.getString("body")).thenReturn("restart");
        when(rs.getString("attributes")).thenReturn(null);

        LogRecord log = mapper.getValue().mapRow(rs, 0);

        assertThat(log.body()).isEqualTo("restart");
        assertThat(log.attributes()).isEmpty();
    }

    @Test
    void seriesKeysPassLimit() {
        ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
        when(jdbc.queryForList(anyString(), params.capture(), eq(String.class))).thenReturn(List.of("a{}", "b{}"));

        assertThat(repository.findSeriesKeys("c1", 2)).containsExactly("a{}", "b{}");
        assertThat(params.getValue().getValue("limit")).isEqualTo(2);
        verify(jdbc).queryForList(anyString(), any(MapSqlParameterSource.class), eq(String.class));
    }
}
