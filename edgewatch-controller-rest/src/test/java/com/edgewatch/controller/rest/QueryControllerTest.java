package com.edgewatch.controller.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.edgewatch.service.core.query.SeriesQueryService;
import com.edgewatch.service.core.store.RecordStore;
import com.edgewatch.service.core.store.WriteResult;
import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricKind;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.TelemetryRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class QueryControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T01:00:00Z");
    private static final long T = NOW.minus(Duration.ofMinutes(30)).toEpochMilli();

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        RecordStore store = new FixedStore(
                List.of(
                        MetricSample.of("c1", "cpu", Map.of(), T, 0.1, MetricKind.GAUGE),
                        MetricSample.of("c1", "cpu", Map.of(), T + 1000, 0.3, MetricKind.GAUGE)),
                List.of(new LogRecord("c1", T, "boot", Map.of("pod", "a"))));
        mvc = MockMvcBuilders.standaloneSetup(
                        new QueryController(new SeriesQueryService(store), Clock.fixed(NOW, ZoneOffset.UTC)))
                .setControllerAdvice(new RestErrorHandler())
                .build();
    }

    @Test
    void seriesDefaultsToLastHourAndKeepsExactValues() throws Exception {
        mvc.perform(get("/api/query/series").param("cluster_id", "c1").param("series_key", "cpu{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("GAUGE"))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.points[0].timestamp").value(T))
                .andExpect(jsonPath("$.points[0].value").value(0.1))
                .andExpect(jsonPath("$.truncated").value(false))
                .andExpect(jsonPath("$.stepMillis").doesNotExist());
    }

    @Test
    void stepAveragesPoints() throws Exception {
        mvc.perform(get("/api/query/series")
                        .param("cluster_id", "c1")
                        .param("series_key", "cpu{}")
                        .param("step", "1m"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stepMillis").value(60000))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.points[0].value").value(0.2));
    }

    @Test
    void limitCapsRawSamples() throws Exception {
        mvc.perform(get("/api/query/series")
                        .param("cluster_id", "c1")
                        .param("series_key", "cpu{}")
                        .param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.truncated").value(true));
    }

    @Test
    void missingParameterIsBadRequest() throws Exception {
        mvc.perform(get("/api/query/series").param("series_key", "cpu{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("cluster_id is required"));
    }

    @Test
    void invalidRangeIsBadRequest() throws Exception {
        mvc.perform(get("/api/query/series")
                        .param("cluster_id", "c1")
                        .param("series_key", "cpu{}")
                        .param("from", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid from: yesterday"));
    }

    @Test
    void listsSeriesKeysAndLogs() throws Exception {
        mvc.perform(get("/api/query/series/keys").param("cluster_id", "c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.seriesKeys[0]").value("cpu{}"));

        mvc.perform(get("/api/query/logs").param("cluster_id", "c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.logs[0].body").value("boot"));
    }

    private record FixedStore(List<MetricSample> samples, List<LogRecord> logs) implements RecordStore {

        @Override
        public WriteResult writeBatch(List<? extends TelemetryRecord> records) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<MetricSample> queryHistory(String seriesKey, String clusterId, Duration window, Instant until) {
            return List.of();
        }

        @Override
        public List<MetricSample> querySeries(
                String clusterId, String seriesKey, Instant from, Instant to, int limit) {
            return samples.stream()
                    .filter(s -> s.seriesKey().equals(seriesKey))
                    .filter(s -> s.timestamp() >= from.toEpochMilli() && s.timestamp() <= to.toEpochMilli())
                    .limit(limit)
                    .toList();
        }

        @Override
        public List<String> listSeries(String clusterId, int limit) {
            return samples.stream().map(MetricSample::seriesKey).distinct().limit(limit).toList();
        }

        @Override
        public List<LogRecord> queryLogs(String clusterId, Instant from, Instant to, int limit) {
            return logs.stream().limit(limit).toList();
        }
    }
}
