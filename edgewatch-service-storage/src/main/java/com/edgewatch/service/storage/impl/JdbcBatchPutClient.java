package com.edgewatch.service.storage.impl;

import com.edgewatch.service.core.store.BatchPutClient;
import com.edgewatch.service.core.store.PutOutcome;
import com.edgewatch.service.core.store.RecordTable;
import com.edgewatch.service.core.store.StorageErrorKind;
import com.edgewatch.service.core.store.StoredItem;
import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.TraceSpan;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.BatchUpdateException;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * PostgreSQL implementation of the batched put: one JDBC batch of upserts per chunk. Rows that the batch reports
 * as failed, or that it never reached, come back as unprocessed.
 */
@Service
@Slf4j
public class JdbcBatchPutClient implements BatchPutClient {

    /** Deadlock, serialization failure, lock not available, too many connections. */
    private static final Set<String> THROTTLE_STATES = Set.of("40P01", "40001", "55P03", "53300");

    /** String too long, program limit exceeded. */
    private static final Set<String> TOO_LARGE_STATES = Set.of("22001", "54000");

    private static final String METRIC_UPSERT =
            """
            insert into metric_samples(cluster_id, sort_key, series_key, metric_name, labels, ts, kind, value)
            values (?, ?, ?, ?, cast(? as jsonb), ?, ?, ?)
            on conflict (cluster_id, sort_key) do update
               set series_key = excluded.series_key,
                   metric_name = excluded.metric_name,
                   labels = excluded.labels,
                   ts = excluded.ts,
                   kind = excluded.kind,
                   value = excluded.value
            """;

    private static final String LOG_UPSERT =
            """
            insert into log_records(cluster_id, sort_key, ts, body, attributes)
            values (?, ?, ?, ?, cast(? as jsonb))
            on conflict (cluster_id, sort_key) do update
               set ts = excluded.ts,
                   body = excluded.body,
                   attributes = excluded.attributes
            """;

    private static final String SPAN_UPSERT =
            """
            insert into trace_spans(cluster_id, sort_key, trace_id, span_id, parent_span_id, name,
                                    start_time, end_time, attributes)
            values (?, ?, ?, ?, ?, ?, ?, ?, cast(? as jsonb))
            on conflict (cluster_id, sort_key) do update
               set trace_id = excluded.trace_id,
                   span_id = excluded.span_id,
                   parent_span_id = excluded.parent_span_id,
                   name = excluded.name,
                   start_time = excluded.start_time,
                   end_time = excluded.end_time,
                   attributes = excluded.attributes
            """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public JdbcBatchPutClient(JdbcTemplate jdbcTemplate, ObjectMapper mapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public PutOutcome putChunk(RecordTable table, List<StoredItem> items) {
        if (items.isEmpty()) {
            return PutOutcome.complete();
        }
        try {
            jdbcTemplate.batchUpdate(sqlFor(table), new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    bind(table, ps, items.get(i));
                }

                @Override
                public int getBatchSize() {
                    return items.size();
                }
            });
            return PutOutcome.complete();
        } catch (DataAccessException ex) {
            StorageErrorKind kind = classify(ex);
            List<StoredItem> unprocessed = unprocessed(items, ex);
            log.warn(
                    "Batch upsert into {} failed for {}/{} items: {} ({})",
                    table.tableName(),
                    unprocessed.size(),
                    items.size(),
                    kind,
                    ex.getMostSpecificCause().getMessage());
            return PutOutcome.partial(unprocessed, kind, ex.getMostSpecificCause().getMessage());
        }
    }

    private static String sqlFor(RecordTable table) {
        return switch (table) {
            case METRIC_SAMPLES -> METRIC_UPSERT;
            case LOG_RECORDS -> LOG_UPSERT;
            case TRACE_SPANS -> SPAN_UPSERT;
        };
    }

    private void bind(RecordTable table, PreparedStatement ps, StoredItem item) throws SQLException {
        ps.setString(1, item.key().partition());
        ps.setString(2, item.key().sort());
        switch (table) {
            case METRIC_SAMPLES -> {
                MetricSample s = (MetricSample) item.record();
                ps.setString(3, s.seriesKey());
                ps.setString(4, s.metricName());
                ps.setString(5, json.write(s.labels()));
                ps.setTimestamp(6, Timestamp.from(Instant.ofEpochMilli(s.timestamp())));
                ps.setString(7, s.kind().name());
                ps.setDouble(8, s.value());
            }
            case LOG_RECORDS -> {
                LogRecord r = (LogRecord) item.record();
                ps.setTimestamp(3, Timestamp.from(Instant.ofEpochMilli(r.timestamp())));
                ps.setString(4, r.body());
                ps.setString(5, json.write(r.attributes()));
            }
            case TRACE_SPANS -> {
                TraceSpan t = (TraceSpan) item.record();
                ps.setString(3, t.traceId());
                ps.setString(4, t.spanId());
                ps.setString(5, t.parentSpanId());
                ps.setString(6, t.name());
                ps.setTimestamp(7, Timestamp.from(Instant.ofEpochMilli(t.startTime())));
                ps.setTimestamp(8, Timestamp.from(Instant.ofEpochMilli(t.endTime())));
                ps.setString(9, json.write(t.attributes()));
            }
        }
    }

    /**
     * Items whose statement did not succeed. Without per-statement counts the whole chunk is returned; upserts
     * make rewriting already stored rows harmless.
     */
    static List<StoredItem> unprocessed(List<StoredItem> items, Throwable ex) {
        BatchUpdateException bue = find(ex, BatchUpdateException.class);
        if (bue == null || bue.getUpdateCounts() == null) {
            return items;
        }
        int[] counts = bue.getUpdateCounts();
        List<StoredItem> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (i >= counts.length || counts[i] == Statement.EXECUTE_FAILED) {
                out.add(items.get(i));
            }
        }
        return out.isEmpty() ? items : out;
    }

    static StorageErrorKind classify(DataAccessException ex) {
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
                if (THROTTLE_STATES.contains(sqlEx.getSQLState())) {
                    return StorageErrorKind.THROTTLED;
                }
                if (TOO_LARGE_STATES.contains(sqlEx.getSQLState())) {
                    return StorageErrorKind.ITEM_TOO_LARGE;
                }
            }
            cause = cause.getCause();
        }
        if (ex instanceof PessimisticLockingFailureException || ex instanceof QueryTimeoutException) {
            return StorageErrorKind.THROTTLED;
        }
        return StorageErrorKind.UNAVAILABLE;
    }

    private static <T extends Throwable> T find(Throwable ex, Class<T> type) {
        Throwable cause = ex;
        while (cause != null) {
            if (type.isInstance(cause)) {
                return type.cast(cause);
            }
            cause = cause.getCause();
        }
        return null;
    }
}
