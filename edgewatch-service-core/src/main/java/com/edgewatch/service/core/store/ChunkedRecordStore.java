package com.edgewatch.service.core.store;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.service.core.support.AttemptResult;
import com.edgewatch.service.core.support.BoundedRetry;
import com.edgewatch.service.core.support.RetryOutcome;
import com.edgewatch.service.core.telemetry.IngestTelemetry;
import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.TelemetryRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Record store that splits writes into chunks no larger than the store's per-request item limit and writes
 * them concurrently on a bounded pool. Unprocessed items of a chunk are retried a bounded number of times.
 *
 * <p>Chunk writes are never cancelled: a write that has started runs to completion even if the caller has
 * given up waiting, so the store is never left with a half-applied retry.
 */
@Service
@Slf4j
public class ChunkedRecordStore implements RecordStore {

    /** Upper bound on samples loaded for one detection window. */
    static final int HISTORY_LIMIT = 10_000;

    private final BatchPutClient putClient;
    private final TelemetryQueryRepository queryRepository;
    private final RecordFingerprinter fingerprinter;
    private final ObjectMapper mapper;
    private final IngestTelemetry telemetry;
    private final EdgeWatchProperties.Store config;
    private final BoundedRetry retry;

    private ExecutorService writers;

    @Autowired
    public ChunkedRecordStore(
            BatchPutClient putClient,
            TelemetryQueryRepository queryRepository,
            RecordFingerprinter fingerprinter,
            ObjectMapper mapper,
            IngestTelemetry telemetry,
            EdgeWatchProperties properties) {
        this(
                putClient,
                queryRepository,
                fingerprinter,
                mapper,
                telemetry,
                properties,
                new BoundedRetry(
                        properties.getStore().getMaxAttempts(),
                        properties.getStore().getInitialBackoff(),
                        properties.getStore().getMaxBackoff()));
    }

    ChunkedRecordStore(
            BatchPutClient putClient,
            TelemetryQueryRepository queryRepository,
            RecordFingerprinter fingerprinter,
            ObjectMapper mapper,
            IngestTelemetry telemetry,
            EdgeWatchProperties properties,
            BoundedRetry retry) {
        this.putClient = putClient;
        this.queryRepository = queryRepository;
        this.fingerprinter = fingerprinter;
        this.mapper = mapper;
        this.telemetry = telemetry;
        this.config = properties.getStore();
        this.retry = retry;
    }

    @PostConstruct
    public void start() {
        writers = Executors.newFixedThreadPool(config.getWriters());
        log.info(
                "Record store started writers={}, maxBatchItems={}, maxItemBytes={}",
                config.getWriters(),
                config.getMaxBatchItems(),
                config.getMaxItemBytes());
    }

    @PreDestroy
    public void stop() {
        if (writers != null) {
            writers.shutdown();
        }
    }

    @Override
    public WriteResult writeBatch(List<? extends TelemetryRecord> records) {
        if (records == null || records.isEmpty()) {
            return WriteResult.empty();
        }
        List<FailedRecord> failed = new ArrayList<>();
        Map<StorageKey, StoredItem> unique = new LinkedHashMap<>();
        int duplicates = 0;
        for (TelemetryRecord record : records) {
            StoredItem item;
            try {
                item = toItem(record);
            } catch (IllegalArgumentException ex) {
                failed.add(new FailedRecord(record, StorageErrorKind.ITEM_TOO_LARGE, ex.getMessage()));
                continue;
            }
            if (item.sizeBytes() > config.getMaxItemBytes()) {
                failed.add(new FailedRecord(
                        record,
                        StorageErrorKind.ITEM_TOO_LARGE,
                        "item is " + item.sizeBytes() + " bytes, limit " + config.getMaxItemBytes()));
                continue;
            }
            if (unique.putIfAbsent(item.key(), item) != null) {
                duplicates++;
            }
        }

        Map<RecordTable, List<StoredItem>> byTable = new EnumMap<>(RecordTable.class);
        for (StoredItem item : unique.values()) {
            byTable.computeIfAbsent(item.table(), t -> new ArrayList<>()).add(item);
        }

        List<CompletableFuture<ChunkResult>> pending = new ArrayList<>();
        for (Map.Entry<RecordTable, List<StoredItem>> entry : byTable.entrySet()) {
            for (List<StoredItem> chunk : partition(entry.getValue(), config.getMaxBatchItems())) {
                pending.add(submit(entry.getKey(), chunk));
            }
        }

        int written = 0;
        for (CompletableFuture<ChunkResult> future : pending) {
            ChunkResult result = future.join();
            written += result.written();
            failed.addAll(result.failed());
        }
        log.debug(
                "Wrote batch records={} chunks={} written={} duplicates={} failed={}",
                records.size(),
                pending.size(),
                written,
                duplicates,
                failed.size());
        telemetry.recordStored(written, failed.size(), duplicates);
        return new WriteResult(written, duplicates, failed);
    }

    @Override
    public List<MetricSample> queryHistory(String seriesKey, String clusterId, Duration window, Instant until) {
        return queryRepository.findSamples(clusterId, seriesKey, until.minus(window), until, HISTORY_LIMIT);
    }

    @Override
    public List<MetricSample> querySeries(String clusterId, String seriesKey, Instant from, Instant to, int limit) {
        return queryRepository.findSamples(clusterId, seriesKey, from, to, limit);
    }

    @Override
    public List<String> listSeries(String clusterId, int limit) {
        return queryRepository.findSeriesKeys(clusterId, limit);
    }

    @Override
    public List<LogRecord> queryLogs(String clusterId, Instant from, Instant to, int limit) {
        return queryRepository.findLogs(clusterId, from, to, limit);
    }

    private CompletableFuture<ChunkResult> submit(RecordTable table, List<StoredItem> chunk) {
        try {
            return CompletableFuture.supplyAsync(() -> writeChunk(table, chunk), writers);
        } catch (RejectedExecutionException ex) {
            log.error("Chunk writer pool rejected {} items for {}", chunk.size(), table.tableName(), ex);
            return CompletableFuture.completedFuture(
                    ChunkResult.allFailed(chunk, StorageErrorKind.UNAVAILABLE, "writer pool unavailable"));
        }
    }

    ChunkResult writeChunk(RecordTable table, List<StoredItem> chunk) {
        AtomicReference<List<StoredItem>> remaining = new AtomicReference<>(chunk);
        RetryOutcome<PutOutcome> outcome = retry.run("Chunk write to " + table.tableName(), attempt -> {
            if (attempt > 1) {
                telemetry.recordChunkRetry(table.tableName());
            }
            PutOutcome put = safePut(table, remaining.get());
            if (put.isComplete()) {
                return AttemptResult.success(put);
            }
            remaining.set(put.unprocessed());
            return put.errorKind() != null && put.errorKind().retryable()
                    ? AttemptResult.retryable(put, put.errorKind() + ": " + put.detail())
                    : AttemptResult.permanent(put, String.valueOf(put.detail()));
        });
        if (outcome.succeeded()) {
            return new ChunkResult(chunk.size(), List.of());
        }
        PutOutcome last = outcome.value();
        log.error(
                "Chunk write to {} left {} of {} items unwritten after {} attempt(s): {} {}",
                table.tableName(),
                last.unprocessed().size(),
                chunk.size(),
                outcome.attempts(),
                last.errorKind(),
                last.detail());
        ChunkResult failed = ChunkResult.allFailed(last.unprocessed(), last.errorKind(), last.detail());
        return new ChunkResult(chunk.size() - last.unprocessed().size(), failed.failed());
    }

    private PutOutcome safePut(RecordTable table, List<StoredItem> items) {
        try {
            return putClient.putChunk(table, items);
        } catch (RuntimeException ex) {
            log.warn("Batched put to {} failed for {} items", table.tableName(), items.size(), ex);
            return PutOutcome.partial(items, StorageErrorKind.UNAVAILABLE, ex.getMessage());
        }
    }

    private StoredItem toItem(TelemetryRecord record) {
        StorageKey key = fingerprinter.keyFor(record);
        return new StoredItem(RecordTable.of(record.recordType()), key, record, key.byteLength() + payloadSize(record));
    }

    private int payloadSize(TelemetryRecord record) {
        try {
            return mapper.writeValueAsBytes(record).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to size record for storage", e);
        }
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("chunk size must be >= 1, got: " + size);
        }
        List<List<T>> chunks = new ArrayList<>((items.size() + size - 1) / size);
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return chunks;
    }

    record ChunkResult(int written, List<FailedRecord> failed) {
        static ChunkResult allFailed(List<StoredItem> items, StorageErrorKind kind, String detail) {
            List<FailedRecord> failed = new ArrayList<>(items.size());
            for (StoredItem item : items) {
                failed.add(new FailedRecord(item.record(), kind, detail));
            }
            return new ChunkResult(0, failed);
        }
    }
}
