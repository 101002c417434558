package com.edgewatch.service.core.store;

import com.edgewatch.telemetry.model.TelemetryRecord;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of {@link RecordStore#writeBatch}.
 *
 * @param written distinct items persisted
 * @param duplicates input records that collapsed onto an item already in the same batch
 */
public record WriteResult(int written, int duplicates, List<FailedRecord> failed) {

    public WriteResult {
        failed = List.copyOf(failed);
    }

    public static WriteResult empty() {
        return new WriteResult(0, 0, List.of());
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }

    public Set<TelemetryRecord> failedRecords() {
        Set<TelemetryRecord> out = new HashSet<>();
        for (FailedRecord f : failed) {
            out.add(f.record());
        }
        return out;
    }

    public Map<StorageErrorKind, Integer> failuresByKind() {
        Map<StorageErrorKind, Integer> out = new EnumMap<>(StorageErrorKind.class);
        for (FailedRecord f : failed) {
            out.merge(f.kind(), 1, Integer::sum);
        }
        return out;
    }
}
