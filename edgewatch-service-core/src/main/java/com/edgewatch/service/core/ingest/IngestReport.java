package com.edgewatch.service.core.ingest;

import com.edgewatch.service.core.alert.DispatchResult;
import com.edgewatch.service.core.store.StorageErrorKind;
import java.util.Map;

/**
 * What happened to one envelope.
 *
 * @param lastStage last stage that completed
 * @param dispatch {@code null} when dispatch did not run
 */
public record IngestReport(
        IngestOutcome outcome,
        IngestStage lastStage,
        String clusterId,
        int metrics,
        int logs,
        int spans,
        int droppedMetricPoints,
        int written,
        int duplicates,
        int failed,
        Map<StorageErrorKind, Integer> storageFailures,
        int anomalies,
        DispatchResult dispatch) {

    public IngestReport {
        storageFailures = Map.copyOf(storageFailures);
    }
}
