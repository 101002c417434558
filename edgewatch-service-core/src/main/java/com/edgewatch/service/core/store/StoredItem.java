package com.edgewatch.service.core.store;

import com.edgewatch.telemetry.model.TelemetryRecord;

/**
 * A record ready to be written.
 *
 * @param sizeBytes estimated size of the persisted item: key plus JSON rendering of the record
 */
public record StoredItem(RecordTable table, StorageKey key, TelemetryRecord record, int sizeBytes) {}
