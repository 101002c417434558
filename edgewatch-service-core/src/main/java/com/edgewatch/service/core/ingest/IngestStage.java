package com.edgewatch.service.core.ingest;

/** Ordered stages of one ingest request. */
public enum IngestStage {
    RECEIVED,
    AUTHENTICATED,
    DECODED,
    STORED,
    DETECTED,
    DISPATCHED,
    RESPONDED
}
