package com.edgewatch.service.core.ingest;

public enum IngestOutcome {
    SUCCESS,
    /** Some records could not be stored; the rest went through detection and dispatch. */
    PARTIAL,
    /** Every record failed to store; detection and dispatch did not run. */
    STORE_FAILED,
    /** The request deadline passed at a stage boundary; later stages did not run. */
    TIMED_OUT
}
