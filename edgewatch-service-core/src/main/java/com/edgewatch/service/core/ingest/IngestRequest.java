package com.edgewatch.service.core.ingest;

import java.time.Instant;

/**
 * An authenticated ingest call.
 *
 * @param clusterHint value of the {@code x-cluster-id} header, may be {@code null}
 * @param contentEncoding value of the {@code Content-Encoding} header, may be {@code null}
 * @param contentType value of the {@code Content-Type} header, may be {@code null}
 */
public record IngestRequest(
        String clusterHint, String contentEncoding, String contentType, byte[] body, Instant receivedAt) {

    /** A JSON envelope request. */
    public IngestRequest(String clusterHint, String contentEncoding, byte[] body, Instant receivedAt) {
        this(clusterHint, contentEncoding, null, body, receivedAt);
    }
}
