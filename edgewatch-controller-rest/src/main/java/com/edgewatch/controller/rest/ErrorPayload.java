package com.edgewatch.controller.rest;

import java.time.Instant;
import org.springframework.http.HttpStatus;

/** Error body for rejected credentials and invalid query arguments. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {

    static ErrorPayload of(HttpStatus status, String message, String path) {
        return new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path);
    }
}
