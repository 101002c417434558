package com.edgewatch.controller.rest;

import com.edgewatch.service.core.telemetry.IngestTelemetryRegistry;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Exposes the in-process ingestion counters. */
@RestController
public class TelemetryController {

    private final IngestTelemetryRegistry registry;

    public TelemetryController(IngestTelemetryRegistry registry) {
        this.registry = registry;
    }

    @GetMapping(path = "/api/telemetry", produces = MediaType.APPLICATION_JSON_VALUE)
    public IngestTelemetryRegistry.Snapshot snapshot() {
        return registry.snapshot();
    }
}
