package com.edgewatch.service.core.alert;

/** A cluster notification that could not be delivered. */
public record FailedDispatch(String clusterId, DispatchErrorKind kind, int eventCount, String detail) {}
