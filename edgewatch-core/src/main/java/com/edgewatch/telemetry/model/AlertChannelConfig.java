package com.edgewatch.telemetry.model;

/** Notification target for one cluster, e.g. a chat id. */
public record AlertChannelConfig(String clusterId, String channelTarget) {}
