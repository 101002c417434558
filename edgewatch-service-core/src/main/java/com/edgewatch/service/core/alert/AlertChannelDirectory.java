package com.edgewatch.service.core.alert;

import com.edgewatch.telemetry.model.AlertChannelConfig;
import java.util.Optional;

/** Lookup of the notification target configured for a cluster. */
public interface AlertChannelDirectory {

    Optional<AlertChannelConfig> findByClusterId(String clusterId);
}
