package com.edgewatch.service.core.alert;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.telemetry.model.AlertChannelConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Caches channel lookups for a short time, including clusters without a target. Lookup failures are not
 * cached and propagate to the caller.
 */
@Component
public class AlertChannelResolver {

    private final AlertChannelDirectory directory;
    private final Cache<String, Optional<AlertChannelConfig>> cache;

    public AlertChannelResolver(AlertChannelDirectory directory, EdgeWatchProperties properties) {
        this.directory = directory;
        this.cache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(properties.getAlerts().getChannelCacheTtl())
                .build();
    }

    public Optional<AlertChannelConfig> resolve(String clusterId) {
        return cache.get(clusterId, directory::findByClusterId);
    }
}
