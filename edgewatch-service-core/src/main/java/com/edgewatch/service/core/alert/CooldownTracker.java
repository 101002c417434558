package com.edgewatch.service.core.alert;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.telemetry.model.SeriesRef;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per-series alert cooldown. A series may notify at most once per cooldown period; the check and the update
 * happen in one atomic step per key.
 *
 * <p>The cache only bounds memory. Whether a slot is still held is decided from the stored fire time and the
 * caller's clock.
 */
@Component
@Slf4j
public class CooldownTracker {

    private final Duration cooldown;
    private final ConcurrentMap<SeriesRef, Instant> lastFired;

    @Autowired
    public CooldownTracker(EdgeWatchProperties properties) {
        this(properties.getAlerts().getCooldown(), properties.getAlerts().getCooldownCacheSize());
    }

    public CooldownTracker(Duration cooldown, long maximumSize) {
        this.cooldown = cooldown;
        Cache<SeriesRef, Instant> cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(cooldown)
                .build();
        this.lastFired = cache.asMap();
        log.info("Initialized alert cooldown tracker cooldown={} maxSize={}", cooldown, maximumSize);
    }

    /** Claims the series for {@code now} unless it fired within the cooldown. */
    public boolean tryAcquire(SeriesRef series, Instant now) {
        boolean[] acquired = {false};
        lastFired.compute(series, (key, previous) -> {
            if (previous != null && now.isBefore(previous.plus(cooldown))) {
                return previous;
            }
            acquired[0] = true;
            return now;
        });
        return acquired[0];
    }

    /** Gives back a slot claimed at {@code firedAt}; a newer claim is left untouched. */
    public void release(SeriesRef series, Instant firedAt) {
        lastFired.remove(series, firedAt);
    }

    public Duration cooldown() {
        return cooldown;
    }
}
