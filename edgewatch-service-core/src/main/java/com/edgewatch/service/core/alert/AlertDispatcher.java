package com.edgewatch.service.core.alert;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.service.core.support.AttemptResult;
import com.edgewatch.service.core.support.BoundedRetry;
import com.edgewatch.service.core.support.RetryOutcome;
import com.edgewatch.service.core.telemetry.IngestTelemetry;
import com.edgewatch.telemetry.model.AlertChannelConfig;
import com.edgewatch.telemetry.model.AnomalyEvent;
import com.edgewatch.telemetry.model.SeriesRef;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns anomaly events into at most one notification per cluster.
 *
 * <p>Events of series still in cooldown are suppressed. Series claimed for a message that then fails to deliver
 * are released again. Delivery failures are reported in the result, never thrown.
 */
@Service
@Slf4j
public class AlertDispatcher {

    private final AlertChannelResolver channels;
    private final CooldownTracker cooldowns;
    private final NotificationChannel channel;
    private final AlertMessageFormatter formatter;
    private final IngestTelemetry telemetry;
    private final Clock clock;
    private final BoundedRetry retry;

    @Autowired
    public AlertDispatcher(
            AlertChannelResolver channels,
            CooldownTracker cooldowns,
            NotificationChannel channel,
            AlertMessageFormatter formatter,
            IngestTelemetry telemetry,
            Clock clock,
            EdgeWatchProperties properties) {
        this(
                channels,
                cooldowns,
                channel,
                formatter,
                telemetry,
                clock,
                new BoundedRetry(
                        properties.getAlerts().getMaxAttempts(),
                        properties.getAlerts().getInitialBackoff(),
                        properties.getAlerts().getMaxBackoff()));
    }

    AlertDispatcher(
            AlertChannelResolver channels,
            CooldownTracker cooldowns,
            NotificationChannel channel,
            AlertMessageFormatter formatter,
            IngestTelemetry telemetry,
            Clock clock,
            BoundedRetry retry) {
        this.channels = channels;
        this.cooldowns = cooldowns;
        this.channel = channel;
        this.formatter = formatter;
        this.telemetry = telemetry;
        this.clock = clock;
        this.retry = retry;
    }

    public DispatchResult dispatch(List<AnomalyEvent> events) {
        if (events == null || events.isEmpty()) {
            return DispatchResult.empty();
        }
        Map<String, List<AnomalyEvent>> byCluster = new LinkedHashMap<>();
        for (AnomalyEvent event : events) {
            byCluster.computeIfAbsent(event.clusterId(), k -> new ArrayList<>()).add(event);
        }

        int sent = 0;
        int delivered = 0;
        int suppressed = 0;
        int unconfigured = 0;
        List<FailedDispatch> failed = new ArrayList<>();

        for (Map.Entry<String, List<AnomalyEvent>> entry : byCluster.entrySet()) {
            String clusterId = entry.getKey();
            List<AnomalyEvent> clusterEvents = entry.getValue();

            Optional<AlertChannelConfig> config;
            try {
                config = channels.resolve(clusterId);
            } catch (RuntimeException ex) {
                log.error("Alert channel lookup failed for cluster {}", clusterId, ex);
                failed.add(new FailedDispatch(
                        clusterId, DispatchErrorKind.CHANNEL_UNAVAILABLE, clusterEvents.size(), ex.getMessage()));
                continue;
            }
            if (config.isEmpty()) {
                log.warn(
                        "No alert channel configured for cluster {}; {} anomaly(ies) logged only",
                        clusterId,
                        clusterEvents.size());
                for (AnomalyEvent e : clusterEvents) {
                    log.warn("ALERT {} {} value={} score={}", clusterId, e.seriesKey(), e.observedValue(), e.score());
                }
                unconfigured += clusterEvents.size();
                continue;
            }

            Instant now = clock.instant();
            List<AnomalyEvent> claimed = new ArrayList<>();
            for (AnomalyEvent e : clusterEvents) {
                if (cooldowns.tryAcquire(SeriesRef.of(e), now)) {
                    claimed.add(e);
                } else {
                    suppressed++;
                }
            }
            if (claimed.isEmpty()) {
                log.debug("All {} anomaly(ies) for cluster {} are in cooldown", clusterEvents.size(), clusterId);
                continue;
            }

            String target = config.get().channelTarget();
            String message = formatter.format(clusterId, claimed);
            RetryOutcome<DeliveryResult> outcome = deliver(clusterId, target, message);
            if (outcome.succeeded()) {
                sent++;
                delivered += claimed.size();
                log.info(
                        "Alert for cluster {} sent via {} ({} anomaly(ies))",
                        clusterId,
                        channel.name(),
                        claimed.size());
            } else {
                for (AnomalyEvent e : claimed) {
                    cooldowns.release(SeriesRef.of(e), now);
                }
                DeliveryResult last = outcome.value();
                log.error(
                        "Alert for cluster {} not delivered after {} attempt(s): {} {}",
                        clusterId,
                        outcome.attempts(),
                        last.errorKind(),
                        last.detail());
                failed.add(new FailedDispatch(clusterId, last.errorKind(), claimed.size(), last.detail()));
            }
        }

        telemetry.recordDispatch(sent, suppressed, failed.size());
        return new DispatchResult(sent, delivered, suppressed, unconfigured, failed);
    }

    private RetryOutcome<DeliveryResult> deliver(String clusterId, String target, String message) {
        return retry.run("Alert delivery for cluster " + clusterId, attempt -> {
            DeliveryResult result = safeSend(target, message);
            if (result.delivered()) {
                return AttemptResult.success(result);
            }
            return result.errorKind().retryable()
                    ? AttemptResult.retryable(result, result.errorKind() + ": " + result.detail())
                    : AttemptResult.permanent(result, result.detail());
        });
    }

    private DeliveryResult safeSend(String target, String message) {
        try {
            return channel.send(target, message);
        } catch (RuntimeException ex) {
            log.warn("Notification channel {} threw", channel.name(), ex);
            return DeliveryResult.failed(DispatchErrorKind.CHANNEL_UNAVAILABLE, ex.getMessage());
        }
    }
}
