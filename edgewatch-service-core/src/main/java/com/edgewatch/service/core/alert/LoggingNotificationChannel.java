package com.edgewatch.service.core.alert;

import lombok.extern.slf4j.Slf4j;

/** Fallback used when no bot token is configured: alerts are written to the log. */
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public DeliveryResult send(String target, String message) {
        log.warn("ALERT for {}:\n{}", target, message);
        return DeliveryResult.ok();
    }

    @Override
    public String name() {
        return "log";
    }
}
