package com.edgewatch.service.core.alert;

/**
 * Sends one alert message to one target. Implementations report failures through {@link DeliveryResult} and
 * do not retry; retries belong to {@link AlertDispatcher}.
 */
public interface NotificationChannel {

    DeliveryResult send(String target, String message);

    /** Short name used in logs. */
    String name();
}
