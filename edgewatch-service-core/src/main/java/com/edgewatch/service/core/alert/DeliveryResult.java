package com.edgewatch.service.core.alert;

/** Outcome of a single delivery attempt on a {@link NotificationChannel}. */
public record DeliveryResult(boolean delivered, DispatchErrorKind errorKind, String detail) {

    public static DeliveryResult ok() {
        return new DeliveryResult(true, null, null);
    }

    public static DeliveryResult failed(DispatchErrorKind kind, String detail) {
        return new DeliveryResult(false, kind, detail);
    }
}
