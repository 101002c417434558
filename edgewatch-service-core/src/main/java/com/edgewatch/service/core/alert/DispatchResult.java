package com.edgewatch.service.core.alert;

import java.util.List;

/**
 * Summary of one dispatch call.
 *
 * @param notificationsSent cluster messages delivered
 * @param delivered anomaly events contained in delivered messages
 * @param suppressed events dropped because their series was still in cooldown
 * @param unconfigured events for clusters without a notification target
 */
public record DispatchResult(
        int notificationsSent, int delivered, int suppressed, int unconfigured, List<FailedDispatch> failed) {

    public DispatchResult {
        failed = List.copyOf(failed);
    }

    public static DispatchResult empty() {
        return new DispatchResult(0, 0, 0, 0, List.of());
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
