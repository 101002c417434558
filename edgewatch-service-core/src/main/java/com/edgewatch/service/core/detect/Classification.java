package com.edgewatch.service.core.detect;

import com.edgewatch.telemetry.model.AnomalyEvent;
import java.util.Optional;

/**
 * @param baseline {@code null} when the verdict is {@code INSUFFICIENT_DATA}
 * @param event present only for {@code ANOMALOUS}
 */
public record Classification(
        DetectionVerdict verdict, SkipReason skipReason, Baseline baseline, double observed, AnomalyEvent event) {

    static Classification insufficient() {
        return new Classification(DetectionVerdict.INSUFFICIENT_DATA, null, null, Double.NaN, null);
    }

    static Classification skipped(SkipReason reason, Baseline baseline, double observed) {
        return new Classification(DetectionVerdict.SKIPPED, reason, baseline, observed, null);
    }

    static Classification normal(Baseline baseline, double observed) {
        return new Classification(DetectionVerdict.NORMAL, null, baseline, observed, null);
    }

    static Classification anomalous(Baseline baseline, double observed, AnomalyEvent event) {
        return new Classification(DetectionVerdict.ANOMALOUS, null, baseline, observed, event);
    }

    public Optional<AnomalyEvent> anomaly() {
        return Optional.ofNullable(event);
    }
}
