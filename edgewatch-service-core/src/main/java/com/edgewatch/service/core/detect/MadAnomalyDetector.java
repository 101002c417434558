package com.edgewatch.service.core.detect;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.telemetry.model.AnomalyEvent;
import com.edgewatch.telemetry.model.MetricKind;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.Severity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Robust outlier detector based on the median and the median absolute deviation (MAD) of a series' history.
 *
 * <p>A sample is anomalous when {@code |x - median| > threshold * 1.4826 * MAD}.
 *
 * <h3>Counters</h3>
 * <p>Counter history is first-differenced into per-second rates. Negative differences (resets, out-of-order
 * points) are discarded rather than treated as observations, and the observed value of a counter sample is
 * its rate against the latest preceding history point. Counters whose rates are all equal are not evaluated.
 *
 * <h3>Flat gauges</h3>
 * <p>When every history value is the same a gauge is anomalous only if it moved by more than {@code epsilon};
 * such anomalies get an infinite score. A zero MAD over a window that still has spread falls back to the
 * standard deviation (see {@link Baseline}).
 *
 * <p>Stateless: the result depends only on the arguments.
 */
@Component
@Slf4j
public class MadAnomalyDetector {

    private final int minSamples;
    private final double threshold;
    private final double epsilon;
    private final double minDeviation;

    @Autowired
    public MadAnomalyDetector(EdgeWatchProperties properties) {
        this(
                properties.getDetection().getMinSamples(),
                properties.getDetection().getThreshold(),
                properties.getDetection().getEpsilon(),
                properties.getDetection().getMinDeviation());
    }

    public MadAnomalyDetector(int minSamples, double threshold, double epsilon, double minDeviation) {
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.minSamples = minSamples;
        this.threshold = threshold;
        this.epsilon = epsilon;
        this.minDeviation = minDeviation;
    }

    public Optional<AnomalyEvent> evaluate(MetricSample sample, List<MetricSample> history) {
        return classify(sample, history).anomaly();
    }

    public Classification classify(MetricSample sample, List<MetricSample> history) {
        List<MetricSample> prior = new ArrayList<>(history.size());
        for (MetricSample h : history) {
            if (h.timestamp() < sample.timestamp()) {
                prior.add(h);
            }
        }
        prior.sort(Comparator.comparingLong(MetricSample::timestamp));

        return sample.kind() == MetricKind.COUNTER ? classifyCounter(sample, prior) : classifyGauge(sample, prior);
    }

    private Classification classifyGauge(MetricSample sample, List<MetricSample> prior) {
        if (prior.size() < minSamples) {
            return Classification.insufficient();
        }
        double[] values = new double[prior.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = prior.get(i).value();
        }
        Baseline baseline = Baseline.of(values);
        double observed = sample.value();
        double deviation = Math.abs(observed - baseline.median());

        if (baseline.flat()) {
            if (deviation > epsilon) {
                return Classification.anomalous(
                        baseline, observed, event(sample, observed, baseline, Double.POSITIVE_INFINITY));
            }
            return Classification.normal(baseline, observed);
        }
        return judge(sample, baseline, observed, deviation);
    }

    private Classification classifyCounter(MetricSample sample, List<MetricSample> prior) {
        double[] rates = counterRates(prior);
        if (rates.length < minSamples) {
            return Classification.insufficient();
        }
        Baseline baseline = Baseline.of(rates);
        MetricSample last = prior.get(prior.size() - 1);
        double delta = sample.value() - last.value();
        double observed = delta * 1000.0 / (sample.timestamp() - last.timestamp());
        if (delta < 0) {
            return Classification.skipped(SkipReason.COUNTER_RESET, baseline, observed);
        }
        if (baseline.flat()) {
            return Classification.skipped(SkipReason.ZERO_VARIANCE, baseline, observed);
        }
        return judge(sample, baseline, observed, Math.abs(observed - baseline.median()));
    }

    private Classification judge(MetricSample sample, Baseline baseline, double observed, double deviation) {
        double scale = Math.max(baseline.scaledDeviation(), minDeviation);
        double score = deviation / scale;
        if (score > threshold) {
            log.debug(
                    "Anomaly on {}/{}: observed={} median={} scaledMad={} score={}",
                    sample.clusterId(),
                    sample.seriesKey(),
                    observed,
                    baseline.median(),
                    baseline.scaledDeviation(),
                    score);
            return Classification.anomalous(baseline, observed, event(sample, observed, baseline, score));
        }
        return Classification.normal(baseline, observed);
    }

    private AnomalyEvent event(MetricSample sample, double observed, Baseline baseline, double score) {
        Severity severity = Double.isInfinite(score) || score >= 2 * threshold ? Severity.CRITICAL : Severity.WARNING;
        return new AnomalyEvent(
                sample.clusterId(),
                sample.seriesKey(),
                sample.metricName(),
                sample.kind(),
                sample.timestamp(),
                observed,
                baseline.median(),
                baseline.scaledDeviation(),
                score,
                severity);
    }

    /**
     * Per-second rates between consecutive points of an ascending counter history. Pairs whose value decreased or
     * whose timestamps do not increase are skipped.
     */
    static double[] counterRates(List<MetricSample> ascending) {
        List<Double> rates = new ArrayList<>(Math.max(0, ascending.size() - 1));
        for (int i = 1; i < ascending.size(); i++) {
            MetricSample prev = ascending.get(i - 1);
            MetricSample cur = ascending.get(i);
            long dt = cur.timestamp() - prev.timestamp();
            double delta = cur.value() - prev.value();
            if (dt <= 0 || delta < 0) {
                continue;
            }
            rates.add(delta * 1000.0 / dt);
        }
        double[] out = new double[rates.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = rates.get(i);
        }
        return out;
    }
}
