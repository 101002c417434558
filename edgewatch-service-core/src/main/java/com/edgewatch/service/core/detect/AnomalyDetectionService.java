package com.edgewatch.service.core.detect;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.service.core.store.RecordStore;
import com.edgewatch.service.core.telemetry.IngestTelemetry;
import com.edgewatch.telemetry.model.AnomalyEvent;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.SeriesRef;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Evaluates freshly written samples against the stored history of their series.
 *
 * <p>Series are evaluated in parallel on a bounded pool; samples of one series are evaluated in order on a single
 * worker. Results are joined in input order so the same batch always yields the same anomaly list.
 */
@Service
@Slf4j
public class AnomalyDetectionService {

    private final RecordStore store;
    private final MadAnomalyDetector detector;
    private final IngestTelemetry telemetry;
    private final EdgeWatchProperties.Detection config;

    private ExecutorService workers;

    public AnomalyDetectionService(
            RecordStore store, MadAnomalyDetector detector, IngestTelemetry telemetry, EdgeWatchProperties properties) {
        this.store = store;
        this.detector = detector;
        this.telemetry = telemetry;
        this.config = properties.getDetection();
    }

    @PostConstruct
    public void start() {
        workers = Executors.newFixedThreadPool(config.getWorkers());
        log.info(
                "Anomaly detection started workers={}, window={}, threshold={}, minSamples={}",
                config.getWorkers(),
                config.getWindow(),
                config.getThreshold(),
                config.getMinSamples());
    }

    @PreDestroy
    public void stop() {
        if (workers != null) {
            workers.shutdown();
        }
    }

    public DetectionReport detect(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return DetectionReport.empty();
        }
        Map<SeriesRef, List<MetricSample>> bySeries = new LinkedHashMap<>();
        for (MetricSample sample : samples) {
            bySeries.computeIfAbsent(SeriesRef.of(sample), k -> new ArrayList<>()).add(sample);
        }

        DetectionSession session = new DetectionSession(store, config.getWindow());
        List<CompletableFuture<SeriesResult>> pending = new ArrayList<>(bySeries.size());
        for (Map.Entry<SeriesRef, List<MetricSample>> entry : bySeries.entrySet()) {
            pending.add(submit(session, entry.getKey(), entry.getValue()));
        }

        List<AnomalyEvent> anomalies = new ArrayList<>();
        List<SeriesRef> failedSeries = new ArrayList<>();
        int evaluated = 0;
        int insufficient = 0;
        int skipped = 0;
        for (CompletableFuture<SeriesResult> future : pending) {
            SeriesResult result = future.join();
            if (result.failed()) {
                failedSeries.add(result.series());
                continue;
            }
            for (Classification c : result.classifications()) {
                switch (c.verdict()) {
                    case INSUFFICIENT_DATA -> insufficient++;
                    case SKIPPED -> skipped++;
                    case NORMAL -> evaluated++;
                    case ANOMALOUS -> {
                        evaluated++;
                        anomalies.add(c.event());
                    }
                }
            }
        }
        telemetry.recordDetection(evaluated, anomalies.size());
        log.debug(
                "Detection samples={} series={} evaluated={} anomalies={} insufficient={} skipped={} failed={}",
                samples.size(),
                bySeries.size(),
                evaluated,
                anomalies.size(),
                insufficient,
                skipped,
                failedSeries.size());
        return new DetectionReport(anomalies, evaluated, insufficient, skipped, failedSeries);
    }

    private CompletableFuture<SeriesResult> submit(
            DetectionSession session, SeriesRef series, List<MetricSample> samples) {
        try {
            return CompletableFuture.supplyAsync(() -> evaluateSeries(session, series, samples), workers);
        } catch (RejectedExecutionException ex) {
            log.error("Detection pool rejected series {}", series, ex);
            return CompletableFuture.completedFuture(SeriesResult.failed(series));
        }
    }

    SeriesResult evaluateSeries(DetectionSession session, SeriesRef series, List<MetricSample> samples) {
        long earliest = Long.MAX_VALUE;
        long latest = Long.MIN_VALUE;
        for (MetricSample s : samples) {
            earliest = Math.min(earliest, s.timestamp());
            latest = Math.max(latest, s.timestamp());
        }
        List<MetricSample> loaded;
        try {
            loaded = session.load(series, earliest, latest);
        } catch (RuntimeException ex) {
            log.warn("History lookup failed for series {}; skipping {} sample(s)", series, samples.size(), ex);
            return SeriesResult.failed(series);
        }
        List<Classification> out = new ArrayList<>(samples.size());
        for (MetricSample sample : samples) {
            out.add(detector.classify(sample, session.historyBefore(sample, loaded)));
        }
        return new SeriesResult(series, out, false);
    }

    record SeriesResult(SeriesRef series, List<Classification> classifications, boolean failed) {
        static SeriesResult failed(SeriesRef series) {
            return new SeriesResult(series, List.of(), true);
        }
    }
}
