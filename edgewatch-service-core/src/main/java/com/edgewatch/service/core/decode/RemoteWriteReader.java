package com.edgewatch.service.core.decode;

import com.edgewatch.service.core.decode.EnvelopeDecodeException.Kind;
import com.edgewatch.service.core.decode.prompb.Label;
import com.edgewatch.service.core.decode.prompb.MetricMetadata;
import com.edgewatch.service.core.decode.prompb.MetricMetadata.MetricType;
import com.edgewatch.service.core.decode.prompb.Sample;
import com.edgewatch.service.core.decode.prompb.TimeSeries;
import com.edgewatch.service.core.decode.prompb.WriteRequest;
import com.edgewatch.telemetry.model.SeriesKeys;
import com.google.protobuf.InvalidProtocolBufferException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a Prometheus remote_write {@link WriteRequest} (already snappy-decoded) into a metrics section.
 *
 * <p>Series kinds come from the request metadata when the sender includes it. Otherwise {@code _total} series are
 * counters, {@code _bucket} series histogram buckets and everything else a gauge. The cluster is taken from the
 * first {@code cluster_id} label found.
 */
final class RemoteWriteReader {

    static final String CONTENT_TYPE = "application/x-protobuf";

    private static final String CLUSTER_LABEL = "cluster_id";
    private static final List<String> FAMILY_SUFFIXES = List.of("_total", "_bucket", "_sum", "_count", "_created");

    /** @param clusterLabel first {@code cluster_id} label value, {@code null} when no series carries one */
    record Result(String clusterLabel, MetricSection section) {}

    private RemoteWriteReader() {}

    static boolean accepts(String contentType) {
        if (contentType == null) {
            return false;
        }
        int params = contentType.indexOf(';');
        String mediaType = params < 0 ? contentType : contentType.substring(0, params);
        return CONTENT_TYPE.equals(mediaType.trim().toLowerCase(Locale.ROOT));
    }

    static Result read(byte[] body) {
        WriteRequest request;
        try {
            request = WriteRequest.parseFrom(body);
        } catch (InvalidProtocolBufferException ex) {
            throw new EnvelopeDecodeException(Kind.MALFORMED, "Body is not a remote_write request", ex);
        }

        Map<String, MetricType> types = new HashMap<>();
        for (MetricMetadata metadata : request.getMetadataList()) {
            types.put(metadata.getMetricFamilyName(), metadata.getType());
        }

        String clusterLabel = null;
        List<MetricSection.Series> series = new ArrayList<>(request.getTimeseriesCount());
        for (int i = 0; i < request.getTimeseriesCount(); i++) {
            String path = "timeseries[" + i + "]";
            TimeSeries ts = request.getTimeseries(i);
            Map<String, String> labels = new LinkedHashMap<>();
            for (Label label : ts.getLabelsList()) {
                if (labels.put(label.getName(), label.getValue()) != null) {
                    throw EnvelopeDecodeException.malformed(path + " repeats label " + label.getName());
                }
            }
            String name = labels.get(SeriesKeys.NAME_LABEL);
            if (name == null || name.isEmpty()) {
                throw EnvelopeDecodeException.malformed(path + " has no " + SeriesKeys.NAME_LABEL + " label");
            }
            EnvelopeDecoder.checkSeriesNames(name, labels, path);
            if (clusterLabel == null) {
                clusterLabel = labels.get(CLUSTER_LABEL);
            }

            List<MetricSection.Point> points = new ArrayList<>(ts.getSamplesCount());
            for (int j = 0; j < ts.getSamplesCount(); j++) {
                Sample sample = ts.getSamples(j);
                long timestamp =
                        EnvelopeDecoder.checkTimestamp(sample.getTimestamp(), path + ".samples[" + j + "].timestamp");
                points.add(new MetricSection.Point(timestamp, sample.getValue()));
            }
            series.add(new MetricSection.Series(name, labels, kindOf(name, types), "cumulative", points));
        }
        return new Result(clusterLabel, new MetricSection(series));
    }

    /** Wire kind in the lower-case form {@link MetricSection.Series#kind()} uses. */
    static String kindOf(String name, Map<String, MetricType> types) {
        MetricType type = types.get(name);
        for (int i = 0; type == null && i < FAMILY_SUFFIXES.size(); i++) {
            String suffix = FAMILY_SUFFIXES.get(i);
            if (name.endsWith(suffix)) {
                type = types.get(name.substring(0, name.length() - suffix.length()));
            }
        }
        if (type != null && type != MetricType.UNKNOWN && type != MetricType.UNRECOGNIZED) {
            return type.name().toLowerCase(Locale.ROOT);
        }
        if (name.endsWith("_total")) {
            return "counter";
        }
        if (name.endsWith("_bucket")) {
            return "histogram";
        }
        return "gauge";
    }
}
