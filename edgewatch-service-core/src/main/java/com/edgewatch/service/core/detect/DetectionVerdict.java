package com.edgewatch.service.core.detect;

/**
 * Classification of one sample. A series without enough history is {@code INSUFFICIENT_DATA}; once baselined,
 * every sample is {@code NORMAL} or {@code ANOMALOUS}, unless policy excludes it ({@code SKIPPED}).
 */
public enum DetectionVerdict {
    INSUFFICIENT_DATA,
    SKIPPED,
    NORMAL,
    ANOMALOUS
}
