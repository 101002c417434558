package com.edgewatch.service.core.detect;

public enum SkipReason {
    /** Every counter rate in the window is the same. */
    ZERO_VARIANCE,
    /** The counter went backwards between the last history point and the sample. */
    COUNTER_RESET
}
