package eryxon.qrm.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * WIP status of a cell relative to its limit.
 */
public enum CapacityStatus {
    /** No WIP limit configured */
    @JsonProperty("no_limit")
    NO_LIMIT,
    /** Below the warning threshold */
    @JsonProperty("normal")
    NORMAL,
    /** At or above the warning threshold, below the limit */
    @JsonProperty("warning")
    WARNING,
    /** At or above the limit */
    @JsonProperty("at_capacity")
    AT_CAPACITY;

    /**
     * Classify a WIP count. A null threshold means 80% of the limit.
     */
    public static CapacityStatus of(int currentWip, Integer wipLimit, Integer warningThreshold) {
        if (wipLimit == null) {
            return NO_LIMIT;
        }
        if (currentWip >= wipLimit) {
            return AT_CAPACITY;
        }
        if (currentWip >= effectiveWarningThreshold(wipLimit, warningThreshold)) {
            return WARNING;
        }
        return NORMAL;
    }

    /** Explicit threshold, or 80% of the limit rounded to the nearest integer. */
    public static int effectiveWarningThreshold(int wipLimit, Integer warningThreshold) {
        return warningThreshold != null ? warningThreshold : (int) Math.round(wipLimit * 0.8);
    }
}
