package eryxon.qrm.model;

/**
 * Lifecycle status of an operation, as stored in the {@code operations.status} column.
 */
public enum OperationStatus {
    /** Queued in its cell, no work started */
    NOT_STARTED("not_started"),
    /** An operator is working on it */
    IN_PROGRESS("in_progress"),
    /** Finished */
    COMPLETED("completed"),
    /** Parked, e.g. waiting for material or an issue resolution */
    ON_HOLD("on_hold");

    private final String wireName;

    OperationStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Work in progress from the cell's point of view. */
    public boolean isWip() {
        return this == NOT_STARTED || this == IN_PROGRESS;
    }

    public static OperationStatus fromWire(String value) {
        for (OperationStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown operation status: " + value);
    }
}
