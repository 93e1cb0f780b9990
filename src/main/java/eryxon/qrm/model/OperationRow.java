package eryxon.qrm.model;

import java.util.Objects;

/**
 * One operation as returned by the routing query: the operation joined with its
 * cell and its part. Cell fields are null when the operation has no cell.
 * Durations are in minutes and null until planned or measured.
 */
public final class OperationRow {
    private final String id;
    private final String tenantId;
    private final String jobId;
    private final String partId;
    private final String cellId;
    private final String cellName;
    private final String cellColor;
    private final int cellSequence;
    private final int sequence;
    private final OperationStatus status;
    private final Integer estimatedTime;
    private final Integer actualTime;

    private OperationRow(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.tenantId = builder.tenantId;
        this.jobId = builder.jobId;
        this.partId = builder.partId;
        this.cellId = builder.cellId;
        this.cellName = builder.cellName;
        this.cellColor = builder.cellColor;
        this.cellSequence = builder.cellSequence;
        this.sequence = builder.sequence;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.estimatedTime = builder.estimatedTime;
        this.actualTime = builder.actualTime;
    }

    public String id() {
        return id;
    }

    public String tenantId() {
        return tenantId;
    }

    public String jobId() {
        return jobId;
    }

    public String partId() {
        return partId;
    }

    public String cellId() {
        return cellId;
    }

    public String cellName() {
        return cellName;
    }

    public String cellColor() {
        return cellColor;
    }

    public int cellSequence() {
        return cellSequence;
    }

    public int sequence() {
        return sequence;
    }

    public OperationStatus status() {
        return status;
    }

    public Integer estimatedTime() {
        return estimatedTime;
    }

    public Integer actualTime() {
        return actualTime;
    }

    public boolean isCompleted() {
        return status == OperationStatus.COMPLETED;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tenantId(tenantId)
                .jobId(jobId)
                .partId(partId)
                .cellId(cellId)
                .cellName(cellName)
                .cellColor(cellColor)
                .cellSequence(cellSequence)
                .sequence(sequence)
                .status(status)
                .estimatedTime(estimatedTime)
                .actualTime(actualTime);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String tenantId;
        private String jobId;
        private String partId;
        private String cellId;
        private String cellName;
        private String cellColor;
        private int cellSequence;
        private int sequence;
        private OperationStatus status = OperationStatus.NOT_STARTED;
        private Integer estimatedTime;
        private Integer actualTime;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder partId(String partId) {
            this.partId = partId;
            return this;
        }

        public Builder cellId(String cellId) {
            this.cellId = cellId;
            return this;
        }

        public Builder cellName(String cellName) {
            this.cellName = cellName;
            return this;
        }

        public Builder cellColor(String cellColor) {
            this.cellColor = cellColor;
            return this;
        }

        public Builder cellSequence(int cellSequence) {
            this.cellSequence = cellSequence;
            return this;
        }

        public Builder sequence(int sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder status(OperationStatus status) {
            this.status = status;
            return this;
        }

        public Builder estimatedTime(Integer estimatedTime) {
            this.estimatedTime = estimatedTime;
            return this;
        }

        public Builder actualTime(Integer actualTime) {
            this.actualTime = actualTime;
            return this;
        }

        public OperationRow build() {
            return new OperationRow(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OperationRow row))
            return false;
        return Objects.equals(id, row.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "OperationRow{id='" + id + "', cell=" + cellId + ", status=" + status + "}";
    }
}
