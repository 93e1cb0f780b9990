package eryxon.qrm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Live WIP metrics of one cell. Ephemeral and always re-derivable from the
 * operations table.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CellQrmMetrics(
        @JsonProperty("cell_id") String cellId,
        @JsonProperty("cell_name") String cellName,
        @JsonProperty("current_wip") Integer currentWip,
        @JsonProperty("wip_limit") Integer wipLimit,
        @JsonProperty("wip_warning_threshold") Integer wipWarningThreshold,
        @JsonProperty("enforce_limit") Boolean enforceLimit,
        @JsonProperty("show_warning") Boolean showWarning,
        @JsonProperty("utilization_percent") Integer utilizationPercent,
        @JsonProperty("status") CapacityStatus status,
        @JsonProperty("jobs_in_cell") List<JobRef> jobsInCell) {

    public CellQrmMetrics {
        jobsInCell = jobsInCell == null ? List.of() : List.copyOf(jobsInCell);
    }

    public void validate() {
        if (cellId == null || cellId.isBlank()) {
            throw new IllegalArgumentException("cell_id is required");
        }
        if (currentWip == null || currentWip < 0) {
            throw new IllegalArgumentException("current_wip must be a non-negative number");
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (wipLimit != null && wipLimit < 0) {
            throw new IllegalArgumentException("wip_limit must be non-negative");
        }
    }

    @JsonIgnore
    public boolean isAtCapacity() {
        return status == CapacityStatus.AT_CAPACITY;
    }
}
