package eryxon.qrm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether the next cell in sequence can take more work.
 * {@code nextCellId} is null when the current cell is the last one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NextCellCapacity(
        @JsonProperty("has_capacity") Boolean hasCapacity,
        @JsonProperty("warning") Boolean warning,
        @JsonProperty("next_cell_id") String nextCellId,
        @JsonProperty("next_cell_name") String nextCellName,
        @JsonProperty("current_wip") Integer currentWip,
        @JsonProperty("wip_limit") Integer wipLimit,
        @JsonProperty("enforce_limit") Boolean enforceLimit,
        @JsonProperty("message") String message) {

    public void validate() {
        if (hasCapacity == null) {
            throw new IllegalArgumentException("has_capacity is required");
        }
        if (nextCellId != null && currentWip == null) {
            throw new IllegalArgumentException("current_wip is required when next_cell_id is set");
        }
    }

    public boolean hasNextCell() {
        return nextCellId != null;
    }

    public boolean warns() {
        return Boolean.TRUE.equals(warning);
    }

    /** Starting work should be blocked: the next cell is full and enforces its limit. */
    public boolean blocksStart() {
        return !hasCapacity && Boolean.TRUE.equals(enforceLimit);
    }
}
