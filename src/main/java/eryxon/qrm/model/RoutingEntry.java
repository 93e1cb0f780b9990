package eryxon.qrm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One cell on a routing: how many operations of the part/job pass through it and
 * how many of those are completed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoutingEntry(
        @JsonProperty("cell_id") String cellId,
        @JsonProperty("cell_name") String cellName,
        @JsonProperty("cell_color") String cellColor,
        @JsonProperty("sequence") int sequence,
        @JsonProperty("operation_count") int operationCount,
        @JsonProperty("completed_operations") int completedOperations) {

    public RoutingEntry {
        if (cellId == null || cellId.isBlank()) {
            throw new IllegalArgumentException("cellId is required");
        }
        if (operationCount < 1) {
            throw new IllegalArgumentException("operationCount must be positive");
        }
        if (completedOperations < 0 || completedOperations > operationCount) {
            throw new IllegalArgumentException(
                    "completedOperations must be between 0 and " + operationCount + ", was " + completedOperations);
        }
    }

    @JsonIgnore
    public boolean isComplete() {
        return completedOperations == operationCount;
    }
}
