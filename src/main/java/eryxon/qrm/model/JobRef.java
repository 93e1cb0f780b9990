package eryxon.qrm.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A job currently holding work in a cell.
 */
public record JobRef(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("job_number") String jobNumber) {
}
