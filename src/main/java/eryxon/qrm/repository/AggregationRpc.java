package eryxon.qrm.repository;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Server-side aggregation functions. Results are untyped JSON trees; callers
 * validate them before use. Both calls are side-effect free and idempotent.
 * Implementations throw {@link eryxon.qrm.error.TransportException} when the
 * service cannot be reached.
 */
public interface AggregationRpc {

    /**
     * WIP metrics of one cell.
     *
     * @param cellId   the cell ID
     * @param tenantId the tenant ID
     * @return JSON object shaped like {@link eryxon.qrm.model.CellQrmMetrics}
     */
    JsonNode computeCellMetrics(String cellId, String tenantId);

    /**
     * Capacity of the active cell that follows {@code cellId} in sequence.
     *
     * @param cellId   the current cell ID
     * @param tenantId the tenant ID
     * @return JSON object shaped like {@link eryxon.qrm.model.NextCellCapacity}
     */
    JsonNode computeNextCellCapacity(String cellId, String tenantId);
}
