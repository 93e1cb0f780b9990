package eryxon.qrm.repository;

import java.util.List;

/**
 * Lists the cells a tenant currently routes work through.
 */
public interface CellDirectory {

    /**
     * IDs of the tenant's active cells, ordered by sequence.
     *
     * @param tenantId the tenant ID
     * @return active cell IDs
     */
    List<String> activeCellIds(String tenantId);
}
