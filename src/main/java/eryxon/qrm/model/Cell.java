package eryxon.qrm.model;

/**
 * A work center. Owned elsewhere; read-only here.
 *
 * @param wipLimit            max WIP, null for unlimited
 * @param wipWarningThreshold warn at this WIP, null for 80% of the limit
 */
public record Cell(
        String id,
        String tenantId,
        String name,
        String color,
        int sequence,
        boolean active,
        Integer wipLimit,
        Integer wipWarningThreshold,
        boolean enforceWipLimit,
        boolean showCapacityWarning) {

    /** Warning threshold in effect, or null when the cell has no limit. */
    public Integer effectiveWarningThreshold() {
        return wipLimit == null ? null : CapacityStatus.effectiveWarningThreshold(wipLimit, wipWarningThreshold);
    }

    public CapacityStatus capacityStatus(int currentWip) {
        return CapacityStatus.of(currentWip, wipLimit, wipWarningThreshold);
    }
}
