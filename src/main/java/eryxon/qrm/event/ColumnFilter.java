package eryxon.qrm.event;

import java.util.Objects;

/**
 * Equality filter on a single column of a single table. This is the only
 * filter shape the change-event source can evaluate server-side.
 */
public record ColumnFilter(String column, String value) {

    public ColumnFilter {
        Objects.requireNonNull(column, "column is required");
        Objects.requireNonNull(value, "value is required");
    }

    public static ColumnFilter tenant(String tenantId) {
        return new ColumnFilter("tenant_id", tenantId);
    }

    public boolean matches(ChangeNotification notification) {
        return value.equals(notification.column(column));
    }

    @Override
    public String toString() {
        return column + "=eq." + value;
    }
}
