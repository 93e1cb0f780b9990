package eryxon.qrm.event;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * What to subscribe to: a named channel within a tenant, with one server-side
 * column filter per table.
 */
public record SubscriptionRequest(
        String channelName,
        String tenantId,
        Map<EntityType, ColumnFilter> tables) {

    public SubscriptionRequest {
        Objects.requireNonNull(channelName, "channelName is required");
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required for channel " + channelName);
        }
        if (tables == null || tables.isEmpty()) {
            throw new IllegalArgumentException("at least one table is required for channel " + channelName);
        }
        tables = Map.copyOf(new EnumMap<>(tables));
    }

    /** True if the server-side filters would deliver this notification. */
    public boolean matches(ChangeNotification notification) {
        if (!tenantId.equals(notification.tenantId())) {
            return false;
        }
        ColumnFilter filter = tables.get(notification.entityType());
        return filter != null && filter.matches(notification);
    }
}
