package eryxon.qrm.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single row change. {@code attributes} holds the column values of the changed
 * row that the source chose to ship (at least the foreign keys); it may be empty.
 * Null column values are dropped, so they read like columns that were not shipped.
 */
public record ChangeNotification(
        EntityType entityType,
        String entityId,
        ChangeKind changeKind,
        String tenantId,
        Map<String, String> attributes) {

    public ChangeNotification {
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(changeKind, "changeKind is required");
        attributes = withoutNulls(attributes);
    }

    public static ChangeNotification of(EntityType entityType, String entityId, ChangeKind changeKind,
            String tenantId) {
        return new ChangeNotification(entityType, entityId, changeKind, tenantId, Map.of());
    }

    private static Map<String, String> withoutNulls(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        attributes.forEach((name, value) -> {
            if (name != null && value != null) {
                copy.put(name, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Column value of the changed row; {@code id} resolves to the entity id.
     */
    public String column(String name) {
        if ("id".equals(name)) {
            return entityId;
        }
        if ("tenant_id".equals(name)) {
            return tenantId;
        }
        return attributes.get(name);
    }
}
