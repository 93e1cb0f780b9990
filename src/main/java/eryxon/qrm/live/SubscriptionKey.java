package eryxon.qrm.live;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * What a consumer is watching. Two consumers with equal keys share one
 * subscription, one debounce timer and one cache slot.
 *
 * @param kind      the view
 * @param tenantId  tenant boundary of the subscription
 * @param entityIds watched entity IDs (cell, part or jobs); empty for tenant-wide views
 */
public record SubscriptionKey(ViewKind kind, String tenantId, List<String> entityIds) {

    public SubscriptionKey {
        Objects.requireNonNull(kind, "kind is required");
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        entityIds = List.copyOf(entityIds);
    }

    public static SubscriptionKey of(ViewKind kind, String tenantId, String... entityIds) {
        return new SubscriptionKey(kind, tenantId, List.of(entityIds));
    }

    /**
     * Name of the change-event channel for this key: the view prefix, the tenant,
     * then the entity ID, e.g. {@code qrm-cell-<tenantId>-<cellId>}. Several IDs
     * are replaced by a digest of their sorted set.
     */
    public String channelName() {
        String base = kind.channelPrefix() + "-" + tenantId;
        if (entityIds.isEmpty()) {
            return base;
        }
        if (entityIds.size() == 1) {
            return base + "-" + entityIds.get(0);
        }
        return base + "-" + digest(new TreeSet<>(entityIds));
    }

    private static String digest(Set<String> ids) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest(String.join("\n", ids).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return kind + "[" + tenantId + (entityIds.isEmpty() ? "" : ":" + String.join(",", entityIds)) + "]";
    }
}
