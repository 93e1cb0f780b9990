package eryxon.qrm.live;

import eryxon.qrm.event.EntityType;
import eryxon.qrm.event.NotificationFilter;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * A live aggregate: what to subscribe to, which notifications matter, and how
 * to recompute the snapshot.
 *
 * @param <V> snapshot type
 */
public interface LiveView<V> {

    SubscriptionKey key();

    /** Tables subscribed to, always within {@code key().tenantId()}. */
    Set<EntityType> entityTypes();

    /** Client-side discard for notifications the tenant-wide subscription lets through. */
    NotificationFilter filter();

    /** Start a recompute. Must not block. */
    CompletableFuture<V> recompute();

    /**
     * Take a snapshot computed by an equal-keyed view as this view's type.
     *
     * @throws ClassCastException if the snapshot is not of this view's type
     */
    V narrow(Object snapshot);
}
