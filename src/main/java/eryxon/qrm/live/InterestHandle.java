package eryxon.qrm.live;

import eryxon.qrm.cache.SnapshotState;

/**
 * One consumer's interest in a live view. Obtained from
 * {@link LifecycleManager#startInterest(LiveView)}; must be stopped when the
 * consumer loses interest.
 *
 * @param <V> snapshot type
 */
public interface InterestHandle<V> extends AutoCloseable {

    SubscriptionKey key();

    /** Latest state of the view; empty once this handle is stopped. */
    SnapshotState<V> read();

    /** Recompute now, bypassing the debounce window. No-op once stopped. */
    void refetch();

    /**
     * End this consumer's interest. When it was the last consumer of the key, the
     * debounce timer is cancelled, the channel is closed and the slot is discarded
     * before this method returns. Idempotent.
     *
     * @throws eryxon.qrm.error.QrmException if the live loop does not answer in
     *         time; the release still happens once the loop catches up
     */
    void stop();

    boolean isStopped();

    @Override
    default void close() {
        stop();
    }
}
