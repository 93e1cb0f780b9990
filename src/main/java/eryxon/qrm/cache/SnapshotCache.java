package eryxon.qrm.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Last-known snapshot per key.
 *
 * Each key owns one {@link Slot}, typed by the snapshot it holds. Reads are safe
 * from any thread. Writes are expected from a single writer (the live loop);
 * ordering between overlapping recomputes of one key is enforced by generation
 * numbers: {@link Slot#beginLoad} hands out a new generation and a result is
 * applied only if it carries the latest one for its slot. Generations are unique
 * across the whole cache, so a result dispatched for a discarded slot can never
 * match a slot opened later for the same key.
 *
 * @param <K> subscription key type
 */
public final class SnapshotCache<K> {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCache.class);

    private final Map<K, Slot<?>> slots = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    /**
     * Create the empty slot of {@code key}.
     *
     * @throws IllegalStateException if {@code key} already has a slot
     */
    public <V> Slot<V> open(K key) {
        Slot<V> slot = new Slot<>(key);
        if (slots.putIfAbsent(key, slot) != null) {
            throw new IllegalStateException("Slot already open for " + key);
        }
        return slot;
    }

    /**
     * Destroy the slot. Results still in flight for it are dropped.
     */
    public void discard(K key) {
        Slot<?> slot = slots.remove(key);
        if (slot != null) {
            slot.discarded = true;
        }
    }

    public boolean contains(K key) {
        return slots.containsKey(key);
    }

    public int size() {
        return slots.size();
    }

    /**
     * Current state of {@code key}; empty if no slot exists.
     */
    public SnapshotState<?> read(K key) {
        Slot<?> slot = slots.get(key);
        return slot == null ? SnapshotState.empty() : slot.state();
    }

    /**
     * Snapshot storage of one key.
     *
     * @param <V> snapshot type
     */
    public final class Slot<V> {
        private final K key;
        private volatile SnapshotState<V> state = SnapshotState.empty();
        private volatile long dispatched;
        private volatile boolean discarded;

        private Slot(K key) {
            this.key = key;
        }

        public K key() {
            return key;
        }

        /** Current state; empty once the slot is discarded. */
        public SnapshotState<V> state() {
            return discarded ? SnapshotState.empty() : state;
        }

        public boolean isOpen() {
            return !discarded;
        }

        /**
         * Start a recompute: move to LOADING and hand out its generation.
         *
         * @return the new generation, or -1 if the slot is discarded
         */
        public long beginLoad() {
            if (discarded) {
                return -1;
            }
            long generation = generations.incrementAndGet();
            dispatched = generation;
            state = state.loading(generation);
            return generation;
        }

        /**
         * Apply a successful recompute.
         *
         * @return false if the result was stale or the slot is gone
         */
        public boolean write(long generation, V value) {
            if (!current(generation)) {
                return false;
            }
            state = state.ready(value);
            return true;
        }

        /**
         * Apply a failed recompute. The last good value stays visible.
         *
         * @return false if the result was stale or the slot is gone
         */
        public boolean fail(long generation, Throwable error) {
            if (!current(generation)) {
                return false;
            }
            state = state.failed(error);
            return true;
        }

        /**
         * Record the health of the key's change-event channel. Value and load
         * state are left untouched.
         *
         * @param channelError null once the channel is healthy again
         */
        public void channelState(Throwable channelError) {
            if (!discarded) {
                state = state.withChannelError(channelError);
            }
        }

        /**
         * Drop the stored value and error, and supersede every recompute in flight.
         */
        public void invalidate() {
            if (discarded) {
                return;
            }
            long generation = generations.incrementAndGet();
            dispatched = generation;
            state = new SnapshotState<>(LoadState.EMPTY, null, null, state.channelError(), generation);
        }

        private boolean current(long generation) {
            if (discarded) {
                log.debug("Dropped result for {} (generation {}): slot discarded", key, generation);
                return false;
            }
            if (generation != dispatched) {
                log.debug("Dropped stale result for {} (generation {}, latest {})", key, generation, dispatched);
                return false;
            }
            return true;
        }
    }
}
