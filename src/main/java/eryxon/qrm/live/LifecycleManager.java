package eryxon.qrm.live;

import eryxon.qrm.cache.SnapshotCache;
import eryxon.qrm.cache.SnapshotState;
import eryxon.qrm.config.QrmConfig;
import eryxon.qrm.error.QrmException;
import eryxon.qrm.error.SubscriptionChannelException;
import eryxon.qrm.error.TransportException;
import eryxon.qrm.event.ChangeEventSource;
import eryxon.qrm.event.ChangeListener;
import eryxon.qrm.event.ChangeNotification;
import eryxon.qrm.event.ChannelStatus;
import eryxon.qrm.event.EventSourceBinding;
import eryxon.qrm.service.AggregationFetcher;
import eryxon.qrm.util.KeyedDebouncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Binds live views to consumers' interest periods.
 *
 * The first consumer of a key opens its channel, creates its cache slot and
 * dispatches an immediate recompute. Notifications re-arm the key's debounce
 * timer; when it fires the view is recomputed and the result lands in the cache
 * if no later recompute was dispatched meanwhile. The last consumer to stop
 * cancels the timer, closes the channel and discards the slot.
 *
 * All per-key state lives on the {@link LiveLoop}; the public methods may be
 * called from any thread and wait for the loop.
 */
public class LifecycleManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private final ChangeEventSource eventSource;
    private final LiveLoop loop;
    private final QrmConfig config;
    private final SnapshotCache<SubscriptionKey> cache = new SnapshotCache<>();
    private final KeyedDebouncer<SubscriptionKey> debouncer;

    // loop-confined
    private final Map<SubscriptionKey, Interest<?>> interests = new HashMap<>();
    private boolean closed;

    public LifecycleManager(ChangeEventSource eventSource, LiveLoop loop, QrmConfig config) {
        this.eventSource = eventSource;
        this.loop = loop;
        this.config = config;
        this.debouncer = new KeyedDebouncer<>(loop.scheduler());
    }

    /**
     * Start watching {@code view}. Consumers of an equal key share one channel,
     * one timer and one slot. If the loop does not answer in time the call fails,
     * and an interest it opens afterwards is released as soon as it exists.
     *
     * @throws QrmException if the manager is closed or the loop does not answer in time
     */
    public <V> InterestHandle<V> startInterest(LiveView<V> view) {
        if (loop.inLoop()) {
            return join(view);
        }
        CompletableFuture<InterestHandle<V>> pending = loop.submit(() -> join(view));
        try {
            return loop.await(pending);
        } catch (RuntimeException e) {
            // nobody will ever hold this handle
            pending.thenAcceptAsync(InterestHandle::stop, loop.executor());
            throw e;
        }
    }

    /** Current state of {@code key}; empty when nobody watches it. */
    public SnapshotState<?> read(SubscriptionKey key) {
        return cache.read(key);
    }

    /** Keys with at least one consumer. */
    public List<SubscriptionKey> activeKeys() {
        return loop.call(() -> new ArrayList<>(interests.keySet()));
    }

    /** Number of consumers sharing {@code key}. */
    public int consumerCount(SubscriptionKey key) {
        return loop.call(() -> {
            Interest<?> interest = interests.get(key);
            return interest == null ? 0 : interest.consumers;
        });
    }

    public boolean isTimerArmed(SubscriptionKey key) {
        return debouncer.isArmed(key);
    }

    /**
     * Tear down every interest. Handles still held by consumers read empty states
     * afterwards; stopping them is a no-op.
     */
    @Override
    public void close() {
        if (!loop.isRunning()) {
            return;
        }
        loop.run(() -> {
            if (closed) {
                return;
            }
            closed = true;
            for (Interest<?> interest : new ArrayList<>(interests.values())) {
                teardown(interest);
            }
            debouncer.cancelAll();
            log.info("Lifecycle manager closed");
        });
    }

    // ---- loop-confined internals ----

    private <V> InterestHandle<V> join(LiveView<V> view) {
        if (closed) {
            throw new QrmException("Lifecycle manager is closed");
        }
        SubscriptionKey key = view.key();
        Interest<?> existing = interests.get(key);
        if (existing != null) {
            existing.consumers++;
            log.debug("Joined {} ({} consumers)", key, existing.consumers);
            return new Handle<>(existing, view);
        }

        SnapshotCache<SubscriptionKey>.Slot<V> slot = cache.open(key);
        Interest<V> interest = new Interest<>(view, slot, config.quietWindow(key.kind()));
        interests.put(key, interest);
        openChannel(interest);
        dispatch(interest);
        log.info("Started interest in {}", key);
        return new Handle<>(interest, view);
    }

    private <V> void openChannel(Interest<V> interest) {
        SubscriptionKey key = interest.view.key();
        try {
            interest.binding = EventSourceBinding.open(eventSource, key.channelName(), key.tenantId(),
                    interest.view.entityTypes(), interest.view.filter(), new LoopListener(interest));
        } catch (RuntimeException e) {
            log.error("Could not open channel {} for {}", key.channelName(), key, e);
            interest.slot.channelState(new SubscriptionChannelException(key.channelName(),
                    "Could not open channel " + key.channelName(), e));
        }
    }

    private <V> void dispatch(Interest<V> interest) {
        long generation = interest.slot.beginLoad();
        if (generation < 0) {
            return;
        }
        interest.recomputes++;
        CompletableFuture<V> result;
        try {
            result = interest.view.recompute();
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        result.whenCompleteAsync((value, error) -> apply(interest, generation, value, error), loop.executor());
    }

    private <V> void apply(Interest<V> interest, long generation, V value, Throwable error) {
        SubscriptionKey key = interest.view.key();
        if (interests.get(key) != interest) {
            log.debug("Dropped result for {} (generation {}): interest ended", key, generation);
            return;
        }
        if (error == null) {
            interest.slot.write(generation, value);
            return;
        }
        Throwable cause = AggregationFetcher.unwrap(error);
        if (!(cause instanceof QrmException)) {
            cause = new TransportException("Recompute of " + key + " failed: " + cause.getMessage(), cause);
        }
        if (interest.slot.fail(generation, cause)) {
            log.warn("Recompute of {} failed: {}", key, cause.getMessage());
        }
    }

    private <V> void onNotification(Interest<V> interest, ChangeNotification notification) {
        if (interests.get(interest.view.key()) != interest) {
            return;
        }
        debouncer.submit(interest.view.key(), interest.quietWindow, () -> recomputeIfLive(interest));
    }

    private <V> void onChannelStatus(Interest<V> interest, ChannelStatus status, Throwable cause) {
        SubscriptionKey key = interest.view.key();
        if (interests.get(key) != interest) {
            return;
        }
        if (status.isHealthy()) {
            boolean recovered = !interest.slot.state().isChannelHealthy();
            interest.slot.channelState(null);
            if (recovered) {
                // updates may have been missed while the channel was down
                log.info("Channel {} recovered, recomputing {}", key.channelName(), key);
                debouncer.submit(key, interest.quietWindow, () -> recomputeIfLive(interest));
            }
        } else {
            interest.slot.channelState(new SubscriptionChannelException(key.channelName(),
                    "Channel " + key.channelName() + " reported " + status, cause));
        }
    }

    private <V> void recomputeIfLive(Interest<V> interest) {
        if (interests.get(interest.view.key()) == interest) {
            dispatch(interest);
        }
    }

    private <V> void refetch(Interest<V> interest) {
        if (interests.get(interest.view.key()) != interest) {
            return;
        }
        debouncer.cancel(interest.view.key());
        dispatch(interest);
    }

    private <V> void release(Interest<V> interest) {
        SubscriptionKey key = interest.view.key();
        if (interests.get(key) != interest) {
            return;
        }
        interest.consumers--;
        if (interest.consumers > 0) {
            log.debug("Left {} ({} consumers remain)", key, interest.consumers);
            return;
        }
        teardown(interest);
        log.info("Stopped interest in {} after {} recomputes", key, interest.recomputes);
    }

    private <V> void teardown(Interest<V> interest) {
        SubscriptionKey key = interest.view.key();
        interests.remove(key);
        debouncer.cancel(key);
        if (interest.binding != null) {
            interest.binding.close();
        }
        cache.discard(key);
        interest.consumers = 0;
    }

    private static final class Interest<V> {
        private final LiveView<V> view;
        private final SnapshotCache<SubscriptionKey>.Slot<V> slot;
        private final Duration quietWindow;
        private EventSourceBinding binding;
        private int consumers = 1;
        private long recomputes;

        Interest(LiveView<V> view, SnapshotCache<SubscriptionKey>.Slot<V> slot, Duration quietWindow) {
            this.view = view;
            this.slot = slot;
            this.quietWindow = quietWindow;
        }
    }

    /**
     * Hops channel callbacks from the source's thread onto the loop.
     */
    private final class LoopListener implements ChangeListener {
        private final Interest<?> interest;

        LoopListener(Interest<?> interest) {
            this.interest = interest;
        }

        @Override
        public void onChange(ChangeNotification notification) {
            loop.execute(() -> onNotification(interest, notification));
        }

        @Override
        public void onStatus(ChannelStatus status, Throwable cause) {
            loop.execute(() -> onChannelStatus(interest, status, cause));
        }
    }

    /**
     * One consumer's view of a shared interest. The slot may have been filled by
     * an equal-keyed view of another consumer, so states are narrowed to this
     * consumer's snapshot type, once per state.
     */
    private final class Handle<V> implements InterestHandle<V> {
        private final Interest<?> interest;
        private final LiveView<V> view;
        private final AtomicBoolean stopped = new AtomicBoolean(false);
        private volatile Narrowed<V> last;

        Handle(Interest<?> interest, LiveView<V> view) {
            this.interest = interest;
            this.view = view;
        }

        @Override
        public SubscriptionKey key() {
            return view.key();
        }

        @Override
        public SnapshotState<V> read() {
            if (stopped.get()) {
                return SnapshotState.empty();
            }
            SnapshotState<?> state = interest.slot.state();
            Narrowed<V> seen = last;
            if (seen != null && seen.source() == state) {
                return seen.state();
            }
            SnapshotState<V> narrowed = state.map(view::narrow);
            last = new Narrowed<>(state, narrowed);
            return narrowed;
        }

        @Override
        public void refetch() {
            if (stopped.get() || !loop.isRunning()) {
                return;
            }
            loop.run(() -> LifecycleManager.this.refetch(interest));
        }

        /**
         * If the loop does not answer in time this throws, but the release stays
         * queued and completes once the loop reaches it.
         */
        @Override
        public void stop() {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
            if (!loop.isRunning()) {
                return;
            }
            loop.run(() -> release(interest));
        }

        @Override
        public boolean isStopped() {
            return stopped.get();
        }

        @Override
        public String toString() {
            return "InterestHandle{" + view.key() + (stopped.get() ? ", stopped" : "") + "}";
        }
    }

    private record Narrowed<V>(SnapshotState<?> source, SnapshotState<V> state) {
    }
}
