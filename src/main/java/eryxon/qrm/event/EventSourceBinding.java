package eryxon.qrm.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One open channel on the change-event source, scoped to a tenant.
 *
 * The source can only filter on a single column, so every table is subscribed
 * by {@code tenant_id} and the narrower interest of the view is applied here,
 * client-side, before anything is forwarded. Nothing is forwarded after
 * {@link #close()}.
 */
public final class EventSourceBinding implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventSourceBinding.class);

    private final String channelName;
    private final NotificationFilter filter;
    private final ChangeListener downstream;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private volatile ChangeSubscription subscription;

    private EventSourceBinding(String channelName, NotificationFilter filter, ChangeListener downstream) {
        this.channelName = channelName;
        this.filter = filter;
        this.downstream = downstream;
    }

    /**
     * Subscribe to {@code entityTypes} of {@code tenantId}.
     *
     * @throws eryxon.qrm.error.TransportException if the source refuses the subscription
     */
    public static EventSourceBinding open(ChangeEventSource source,
            String channelName,
            String tenantId,
            Set<EntityType> entityTypes,
            NotificationFilter filter,
            ChangeListener downstream) {
        Map<EntityType, ColumnFilter> tables = new EnumMap<>(EntityType.class);
        for (EntityType type : entityTypes) {
            tables.put(type, ColumnFilter.tenant(tenantId));
        }
        SubscriptionRequest request = new SubscriptionRequest(channelName, tenantId, tables);

        EventSourceBinding binding = new EventSourceBinding(channelName, filter, downstream);
        binding.subscription = source.subscribe(request, binding.new Forwarder());
        log.debug("Opened channel {} on {} for tenant {}", channelName, entityTypes, tenantId);
        return binding;
    }

    public String channelName() {
        return channelName;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /** Notifications that passed the client-side filter. */
    public long forwardedCount() {
        return forwarded.get();
    }

    /** Notifications dropped by the client-side filter. */
    public long discardedCount() {
        return discarded.get();
    }

    /**
     * Release the channel. Idempotent; failures of the source are logged.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ChangeSubscription sub = subscription;
        if (sub == null) {
            return;
        }
        try {
            sub.unsubscribe();
            log.debug("Closed channel {} ({} forwarded, {} discarded)",
                    channelName, forwarded.get(), discarded.get());
        } catch (RuntimeException e) {
            log.warn("Error closing channel {}: {}", channelName, e.getMessage());
        }
    }

    private final class Forwarder implements ChangeListener {

        @Override
        public void onChange(ChangeNotification notification) {
            if (closed.get()) {
                return;
            }
            if (!filter.accepts(notification)) {
                discarded.incrementAndGet();
                return;
            }
            forwarded.incrementAndGet();
            downstream.onChange(notification);
        }

        @Override
        public void onStatus(ChannelStatus status, Throwable cause) {
            if (closed.get()) {
                return;
            }
            if (status.isHealthy()) {
                log.debug("Channel {} subscribed", channelName);
            } else {
                log.error("Realtime channel {} reported {}", channelName, status, cause);
            }
            downstream.onStatus(status, cause);
        }
    }
}
