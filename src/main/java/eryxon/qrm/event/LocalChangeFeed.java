package eryxon.qrm.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process change-event source.
 * Writers in the same JVM {@link #publish} row changes; every open subscription
 * whose tenant and column filter match receives them on the publishing thread.
 */
public final class LocalChangeFeed implements ChangeEventSource {

    private static final Logger log = LoggerFactory.getLogger(LocalChangeFeed.class);

    private final CopyOnWriteArrayList<Channel> channels = new CopyOnWriteArrayList<>();

    @Override
    public ChangeSubscription subscribe(SubscriptionRequest request, ChangeListener listener) {
        Channel channel = new Channel(request, listener);
        channels.add(channel);
        deliverStatus(channel, ChannelStatus.SUBSCRIBED, null);
        return channel;
    }

    /**
     * Deliver a row change to matching subscribers.
     *
     * @return number of channels that received it
     */
    public int publish(ChangeNotification notification) {
        int delivered = 0;
        for (Channel channel : channels) {
            if (!channel.request.matches(notification)) {
                continue;
            }
            try {
                channel.listener.onChange(notification);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Listener of channel {} failed on {}", channel.channelName(), notification, e);
            }
        }
        return delivered;
    }

    /**
     * Push a status to every open channel with the given name.
     */
    public void signal(String channelName, ChannelStatus status, Throwable cause) {
        for (Channel channel : channels) {
            if (channel.channelName().equals(channelName)) {
                deliverStatus(channel, status, cause);
            }
        }
    }

    /** Number of open channels. */
    public int openChannels() {
        return channels.size();
    }

    public boolean isOpen(String channelName) {
        return channels.stream().anyMatch(c -> c.channelName().equals(channelName));
    }

    private void deliverStatus(Channel channel, ChannelStatus status, Throwable cause) {
        try {
            channel.listener.onStatus(status, cause);
        } catch (RuntimeException e) {
            log.warn("Listener of channel {} failed on status {}", channel.channelName(), status, e);
        }
    }

    private final class Channel implements ChangeSubscription {
        private final SubscriptionRequest request;
        private final ChangeListener listener;

        Channel(SubscriptionRequest request, ChangeListener listener) {
            this.request = request;
            this.listener = listener;
        }

        @Override
        public String channelName() {
            return request.channelName();
        }

        @Override
        public void unsubscribe() {
            channels.remove(this);
        }
    }
}
