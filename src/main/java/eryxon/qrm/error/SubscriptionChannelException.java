package eryxon.qrm.error;

/**
 * The change-event channel reported itself unhealthy (or could not be opened).
 * Live updates for the channel may be missing until it recovers.
 */
public class SubscriptionChannelException extends QrmException {

    private final String channelName;

    public SubscriptionChannelException(String channelName, String message) {
        super(message);
        this.channelName = channelName;
    }

    public SubscriptionChannelException(String channelName, String message, Throwable cause) {
        super(message, cause);
        this.channelName = channelName;
    }

    public String channelName() {
        return channelName;
    }
}
