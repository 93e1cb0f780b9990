package eryxon.qrm.event;

/**
 * Receives the notifications and status changes of one channel.
 */
public interface ChangeListener {

    void onChange(ChangeNotification notification);

    /**
     * Channel status changed. {@code cause} is set only for error statuses, and only
     * when the source knows one.
     */
    default void onStatus(ChannelStatus status, Throwable cause) {
    }
}
