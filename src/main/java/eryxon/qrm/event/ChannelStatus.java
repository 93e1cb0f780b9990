package eryxon.qrm.event;

/**
 * Health of a change-event channel as reported by the event source.
 */
public enum ChannelStatus {
    /** Channel is live and delivering notifications */
    SUBSCRIBED,
    /** The source reported an error on the channel */
    CHANNEL_ERROR,
    /** The source gave up joining the channel */
    TIMED_OUT,
    /** Channel was closed by the source */
    CLOSED;

    public boolean isHealthy() {
        return this == SUBSCRIBED;
    }
}
