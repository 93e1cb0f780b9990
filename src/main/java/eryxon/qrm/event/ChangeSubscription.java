package eryxon.qrm.event;

/**
 * An open channel on the change-event source.
 */
public interface ChangeSubscription {

    String channelName();

    /** Release the channel. Safe to call more than once. */
    void unsubscribe();
}
