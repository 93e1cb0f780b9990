package eryxon.qrm.event;

/**
 * Port to the external change-event service.
 * Implementations hold a live network resource per subscription until
 * {@link ChangeSubscription#unsubscribe()} is called.
 */
public interface ChangeEventSource {

    /**
     * Open a channel.
     *
     * @throws eryxon.qrm.error.TransportException if the source cannot be reached
     */
    ChangeSubscription subscribe(SubscriptionRequest request, ChangeListener listener);
}
