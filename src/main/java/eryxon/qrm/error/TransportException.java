package eryxon.qrm.error;

/**
 * The change-event source, the RPC service or the routing query could not be
 * reached, or answered with a payload that does not match its schema.
 * Recovered only by re-triggering a recompute.
 */
public class TransportException extends QrmException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
