package eryxon.qrm.error;

/**
 * Base type for failures surfaced by the live aggregation layer.
 * Every subtype is unchecked and ends up as the {@code error} of a snapshot slot.
 */
public class QrmException extends RuntimeException {

    public QrmException(String message) {
        super(message);
    }

    public QrmException(String message, Throwable cause) {
        super(message, cause);
    }
}
