package eryxon.qrm.event;

/**
 * Kind of row change carried by a notification.
 */
public enum ChangeKind {
    INSERT,
    UPDATE,
    DELETE
}
