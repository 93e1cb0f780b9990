package eryxon.qrm.event;

/**
 * Client-side discard applied to notifications that the coarse server-side
 * subscription lets through.
 */
@FunctionalInterface
public interface NotificationFilter {

    boolean accepts(ChangeNotification notification);

    static NotificationFilter acceptAll() {
        return n -> true;
    }

    /**
     * Accepts notifications of {@code type} whose {@code column} equals {@code value}.
     * A notification that does not carry the column at all (e.g. a delete shipping
     * only the primary key) is accepted.
     */
    static NotificationFilter column(EntityType type, String column, String value) {
        return n -> {
            if (n.entityType() != type) {
                return false;
            }
            String actual = n.column(column);
            return actual == null || value.equals(actual);
        };
    }

    /** Accepts every notification of {@code type}. */
    static NotificationFilter entity(EntityType type) {
        return n -> n.entityType() == type;
    }

    default NotificationFilter or(NotificationFilter other) {
        return n -> accepts(n) || other.accepts(n);
    }
}
