package eryxon.qrm.event;

/**
 * Tables whose changes the live views react to.
 */
public enum EntityType {
    OPERATIONS("operations"),
    CELLS("cells"),
    PARTS("parts"),
    JOBS("jobs");

    private final String table;

    EntityType(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }
}
