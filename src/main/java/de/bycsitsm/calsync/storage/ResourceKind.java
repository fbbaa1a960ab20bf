package de.bycsitsm.calsync.storage;

/**
 * The two kinds of synchronized resources.
 */
public enum ResourceKind {

    /**
     * A CalDAV server published as one combined ICS document.
     */
    SOURCE("Source"),

    /**
     * An ICS feed uploaded event by event into a CalDAV collection.
     */
    DESTINATION("Destination");

    private final String displayName;

    ResourceKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
