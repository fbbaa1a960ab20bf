package de.bycsitsm.calsync.sync;

/**
 * Result of one CalDAV to ICS synchronization.
 *
 * @param eventCount    the number of complete VEVENT blocks in the combined document
 * @param calendarCount the number of discovered calendar collections
 * @param ics           the combined ICS document
 */
public record SourceSyncResult(int eventCount, int calendarCount, String ics) {

    public String message() {
        return "Successfully synchronised " + eventCount + " events from " + calendarCount + " calendars";
    }
}
