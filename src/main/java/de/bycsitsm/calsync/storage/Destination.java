package de.bycsitsm.calsync.storage;

import de.bycsitsm.calsync.caldav.Credentials;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * An ICS feed whose events are uploaded into a CalDAV calendar collection.
 *
 * @param id               the store-assigned identifier, {@code 0} before the destination is added
 * @param name             the human-readable name
 * @param icsUrl           the URL of the ICS feed to read
 * @param caldavUrl        the CalDAV base URL of the target
 * @param calendarName     the name of the target calendar collection
 * @param credentials      the credentials for the CalDAV server
 * @param syncIntervalSecs the auto-sync interval in seconds, {@code 0} for manual synchronization only
 * @param syncAll          reserved, accepted but not interpreted by the uploader
 * @param keepLocal        reserved, accepted but not interpreted by the uploader
 * @param lastSynced       when the last successful synchronization finished
 * @param status           the outcome of the last synchronization
 * @param lastError        the error message of the last failed synchronization
 */
public record Destination(
        long id,
        String name,
        String icsUrl,
        String caldavUrl,
        String calendarName,
        Credentials credentials,
        long syncIntervalSecs,
        boolean syncAll,
        boolean keepLocal,
        @Nullable Instant lastSynced,
        SyncStatus status,
        @Nullable String lastError
) {

    /**
     * Creates a destination that has never been synchronized.
     */
    public static Destination create(String name, String icsUrl, String caldavUrl, String calendarName,
                                     Credentials credentials, long syncIntervalSecs,
                                     boolean syncAll, boolean keepLocal) {
        return new Destination(0, name, icsUrl, caldavUrl, calendarName, credentials, syncIntervalSecs,
                syncAll, keepLocal, null, SyncStatus.PENDING, null);
    }

    public boolean autoSyncEnabled() {
        return syncIntervalSecs > 0;
    }

    Destination withId(long newId) {
        return new Destination(newId, name, icsUrl, caldavUrl, calendarName, credentials, syncIntervalSecs,
                syncAll, keepLocal, lastSynced, status, lastError);
    }

    Destination withStatus(SyncStatus newStatus, @Nullable String error) {
        return new Destination(id, name, icsUrl, caldavUrl, calendarName, credentials, syncIntervalSecs,
                syncAll, keepLocal, lastSynced, newStatus, error);
    }

    Destination withLastSynced(Instant at) {
        return new Destination(id, name, icsUrl, caldavUrl, calendarName, credentials, syncIntervalSecs,
                syncAll, keepLocal, at, status, lastError);
    }

    Destination withStateOf(Destination current) {
        return new Destination(current.id, name, icsUrl, caldavUrl, calendarName, credentials, syncIntervalSecs,
                syncAll, keepLocal, current.lastSynced, current.status, current.lastError);
    }
}
