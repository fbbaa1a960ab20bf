package de.bycsitsm.calsync.storage;

import de.bycsitsm.calsync.caldav.Credentials;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A CalDAV server whose calendars are combined into one published ICS document.
 *
 * @param id               the store-assigned identifier, {@code 0} before the source is added
 * @param name             the human-readable name
 * @param caldavUrl        the collection base URL that is searched for calendars
 * @param credentials      the credentials for the CalDAV server
 * @param syncIntervalSecs the auto-sync interval in seconds, {@code 0} for manual synchronization only
 * @param lastSynced       when the last successful synchronization finished
 * @param status           the outcome of the last synchronization
 * @param lastError        the error message of the last failed synchronization
 */
public record Source(
        long id,
        String name,
        String caldavUrl,
        Credentials credentials,
        long syncIntervalSecs,
        @Nullable Instant lastSynced,
        SyncStatus status,
        @Nullable String lastError
) {

    /**
     * Creates a source that has never been synchronized.
     */
    public static Source create(String name, String caldavUrl, Credentials credentials, long syncIntervalSecs) {
        return new Source(0, name, caldavUrl, credentials, syncIntervalSecs, null, SyncStatus.PENDING, null);
    }

    public boolean autoSyncEnabled() {
        return syncIntervalSecs > 0;
    }

    Source withId(long newId) {
        return new Source(newId, name, caldavUrl, credentials, syncIntervalSecs, lastSynced, status, lastError);
    }

    Source withStatus(SyncStatus newStatus, @Nullable String error) {
        return new Source(id, name, caldavUrl, credentials, syncIntervalSecs, lastSynced, newStatus, error);
    }

    Source withLastSynced(Instant at) {
        return new Source(id, name, caldavUrl, credentials, syncIntervalSecs, at, status, lastError);
    }

    /**
     * Takes the configuration of this source and the synchronization state of {@code current}.
     */
    Source withStateOf(Source current) {
        return new Source(current.id, name, caldavUrl, credentials, syncIntervalSecs,
                current.lastSynced, current.status, current.lastError);
    }
}
