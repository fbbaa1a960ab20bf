package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.caldav.CalDavClient;
import de.bycsitsm.calsync.caldav.CalDavException;
import de.bycsitsm.calsync.caldav.Credentials;
import de.bycsitsm.calsync.ics.IcsCalendarWriter;
import de.bycsitsm.calsync.ics.VEvent;
import de.bycsitsm.calsync.ics.VEventScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * CalDAV to ICS pipeline: discovers the calendars below a CalDAV URL, fetches
 * their events and combines them into one published ICS document.
 */
@Component
public class SourceSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(SourceSynchronizer.class);

    private final CalDavClient calDavClient;

    SourceSynchronizer(CalDavClient calDavClient) {
        this.calDavClient = calDavClient;
    }

    /**
     * Runs the pipeline once.
     * <p>
     * A calendar whose events cannot be fetched is skipped; a failed discovery
     * fails the whole run.
     *
     * @param caldavUrl   the collection base URL
     * @param credentials the credentials for the CalDAV server
     * @return the combined document with its event and calendar counts
     * @throws CalDavException if validation or calendar discovery fails
     */
    public SourceSyncResult synchronize(String caldavUrl, Credentials credentials) {
        Validation.requireCalDavInputs(caldavUrl, credentials);

        var calendarPaths = calDavClient.discoverCalendars(caldavUrl, credentials);
        log.debug("Discovered {} calendar(s) at {}", calendarPaths.size(), caldavUrl);

        var events = new ArrayList<VEvent>();
        for (var calendarPath : calendarPaths) {
            try {
                for (var document : calDavClient.fetchEvents(caldavUrl, calendarPath, credentials)) {
                    events.addAll(VEventScanner.scan(document));
                }
            } catch (CalDavException e) {
                log.warn("Skipping calendar {}: {}", calendarPath, e.getMessage());
            }
        }

        return new SourceSyncResult(events.size(), calendarPaths.size(), IcsCalendarWriter.combine(events));
    }
}
