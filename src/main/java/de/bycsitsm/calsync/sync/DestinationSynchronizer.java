package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.caldav.CalDavClient;
import de.bycsitsm.calsync.caldav.CalDavException;
import de.bycsitsm.calsync.ics.IcsCalendarWriter;
import de.bycsitsm.calsync.ics.VEventScanner;
import de.bycsitsm.calsync.storage.Destination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * ICS to CalDAV pipeline: downloads an ICS feed and stores each event as its own
 * calendar object resource named after the event UID.
 * <p>
 * Uploads overwrite resources of the same name, so repeating a run is safe. Nothing
 * is ever deleted on the server.
 */
@Component
public class DestinationSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(DestinationSynchronizer.class);

    private final CalDavClient calDavClient;

    DestinationSynchronizer(CalDavClient calDavClient) {
        this.calDavClient = calDavClient;
    }

    /**
     * Runs the pipeline once. Every event is attempted even after failures.
     *
     * @param destination the destination to synchronize
     * @return the upload counts when every event was uploaded
     * @throws PartialUploadException if at least one upload failed
     * @throws CalDavException        if validation fails or the feed cannot be fetched
     */
    public UploadResult synchronize(Destination destination) {
        Validation.requireCalDavInputs(destination.caldavUrl(), destination.credentials());
        if (destination.icsUrl() == null || destination.icsUrl().isBlank()) {
            throw new CalDavException("ICS URL must not be empty.");
        }
        if (destination.calendarName() == null || destination.calendarName().isBlank()) {
            throw new CalDavException("Calendar name must not be empty.");
        }

        var events = VEventScanner.scanWithUid(calDavClient.fetchFeed(destination.icsUrl()));
        var calendarBase = collectionBase(destination.caldavUrl(), destination.calendarName());

        int uploaded = 0;
        int errors = 0;
        for (var event : events) {
            var eventUrl = calendarBase + encodePathSegment(event.uid()) + ".ics";
            try {
                int status = calDavClient.putCalendarObject(eventUrl, IcsCalendarWriter.wrapForUpload(event),
                        destination.credentials());
                if (status >= 200 && status < 300) {
                    uploaded++;
                } else {
                    log.warn("PUT {} returned {}", eventUrl, status);
                    errors++;
                }
            } catch (CalDavException e) {
                log.error("PUT {} failed: {}", eventUrl, e.getMessage());
                errors++;
            }
        }

        if (errors > 0) {
            throw new PartialUploadException(uploaded, errors);
        }
        return new UploadResult(uploaded, events.size());
    }

    /**
     * Percent-encodes a UID so that it forms a single path segment.
     */
    static String encodePathSegment(String uid) {
        return URLEncoder.encode(uid, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Returns the URL of the target collection, ending with a slash. The calendar
     * name is appended unless the URL already ends with it.
     */
    static String collectionBase(String caldavUrl, String calendarName) {
        var normalized = caldavUrl.replaceAll("/+$", "");
        if (normalized.endsWith(calendarName)) {
            return normalized + "/";
        }
        return normalized + "/" + calendarName + "/";
    }
}
