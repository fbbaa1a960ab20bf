package de.bycsitsm.calsync.ics;

import java.util.List;

import static de.bycsitsm.calsync.ics.VEventScanner.CRLF;

/**
 * Writes VEVENT blocks into VCALENDAR envelopes. Output always uses CRLF line endings.
 */
public final class IcsCalendarWriter {

    static final String PUBLISHED_PRODUCT_ID = "-//CalDAV to ICS//EN";
    static final String UPLOAD_PRODUCT_ID = "-//CalDAV/ICS Sync//EN";

    private static final String PUBLISHED_PREAMBLE = "BEGIN:VCALENDAR" + CRLF
            + "VERSION:2.0" + CRLF
            + "PRODID:" + PUBLISHED_PRODUCT_ID + CRLF
            + "CALSCALE:GREGORIAN" + CRLF
            + "METHOD:PUBLISH" + CRLF;

    private static final String END_VCALENDAR = "END:VCALENDAR" + CRLF;

    private IcsCalendarWriter() {
    }

    /**
     * Combines events from any number of calendars into one published calendar.
     * The envelope is written even when there are no events.
     *
     * @param events the events in the order they should appear
     * @return the complete VCALENDAR document
     */
    public static String combine(List<VEvent> events) {
        var output = new StringBuilder(PUBLISHED_PREAMBLE);
        for (var event : events) {
            output.append(event.text());
        }
        return output.append(END_VCALENDAR).toString();
    }

    /**
     * Wraps a single event in the minimal envelope used to upload it as a calendar object resource.
     *
     * @param event the event
     * @return the complete VCALENDAR document
     */
    public static String wrapForUpload(VEvent event) {
        return "BEGIN:VCALENDAR" + CRLF
                + "VERSION:2.0" + CRLF
                + "PRODID:" + UPLOAD_PRODUCT_ID + CRLF
                + event.text() + CRLF
                + END_VCALENDAR;
    }
}
