package de.bycsitsm.calsync.sync;

/**
 * Result of one ICS to CalDAV synchronization in which every upload succeeded.
 *
 * @param uploaded the number of events stored on the CalDAV server
 * @param total    the number of UID-bearing events in the feed
 */
public record UploadResult(int uploaded, int total) {

    public String message() {
        return "Uploaded " + uploaded + " of " + total + " events";
    }
}
