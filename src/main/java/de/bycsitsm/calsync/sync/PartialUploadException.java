package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.caldav.CalDavException;

/**
 * Thrown when at least one event of a feed could not be uploaded. Events that were
 * uploaded successfully stay on the server.
 */
public class PartialUploadException extends CalDavException {

    private final int uploaded;
    private final int failed;

    public PartialUploadException(int uploaded, int failed) {
        super("Uploaded " + uploaded + " events but " + failed + " failed");
        this.uploaded = uploaded;
        this.failed = failed;
    }

    public int uploaded() {
        return uploaded;
    }

    public int failed() {
        return failed;
    }
}
