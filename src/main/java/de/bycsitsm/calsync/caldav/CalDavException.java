package de.bycsitsm.calsync.caldav;

/**
 * Exception thrown when a CalDAV or ICS feed operation fails, either at the
 * transport level, because of an unexpected status, or while parsing a response.
 */
public class CalDavException extends RuntimeException {

    public CalDavException(String message) {
        super(message);
    }

    public CalDavException(String message, Throwable cause) {
        super(message, cause);
    }
}
