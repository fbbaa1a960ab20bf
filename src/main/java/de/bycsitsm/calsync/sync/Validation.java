package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.caldav.CalDavException;
import de.bycsitsm.calsync.caldav.Credentials;

final class Validation {

    private Validation() {
    }

    static void requireCalDavInputs(String url, Credentials credentials) {
        if (url == null || url.isBlank()) {
            throw new CalDavException("CalDAV URL must not be empty.");
        }
        if (credentials.username() == null || credentials.username().isBlank()) {
            throw new CalDavException("Username must not be empty.");
        }
        if (credentials.password() == null || credentials.password().isBlank()) {
            throw new CalDavException("Password must not be empty.");
        }
    }
}
