package de.bycsitsm.calsync.caldav;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Basic-Auth credentials for a CalDAV server.
 *
 * @param username the username
 * @param password the password
 */
public record Credentials(String username, String password) {

    /**
     * Returns the value of the {@code Authorization} header for these credentials.
     */
    public String basicAuthorization() {
        var encoded = Base64.getEncoder().encodeToString(
                (username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return "Basic " + encoded;
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=****]";
    }
}
