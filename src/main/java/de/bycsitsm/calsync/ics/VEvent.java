package de.bycsitsm.calsync.ics;

import org.jspecify.annotations.Nullable;

/**
 * A single {@code BEGIN:VEVENT} ... {@code END:VEVENT} block, kept as opaque text.
 *
 * @param uid  the value of the block's {@code UID:} line, or {@code null} if it has none
 * @param text the block including its boundary lines, every line terminated by CRLF
 */
public record VEvent(@Nullable String uid, String text) {

    public boolean hasUid() {
        return uid != null;
    }
}
