package de.bycsitsm.calsync.ics;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented scanner that cuts VEVENT blocks out of ICS text.
 * <p>
 * The scanner is a two-state machine. {@code BEGIN:VEVENT} moves it from
 * {@link State#OUTSIDE} to {@link State#INSIDE_VEVENT} and starts a fresh block;
 * inside a block every line is buffered with a CRLF terminator, whatever the
 * input's line endings; {@code END:VEVENT} completes the block and moves the
 * scanner back outside. A block still open at the end of the input is dropped.
 * <p>
 * Nothing beyond the boundary lines and the {@code UID:} line is interpreted.
 */
public final class VEventScanner {

    private static final Logger log = LoggerFactory.getLogger(VEventScanner.class);

    static final String CRLF = "\r\n";

    private static final String BEGIN_VEVENT = "BEGIN:VEVENT";
    private static final String END_VEVENT = "END:VEVENT";
    private static final String UID_PREFIX = "UID:";

    enum State {
        OUTSIDE,
        INSIDE_VEVENT
    }

    private VEventScanner() {
    }

    /**
     * Scans the given ICS text.
     *
     * @param ics the ICS document, with any line endings
     * @return the completed VEVENT blocks in input order
     */
    public static List<VEvent> scan(String ics) {
        var events = new ArrayList<VEvent>();
        var state = State.OUTSIDE;
        var buffer = new StringBuilder();
        @Nullable String uid = null;

        for (var line : (Iterable<String>) ics.lines()::iterator) {
            if (line.startsWith(BEGIN_VEVENT)) {
                state = State.INSIDE_VEVENT;
                buffer.setLength(0);
                uid = null;
            }

            switch (state) {
                case OUTSIDE -> {
                    // lines between blocks are not part of any event
                }
                case INSIDE_VEVENT -> {
                    buffer.append(line).append(CRLF);
                    if (line.startsWith(UID_PREFIX)) {
                        var value = line.substring(UID_PREFIX.length()).strip();
                        uid = value.isEmpty() ? null : value;
                    }
                    if (line.startsWith(END_VEVENT)) {
                        events.add(new VEvent(uid, buffer.toString()));
                        buffer.setLength(0);
                        uid = null;
                        state = State.OUTSIDE;
                    }
                }
            }
        }

        if (state == State.INSIDE_VEVENT) {
            log.debug("Dropping unterminated VEVENT block at end of input");
        }
        return events;
    }

    /**
     * Scans the given ICS text and keeps only the blocks that carry a UID.
     *
     * @param ics the ICS document
     * @return the UID-bearing VEVENT blocks in input order
     */
    public static List<VEvent> scanWithUid(String ics) {
        var events = scan(ics);
        var withUid = events.stream().filter(VEvent::hasUid).toList();
        if (withUid.size() < events.size()) {
            log.debug("Ignoring {} VEVENT block(s) without UID", events.size() - withUid.size());
        }
        return withUid;
    }
}
