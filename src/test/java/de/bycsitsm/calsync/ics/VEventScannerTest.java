package de.bycsitsm.calsync.ics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VEventScannerTest {

    @Test
    void scanning_extracts_terminated_blocks_with_crlf_line_endings() {
        var ics = """
                BEGIN:VCALENDAR
                VERSION:2.0
                BEGIN:VEVENT
                UID:first@example.com
                SUMMARY:Standup
                END:VEVENT
                BEGIN:VEVENT
                UID:second@example.com
                SUMMARY:Retro
                END:VEVENT
                END:VCALENDAR
                """;

        var events = VEventScanner.scan(ics);

        assertThat(events).hasSize(2);
        assertThat(events.get(0).text())
                .isEqualTo("BEGIN:VEVENT\r\nUID:first@example.com\r\nSUMMARY:Standup\r\nEND:VEVENT\r\n");
        assertThat(events.get(0).uid()).isEqualTo("first@example.com");
        assertThat(events.get(1).uid()).isEqualTo("second@example.com");
    }

    @Test
    void scanning_normalizes_crlf_input() {
        var ics = "BEGIN:VCALENDAR\r\nBEGIN:VEVENT\r\nUID:a\r\nEND:VEVENT\r\nEND:VCALENDAR\r\n";

        var events = VEventScanner.scan(ics);

        assertThat(events).singleElement()
                .satisfies(event -> assertThat(event.text()).isEqualTo("BEGIN:VEVENT\r\nUID:a\r\nEND:VEVENT\r\n"));
    }

    @Test
    void scanning_drops_unterminated_block_at_end_of_input() {
        var ics = """
                BEGIN:VCALENDAR
                BEGIN:VEVENT
                UID:complete
                END:VEVENT
                BEGIN:VEVENT
                UID:truncated
                SUMMARY:Never closed
                """;

        var events = VEventScanner.scan(ics);

        assertThat(events).extracting(VEvent::uid).containsExactly("complete");
    }

    @Test
    void scanning_empty_input_yields_no_events() {
        assertThat(VEventScanner.scan("")).isEmpty();
    }

    @Test
    void scanning_calendar_without_events_yields_no_events() {
        var ics = """
                BEGIN:VCALENDAR
                VERSION:2.0
                BEGIN:VTODO
                UID:todo
                END:VTODO
                END:VCALENDAR
                """;

        assertThat(VEventScanner.scan(ics)).isEmpty();
    }

    @Test
    void block_without_uid_is_kept_by_scan_but_dropped_by_scan_with_uid() {
        var ics = """
                BEGIN:VEVENT
                SUMMARY:No identifier
                END:VEVENT
                BEGIN:VEVENT
                UID:with-uid
                END:VEVENT
                """;

        assertThat(VEventScanner.scan(ics)).hasSize(2);
        assertThat(VEventScanner.scan(ics).get(0).hasUid()).isFalse();
        assertThat(VEventScanner.scanWithUid(ics)).extracting(VEvent::uid).containsExactly("with-uid");
    }

    @Test
    void blank_uid_counts_as_missing() {
        var ics = """
                BEGIN:VEVENT
                UID:\s\s
                END:VEVENT
                """;

        assertThat(VEventScanner.scanWithUid(ics)).isEmpty();
    }

    @Test
    void uid_value_is_trimmed() {
        var ics = "BEGIN:VEVENT\nUID:  spaced-uid  \nEND:VEVENT\n";

        assertThat(VEventScanner.scan(ics).get(0).uid()).isEqualTo("spaced-uid");
    }

    @Test
    void begin_inside_open_block_starts_a_fresh_block() {
        var ics = """
                BEGIN:VEVENT
                UID:abandoned
                BEGIN:VEVENT
                UID:kept
                END:VEVENT
                """;

        var events = VEventScanner.scan(ics);

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.uid()).isEqualTo("kept");
            assertThat(event.text()).doesNotContain("abandoned");
        });
    }

    @Test
    void nested_alarm_stays_inside_its_event() {
        var ics = """
                BEGIN:VEVENT
                UID:with-alarm
                BEGIN:VALARM
                TRIGGER:-PT15M
                END:VALARM
                END:VEVENT
                """;

        var events = VEventScanner.scan(ics);

        assertThat(events).singleElement()
                .satisfies(event -> assertThat(event.text()).contains("BEGIN:VALARM\r\nTRIGGER:-PT15M\r\nEND:VALARM\r\n"));
    }

    @Test
    void end_line_outside_a_block_is_ignored() {
        var ics = """
                END:VEVENT
                BEGIN:VEVENT
                UID:a
                END:VEVENT
                """;

        assertThat(VEventScanner.scan(ics)).hasSize(1);
    }
}
