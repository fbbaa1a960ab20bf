package de.bycsitsm.calsync.caldav;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalDavClientHttpTest {

    private static final String MULTISTATUS = """
            <?xml version="1.0" encoding="utf-8"?>
            <d:multistatus xmlns:d="DAV:" xmlns:cal="urn:ietf:params:xml:ns:caldav">
              <d:response>
                <d:href>/cal/team/</d:href>
                <d:propstat>
                  <d:prop><d:resourcetype><d:collection/><cal:calendar/></d:resourcetype></d:prop>
                  <d:status>HTTP/1.1 200 OK</d:status>
                </d:propstat>
              </d:response>
            </d:multistatus>
            """;

    private static final String CALENDAR_QUERY_RESPONSE = """
            <?xml version="1.0" encoding="utf-8"?>
            <d:multistatus xmlns:d="DAV:" xmlns:cal="urn:ietf:params:xml:ns:caldav">
              <d:response>
                <d:href>/cal/team/a.ics</d:href>
                <d:propstat>
                  <d:prop><cal:calendar-data>BEGIN:VCALENDAR
            END:VCALENDAR
            </cal:calendar-data></d:prop>
                </d:propstat>
              </d:response>
            </d:multistatus>
            """;

    private final Credentials credentials = new Credentials("alice", "s3cret");
    private final CalDavClient client = new CalDavClient(new CalDavProperties(false, null, null));

    private WireMockServer server;

    @BeforeEach
    void startServer() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
    }

    @AfterEach
    void stopServer() {
        if (server.isRunning()) {
            server.stop();
        }
    }

    private String url(String path) {
        return "http://localhost:" + server.port() + path;
    }

    @Test
    void propfind_sends_depth_and_credentials() {
        server.stubFor(WireMock.request("PROPFIND", urlEqualTo("/cal/"))
                .withHeader("Depth", equalTo("1"))
                .withHeader("Authorization", equalTo(credentials.basicAuthorization()))
                .withRequestBody(containing("supported-calendar-component-set"))
                .willReturn(aResponse().withStatus(207).withBody(MULTISTATUS)));

        var calendars = client.discoverCalendars(url("/cal/"), credentials);

        assertThat(calendars).containsExactly("/cal/team/");
    }

    @Test
    void propfind_is_retried_once_with_trailing_slash_added() {
        server.stubFor(WireMock.request("PROPFIND", urlEqualTo("/cal"))
                .willReturn(aResponse().withStatus(404)));
        server.stubFor(WireMock.request("PROPFIND", urlEqualTo("/cal/"))
                .willReturn(aResponse().withStatus(207).withBody(MULTISTATUS)));

        var calendars = client.discoverCalendars(url("/cal"), credentials);

        assertThat(calendars).containsExactly("/cal/team/");
        server.verify(1, WireMock.requestedFor("PROPFIND", urlEqualTo("/cal")));
        server.verify(1, WireMock.requestedFor("PROPFIND", urlEqualTo("/cal/")));
    }

    @Test
    void propfind_is_retried_once_with_trailing_slash_removed() {
        server.stubFor(WireMock.request("PROPFIND", urlEqualTo("/cal/"))
                .willReturn(aResponse().withStatus(405)));
        server.stubFor(WireMock.request("PROPFIND", urlEqualTo("/cal"))
                .willReturn(aResponse().withStatus(207).withBody(MULTISTATUS)));

        assertThat(client.discoverCalendars(url("/cal/"), credentials)).containsExactly("/cal/team/");
    }

    @Test
    void propfind_fails_when_both_url_variants_are_rejected() {
        server.stubFor(WireMock.request("PROPFIND", urlEqualTo("/cal"))
                .willReturn(aResponse().withStatus(401)));
        server.stubFor(WireMock.request("PROPFIND", urlEqualTo("/cal/"))
                .willReturn(aResponse().withStatus(401)));

        assertThatThrownBy(() -> client.discoverCalendars(url("/cal"), credentials))
                .isInstanceOf(CalDavException.class)
                .hasMessageContaining("failed with status 401");
        server.verify(2, WireMock.requestedFor("PROPFIND", WireMock.urlMatching("/cal/?")));
    }

    @Test
    void propfind_with_malformed_body_fails() {
        server.stubFor(WireMock.request("PROPFIND", urlEqualTo("/cal/"))
                .willReturn(aResponse().withStatus(207).withBody("<multistatus")));

        assertThatThrownBy(() -> client.discoverCalendars(url("/cal/"), credentials))
                .isInstanceOf(CalDavException.class);
    }

    @Test
    void report_body_is_parsed_even_when_status_is_not_successful() {
        server.stubFor(WireMock.request("REPORT", urlEqualTo("/cal/team/"))
                .withHeader("Depth", equalTo("1"))
                .withRequestBody(containing("comp-filter name=\"VEVENT\""))
                .willReturn(aResponse().withStatus(500).withBody(CALENDAR_QUERY_RESPONSE)));

        var documents = client.fetchEvents(url("/"), "/cal/team/", credentials);

        assertThat(documents).hasSize(1);
    }

    @Test
    void report_with_unparsable_body_fails() {
        server.stubFor(WireMock.request("REPORT", urlEqualTo("/cal/team/"))
                .willReturn(aResponse().withStatus(500).withBody("Internal Server Error")));

        assertThatThrownBy(() -> client.fetchEvents(url("/"), "/cal/team/", credentials))
                .isInstanceOf(CalDavException.class)
                .hasMessageContaining("Failed to parse calendar-query response");
    }

    @Test
    void put_sends_calendar_content_type_and_returns_status() {
        server.stubFor(put(urlEqualTo("/cal/team/abc.ics")).willReturn(aResponse().withStatus(201)));

        int status = client.putCalendarObject(url("/cal/team/abc.ics"), "BEGIN:VCALENDAR\r\nEND:VCALENDAR\r\n",
                credentials);

        assertThat(status).isEqualTo(201);
        server.verify(putRequestedFor(urlEqualTo("/cal/team/abc.ics"))
                .withHeader("Content-Type", equalTo("text/calendar; charset=utf-8"))
                .withHeader("Authorization", equalTo(credentials.basicAuthorization())));
    }

    @Test
    void feed_is_fetched_without_credentials() {
        server.stubFor(get(urlEqualTo("/feed.ics")).willReturn(aResponse().withStatus(200).withBody("BEGIN:VCALENDAR")));

        assertThat(client.fetchFeed(url("/feed.ics"))).isEqualTo("BEGIN:VCALENDAR");
        server.verify(WireMock.getRequestedFor(urlEqualTo("/feed.ics")).withoutHeader("Authorization"));
    }

    @Test
    void feed_with_error_status_fails() {
        server.stubFor(get(urlEqualTo("/feed.ics")).willReturn(aResponse().withStatus(404)));

        assertThatThrownBy(() -> client.fetchFeed(url("/feed.ics")))
                .isInstanceOf(CalDavException.class)
                .hasMessageContaining("status 404");
    }

    @Test
    void unreachable_server_is_reported_as_caldav_exception() {
        var unreachable = url("/cal/");
        server.stop();

        assertThatThrownBy(() -> client.discoverCalendars(unreachable, credentials))
                .isInstanceOf(CalDavException.class)
                .hasMessageContaining("Failed to discover calendars");
    }
}
