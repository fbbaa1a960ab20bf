package de.bycsitsm.calsync.caldav;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Low-level CalDAV protocol client that communicates with CalDAV servers
 * and ICS feeds using Java's built-in {@link HttpClient}.
 * <p>
 * Supports the four verbs the synchronization pipelines need:
 * <ul>
 *   <li>{@code PROPFIND} to discover the calendar collections below a base URL,</li>
 *   <li>{@code REPORT} ({@code calendar-query}) to fetch every VEVENT of a collection,</li>
 *   <li>{@code PUT} to store a single calendar object resource,</li>
 *   <li>{@code GET} to download a plain ICS feed.</li>
 * </ul>
 * Every call is blocking and surfaces failures as {@link CalDavException}.
 */
@Component
public class CalDavClient {

    private static final Logger log = LoggerFactory.getLogger(CalDavClient.class);

    private static final String DAV_NS = "DAV:";
    private static final String CALDAV_NS = "urn:ietf:params:xml:ns:caldav";

    private static final String XML_CONTENT_TYPE = "application/xml; charset=utf-8";
    private static final String CALENDAR_CONTENT_TYPE = "text/calendar; charset=utf-8";

    /**
     * XML body for a PROPFIND request that discovers calendar collections.
     */
    private static final String PROPFIND_CALENDARS_XML = """
            <?xml version="1.0" encoding="utf-8" ?>
            <d:propfind xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav">
              <d:prop>
                 <d:resourcetype />
                 <d:displayname />
                 <c:supported-calendar-component-set />
              </d:prop>
            </d:propfind>""";

    /**
     * XML body for a REPORT calendar-query that returns the data of every VEVENT.
     */
    private static final String CALENDAR_QUERY_XML = """
            <?xml version="1.0" encoding="utf-8" ?>
            <c:calendar-query xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav">
              <d:prop>
                <d:getetag />
                <c:calendar-data />
              </d:prop>
              <c:filter>
                <c:comp-filter name="VCALENDAR">
                  <c:comp-filter name="VEVENT" />
                </c:comp-filter>
              </c:filter>
            </c:calendar-query>""";

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public CalDavClient(CalDavProperties properties) {
        var clientBuilder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL);

        if (properties.trustAllCertificates()) {
            log.warn("CalDAV client is configured to accept all SSL certificates including self-signed. "
                    + "Set caldav.trust-all-certificates=false to enforce certificate validation.");
            clientBuilder.sslContext(createTrustAllSslContext());
        }

        this.httpClient = clientBuilder.build();
        this.requestTimeout = properties.requestTimeout();
    }

    /**
     * Discovers the calendar collections directly below the given URL.
     * <p>
     * If the server rejects the PROPFIND, the request is repeated once with the
     * trailing slash of the URL toggled, since servers disagree on whether a
     * collection URL ends with a slash.
     *
     * @param url         the collection base URL
     * @param credentials the credentials for authentication
     * @return the hrefs of all calendar collections, in document order
     * @throws CalDavException if both requests fail or the response cannot be parsed
     */
    public List<String> discoverCalendars(String url, Credentials credentials) {
        try {
            var response = sendPropfind(url, credentials);
            if (!isSuccess(response.statusCode())) {
                var alternateUrl = toggleTrailingSlash(url);
                log.debug("PROPFIND to {} returned status {}, retrying with {}",
                        url, response.statusCode(), alternateUrl);
                response = sendPropfind(alternateUrl, credentials);
                if (!isSuccess(response.statusCode())) {
                    throw new CalDavException("Calendar discovery at " + alternateUrl
                            + " failed with status " + response.statusCode() + ".");
                }
            }
            return parseMultistatusResponse(response.body());
        } catch (CalDavException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalDavException("Interrupted while discovering calendars at " + url, e);
        } catch (Exception e) {
            throw new CalDavException("Failed to discover calendars at " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Fetches the raw ICS documents of every event in a calendar collection.
     * <p>
     * The response status is not checked: the body is parsed as a multistatus
     * document whatever the status, and only a parse failure is reported.
     *
     * @param baseUrl      the URL whose scheme, host and port resolve relative calendar paths
     * @param calendarPath the absolute URL or server-relative path of the calendar collection
     * @param credentials  the credentials for authentication
     * @return one ICS document per {@code calendar-data} element, in response order
     * @throws CalDavException if the request fails or the response cannot be parsed
     */
    public List<String> fetchEvents(String baseUrl, String calendarPath, Credentials credentials) {
        var calendarUrl = resolveCalendarUrl(baseUrl, calendarPath);
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(calendarUrl))
                    .method("REPORT", HttpRequest.BodyPublishers.ofString(CALENDAR_QUERY_XML))
                    .header("Content-Type", XML_CONTENT_TYPE)
                    .header("Depth", "1")
                    .header("Authorization", credentials.basicAuthorization())
                    .timeout(requestTimeout)
                    .build();

            log.debug("Sending REPORT calendar-query to {}", calendarUrl);
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return parseCalendarQueryResponse(response.body());
        } catch (CalDavException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalDavException("Interrupted while fetching events from " + calendarUrl, e);
        } catch (Exception e) {
            throw new CalDavException("Failed to fetch events from " + calendarUrl + ": " + e.getMessage(), e);
        }
    }

    /**
     * Stores a calendar object resource with a {@code PUT}, overwriting any existing resource.
     *
     * @param url         the URL of the calendar object resource
     * @param icsBody     the complete VCALENDAR document
     * @param credentials the credentials for authentication
     * @return the HTTP status returned by the server
     * @throws CalDavException if the request cannot be sent
     */
    public int putCalendarObject(String url, String icsBody, Credentials credentials) {
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .PUT(HttpRequest.BodyPublishers.ofString(icsBody))
                    .header("Content-Type", CALENDAR_CONTENT_TYPE)
                    .header("Authorization", credentials.basicAuthorization())
                    .timeout(requestTimeout)
                    .build();

            log.debug("Sending PUT to {}", url);
            return httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalDavException("Interrupted while uploading " + url, e);
        } catch (Exception e) {
            throw new CalDavException("Failed to upload " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Downloads a plain ICS feed without authentication.
     *
     * @param url the feed URL
     * @return the feed body
     * @throws CalDavException if the request fails or the server does not answer with a success status
     */
    public String fetchFeed(String url) {
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .GET()
                    .timeout(requestTimeout)
                    .build();

            log.debug("Fetching ICS feed {}", url);
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (!isSuccess(response.statusCode())) {
                throw new CalDavException("Failed to fetch ICS file: server returned status "
                        + response.statusCode() + ".");
            }
            return response.body();
        } catch (CalDavException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalDavException("Interrupted while fetching ICS file " + url, e);
        } catch (Exception e) {
            throw new CalDavException("Failed to fetch ICS file " + url + ": " + e.getMessage(), e);
        }
    }

    private HttpResponse<String> sendPropfind(String url, Credentials credentials)
            throws IOException, InterruptedException {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .method("PROPFIND", HttpRequest.BodyPublishers.ofString(PROPFIND_CALENDARS_XML))
                .header("Content-Type", XML_CONTENT_TYPE)
                .header("Depth", "1")
                .header("Authorization", credentials.basicAuthorization())
                .timeout(requestTimeout)
                .build();

        log.debug("Sending PROPFIND to {}", url);
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Extracts the hrefs of all calendar collections from a PROPFIND multistatus response.
     * A response is a calendar when its {@code resourcetype} contains a CalDAV
     * {@code calendar} element. Duplicates are kept.
     */
    List<String> parseMultistatusResponse(String xml) {
        var hrefs = new ArrayList<String>();
        try {
            var document = parse(xml);
            var responses = document.getElementsByTagNameNS(DAV_NS, "response");
            for (int i = 0; i < responses.getLength(); i++) {
                var response = (Element) responses.item(i);
                var href = getTextContent(response, DAV_NS, "href");
                if (href == null) {
                    continue;
                }
                if (isCalendarResource(response)) {
                    hrefs.add(href.strip());
                }
            }
        } catch (Exception e) {
            throw new CalDavException("Failed to parse server response: " + e.getMessage(), e);
        }
        return hrefs;
    }

    /**
     * Extracts the text of every {@code calendar-data} element from a calendar-query response.
     */
    List<String> parseCalendarQueryResponse(String xml) {
        var documents = new ArrayList<String>();
        try {
            var document = parse(xml);
            var calendarData = document.getElementsByTagNameNS(CALDAV_NS, "calendar-data");
            for (int i = 0; i < calendarData.getLength(); i++) {
                var text = calendarData.item(i).getTextContent();
                if (text != null && !text.isEmpty()) {
                    documents.add(text);
                }
            }
        } catch (Exception e) {
            throw new CalDavException("Failed to parse calendar-query response: " + e.getMessage(), e);
        }
        return documents;
    }

    private Document parse(String xml) throws Exception {
        var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        var builder = factory.newDocumentBuilder();
        return builder.parse(new InputSource(new StringReader(xml)));
    }

    private boolean isCalendarResource(Element response) {
        var propstats = response.getElementsByTagNameNS(DAV_NS, "propstat");
        for (int i = 0; i < propstats.getLength(); i++) {
            var propstat = (Element) propstats.item(i);
            var props = propstat.getElementsByTagNameNS(DAV_NS, "prop");
            for (int j = 0; j < props.getLength(); j++) {
                var prop = (Element) props.item(j);
                var resourceTypes = prop.getElementsByTagNameNS(DAV_NS, "resourcetype");
                for (int k = 0; k < resourceTypes.getLength(); k++) {
                    var resourceType = (Element) resourceTypes.item(k);
                    var calendarElements = resourceType.getElementsByTagNameNS(CALDAV_NS, "calendar");
                    if (calendarElements.getLength() > 0) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private @Nullable String getTextContent(Element parent, String namespace, String localName) {
        var elements = parent.getElementsByTagNameNS(namespace, localName);
        if (elements.getLength() > 0) {
            return elements.item(0).getTextContent();
        }
        return null;
    }

    /**
     * Resolves a calendar href against the base URL. Absolute URLs are returned
     * unchanged, paths borrow the scheme, host and port of the base URL.
     */
    static String resolveCalendarUrl(String baseUrl, String calendarPath) {
        if (calendarPath.startsWith("http://") || calendarPath.startsWith("https://")) {
            return calendarPath;
        }
        URI baseUri;
        try {
            baseUri = URI.create(baseUrl);
        } catch (IllegalArgumentException e) {
            throw new CalDavException("Invalid CalDAV URL " + baseUrl + ": " + e.getMessage(), e);
        }
        if (baseUri.getScheme() == null || baseUri.getHost() == null) {
            throw new CalDavException("Invalid CalDAV URL " + baseUrl + ": scheme and host are required.");
        }

        var resolved = new StringBuilder()
                .append(baseUri.getScheme())
                .append("://")
                .append(baseUri.getHost());
        if (baseUri.getPort() != -1) {
            resolved.append(':').append(baseUri.getPort());
        }
        if (!calendarPath.startsWith("/")) {
            resolved.append('/');
        }
        return resolved.append(calendarPath).toString();
    }

    static String toggleTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url + "/";
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Creates an {@link SSLContext} that trusts all certificates, including self-signed ones.
     */
    private SSLContext createTrustAllSslContext() {
        try {
            var trustAllManager = new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                    // Trust all client certificates
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                    // Trust all server certificates
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            };

            var sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{trustAllManager}, null);
            return sslContext;
        } catch (NoSuchAlgorithmException | KeyManagementException e) {
            throw new CalDavException("Failed to create SSL context for trusting all certificates.", e);
        }
    }
}
