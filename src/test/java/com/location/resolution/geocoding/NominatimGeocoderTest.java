package com.location.resolution.geocoding;

import com.location.resolution.core.model.GeocodingResult;
import com.location.resolution.core.model.GeocodingSource;
import com.location.resolution.core.model.GeographicCoordinates;
import com.location.resolution.core.model.LocationHierarchy;
import com.location.resolution.core.model.LocationType;
import com.location.resolution.upstream.LookupOutcome;
import com.location.resolution.upstream.StubHttpServer;
import com.location.resolution.upstream.UpstreamConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NominatimGeocoderTest {

    private static final String NAGOLD = """
            [{
              "lat": "48.5519",
              "lon": "8.7256",
              "display_name": "Nagold, Landkreis Calw, Baden-Württemberg, 72202, Deutschland",
              "address": {
                "town": "Nagold",
                "county": "Landkreis Calw",
                "state": "Baden-Württemberg",
                "postcode": "72202",
                "country": "Deutschland",
                "country_code": "de"
              },
              "extratags": {"population": "22000"}
            }]
            """;

    private static NominatimPlace place(String displayName, Map<String, String> address) {
        return new NominatimPlace("48.5", "8.7", displayName, address, Map.of());
    }

    @Nested
    @DisplayName("HTTP round trip")
    class HttpTests {

        private StubHttpServer server;
        private NominatimGeocoder geocoder;

        @BeforeEach
        void setUp() throws IOException {
            server = new StubHttpServer();
            geocoder = NominatimGeocoder.builder()
                    .config(new UpstreamConfig(server.baseUrl(), Duration.ofSeconds(5), "location-test/1.0"))
                    .build();
        }

        @AfterEach
        void tearDown() {
            server.close();
        }

        @Test
        @DisplayName("Parses the first hit into coordinates, hierarchy and confidence")
        void parsesHit() {
            server.respond("/search", 200, NAGOLD);

            LookupOutcome<GeocodingResult> outcome = geocoder.resolve("Nagold", "DE").join();

            assertTrue(outcome.isOk());
            GeocodingResult result = outcome.value();
            assertEquals(48.5519, result.coordinates().lat(), 1e-9);
            assertEquals(8.7256, result.coordinates().lng(), 1e-9);
            assertEquals(GeocodingSource.EXTERNAL, result.source());
            assertEquals(0.9, result.confidence());

            LocationHierarchy hierarchy = result.hierarchy();
            assertEquals("Nagold", hierarchy.city());
            assertEquals("DE", hierarchy.countryCode());
            assertEquals("Deutschland", hierarchy.country());
            assertEquals("Baden-Württemberg", hierarchy.region());
            assertEquals("Landkreis Calw", hierarchy.district());
            assertEquals("72202", hierarchy.postalCode());
            assertEquals(22000L, hierarchy.population());
            assertEquals(LocationType.TOWN, hierarchy.locationType());
        }

        @Test
        @DisplayName("Sends the search parameters and an identifying User-Agent")
        void requestShape() {
            server.respond("/search", 200, NAGOLD);

            geocoder.resolve("Bad Urach", "Germany").join();

            String query = server.lastRequest().getRawQuery();
            assertTrue(query.startsWith("q=Bad+Urach&format=json&limit=1&addressdetails=1&extratags=1"), query);
            assertTrue(query.endsWith("&countrycodes=de"), query);
            assertEquals("location-test/1.0", server.userAgents().get(0));
        }

        @Test
        @DisplayName("Unknown preferred country is not sent")
        void unknownCountry() {
            server.respond("/search", 200, "[]");

            geocoder.resolve("Nagold", "Atlantis").join();

            assertFalse(server.lastRequest().getRawQuery().contains("countrycodes"));
        }

        @Test
        @DisplayName("Empty array is NOT_FOUND")
        void emptyArray() {
            server.respond("/search", 200, "[]");
            assertEquals(LookupOutcome.Status.NOT_FOUND, geocoder.resolve("Atlantis", null).join().status());
        }

        @Test
        @DisplayName("Non-2xx status is UPSTREAM_UNAVAILABLE")
        void serverError() {
            server.respond("/search", 503, "{}");
            assertEquals(LookupOutcome.Status.UPSTREAM_UNAVAILABLE,
                    geocoder.resolve("Nagold", null).join().status());
        }

        @Test
        @DisplayName("Unparseable body is MALFORMED")
        void invalidJson() {
            server.respond("/search", 200, "<html>rate limited</html>");
            assertEquals(LookupOutcome.Status.MALFORMED, geocoder.resolve("Nagold", null).join().status());
        }

        @Test
        @DisplayName("Unreachable server is UPSTREAM_UNAVAILABLE")
        void unreachable() {
            String baseUrl = server.baseUrl();
            server.close();
            NominatimGeocoder offline = NominatimGeocoder.builder()
                    .config(new UpstreamConfig(baseUrl, Duration.ofSeconds(2), null))
                    .build();

            assertEquals(LookupOutcome.Status.UPSTREAM_UNAVAILABLE, offline.resolve("Nagold", null).join().status());
        }

        @Test
        @DisplayName("Unsupported URL scheme is UPSTREAM_UNAVAILABLE instead of an exception")
        void unsupportedScheme() {
            NominatimGeocoder ftp = NominatimGeocoder.builder()
                    .config(new UpstreamConfig("ftp://nominatim.example.org", Duration.ofSeconds(2), null))
                    .build();

            LookupOutcome<GeocodingResult> outcome = assertDoesNotThrow(() -> ftp.resolve("Nagold", null).join());

            assertEquals(LookupOutcome.Status.UPSTREAM_UNAVAILABLE, outcome.status());
        }

        @Test
        @DisplayName("Illegal User-Agent value is UPSTREAM_UNAVAILABLE instead of an exception")
        void illegalUserAgent() {
            NominatimGeocoder broken = NominatimGeocoder.builder()
                    .config(new UpstreamConfig(server.baseUrl(), Duration.ofSeconds(2), "agent\r\nX-Injected: 1"))
                    .build();

            LookupOutcome<GeocodingResult> outcome = assertDoesNotThrow(() -> broken.resolve("Nagold", null).join());

            assertEquals(LookupOutcome.Status.UPSTREAM_UNAVAILABLE, outcome.status());
            assertTrue(server.requests().isEmpty());
        }

        @Test
        @DisplayName("Blank query is NOT_FOUND without a request")
        void blankQuery() {
            assertEquals(LookupOutcome.Status.NOT_FOUND, geocoder.resolve("  ", null).join().status());
            assertTrue(server.requests().isEmpty());
        }
    }

    @Nested
    @DisplayName("Hierarchy extraction")
    class ExtractionTests {

        private final GeographicCoordinates point = GeographicCoordinates.of(48.5, 8.7);

        @Test
        @DisplayName("City falls back through town, village and municipality")
        void cityFallbacks() {
            assertEquals("Dorf", NominatimGeocoder.extractHierarchy(
                    place("x", Map.of("village", "Dorf")), point).city());
            assertEquals("Gemeinde", NominatimGeocoder.extractHierarchy(
                    place("x", Map.of("municipality", "Gemeinde")), point).city());
        }

        @Test
        @DisplayName("Without any locality the first display name segment is the city")
        void displayNameFallback() {
            LocationHierarchy hierarchy = NominatimGeocoder.extractHierarchy(
                    place("Schwarzwald, Baden-Württemberg, Deutschland", Map.of("state", "Baden-Württemberg")), point);
            assertEquals("Schwarzwald", hierarchy.city());
            assertEquals("Unknown", hierarchy.country());
            assertEquals("XX", hierarchy.countryCode());
        }

        @Test
        @DisplayName("Region falls back to province; suburb to neighbourhood")
        void otherFallbacks() {
            LocationHierarchy hierarchy = NominatimGeocoder.extractHierarchy(
                    place("x", Map.of("city", "Roma", "province", "Lazio", "neighbourhood", "Trastevere")), point);
            assertEquals("Lazio", hierarchy.region());
            assertEquals("Trastevere", hierarchy.suburb());
        }

        @Test
        @DisplayName("Unparseable coordinates are MALFORMED")
        void badCoordinates() {
            NominatimGeocoder geocoder = NominatimGeocoder.builder().baseUrl("http://localhost").build();
            NominatimPlace broken = new NominatimPlace("north", "8.7", "x", Map.of(), Map.of());
            assertEquals(LookupOutcome.Status.MALFORMED, geocoder.toResult(broken, "x").status());
        }
    }

    @Nested
    @DisplayName("Confidence and type rules")
    class RuleTests {

        private final NominatimGeocoder geocoder = NominatimGeocoder.builder().baseUrl("http://localhost").build();

        private double confidence(NominatimPlace place, String query) {
            return geocoder.toResult(place, query).value().confidence();
        }

        @Test
        @DisplayName("Display name containing the query scores 0.9")
        void displayNameContains() {
            assertEquals(0.9, confidence(place("Nagold, Calw", Map.of("town", "Nagold")), "Nagold"));
        }

        @Test
        @DisplayName("Address component equal to the query scores 0.8")
        void componentEquals() {
            assertEquals(0.8, confidence(place("Munich, Bavaria", Map.of("city", "München")), "münchen"));
        }

        @Test
        @DisplayName("Address component containing the query scores 0.7")
        void componentContains() {
            assertEquals(0.7, confidence(place("Munich, Bavaria", Map.of("city", "München")), "münch"));
        }

        @Test
        @DisplayName("Otherwise the floor of 0.6 applies")
        void floor() {
            assertEquals(0.6, confidence(place("Munich, Bavaria", Map.of("city", "München")), "monaco"));
        }

        @Test
        @DisplayName("Type is inferred from the most specific address component")
        void typeInference() {
            assertEquals(LocationType.CITY, LocationTypeRules.infer(place("x", Map.of("city", "a", "state", "b"))));
            assertEquals(LocationType.VILLAGE, LocationTypeRules.infer(place("x", Map.of("village", "a"))));
            assertEquals(LocationType.SUBURB, LocationTypeRules.infer(place("x", Map.of("suburb", "a"))));
            assertEquals(LocationType.DISTRICT, LocationTypeRules.infer(place("x", Map.of("county", "a"))));
            assertEquals(LocationType.REGION, LocationTypeRules.infer(place("x", Map.of("state", "a"))));
            assertEquals(LocationType.COUNTRY, LocationTypeRules.infer(place("x", Map.of("country", "a"))));
            assertEquals(LocationType.CITY, LocationTypeRules.infer(place("x", Map.of())));
        }
    }

    @Test
    @DisplayName("Provider name includes the base URL")
    void providerName() {
        assertEquals("Nominatim/https://nominatim.openstreetmap.org",
                NominatimGeocoder.createDefault().getProviderName());
    }
}
