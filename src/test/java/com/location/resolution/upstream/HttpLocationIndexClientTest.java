package com.location.resolution.upstream;

import com.location.resolution.core.model.GeographicCoordinates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpLocationIndexClientTest {

    private StubHttpServer server;
    private HttpLocationIndexClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
        client = HttpLocationIndexClient.builder()
                .baseUrl(server.baseUrl() + "/api/")
                .build();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Nested
    @DisplayName("Requests")
    class RequestTests {

        @Test
        @DisplayName("nearby sends center, radius, country and limit")
        void nearby() {
            server.respond("/api/locations/nearby", 200, "{\"results\": []}");

            client.nearby(GeographicCoordinates.of(52.52, 13.405), 25, "DE", 13).join();

            assertEquals("lat=52.52&lng=13.405&radius=25&country=DE&limit=13", server.lastRequest().getRawQuery());
        }

        @Test
        @DisplayName("postal, city and region lookups use their endpoints")
        void lookups() {
            server.respond("/api/locations/postal-lookup", 200, "{\"results\": []}");
            server.respond("/api/locations/city-lookup", 200, "{\"results\": []}");
            server.respond("/api/locations/region-lookup", 200, "{\"results\": []}");

            client.postalLookup("72202", "DE", 8).join();
            assertEquals("postal_code=72202&country=DE&limit=8", server.lastRequest().getRawQuery());

            client.cityLookup("Bad Urach", "DE", 8).join();
            assertEquals("city=Bad+Urach&country=DE&limit=8", server.lastRequest().getRawQuery());

            client.regionLookup("Bayern", "DE", 50).join();
            assertEquals("/api/locations/region-lookup", server.lastRequest().getPath());
        }
    }

    @Nested
    @DisplayName("Responses")
    class ResponseTests {

        @Test
        @DisplayName("Rows are parsed over field aliases")
        void aliases() {
            server.respond("/api/locations/city-lookup", 200, """
                    {"results": [
                      {"id": "1", "city": "Nagold", "postal_code": "72202", "admin_name1": "Baden-Württemberg",
                       "admin_name2": "Calw", "country": "DE", "latitude": 48.5519, "longitude": 8.7256,
                       "relevanceScore": 0.75},
                      {"name": "Iselshausen", "postalCode": "72202", "region": "Baden-Württemberg",
                       "countryCode": "DE", "coordinates": {"lat": 48.53, "lng": 8.71}, "confidence": 0.95}
                    ]}
                    """);

            LookupOutcome<List<IndexRow>> outcome = client.cityLookup("Nagold", "DE", 8).join();

            assertTrue(outcome.isOk());
            List<IndexRow> rows = outcome.value();
            assertEquals(2, rows.size());

            IndexRow first = rows.get(0);
            assertEquals("Nagold", first.cityOrName());
            assertEquals("72202", first.postalCode());
            assertEquals("Baden-Württemberg", first.region());
            assertEquals("Calw", first.district());
            assertEquals("DE", first.countryCode());
            assertEquals(0.75, first.confidence());

            IndexRow second = rows.get(1);
            assertEquals("Iselshausen", second.cityOrName());
            assertEquals(48.53, second.coordinates().lat(), 1e-9);
            assertEquals(0.95, second.confidence());
        }

        @Test
        @DisplayName("Rows with missing or invalid coordinates are skipped")
        void invalidRowsSkipped() {
            server.respond("/api/locations/nearby", 200, """
                    {"results": [
                      {"city": "NoCoords"},
                      {"city": "OutOfRange", "latitude": 95.0, "longitude": 8.0},
                      {"city": "Text", "latitude": "abc", "longitude": 8.0},
                      {"city": "Good", "latitude": "48.5", "longitude": "8.7"}
                    ]}
                    """);

            List<IndexRow> rows = client.nearby(GeographicCoordinates.of(48.5, 8.7), 5, "DE", 10).join().value();

            assertEquals(1, rows.size());
            assertEquals("Good", rows.get(0).city());
        }

        @Test
        @DisplayName("Non-2xx status is UPSTREAM_UNAVAILABLE")
        void serverError() {
            server.respond("/api/locations/postal-lookup", 500, "{}");
            assertEquals(LookupOutcome.Status.UPSTREAM_UNAVAILABLE,
                    client.postalLookup("72202", "DE", 8).join().status());
        }

        @Test
        @DisplayName("Invalid JSON is MALFORMED")
        void invalidJson() {
            server.respond("/api/locations/postal-lookup", 200, "not json");
            assertEquals(LookupOutcome.Status.MALFORMED, client.postalLookup("72202", "DE", 8).join().status());
        }

        @Test
        @DisplayName("Missing results array is MALFORMED")
        void missingResults() {
            server.respond("/api/locations/postal-lookup", 200, "{\"data\": []}");
            assertEquals(LookupOutcome.Status.MALFORMED, client.postalLookup("72202", "DE", 8).join().status());
        }

        @Test
        @DisplayName("Unreachable index is UPSTREAM_UNAVAILABLE and never an exception")
        void unreachable() {
            server.close();
            LookupOutcome<List<IndexRow>> outcome = client.postalLookup("72202", "DE", 8).join();
            assertEquals(LookupOutcome.Status.UPSTREAM_UNAVAILABLE, outcome.status());
        }
    }

    @Test
    @DisplayName("Builder requires a base URL")
    void builderRequiresConfig() {
        assertThrows(IllegalStateException.class, () -> HttpLocationIndexClient.builder().build());
    }
}
