package space.ketterling.dataviento.openmeteo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.metrics.ExternalApiMetrics;
import space.ketterling.dataviento.support.FakeOpenMeteoServer;
import space.ketterling.dataviento.support.TestConfigs;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenMeteoClientTest {
    private FakeOpenMeteoServer server;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeOpenMeteoServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private OpenMeteoClient client(int maxRetries, String baseDelay) {
        Properties p = TestConfigs.withUpstream(TestConfigs.base("jdbc:sqlite::memory:"), server.baseUrl());
        p.setProperty("http.maxRetries", Integer.toString(maxRetries));
        p.setProperty("http.retryBaseDelay", baseDelay);
        AppConfig cfg = TestConfigs.load(p);
        return new OpenMeteoClient(cfg, new ObjectMapper(), sleeps::add);
    }

    private static Map<String, String> madrid() {
        Map<String, String> q = new LinkedHashMap<>();
        q.put("latitude", "40.4168");
        q.put("longitude", "-3.7038");
        q.put("current", "temperature_2m,wind_speed_10m");
        return q;
    }

    @Test
    void retriesServerErrorsThenReturnsBody() throws Exception {
        server.reply("/v1/forecast", 503, "{\"reason\":\"busy\"}")
                .reply("/v1/forecast", 502, "bad gateway")
                .reply("/v1/forecast", 200, "{\"latitude\":40.4,\"current\":{\"temperature_2m\":15.2}}");

        try (OpenMeteoClient client = client(3, "PT0.01S")) {
            JsonNode body = client.get(OpenMeteoEndpoint.FORECAST, madrid());

            assertEquals(15.2, body.path("current").path("temperature_2m").asDouble(), 1e-9);
            assertEquals(3, server.requestCount("/v1/forecast"));
            assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeps);
        }
    }

    @Test
    void givesUpAfterMaxAttemptsWithDoublingDelays() {
        server.reply("/v1/forecast", 500, "{\"error\":true}");

        try (OpenMeteoClient client = client(5, "PT1S")) {
            OpenMeteoException e = assertThrows(OpenMeteoException.class,
                    () -> client.get(OpenMeteoEndpoint.FORECAST, madrid()));

            assertEquals(500, e.statusCode());
            assertEquals(5, e.attempts());
            assertEquals(5, server.requestCount("/v1/forecast"));
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                    Duration.ofSeconds(8)), sleeps);
        }
    }

    @Test
    void unparseableSuccessBodyIsRetriedAsTransportFailure() {
        server.reply("/v1/marine", 200, "<html>maintenance</html>");

        try (OpenMeteoClient client = client(2, "PT0.01S")) {
            OpenMeteoException e = assertThrows(OpenMeteoException.class,
                    () -> client.get(OpenMeteoEndpoint.MARINE, madrid()));

            assertNull(e.statusCode());
            assertEquals(2, server.requestCount("/v1/marine"));
        }
    }

    @Test
    void sendsQueryWithReadableCommas() throws Exception {
        server.reply("/v1/forecast", 200, "{}");

        try (OpenMeteoClient client = client(1, "PT0.01S")) {
            client.get(OpenMeteoEndpoint.FORECAST, madrid());
        }

        String uri = server.requests().get(0);
        assertTrue(uri.contains("current=temperature_2m,wind_speed_10m"), uri);
        assertTrue(uri.contains("latitude=40.4168"), uri);
    }

    @Test
    void buildUrlSkipsNullValuesAndAppendsToExistingQuery() {
        Map<String, String> q = new LinkedHashMap<>();
        q.put("a", "1");
        q.put("b", null);
        q.put("tz", "Europe/Madrid");

        assertEquals("http://x/y?k=v&a=1&tz=Europe%2FMadrid", OpenMeteoClient.buildUrl("http://x/y?k=v", q));
        assertEquals("http://x/y", OpenMeteoClient.buildUrl("http://x/y", Map.of()));
    }

    @Test
    void recordsAttemptsPerEndpointFamily() throws Exception {
        server.reply("/v1/air-quality", 500, "{}").reply("/v1/air-quality", 200, "{}");

        try (OpenMeteoClient client = client(2, "PT0.01S")) {
            client.get(OpenMeteoEndpoint.AIR_QUALITY, madrid());
        }

        ExternalApiMetrics.EndpointSnapshot s = ExternalApiMetrics.snapshot().get("air-quality");
        assertTrue(s.attempts() >= 2);
        assertTrue(s.retried() >= 1);
    }

    @Test
    void closeIsIdempotentAndRejectsFurtherCalls() {
        OpenMeteoClient client = client(1, "PT0.01S");
        client.close();
        client.close();

        assertTrue(client.isClosed());
        assertThrows(IllegalStateException.class, () -> client.get(OpenMeteoEndpoint.FORECAST, madrid()));
    }
}
