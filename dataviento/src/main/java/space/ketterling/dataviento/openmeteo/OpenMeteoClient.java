/*
* Copyright 2025 Taylor Ketterling
* Open-Meteo Client for DataViento, an environmental data ingestion application.
* Utilizes Java HttpClient for requests against the forecast, air-quality, marine,
* satellite and climate endpoint families, and Jackson for JSON processing.
*/

package space.ketterling.dataviento.openmeteo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.metrics.ExternalApiMetrics;
import space.ketterling.dataviento.metrics.ExternalApiMetrics.Outcome;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP client for the Open-Meteo APIs with bounded retries and exponential
 * backoff.
 *
 * <p>
 * The target URL is built per call from a base URL and the query map, so one
 * instance is safe to share between ingest workers. The client owns the
 * executor behind its connection pool and must be closed explicitly.
 * </p>
 */
public final class OpenMeteoClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpenMeteoClient.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final Sleeper sleeper;
    private final ExecutorService httpExecutor;
    private final HttpClient http;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a client that sleeps on the calling thread between attempts.
     */
    public OpenMeteoClient(AppConfig cfg, ObjectMapper om) {
        this(cfg, om, d -> Thread.sleep(d.toMillis()));
    }

    public OpenMeteoClient(AppConfig cfg, ObjectMapper om, Sleeper sleeper) {
        this.cfg = cfg;
        this.om = om;
        this.sleeper = sleeper;
        AtomicInteger n = new AtomicInteger();
        this.httpExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "openmeteo-http-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.http = HttpClient.newBuilder()
                .connectTimeout(cfg.httpConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(httpExecutor)
                .build();
    }

    /**
     * GET against one of the configured endpoint families.
     */
    public JsonNode get(OpenMeteoEndpoint endpoint, Map<String, String> params)
            throws OpenMeteoException, InterruptedException {
        return execute("GET", endpoint.label(), cfg.baseUrl(endpoint), params);
    }

    /**
     * Issues a request against an explicit URL. Retries transport failures and
     * non-2xx responses, then throws once the last attempt has failed.
     */
    public JsonNode fetch(String method, String url, Map<String, String> params)
            throws OpenMeteoException, InterruptedException {
        String host = URI.create(url).getHost();
        return execute(method, host == null ? "unknown" : host, url, params);
    }

    private JsonNode execute(String method, String family, String baseUrl, Map<String, String> params)
            throws OpenMeteoException, InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("OpenMeteoClient is closed");
        }
        String url = buildUrl(baseUrl, params);
        int maxAttempts = cfg.httpMaxRetries();
        Duration backoff = cfg.httpRetryBaseDelay();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            log.debug("Request attempt {}/{}: {} {}", attempt, maxAttempts, method, url);
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(cfg.httpRequestTimeout())
                    .header("Accept", "application/json")
                    .method(method, HttpRequest.BodyPublishers.noBody())
                    .build();

            boolean last = attempt == maxAttempts;
            long t0 = System.nanoTime();
            try {
                HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
                int code = resp.statusCode();
                long ms = (System.nanoTime() - t0) / 1_000_000L;
                if (code >= 200 && code < 300) {
                    JsonNode body = om.readTree(resp.body());
                    ExternalApiMetrics.record(family, Outcome.SUCCESS);
                    log.info("{} {} -> {} ({} ms, attempt {})", method, url, code, ms, attempt);
                    return body;
                }

                ExternalApiMetrics.record(family, last ? Outcome.FAILED : Outcome.RETRIED);
                log.warn("{} request failed code={} url={} attempt={}/{}", family, code, url, attempt, maxAttempts);
                if (last) {
                    throw new OpenMeteoException(
                            family + " request failed: " + code + " url=" + url + " body=" + abbreviate(resp.body()),
                            code, attempt, url, null);
                }
            } catch (IOException e) {
                // transport errors, timeouts and unparseable 2xx bodies
                ExternalApiMetrics.record(family, last ? Outcome.FAILED : Outcome.RETRIED);
                log.warn("{} request exception url={} attempt={}/{} err={}", family, url, attempt, maxAttempts,
                        e.toString());
                if (last) {
                    throw new OpenMeteoException(family + " request failed after " + attempt + " attempts: "
                            + e.getMessage(), null, attempt, url, e);
                }
            }

            sleeper.sleep(backoff);
            backoff = backoff.multipliedBy(2);
        }

        // maxAttempts is validated to be >= 1 by AppConfig
        throw new IllegalStateException("unreachable: no attempts made for " + url);
    }

    /**
     * Builds base?k=v&k=v with URL-encoded values, in map iteration order.
     */
    static String buildUrl(String baseUrl, Map<String, String> params) {
        if (params == null || params.isEmpty())
            return baseUrl;
        StringJoiner q = new StringJoiner("&");
        for (var e : params.entrySet()) {
            if (e.getValue() == null)
                continue;
            q.add(enc(e.getKey()) + "=" + enc(e.getValue()));
        }
        String sep = baseUrl.contains("?") ? "&" : "?";
        return baseUrl + sep + q;
    }

    private static String enc(String s) {
        // Open-Meteo takes comma-separated lists; keep the commas readable
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("%2C", ",");
    }

    private static String abbreviate(String body) {
        if (body == null)
            return "";
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Releases the connection pool. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        httpExecutor.shutdown();
        try {
            if (!httpExecutor.awaitTermination(3, TimeUnit.SECONDS)) {
                httpExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            httpExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("OpenMeteoClient closed");
    }

    /**
     * Waits between attempts. Swapped out in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }
}
