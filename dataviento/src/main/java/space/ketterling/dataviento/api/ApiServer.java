/*
* Copyright 2025 Taylor Ketterling
* API Server for DataViento, an environmental data ingestion application.
* Utilizes Javalin for the HTTP server and exposes read-only views of ingested data.
* Uses Jackson for JSON processing and HikariCP for database connection pooling.
*/

package space.ketterling.dataviento.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.db.DailyAggregateRepo;
import space.ketterling.dataviento.db.IngestLogRepo;
import space.ketterling.dataviento.db.LocationRepo;
import space.ketterling.dataviento.db.SnapshotRepo;
import space.ketterling.dataviento.db.TimeSeriesRepo;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Read-only HTTP surface over the ingested data.
 */
public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final HikariDataSource ds;
    private final Clock clock;
    private final LocationRepo locationRepo;
    private final SnapshotRepo snapshotRepo;
    private final TimeSeriesRepo timeSeriesRepo;
    private final DailyAggregateRepo dailyRepo;
    private final IngestLogRepo ingestLogRepo;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, HikariDataSource ds, Clock clock) {
        this.cfg = cfg;
        this.om = om;
        this.ds = ds;
        this.clock = clock;
        this.locationRepo = new LocationRepo(ds);
        this.snapshotRepo = new SnapshotRepo(ds);
        this.timeSeriesRepo = new TimeSeriesRepo(ds);
        this.dailyRepo = new DailyAggregateRepo(ds);
        this.ingestLogRepo = new IngestLogRepo(ds, clock);
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.debug("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(BadRequest.class, (e, ctx) -> error(ctx, 400, "bad_request", e.getMessage()));

        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            error(ctx, 500, "internal_error", e.getMessage() == null ? "Unknown error" : e.getMessage());
        });

        ApiRoutesRoot.register(this);
        ApiRoutesData.register(this);
        ApiRoutesIngest.register(this);
        ApiRoutesMetrics.register(this);

        app.start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int port() {
        return app.port();
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    HikariDataSource ds() {
        return ds;
    }

    Clock clock() {
        return clock;
    }

    LocationRepo locations() {
        return locationRepo;
    }

    SnapshotRepo snapshots() {
        return snapshotRepo;
    }

    TimeSeriesRepo timeSeries() {
        return timeSeriesRepo;
    }

    DailyAggregateRepo daily() {
        return dailyRepo;
    }

    IngestLogRepo ingestLog() {
        return ingestLogRepo;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------

    void error(Context ctx, int status, String code, String message) {
        ctx.status(status).json(om.createObjectNode()
                .put("error", code)
                .put("message", message));
    }

    /**
     * Puts a value under key, writing JSON null for null and numbers as numbers.
     */
    void putNullable(ObjectNode node, String key, Object value) {
        if (value == null) {
            node.putNull(key);
        } else if (value instanceof Integer i) {
            node.put(key, i);
        } else if (value instanceof Long l) {
            node.put(key, l);
        } else if (value instanceof Number n) {
            node.put(key, n.doubleValue());
        } else if (value instanceof Boolean b) {
            node.put(key, b);
        } else {
            node.put(key, value.toString());
        }
    }

    static int parseInt(String s, int def, int min, int max) {
        if (s == null || s.isBlank())
            return def;
        try {
            int v = Integer.parseInt(s.trim());
            return Math.max(min, Math.min(max, v));
        } catch (NumberFormatException e) {
            throw new BadRequest("not an integer: " + s);
        }
    }

    static long requireLong(Context ctx, String name) {
        String raw = ctx.queryParam(name);
        if (raw == null || raw.isBlank())
            throw new BadRequest(name + " is required");
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new BadRequest(name + " must be an integer: " + raw);
        }
    }

    static LocalDate parseDate(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            return LocalDate.parse(s.trim());
        } catch (DateTimeParseException e) {
            throw new BadRequest("not an ISO date (yyyy-MM-dd): " + s);
        }
    }

    /**
     * Invalid request input; rendered as 400.
     */
    static final class BadRequest extends RuntimeException {
        BadRequest(String message) {
            super(message);
        }
    }
}
