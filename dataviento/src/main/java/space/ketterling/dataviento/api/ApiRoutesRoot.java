package space.ketterling.dataviento.api;

import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        HikariDataSource ds = api.ds();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "dataviento",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /api/locations",
                        "GET /api/{weather|air-quality|marine}/current?locationId=1",
                        "GET /api/{weather|air-quality|marine}/hourly?locationId=1&limit=500",
                        "GET /api/{weather|marine|satellite|climate}/daily?locationId=1&from=2025-01-01&to=2025-01-31",
                        "GET /api/satellite/statistics?locationId=1&from=2025-01-01&to=2025-01-31",
                        "GET /api/ingest/runs",
                        "GET /api/ingest/events?runId=<uuid>",
                        "GET /api/metrics/external"
                })));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", api.clock().instant().toString());

            try (Connection c = ds.getConnection();
                    PreparedStatement ps = c.prepareStatement("SELECT 1");
                    ResultSet rs = ps.executeQuery()) {
                out.put("db", rs.next() ? "ok" : "unknown");
            } catch (Exception e) {
                out.put("status", "degraded");
                out.put("db", "fail");
                out.put("db_error", e.getMessage());
                ctx.status(503);
            }

            ctx.json(out);
        });
    }
}
