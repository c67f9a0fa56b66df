package space.ketterling.dataviento.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.dataviento.metrics.ExternalApiMetrics;

/**
 * Upstream call health over the rolling metrics window.
 */
final class ApiRoutesMetrics {
    private ApiRoutesMetrics() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/metrics/external", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", ExternalApiMetrics.windowMinutes());
            ArrayNode services = out.putArray("services");

            for (var e : ExternalApiMetrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("service", e.getKey());
                row.put("attempts_last_hour", snap.attempts());
                row.put("retried_last_hour", snap.retried());
                row.put("failures_last_hour", snap.failed());
                row.put("failure_pct", snap.failurePct());
                row.put("status", snap.status());
                services.add(row);
            }

            ctx.json(out);
        });
    }
}
