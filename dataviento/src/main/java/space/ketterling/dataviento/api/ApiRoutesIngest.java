package space.ketterling.dataviento.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.dataviento.db.IngestLogRepo;

import java.util.UUID;

/**
 * Routes that show ingest runs and their failed locations.
 */
final class ApiRoutesIngest {
    private ApiRoutesIngest() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        IngestLogRepo repo = api.ingestLog();

        app.get("/api/ingest/runs", ctx -> {
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 50, 1, 200);

            ArrayNode arr = om.createArrayNode();
            for (IngestLogRepo.RunRow r : repo.listRuns(limit)) {
                ObjectNode row = om.createObjectNode();
                row.put("run_id", r.runId().toString());
                row.put("job_name", r.jobName());
                api.putNullable(row, "started_at", r.startedAt());
                api.putNullable(row, "finished_at", r.finishedAt());
                row.put("status", r.status());
                api.putNullable(row, "attempted", r.attempted());
                api.putNullable(row, "succeeded", r.succeeded());
                api.putNullable(row, "failed", r.failed());
                row.put("notes", r.notes());
                arr.add(row);
            }

            ctx.json(arr);
        });

        app.get("/api/ingest/events", ctx -> {
            String raw = ctx.queryParam("runId");
            UUID runId;
            try {
                runId = UUID.fromString(raw == null ? "" : raw.trim());
            } catch (IllegalArgumentException e) {
                throw new ApiServer.BadRequest("runId must be a UUID: " + raw);
            }

            ArrayNode arr = om.createArrayNode();
            for (IngestLogRepo.EventRow e : repo.listEvents(runId)) {
                ObjectNode row = om.createObjectNode();
                row.put("source", e.source());
                row.put("location_name", e.locationName());
                api.putNullable(row, "location_id", e.locationId());
                row.put("stage", e.stage());
                row.put("error", e.error());
                api.putNullable(row, "created_at", e.createdAt());
                arr.add(row);
            }

            ctx.json(arr);
        });
    }
}
