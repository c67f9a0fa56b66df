package space.ketterling.dataviento.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import space.ketterling.dataviento.db.BatchHeader;
import space.ketterling.dataviento.db.DailyRow;
import space.ketterling.dataviento.db.DailyTable;
import space.ketterling.dataviento.db.LocationRow;
import space.ketterling.dataviento.db.RadiationStatistics;
import space.ketterling.dataviento.db.Snapshot;
import space.ketterling.dataviento.db.SnapshotTable;
import space.ketterling.dataviento.db.StoredPoint;
import space.ketterling.dataviento.db.TimeSeriesTable;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Read accessors for locations, snapshots, hourly batches and daily rows.
 * A location with no data for a section yields an empty list, not an error.
 */
final class ApiRoutesData {
    private static final Map<String, SnapshotTable> SNAPSHOTS = Map.of(
            "weather", SnapshotTable.WEATHER,
            "air-quality", SnapshotTable.AIR_QUALITY,
            "marine", SnapshotTable.MARINE);
    private static final Map<String, TimeSeriesTable> HOURLY = Map.of(
            "weather", TimeSeriesTable.WEATHER,
            "air-quality", TimeSeriesTable.AIR_QUALITY,
            "marine", TimeSeriesTable.MARINE);
    private static final Map<String, DailyTable> DAILY = Map.of(
            "weather", DailyTable.WEATHER,
            "marine", DailyTable.MARINE,
            "satellite", DailyTable.SATELLITE,
            "climate", DailyTable.CLIMATE);

    private ApiRoutesData() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/locations", ctx -> {
            ArrayNode arr = om.createArrayNode();
            for (LocationRow l : api.locations().list()) {
                arr.add(location(api, l));
            }
            ctx.json(arr);
        });

        app.get("/api/satellite/statistics", ctx -> {
            long locationId = ApiServer.requireLong(ctx, "locationId");
            LocalDate to = ApiServer.parseDate(ctx.queryParam("to"));
            if (to == null)
                to = LocalDate.now(api.clock());
            LocalDate from = ApiServer.parseDate(ctx.queryParam("from"));
            if (from == null)
                from = to.minusDays(30);

            Optional<RadiationStatistics> stats = api.daily().getSatelliteStatistics(locationId, from, to);
            if (stats.isEmpty()) {
                api.error(ctx, 404, "not_found", "no satellite data for location " + locationId);
                return;
            }
            RadiationStatistics s = stats.get();
            ObjectNode out = om.createObjectNode();
            out.put("location_id", locationId);
            out.put("days", s.days());
            api.putNullable(out, "avg_shortwave_radiation", s.avgShortwave());
            api.putNullable(out, "avg_direct_radiation", s.avgDirect());
            api.putNullable(out, "avg_diffuse_radiation", s.avgDiffuse());
            api.putNullable(out, "avg_direct_normal_irradiance", s.avgDni());
            api.putNullable(out, "avg_global_tilted_irradiance", s.avgGti());
            api.putNullable(out, "avg_terrestrial_radiation", s.avgTerrestrial());
            api.putNullable(out, "max_direct_normal_irradiance", s.maxDni());
            api.putNullable(out, "min_direct_normal_irradiance", s.minDni());
            api.putNullable(out, "avg_quality_score", s.avgQualityScore());
            api.putNullable(out, "first_date", s.firstDate());
            api.putNullable(out, "last_date", s.lastDate());
            ctx.json(out);
        });

        app.get("/api/{domain}/current", ctx -> {
            SnapshotTable table = lookup(api, ctx, SNAPSHOTS);
            if (table == null)
                return;
            long locationId = ApiServer.requireLong(ctx, "locationId");

            Optional<Snapshot> snap = api.snapshots().getCurrent(table, locationId);
            if (snap.isEmpty()) {
                api.error(ctx, 404, "not_found", "no current data for location " + locationId);
                return;
            }
            Snapshot s = snap.get();
            ObjectNode out = om.createObjectNode();
            out.put("location_id", s.locationId());
            out.put("model_id", s.modelId());
            api.putNullable(out, "observation_time", s.observationTime());
            api.putNullable(out, "updated_at", s.updatedAt());
            ObjectNode values = out.putObject("values");
            for (var e : s.values().entrySet()) {
                api.putNullable(values, e.getKey(), e.getValue());
            }
            ctx.json(out);
        });

        app.get("/api/{domain}/hourly", ctx -> {
            TimeSeriesTable table = lookup(api, ctx, HOURLY);
            if (table == null)
                return;
            long locationId = ApiServer.requireLong(ctx, "locationId");
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 500, 1, 5000);

            ObjectNode out = om.createObjectNode();
            out.put("location_id", locationId);
            Optional<BatchHeader> batch = api.timeSeries().latestBatch(table, locationId);
            if (batch.isPresent()) {
                BatchHeader b = batch.get();
                ObjectNode h = out.putObject("batch");
                api.putNullable(h, "id", b.id());
                api.putNullable(h, "reference_time", b.referenceTime());
                api.putNullable(h, "generation_time_ms", b.generationTimeMs());
                api.putNullable(h, "timezone", b.timezone());
                api.putNullable(h, "utc_offset_seconds", b.utcOffsetSeconds());
            } else {
                out.putNull("batch");
            }

            ArrayNode points = out.putArray("points");
            for (StoredPoint p : api.timeSeries().getHourly(table, locationId, limit)) {
                ObjectNode row = om.createObjectNode();
                row.put("parameter", p.parameterCode());
                api.putNullable(row, "valid_time", p.validTime());
                row.put("forecast_hour", p.forecastHour());
                api.putNullable(row, "value", p.value());
                api.putNullable(row, "unit", p.unit());
                row.put("quality_flag", p.qualityFlag());
                points.add(row);
            }
            ctx.json(out);
        });

        app.get("/api/{domain}/daily", ctx -> {
            DailyTable table = lookup(api, ctx, DAILY);
            if (table == null)
                return;
            long locationId = ApiServer.requireLong(ctx, "locationId");
            LocalDate from = ApiServer.parseDate(ctx.queryParam("from"));
            LocalDate to = ApiServer.parseDate(ctx.queryParam("to"));

            ArrayNode arr = om.createArrayNode();
            for (DailyRow r : api.daily().getDaily(table, locationId, from, to)) {
                ObjectNode row = om.createObjectNode();
                row.put("valid_date", r.validDate().toString());
                for (DailyTable.Column col : table.columns()) {
                    api.putNullable(row, col.name(), r.values().get(col.name()));
                }
                arr.add(row);
            }
            ctx.json(arr);
        });
    }

    private static <T> T lookup(ApiServer api, Context ctx, Map<String, T> tables) {
        String domain = ctx.pathParam("domain").replace('_', '-');
        T table = tables.get(domain);
        if (table == null) {
            api.error(ctx, 404, "not_found", "no such data set: " + ctx.path());
        }
        return table;
    }

    private static ObjectNode location(ApiServer api, LocationRow l) {
        ObjectNode row = api.om().createObjectNode();
        row.put("id", l.id());
        row.put("name", l.name());
        row.put("latitude", l.latitude());
        row.put("longitude", l.longitude());
        api.putNullable(row, "elevation", l.elevation());
        api.putNullable(row, "timezone", l.timezone());
        api.putNullable(row, "country_code", l.countryCode());
        api.putNullable(row, "country_name", l.countryName());
        api.putNullable(row, "state", l.state());
        api.putNullable(row, "admin1", l.admin1());
        api.putNullable(row, "admin2", l.admin2());
        api.putNullable(row, "population", l.population());
        api.putNullable(row, "created_at", l.createdAt());
        return row;
    }
}
