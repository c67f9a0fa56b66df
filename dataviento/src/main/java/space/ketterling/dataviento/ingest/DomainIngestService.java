package space.ketterling.dataviento.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.dataviento.db.BatchHeader;
import space.ketterling.dataviento.db.BatchWriteResult;
import space.ketterling.dataviento.db.DailyRow;
import space.ketterling.dataviento.db.DataPoint;
import space.ketterling.dataviento.db.SnapshotRepo;
import space.ketterling.dataviento.db.SnapshotTable;
import space.ketterling.dataviento.db.TimeSeriesRepo;
import space.ketterling.dataviento.db.TimeSeriesTable;
import space.ketterling.dataviento.openmeteo.OpenMeteoClient;
import space.ketterling.dataviento.openmeteo.OpenMeteoEndpoint;
import space.ketterling.dataviento.openmeteo.OpenMeteoException;
import space.ketterling.dataviento.openmeteo.OpenMeteoTime;
import space.ketterling.dataviento.openmeteo.PayloadValidationException;
import space.ketterling.dataviento.openmeteo.model.OpenMeteoResponse;
import space.ketterling.dataviento.registry.Domain;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.registry.ParameterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetch, validate, resolve and persist for one domain and one location.
 *
 * <p>
 * Subclasses supply the request parameters and the per-section writes. Each
 * section is written independently: a failed section is recorded in the result
 * and the remaining sections are still attempted. {@link #fetchAndSave} never
 * throws.
 * </p>
 *
 * @param <R> typed payload for the domain
 * @param <O> request options for the domain
 */
public abstract class DomainIngestService<R extends OpenMeteoResponse, O> {
    private static final Logger log = LoggerFactory.getLogger(DomainIngestService.class);

    protected final OpenMeteoClient client;
    protected final ObjectMapper om;
    protected final LocationRegistry locations;
    protected final ParameterRegistry parameters;
    protected final Clock clock;
    private final Class<R> responseType;

    protected DomainIngestService(OpenMeteoClient client, ObjectMapper om, LocationRegistry locations,
            ParameterRegistry parameters, Clock clock, Class<R> responseType) {
        this.client = client;
        this.om = om;
        this.locations = locations;
        this.parameters = parameters;
        this.clock = clock;
        this.responseType = responseType;
    }

    public abstract Domain domain();

    protected abstract OpenMeteoEndpoint endpoint();

    /**
     * Query string for the upstream call.
     */
    protected abstract Map<String, String> queryParams(LocationTarget target, O options);

    /**
     * Rejects options that cannot produce a valid request. Runs before the
     * fetch; a failure is reported as a validation failure.
     */
    protected void checkOptions(O options) throws PayloadValidationException {
    }

    /**
     * Writes every requested section that the payload carries, reporting each
     * through {@link #section}.
     */
    protected abstract void persist(R response, long locationId, O options, LocationIngestResult.Builder result);

    /**
     * Ingests one location. Failures of any stage end up in the returned
     * result.
     */
    public LocationIngestResult fetchAndSave(LocationTarget target, O options) {
        LocationIngestResult.Builder result = LocationIngestResult.builder(domain(), target.name());
        String prevLocation = MDC.get("location");
        MDC.put("location", target.name());
        try {
            try {
                checkOptions(options);
            } catch (PayloadValidationException e) {
                return fail(result, Stage.VALIDATE, e.getMessage());
            }

            JsonNode raw;
            try {
                raw = client.get(endpoint(), queryParams(target, options));
            } catch (OpenMeteoException e) {
                return fail(result, Stage.FETCH, "Failed to fetch data from API: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(result, Stage.FETCH, "Interrupted while fetching data from API");
            }

            R response;
            try {
                response = om.treeToValue(raw, responseType);
                if (response == null)
                    throw new PayloadValidationException(domain().tag() + " response", List.of("empty body"));
                response.validate();
            } catch (PayloadValidationException e) {
                return fail(result, Stage.VALIDATE, e.getMessage());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                return fail(result, Stage.VALIDATE, "Malformed " + domain().tag() + " response: "
                        + e.getMessage());
            }

            long locationId;
            try {
                locationId = locations.resolveOrCreate(target);
            } catch (Exception e) {
                return fail(result, Stage.RESOLVE, "Failed to resolve location: " + e.getMessage());
            }
            result.locationId(locationId);

            persist(response, locationId, options, result);
            LocationIngestResult r = result.build();
            if (r.success()) {
                log.info("{} ingest ok for {} (locationId={} current={} hourly={} daily={} rows={})",
                        domain().tag(), target.name(), locationId, r.currentSaved(), r.hourlySaved(),
                        r.dailySaved(), r.rowsWritten());
            } else {
                log.warn("{} ingest incomplete for {}: {}", domain().tag(), target.name(), r.error());
            }
            return r;
        } catch (RuntimeException e) {
            log.error("Unexpected {} ingest failure for {}", domain().tag(), target.name(), e);
            return result.failed(Stage.PERSIST, "Unexpected error: " + e).build();
        } finally {
            if (prevLocation == null)
                MDC.remove("location");
            else
                MDC.put("location", prevLocation);
        }
    }

    private LocationIngestResult fail(LocationIngestResult.Builder result, Stage stage, String message) {
        log.warn("{} ingest failed for {} at {}: {}", domain().tag(), result.locationName(), stage, message);
        return result.failed(stage, message).build();
    }

    /**
     * Runs one section write. A failure is logged with the operation name and
     * recorded against the result; it does not stop other sections.
     */
    protected final void section(LocationIngestResult.Builder result, Section section, String operation,
            SectionWriter writer) {
        try {
            int rows = writer.write();
            result.saved(section, rows);
            log.debug("{}: {} rows for {}", operation, rows, result.locationName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.failed(Stage.PERSIST, operation + " interrupted");
        } catch (Exception e) {
            log.warn("{} failed for {}: {}", operation, result.locationName(), e.toString());
            result.failed(Stage.PERSIST, operation + " failed: " + e.getMessage());
        }
    }

    @FunctionalInterface
    protected interface SectionWriter {
        /**
         * @return rows written
         */
        int write() throws Exception;
    }

    // ----------------------------
    // shared section writers
    // ----------------------------

    /**
     * Observation time of a current section: its local time in the payload's
     * zone, or now when the payload has none.
     */
    protected Instant observedAt(String localTime, R response) {
        if (localTime == null || localTime.isBlank())
            return clock.instant();
        ZoneId zone = OpenMeteoTime.zoneOf(response.timezone(), response.utcOffsetSeconds());
        return OpenMeteoTime.toInstants(List.of(localTime), zone).get(0);
    }

    protected int writeSnapshot(SnapshotRepo repo, SnapshotTable table, long locationId, long modelId,
            Instant observedAt, Map<String, Double> values) throws Exception {
        repo.upsertCurrent(table, locationId, modelId, observedAt, clock.instant(), values);
        return 1;
    }

    /**
     * Stores one hourly batch. Parameter ids are resolved before the batch
     * transaction opens.
     *
     * @return points inserted
     */
    protected int writeHourly(TimeSeriesRepo repo, TimeSeriesTable table, R response, long locationId, long modelId,
            List<String> time, Map<String, List<Double>> series) throws Exception {
        Map<String, Long> ids = new LinkedHashMap<>();
        for (String code : series.keySet()) {
            ids.put(code, parameters.resolveOrCreate(code));
        }

        List<Instant> validTimes = OpenMeteoTime.toInstants(time,
                OpenMeteoTime.zoneOf(response.timezone(), response.utcOffsetSeconds()));
        List<DataPoint> points = new ArrayList<>(time.size() * series.size());
        for (int i = 0; i < time.size(); i++) {
            Instant validTime = validTimes.get(i);
            for (var e : series.entrySet()) {
                String code = e.getKey();
                points.add(DataPoint.of(ids.get(code), validTime, i, e.getValue().get(i), parameters.unitOf(code)));
            }
        }

        if (points.isEmpty())
            throw new IllegalStateException("no hourly values in payload");

        Instant now = clock.instant();
        BatchHeader header = new BatchHeader(null, locationId, modelId, now, response.generationTimeMs(),
                response.timezone(), response.utcOffsetSeconds());
        BatchWriteResult written = repo.writeBatch(table, header, points, now);
        return written.pointsInserted();
    }

    /**
     * Pivots column series into one row per date.
     */
    protected static List<DailyRow> dailyRows(List<String> time, Map<String, List<?>> columns) {
        List<DailyRow> rows = new ArrayList<>(time.size());
        for (int i = 0; i < time.size(); i++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (var e : columns.entrySet()) {
                Object v = e.getValue().get(i);
                if (v != null)
                    values.put(e.getKey(), v);
            }
            rows.add(new DailyRow(OpenMeteoTime.toDate(time.get(i)), values));
        }
        return rows;
    }

    protected static String joined(List<String> fields) {
        return String.join(",", fields);
    }

    /**
     * Coordinates and timezone, common to every endpoint family.
     */
    protected static Map<String, String> baseParams(LocationTarget target) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("latitude", Double.toString(target.latitude()));
        p.put("longitude", Double.toString(target.longitude()));
        p.put("timezone", target.timezone());
        return p;
    }
}
