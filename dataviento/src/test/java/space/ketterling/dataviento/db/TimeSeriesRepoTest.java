package space.ketterling.dataviento.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.registry.ModelCatalog;
import space.ketterling.dataviento.registry.ModelRegistry;
import space.ketterling.dataviento.registry.ParameterRegistry;
import space.ketterling.dataviento.support.MutableClock;
import space.ketterling.dataviento.support.TestDatabase;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeSeriesRepoTest {
    private static final Instant T0 = Instant.parse("2025-10-01T00:00:00Z");

    private TestDatabase db;
    private TimeSeriesRepo repo;
    private long locationId;
    private long modelId;
    private long tempId;
    private long humidityId;

    @BeforeEach
    void setUp() throws Exception {
        db = TestDatabase.create();
        MutableClock clock = new MutableClock(T0, ZoneOffset.UTC);
        repo = new TimeSeriesRepo(db.dataSource());
        locationId = new LocationRegistry(new LocationRepo(db.dataSource()), clock)
                .resolveOrCreate(LocationTarget.of("Madrid", 40.4168, -3.7038));
        modelId = new ModelRegistry(new ModelRepo(db.dataSource()), clock).resolveOrCreate(ModelCatalog.WEATHER);
        ParameterRegistry parameters = new ParameterRegistry(new ParameterRepo(db.dataSource()), clock);
        tempId = parameters.resolveOrCreate("temp_2m");
        humidityId = parameters.resolveOrCreate("humidity_2m");
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    private BatchHeader header(Instant referenceTime) {
        return new BatchHeader(null, locationId, modelId, referenceTime, 0.4, "Europe/Madrid", 7200);
    }

    @Test
    void duplicatePointInOneBatchIsStoredOnce() throws Exception {
        List<DataPoint> points = List.of(
                DataPoint.of(tempId, T0, 0, 12.1, "°C"),
                DataPoint.of(tempId, T0, 0, 12.5, "°C"),
                DataPoint.of(humidityId, T0, 0, 70.0, "%"));

        BatchWriteResult r = repo.writeBatch(TimeSeriesTable.WEATHER, header(T0), points, T0);

        assertEquals(3, r.pointsSubmitted());
        assertEquals(2, repo.countPoints(TimeSeriesTable.WEATHER, r.batchId()));
    }

    @Test
    void insertingTheSamePointsAgainAddsNothing() throws Exception {
        long batchId = repo.createBatch(TimeSeriesTable.AIR_QUALITY, header(T0), T0);
        List<DataPoint> points = List.of(DataPoint.of(tempId, T0, 0, 1.0, "µg/m³"),
                DataPoint.of(tempId, T0.plusSeconds(3600), 1, 2.0, "µg/m³"));

        repo.insertPoints(TimeSeriesTable.AIR_QUALITY, batchId, points);
        repo.insertPoints(TimeSeriesTable.AIR_QUALITY, batchId, points);

        assertEquals(2, db.count("air_quality_point"));
    }

    @Test
    void nullValuesAreFlaggedMissing() throws Exception {
        repo.writeBatch(TimeSeriesTable.WEATHER, header(T0),
                List.of(DataPoint.of(tempId, T0, 0, null, "°C"), DataPoint.of(humidityId, T0, 0, 60.0, "%")), T0);

        List<StoredPoint> stored = repo.getHourly(TimeSeriesTable.WEATHER, locationId, 100);
        assertEquals(2, stored.size());
        StoredPoint humidity = stored.get(0);
        StoredPoint temp = stored.get(1);
        assertEquals("humidity_2m", humidity.parameterCode());
        assertEquals(DataPoint.GOOD, humidity.qualityFlag());
        assertNull(temp.value());
        assertEquals(DataPoint.MISSING, temp.qualityFlag());
    }

    @Test
    void failedPointInsertRollsBackTheBatch() throws Exception {
        List<DataPoint> points = List.of(DataPoint.of(9_999L, T0, 0, 1.0, "°C"));

        assertThrows(Exception.class, () -> repo.writeBatch(TimeSeriesTable.WEATHER, header(T0), points, T0));
        assertEquals(0, db.count("weather_forecast_batch"));
    }

    @Test
    void latestBatchIsTheNewestReferenceTime() throws Exception {
        repo.createBatch(TimeSeriesTable.MARINE, header(T0), T0);
        long newer = repo.createBatch(TimeSeriesTable.MARINE, header(T0.plusSeconds(3600)), T0);

        assertEquals(newer, repo.latestBatch(TimeSeriesTable.MARINE, locationId).orElseThrow().id());
        assertTrue(repo.getHourly(TimeSeriesTable.MARINE, locationId, 10).isEmpty());
    }

    @Test
    void expiredBatchesAreDeletedWithTheirPoints() throws Exception {
        repo.writeBatch(TimeSeriesTable.WEATHER, header(T0),
                List.of(DataPoint.of(tempId, T0, 0, 1.0, "°C"), DataPoint.of(humidityId, T0, 0, 2.0, "%")), T0);
        Instant fresh = T0.plus(Duration.ofDays(8));
        repo.writeBatch(TimeSeriesTable.WEATHER, header(fresh),
                List.of(DataPoint.of(tempId, fresh, 0, 1.0, "°C")), fresh);

        TimeSeriesRepo.DeleteCounts dc = repo.deleteBatchesBefore(TimeSeriesTable.WEATHER,
                T0.plus(Duration.ofDays(1)), 100);

        assertEquals(1, dc.batches());
        assertEquals(2, dc.points());
        assertEquals(1, db.count("weather_forecast_batch"));
        assertEquals(1, db.count("weather_forecast_point"));
    }
}
