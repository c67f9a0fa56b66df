package space.ketterling.dataviento.retention;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.db.BatchHeader;
import space.ketterling.dataviento.db.DailyAggregateRepo;
import space.ketterling.dataviento.db.DailyRow;
import space.ketterling.dataviento.db.DailyTable;
import space.ketterling.dataviento.db.DataPoint;
import space.ketterling.dataviento.db.LocationRepo;
import space.ketterling.dataviento.db.ModelRepo;
import space.ketterling.dataviento.db.ParameterRepo;
import space.ketterling.dataviento.db.SnapshotRepo;
import space.ketterling.dataviento.db.SnapshotTable;
import space.ketterling.dataviento.db.TableStatsRepo;
import space.ketterling.dataviento.db.TimeSeriesRepo;
import space.ketterling.dataviento.db.TimeSeriesTable;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.registry.ModelCatalog;
import space.ketterling.dataviento.registry.ModelRegistry;
import space.ketterling.dataviento.registry.ParameterRegistry;
import space.ketterling.dataviento.support.MutableClock;
import space.ketterling.dataviento.support.TestConfigs;
import space.ketterling.dataviento.support.TestDatabase;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetentionServiceTest {
    private static final Instant T0 = Instant.parse("2025-10-01T00:00:00Z");

    private TestDatabase db;
    private MutableClock clock;
    private TimeSeriesRepo timeSeries;
    private DailyAggregateRepo daily;
    private SnapshotRepo snapshots;
    private RetentionService retention;
    private long locationId;
    private long modelId;
    private long tempId;

    @BeforeEach
    void setUp() throws Exception {
        db = TestDatabase.create();
        clock = new MutableClock(T0, ZoneOffset.UTC);
        Properties p = TestConfigs.base(db.jdbcUrl());
        p.setProperty("retention.chunkSize", "1");
        AppConfig cfg = TestConfigs.load(p);

        timeSeries = new TimeSeriesRepo(db.dataSource());
        daily = new DailyAggregateRepo(db.dataSource());
        snapshots = new SnapshotRepo(db.dataSource());
        retention = new RetentionService(cfg, timeSeries, daily, snapshots, new TableStatsRepo(db.dataSource()),
                clock);

        locationId = new LocationRegistry(new LocationRepo(db.dataSource()), clock)
                .resolveOrCreate(LocationTarget.of("Madrid", 40.4168, -3.7038));
        modelId = new ModelRegistry(new ModelRepo(db.dataSource()), clock).resolveOrCreate(ModelCatalog.WEATHER);
        tempId = new ParameterRegistry(new ParameterRepo(db.dataSource()), clock).resolveOrCreate("temp_2m");
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    private void batchAt(Instant referenceTime, int points) throws Exception {
        BatchHeader header = new BatchHeader(null, locationId, modelId, referenceTime, 0.5, "GMT", 0);
        List<DataPoint> list = new ArrayList<>();
        for (int i = 0; i < points; i++) {
            list.add(DataPoint.of(tempId, referenceTime.plusSeconds(3600L * i), i, 10.0 + i, "°C"));
        }
        timeSeries.writeBatch(TimeSeriesTable.WEATHER, header, list, referenceTime);
    }

    @Test
    void expiredBatchesGoInChunksAndRerunDeletesNothing() throws Exception {
        batchAt(T0, 2);
        batchAt(T0.plus(Duration.ofHours(1)), 3);
        batchAt(T0.plus(Duration.ofDays(6)), 1);
        clock.setInstant(T0.plus(Duration.ofDays(8)));

        CleanupReport report = retention.cleanup(RetentionTarget.WEATHER_BATCHES, Duration.ofDays(7));

        assertEquals(T0.plus(Duration.ofDays(1)), report.cutoff());
        assertEquals(2, report.deletedFrom("weather_forecast_batch"));
        assertEquals(5, report.deletedFrom("weather_forecast_point"));
        assertEquals(1, db.count("weather_forecast_batch"));
        assertEquals(1, db.count("weather_forecast_point"));

        CleanupReport again = retention.cleanup(RetentionTarget.WEATHER_BATCHES, Duration.ofDays(7));
        assertEquals(0, again.total());
    }

    @Test
    void pointsExpireByValidTimeIndependentOfTheirBatch() throws Exception {
        batchAt(T0, 4);
        clock.setInstant(T0.plus(Duration.ofHours(2)).plus(Duration.ofDays(7)));

        CleanupReport report = retention.cleanup(RetentionTarget.WEATHER_POINTS, Duration.ofDays(7));

        assertEquals(2, report.deletedFrom("weather_forecast_point"));
        assertEquals(1, db.count("weather_forecast_batch"));
        assertEquals(2, db.count("weather_forecast_point"));
    }

    @Test
    void dailyRowsBeforeTheCutoffDateAreRemoved() throws Exception {
        Map<String, Object> v = new HashMap<>();
        v.put("temperature_2m_max", 20.0);
        daily.upsertDaily(DailyTable.WEATHER, locationId, modelId, List.of(
                new DailyRow(LocalDate.of(2025, 9, 1), v),
                new DailyRow(LocalDate.of(2025, 9, 2), v),
                new DailyRow(LocalDate.of(2025, 9, 30), v)), T0);

        CleanupReport report = retention.cleanup(RetentionTarget.WEATHER_DAILY, Duration.ofDays(28));

        assertEquals(2, report.deletedFrom("weather_daily"));
        assertEquals(1, daily.count(DailyTable.WEATHER, locationId));
    }

    @Test
    void staleSnapshotsAreRemovedFromEveryTable() throws Exception {
        snapshots.upsertCurrent(SnapshotTable.WEATHER, locationId, modelId, T0, T0, Map.of("temperature_2m", 1.0));
        snapshots.upsertCurrent(SnapshotTable.MARINE, locationId, modelId, T0, T0, Map.of("wave_height", 1.0));
        clock.setInstant(T0.plus(Duration.ofDays(31)));

        CleanupReport report = retention.cleanup(RetentionTarget.SNAPSHOTS, Duration.ofDays(30));

        assertEquals(1, report.deletedFrom("weather_current"));
        assertEquals(1, report.deletedFrom("marine_current"));
        assertEquals(0, report.deletedFrom("air_quality_current"));
        assertEquals(2, report.total());
    }

    @Test
    void cleanupAllUsesConfiguredWindows() throws Exception {
        batchAt(T0, 1);
        clock.setInstant(T0.plus(Duration.ofDays(400)));

        List<CleanupReport> reports = retention.cleanupAll();

        assertEquals(RetentionTarget.values().length, reports.size());
        assertEquals(0, db.count("weather_forecast_batch"));
        assertTrue(retention.stats().stream().allMatch(s -> s.rows() == 0));
    }

    @Test
    void negativeWindowIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> retention.cleanup(RetentionTarget.MARINE_DAILY, Duration.ofDays(-1)));
    }
}
