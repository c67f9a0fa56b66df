package space.ketterling.dataviento.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.registry.ModelCatalog;
import space.ketterling.dataviento.registry.ModelRegistry;
import space.ketterling.dataviento.support.MutableClock;
import space.ketterling.dataviento.support.TestDatabase;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotRepoTest {
    private static final Instant T0 = Instant.parse("2025-10-01T10:00:00Z");

    private TestDatabase db;
    private SnapshotRepo repo;
    private long locationId;
    private long modelId;

    @BeforeEach
    void setUp() throws Exception {
        db = TestDatabase.create();
        MutableClock clock = new MutableClock(T0, ZoneOffset.UTC);
        repo = new SnapshotRepo(db.dataSource());
        locationId = new LocationRegistry(new LocationRepo(db.dataSource()), clock)
                .resolveOrCreate(LocationTarget.of("Madrid", 40.4168, -3.7038));
        modelId = new ModelRegistry(new ModelRepo(db.dataSource()), clock).resolveOrCreate(ModelCatalog.WEATHER);
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    @Test
    void secondUpsertOverwritesTheOnlyRow() throws Exception {
        Map<String, Double> first = new HashMap<>();
        first.put("temperature_2m", 15.2);
        first.put("relative_humidity_2m", 48.0);
        repo.upsertCurrent(SnapshotTable.WEATHER, locationId, modelId, T0, T0, first);

        Instant later = T0.plusSeconds(900);
        repo.upsertCurrent(SnapshotTable.WEATHER, locationId, modelId, later, later,
                Map.of("temperature_2m", 16.0));

        assertEquals(1, db.count("weather_current"));
        Snapshot s = repo.getCurrent(SnapshotTable.WEATHER, locationId).orElseThrow();
        assertEquals(16.0, s.values().get("temperature_2m"));
        assertNull(s.values().get("relative_humidity_2m"));
        assertEquals(later, s.observationTime());
        assertEquals(later, s.updatedAt());
    }

    @Test
    void unknownColumnIsRejectedBeforeWriting() {
        assertThrows(IllegalArgumentException.class, () -> repo.upsertCurrent(SnapshotTable.MARINE, locationId,
                modelId, T0, T0, Map.of("temperature_2m", 1.0)));
    }

    @Test
    void missingSnapshotIsEmpty() throws Exception {
        assertTrue(repo.getCurrent(SnapshotTable.AIR_QUALITY, locationId).isEmpty());
    }

    @Test
    void deleteStaleRemovesOnlyRowsOlderThanCutoff() throws Exception {
        repo.upsertCurrent(SnapshotTable.AIR_QUALITY, locationId, modelId, T0, T0, Map.of("pm2_5", 8.0));

        assertEquals(0, repo.deleteStale(SnapshotTable.AIR_QUALITY, T0, 100));
        assertEquals(1, repo.deleteStale(SnapshotTable.AIR_QUALITY, T0.plusSeconds(1), 100));
        assertEquals(0, db.count("air_quality_current"));
    }
}
