package space.ketterling.dataviento.registry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.db.LocationRepo;
import space.ketterling.dataviento.db.LocationRow;
import space.ketterling.dataviento.support.MutableClock;
import space.ketterling.dataviento.support.TestDatabase;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class LocationRegistryTest {
    private TestDatabase db;
    private LocationRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        db = TestDatabase.create();
        registry = new LocationRegistry(new LocationRepo(db.dataSource()),
                new MutableClock(Instant.parse("2025-10-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    @Test
    void nearbyCoordinatesResolveToTheSameLocation() throws Exception {
        long madrid = registry.resolveOrCreate(LocationTarget.of("Madrid", 40.4168, -3.7038));
        long again = registry.resolveOrCreate(LocationTarget.of("Madrid centro", 40.4169, -3.7039));
        long elsewhere = registry.resolveOrCreate(LocationTarget.of("Somewhere", 41.0, -3.0));

        assertEquals(madrid, again);
        assertNotEquals(madrid, elsewhere);
        assertEquals(2, db.count("location"));
    }

    @Test
    void firstWriteKeepsItsNameAndAttributes() throws Exception {
        LocationAttributes attrs = new LocationAttributes(667.0, "Europe/Madrid", "ES", "Spain", null,
                "Comunidad de Madrid", null, 3_300_000L);
        long id = registry.resolveOrCreate(new LocationTarget("Madrid", 40.4168, -3.7038, attrs));
        registry.resolveOrCreate(new LocationTarget("Other", 40.417, -3.704,
                LocationAttributes.withTimezone("UTC")));

        LocationRow row = registry.findById(id).orElseThrow();
        assertEquals("Madrid", row.name());
        assertEquals("Europe/Madrid", row.timezone());
        assertEquals("ES", row.countryCode());
        assertEquals(3_300_000L, row.population());
    }

    @Test
    void missingTimezoneIsStoredAsAuto() throws Exception {
        long id = registry.resolveOrCreate(LocationTarget.of("Bogota", 4.711, -74.0721));

        assertEquals("auto", registry.findById(id).orElseThrow().timezone());
    }

    @Test
    void concurrentResolutionOfANewPointCreatesOneRow() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> registry.resolveOrCreate(
                        LocationTarget.of("Cartagena", 10.391, -75.4794))));
            }
            Set<Long> ids = new HashSet<>();
            for (Future<Long> f : futures) {
                ids.add(f.get());
            }
            assertEquals(1, ids.size());
            assertEquals(1, db.count("location"));
        } finally {
            pool.shutdownNow();
        }
    }
}
