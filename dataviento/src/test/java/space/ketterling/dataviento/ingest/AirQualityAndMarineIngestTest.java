package space.ketterling.dataviento.ingest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.db.DailyTable;
import space.ketterling.dataviento.db.SnapshotTable;
import space.ketterling.dataviento.db.StoredPoint;
import space.ketterling.dataviento.db.TimeSeriesTable;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.support.IngestHarness;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AirQualityAndMarineIngestTest {
    private IngestHarness h;

    @BeforeEach
    void setUp() throws Exception {
        h = new IngestHarness();
    }

    @AfterEach
    void tearDown() throws Exception {
        h.close();
    }

    @Test
    void airQualityStoresSnapshotAndHourlyBatch() throws Exception {
        AirQualityIngestService service = new AirQualityIngestService(h.client, h.om, h.locations, h.parameters,
                h.models, h.snapshots, h.timeSeries, h.clock);
        h.upstream.replyFixture("/v1/air-quality", "fixtures/air-quality.json");

        LocationIngestResult r = service.fetchAndSave(LocationTarget.of("Madrid", 40.4168, -3.7038),
                ForecastOptions.all(5));

        assertTrue(r.success(), r.error());
        assertFalse(r.dailySaved());
        var snap = h.snapshots.getCurrent(SnapshotTable.AIR_QUALITY, r.locationId()).orElseThrow();
        assertEquals(22.0, snap.values().get("european_aqi"));
        assertNull(snap.values().get("ammonia"));

        List<StoredPoint> points = h.timeSeries.getHourly(TimeSeriesTable.AIR_QUALITY, r.locationId(), 100);
        assertEquals(16, points.size());
        assertEquals("aqi_european", points.get(0).parameterCode());

        String uri = h.upstream.requests().get(0);
        assertFalse(uri.contains("daily="), uri);
    }

    @Test
    void marineDefaultsToCurrentAndDaily() throws Exception {
        MarineIngestService service = new MarineIngestService(h.client, h.om, h.locations, h.parameters,
                h.models, h.snapshots, h.timeSeries, h.daily, h.clock);
        h.upstream.replyFixture("/v1/marine", "fixtures/marine.json");

        LocationIngestResult r = service.fetchAndSave(LocationTarget.of("Cartagena", 10.391, -75.4794),
                MarineIngestService.defaultOptions(3));

        assertTrue(r.success(), r.error());
        assertTrue(r.currentSaved());
        assertFalse(r.hourlySaved());
        assertTrue(r.dailySaved());
        assertEquals(0, h.db.count("marine_batch"));
        assertEquals(1, h.daily.count(DailyTable.MARINE, r.locationId()));
        assertEquals(28.9, h.snapshots.getCurrent(SnapshotTable.MARINE, r.locationId()).orElseThrow()
                .values().get("sea_surface_temperature"));
    }

    @Test
    void marineHourlyWhenRequested() throws Exception {
        MarineIngestService service = new MarineIngestService(h.client, h.om, h.locations, h.parameters,
                h.models, h.snapshots, h.timeSeries, h.daily, h.clock);
        h.upstream.replyFixture("/v1/marine", "fixtures/marine.json");

        LocationIngestResult r = service.fetchAndSave(LocationTarget.of("Cartagena", 10.391, -75.4794),
                ForecastOptions.of(3, Section.HOURLY));

        assertTrue(r.success(), r.error());
        assertEquals(16, h.db.count("marine_point"));
        assertEquals(0, h.db.count("marine_current"));
    }
}
