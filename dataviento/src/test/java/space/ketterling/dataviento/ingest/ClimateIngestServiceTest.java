package space.ketterling.dataviento.ingest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.db.DailyRow;
import space.ketterling.dataviento.db.DailyTable;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.support.IngestHarness;

import java.sql.Connection;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClimateIngestServiceTest {
    private static final String PATH = "/v1/climate";
    private static final LocalDate START = LocalDate.of(2030, 1, 1);
    private static final LocalDate END = LocalDate.of(2030, 1, 3);
    private static final LocationTarget MADRID = LocationTarget.of("Madrid", 40.4168, -3.7038);

    private IngestHarness h;
    private ClimateIngestService service;

    @BeforeEach
    void setUp() throws Exception {
        h = new IngestHarness();
        service = new ClimateIngestService(h.client, h.om, h.locations, h.parameters, h.models, h.projections,
                h.clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        h.close();
    }

    @Test
    void storesOneProjectionWithItsDays() throws Exception {
        h.upstream.replyFixture(PATH, "fixtures/climate.json");

        LocationIngestResult r = service.fetchAndSave(MADRID, ClimateOptions.of(START, END, "MRI_AGCM3_2_S"));

        assertTrue(r.success(), r.error());
        assertEquals(3, r.rowsWritten());
        assertEquals(1, h.db.count("climate_projection"));

        List<DailyRow> days = h.daily.getDaily(DailyTable.CLIMATE, r.locationId(), START, END);
        assertEquals(3, days.size());
        assertNotNull(days.get(0).values().get("projection_id"));
        assertEquals(1015.2, days.get(1).number("pressure_msl_mean"));

        String uri = h.upstream.requests().get(0);
        assertTrue(uri.contains("models=MRI_AGCM3_2_S"), uri);
        assertTrue(uri.contains("cell_selection=land"), uri);
    }

    @Test
    void rerunReusesTheProjection() throws Exception {
        h.upstream.replyFixture(PATH, "fixtures/climate.json");
        ClimateOptions options = new ClimateOptions(START, END, "EC_Earth3P_HR", true, "nearest");

        service.fetchAndSave(MADRID, options);
        LocationIngestResult r = service.fetchAndSave(MADRID, options);

        assertTrue(r.success(), r.error());
        assertEquals(1, h.db.count("climate_projection"));
        assertEquals(3, h.db.count("climate_daily"));
        assertTrue(h.upstream.requests().get(0).contains("disable_bias_correction=true"));
    }

    @Test
    void unknownModelFailsValidationWithoutCallingUpstream() throws Exception {
        LocationIngestResult r = service.fetchAndSave(MADRID, ClimateOptions.of(START, END, "OM_FORECAST"));

        assertEquals(Stage.VALIDATE, r.failedStage());
        assertTrue(r.error().contains("unknown climate model"), r.error());
        assertTrue(h.upstream.requests().isEmpty());
        assertEquals(0, h.db.count("location"));
    }

    @Test
    void badCellSelectionFailsValidation() {
        LocationIngestResult r = service.fetchAndSave(MADRID,
                new ClimateOptions(START, END, "EC_Earth3P_HR", false, "ocean"));

        assertEquals(Stage.VALIDATE, r.failedStage());
        assertTrue(h.upstream.requests().isEmpty());
    }

    @Test
    void failedDailyWriteLeavesNoProjectionBehind() throws Exception {
        h.upstream.replyFixture(PATH, "fixtures/climate.json");
        try (Connection c = h.db.dataSource().getConnection(); Statement st = c.createStatement()) {
            st.execute("DROP TABLE climate_daily");
        }

        LocationIngestResult r = service.fetchAndSave(MADRID, ClimateOptions.of(START, END, "EC_Earth3P_HR"));

        assertFalse(r.success());
        assertEquals(Stage.PERSIST, r.failedStage());
        assertTrue(r.error().startsWith("upsertClimateDaily failed"), r.error());
        assertEquals(0, h.db.count("climate_projection"));
    }
}
