package space.ketterling.dataviento.registry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.db.ModelRepo;
import space.ketterling.dataviento.db.ParameterRepo;
import space.ketterling.dataviento.support.MutableClock;
import space.ketterling.dataviento.support.TestDatabase;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogRegistryTest {
    private TestDatabase db;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        db = TestDatabase.create();
        clock = new MutableClock(Instant.parse("2025-10-01T00:00:00Z"), ZoneOffset.UTC);
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    @Test
    void parameterIsInsertedOnceAndCached() throws Exception {
        ParameterRegistry registry = new ParameterRegistry(new ParameterRepo(db.dataSource()), clock);

        long temp = registry.resolveOrCreate("temp_2m");
        assertEquals(temp, registry.resolveOrCreate("temp_2m"));
        assertNotEquals(temp, registry.resolveOrCreate("pm2_5"));
        assertEquals(2, db.count("parameter"));
        assertEquals("°C", registry.unitOf("temp_2m"));
    }

    @Test
    void separateRegistriesShareStoredIds() throws Exception {
        long first = new ParameterRegistry(new ParameterRepo(db.dataSource()), clock).resolveOrCreate("wave_height");
        long second = new ParameterRegistry(new ParameterRepo(db.dataSource()), clock).resolveOrCreate("wave_height");

        assertEquals(first, second);
        assertEquals(1, db.count("parameter"));
    }

    @Test
    void unknownParameterCodeIsRejected() {
        ParameterRegistry registry = new ParameterRegistry(new ParameterRepo(db.dataSource()), clock);

        assertThrows(IllegalArgumentException.class, () -> registry.resolveOrCreate("not_a_parameter"));
    }

    @Test
    void modelsResolveAndUnknownCodesAreRejected() throws Exception {
        ModelRegistry registry = new ModelRegistry(new ModelRepo(db.dataSource()), clock);

        long weather = registry.resolveOrCreate(ModelCatalog.WEATHER);
        assertEquals(weather, registry.resolveOrCreate(ModelCatalog.WEATHER));
        registry.resolveOrCreate("MRI_AGCM3_2_S");
        assertEquals(2, db.count("measurement_model"));

        assertThrows(IllegalArgumentException.class, () -> registry.resolveOrCreate("GFS_SEAMLESS"));
    }

    @Test
    void onlyClimateModelsAreSelectableForProjections() {
        assertTrue(ModelCatalog.isClimateModel("EC_Earth3P_HR"));
        assertTrue(ModelCatalog.isClimateModel("NICAM16_8S"));
        assertFalse(ModelCatalog.isClimateModel(ModelCatalog.WEATHER));
        assertFalse(ModelCatalog.isClimateModel("nope"));
    }
}
