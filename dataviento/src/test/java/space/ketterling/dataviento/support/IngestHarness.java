package space.ketterling.dataviento.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.db.ClimateProjectionRepo;
import space.ketterling.dataviento.db.DailyAggregateRepo;
import space.ketterling.dataviento.db.IngestLogRepo;
import space.ketterling.dataviento.db.LocationRepo;
import space.ketterling.dataviento.db.ModelRepo;
import space.ketterling.dataviento.db.ParameterRepo;
import space.ketterling.dataviento.db.SnapshotRepo;
import space.ketterling.dataviento.db.TimeSeriesRepo;
import space.ketterling.dataviento.openmeteo.OpenMeteoClient;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.ModelRegistry;
import space.ketterling.dataviento.registry.ParameterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Database, fake upstream and the wiring between them, as the application
 * builds it at startup.
 */
public final class IngestHarness implements AutoCloseable {
    public static final Instant START = Instant.parse("2025-10-01T10:00:00Z");

    public final TestDatabase db;
    public final FakeOpenMeteoServer upstream;
    public final AppConfig cfg;
    public final MutableClock clock = new MutableClock(START, ZoneOffset.UTC);
    public final ObjectMapper om = new ObjectMapper();
    public final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    public final OpenMeteoClient client;

    public final LocationRepo locationRepo;
    public final SnapshotRepo snapshots;
    public final TimeSeriesRepo timeSeries;
    public final DailyAggregateRepo daily;
    public final ClimateProjectionRepo projections;
    public final IngestLogRepo ingestLog;

    public final LocationRegistry locations;
    public final ParameterRegistry parameters;
    public final ModelRegistry models;

    public IngestHarness() throws Exception {
        db = TestDatabase.create();
        upstream = new FakeOpenMeteoServer();
        Properties p = TestConfigs.withUpstream(TestConfigs.base(db.jdbcUrl()), upstream.baseUrl());
        cfg = TestConfigs.load(p);
        client = new OpenMeteoClient(cfg, om, sleeps::add);

        var ds = db.dataSource();
        locationRepo = new LocationRepo(ds);
        snapshots = new SnapshotRepo(ds);
        timeSeries = new TimeSeriesRepo(ds);
        daily = new DailyAggregateRepo(ds);
        projections = new ClimateProjectionRepo(ds);
        ingestLog = new IngestLogRepo(ds, clock);

        locations = new LocationRegistry(locationRepo, clock);
        parameters = new ParameterRegistry(new ParameterRepo(ds), clock);
        models = new ModelRegistry(new ModelRepo(ds), clock);
    }

    @Override
    public void close() throws Exception {
        client.close();
        upstream.close();
        db.close();
    }
}
