package space.ketterling.dataviento.ingest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.db.IngestLogRepo;
import space.ketterling.dataviento.db.TableStatsRepo;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.retention.RetentionService;
import space.ketterling.dataviento.support.IngestHarness;
import space.ketterling.dataviento.support.TestConfigs;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestSchedulerTest {
    private static final String[] SCHEDULES = {
            "schedule.weatherCurrent", "schedule.weatherHourly", "schedule.weatherDaily",
            "schedule.airQualityCurrent", "schedule.airQualityHourly", "schedule.marineCurrent",
            "schedule.marineHourly", "schedule.marineDaily", "schedule.satellite", "schedule.climate",
            "schedule.retention" };

    private IngestHarness h;
    private IngestRunner runner;
    private IngestScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        h = new IngestHarness();
        runner = new IngestRunner(h.locations, h.ingestLog, 2);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (scheduler != null)
            scheduler.stop();
        runner.close();
        h.close();
    }

    @Test
    void onlyEnabledJobsRunAndTheFirstStartsImmediately() throws Exception {
        Properties p = TestConfigs.withUpstream(TestConfigs.base(h.db.jdbcUrl()), h.upstream.baseUrl());
        for (String key : SCHEDULES) {
            p.setProperty(key, "PT0S");
        }
        p.setProperty("schedule.weatherCurrent", "PT1H");
        AppConfig cfg = TestConfigs.load(p);

        h.locations.resolveOrCreate(LocationTarget.of("Madrid", 40.4168, -3.7038));
        h.upstream.replyFixture("/v1/forecast", "fixtures/weather.json");

        scheduler = new IngestScheduler(cfg, h.clock, runner,
                new WeatherIngestService(h.client, h.om, h.locations, h.parameters, h.models, h.snapshots,
                        h.timeSeries, h.daily, h.clock),
                new AirQualityIngestService(h.client, h.om, h.locations, h.parameters, h.models, h.snapshots,
                        h.timeSeries, h.clock),
                new MarineIngestService(h.client, h.om, h.locations, h.parameters, h.models, h.snapshots,
                        h.timeSeries, h.daily, h.clock),
                new SatelliteIngestService(h.client, h.om, h.locations, h.parameters, h.models, h.daily, h.clock),
                new ClimateIngestService(h.client, h.om, h.locations, h.parameters, h.models, h.projections,
                        h.clock),
                new RetentionService(cfg, h.timeSeries, h.daily, h.snapshots,
                        new TableStatsRepo(h.db.dataSource()), h.clock));
        scheduler.start();

        List<IngestLogRepo.RunRow> runs = awaitFinishedRun(5_000);
        scheduler.stop();

        assertEquals(1, runs.size());
        assertEquals("weather_current", runs.get(0).jobName());
        assertEquals("SUCCESS", runs.get(0).status());
        assertTrue(h.upstream.requests().stream().allMatch(r -> r.startsWith("/v1/forecast")));
        assertEquals(1, h.db.count("weather_current"));
    }

    private List<IngestLogRepo.RunRow> awaitFinishedRun(long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            List<IngestLogRepo.RunRow> runs = h.ingestLog.listRuns(10);
            if (!runs.isEmpty() && runs.get(0).finishedAt() != null)
                return runs;
            Thread.sleep(50);
        }
        throw new AssertionError("no finished run within " + timeoutMs + " ms");
    }
}
