package space.ketterling.dataviento.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.dataviento.support.MutableClock;
import space.ketterling.dataviento.support.TestDatabase;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class IngestLogRepoTest {
    private static final Instant T0 = Instant.parse("2025-10-01T10:00:00Z");

    private TestDatabase db;
    private MutableClock clock;
    private IngestLogRepo repo;

    @BeforeEach
    void setUp() throws Exception {
        db = TestDatabase.create();
        clock = new MutableClock(T0, ZoneOffset.UTC);
        repo = new IngestLogRepo(db.dataSource(), clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    @Test
    void runIsStartedThenFinishedWithCounts() throws Exception {
        UUID runId = repo.startRun("weather_current");
        clock.advance(Duration.ofSeconds(4));
        repo.finishRun(runId, "PARTIAL", 3, 2, 1, "ok=2 fail=1");

        List<IngestLogRepo.RunRow> runs = repo.listRuns(10);
        assertEquals(1, runs.size());
        IngestLogRepo.RunRow run = runs.get(0);
        assertEquals(runId, run.runId());
        assertEquals("PARTIAL", run.status());
        assertEquals(T0, run.startedAt());
        assertEquals(T0.plusSeconds(4), run.finishedAt());
        assertEquals(2, run.succeeded());
    }

    @Test
    void unfinishedRunStaysRunning() throws Exception {
        repo.startRun("marine_daily");

        IngestLogRepo.RunRow run = repo.listRuns(1).get(0);
        assertEquals("RUNNING", run.status());
        assertNull(run.finishedAt());
    }

    @Test
    void eventsAreListedPerRun() throws Exception {
        UUID runId = repo.startRun("air_quality_hourly");
        UUID other = repo.startRun("air_quality_hourly");
        repo.logEvent(runId, "air_quality", "Madrid", 1L, "FETCH", "503 from upstream");
        repo.logEvent(runId, "air_quality", "Bogota", null, "VALIDATE", "bad payload");
        repo.logEvent(other, "air_quality", "Cartagena", 3L, "PERSIST", "disk full");

        List<IngestLogRepo.EventRow> events = repo.listEvents(runId);
        assertEquals(2, events.size());
        assertEquals("FETCH", events.get(0).stage());
        assertNull(events.get(1).locationId());
    }
}
