package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Database access for ingest run summaries and per-location failure events.
 */
public class IngestLogRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(IngestLogRepo.class);

    private final HikariDataSource ds;
    private final Clock clock;

    public IngestLogRepo(HikariDataSource ds, Clock clock) {
        this.ds = ds;
        this.clock = clock;
    }

    /**
     * Starts a new ingest run and returns its unique ID.
     */
    public UUID startRun(String jobName) throws Exception {
        UUID runId = UUID.randomUUID();
        if (ds.isClosed()) {
            log.warn("startRun skipped (datasource closed): {}", jobName);
            return runId;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO ingest_run (run_id, job_name, started_at, status) VALUES (?, ?, ?, 'RUNNING')")) {
            ps.setString(1, runId.toString());
            ps.setString(2, jobName);
            Jdbc.setInstant(ps, 3, clock.instant());
            ps.executeUpdate();
        }
        log.debug("startRun: {} -> {}", jobName, runId);
        return runId;
    }

    /**
     * Records the final status and counts of a run.
     */
    public void finishRun(UUID runId, String status, int attempted, int succeeded, int failed, String notes)
            throws Exception {
        if (ds.isClosed()) {
            log.warn("finishRun skipped (datasource closed): {}", runId);
            return;
        }
        String sql = "UPDATE ingest_run SET finished_at = ?, status = ?, attempted = ?, succeeded = ?, failed = ?,"
                + " notes = ? WHERE run_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            Jdbc.setInstant(ps, 1, clock.instant());
            ps.setString(2, status);
            ps.setInt(3, attempted);
            ps.setInt(4, succeeded);
            ps.setInt(5, failed);
            ps.setString(6, notes);
            ps.setString(7, runId.toString());
            ps.executeUpdate();
        }
        log.debug("finishRun: {} status={} notes={}", runId, status, notes);
    }

    /**
     * Logs one location failure within a run.
     */
    public void logEvent(UUID runId, String source, String locationName, Long locationId, String stage,
            String error) throws Exception {
        if (ds.isClosed()) {
            log.warn("logEvent skipped (datasource closed): {} {}", source, locationName);
            return;
        }
        String sql = "INSERT INTO ingest_event (run_id, source, location_name, location_id, stage, error, created_at)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId.toString());
            ps.setString(2, source);
            ps.setString(3, locationName);
            if (locationId == null)
                ps.setNull(4, java.sql.Types.BIGINT);
            else
                ps.setLong(4, locationId);
            ps.setString(5, stage);
            ps.setString(6, error);
            Jdbc.setInstant(ps, 7, clock.instant());
            ps.executeUpdate();
        }
        log.debug("logEvent: run={} source={} location={} stage={} error={}", runId, source, locationName, stage,
                error);
    }

    /**
     * Most recent runs first.
     */
    public List<RunRow> listRuns(int limit) throws Exception {
        String sql = "SELECT run_id, job_name, started_at, finished_at, status, attempted, succeeded, failed, notes"
                + " FROM ingest_run ORDER BY started_at DESC LIMIT ?";
        List<RunRow> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRun(rs));
                }
            }
        }
        return out;
    }

    public List<EventRow> listEvents(UUID runId) throws Exception {
        String sql = "SELECT source, location_name, location_id, stage, error, created_at FROM ingest_event"
                + " WHERE run_id = ? ORDER BY id";
        List<EventRow> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId.toString());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long locId = rs.getLong("location_id");
                    Long locationId = rs.wasNull() ? null : locId;
                    out.add(new EventRow(
                            rs.getString("source"),
                            rs.getString("location_name"),
                            locationId,
                            rs.getString("stage"),
                            rs.getString("error"),
                            Jdbc.getInstant(rs, "created_at")));
                }
            }
        }
        return out;
    }

    private static RunRow mapRun(ResultSet rs) throws SQLException {
        return new RunRow(
                UUID.fromString(rs.getString("run_id")),
                rs.getString("job_name"),
                Jdbc.getInstant(rs, "started_at"),
                Jdbc.getInstant(rs, "finished_at"),
                rs.getString("status"),
                Jdbc.getInteger(rs, "attempted"),
                Jdbc.getInteger(rs, "succeeded"),
                Jdbc.getInteger(rs, "failed"),
                rs.getString("notes"));
    }

    public record RunRow(UUID runId, String jobName, Instant startedAt, Instant finishedAt, String status,
            Integer attempted, Integer succeeded, Integer failed, String notes) {
    }

    public record EventRow(String source, String locationName, Long locationId, String stage, String error,
            Instant createdAt) {
    }
}
