package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Database access for climate projection headers and the daily rows under them.
 */
public class ClimateProjectionRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ClimateProjectionRepo.class);

    private final HikariDataSource ds;

    public ClimateProjectionRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Upserts the projection header and its daily rows in one transaction.
     * Each row gets the projection's id; on failure neither is kept.
     */
    public ProjectionWriteResult writeProjection(ClimateProjection p, List<DailyRow> rows, Instant fetchedAt)
            throws Exception {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                long id = upsertProjection(c, p, fetchedAt);
                for (DailyRow row : rows) {
                    row.values().put("projection_id", id);
                }
                int written = DailyAggregateRepo.upsertDaily(c, DailyTable.CLIMATE, p.locationId(), p.modelId(),
                        rows, fetchedAt);
                c.commit();
                log.debug("writeProjection: location={} model={} {}..{} -> {} ({} days)", p.locationId(),
                        p.modelId(), p.startDate(), p.endDate(), id, written);
                return new ProjectionWriteResult(id, written);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
    }

    /**
     * Inserts the projection or refreshes the metadata of the existing one
     * with the same (location, model, start, end), and returns its id.
     */
    private static long upsertProjection(Connection c, ClimateProjection p, Instant fetchedAt) throws SQLException {
        String upsert = """
                INSERT INTO climate_projection (location_id, model_id, start_date, end_date,
                    disable_bias_correction, cell_selection, generation_time_ms, timezone, utc_offset_seconds,
                    fetched_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (location_id, model_id, start_date, end_date) DO UPDATE SET
                    disable_bias_correction = excluded.disable_bias_correction,
                    cell_selection = excluded.cell_selection,
                    generation_time_ms = excluded.generation_time_ms,
                    timezone = excluded.timezone,
                    utc_offset_seconds = excluded.utc_offset_seconds,
                    fetched_at = excluded.fetched_at
                """;
        try (PreparedStatement ps = c.prepareStatement(upsert)) {
            ps.setLong(1, p.locationId());
            ps.setLong(2, p.modelId());
            Jdbc.setDate(ps, 3, p.startDate());
            Jdbc.setDate(ps, 4, p.endDate());
            ps.setBoolean(5, p.disableBiasCorrection());
            ps.setString(6, p.cellSelection());
            Jdbc.setDouble(ps, 7, p.generationTimeMs());
            ps.setString(8, p.timezone());
            Jdbc.setInteger(ps, 9, p.utcOffsetSeconds());
            Jdbc.setInstant(ps, 10, fetchedAt);
            ps.executeUpdate();
        }
        return findId(c, p);
    }

    private static long findId(Connection c, ClimateProjection p) throws SQLException {
        String sql = "SELECT id FROM climate_projection"
                + " WHERE location_id = ? AND model_id = ? AND start_date = ? AND end_date = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, p.locationId());
            ps.setLong(2, p.modelId());
            Jdbc.setDate(ps, 3, p.startDate());
            Jdbc.setDate(ps, 4, p.endDate());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Climate projection missing after upsert");
                }
                return rs.getLong(1);
            }
        }
    }
}
