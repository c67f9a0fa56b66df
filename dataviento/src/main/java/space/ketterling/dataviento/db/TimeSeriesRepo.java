package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Hourly time-series persistence: a batch header plus its data points.
 */
public class TimeSeriesRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(TimeSeriesRepo.class);

    private final HikariDataSource ds;

    public TimeSeriesRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Creates a batch header and returns its id.
     */
    public long createBatch(TimeSeriesTable table, BatchHeader header, Instant createdAt) throws Exception {
        try (Connection c = ds.getConnection()) {
            return createBatch(c, table, header, createdAt);
        }
    }

    /**
     * Inserts points under an existing batch. A point whose
     * (batch, parameter, valid_time) is already stored is skipped.
     *
     * @return number of points actually inserted
     */
    public int insertPoints(TimeSeriesTable table, long batchId, List<DataPoint> points) throws Exception {
        try (Connection c = ds.getConnection()) {
            return insertPoints(c, table, batchId, points);
        }
    }

    /**
     * Creates the batch and inserts its points in one transaction, so a failed
     * write leaves neither behind.
     */
    public BatchWriteResult writeBatch(TimeSeriesTable table, BatchHeader header, List<DataPoint> points,
            Instant createdAt) throws Exception {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                long batchId = createBatch(c, table, header, createdAt);
                int inserted = insertPoints(c, table, batchId, points);
                c.commit();
                log.debug("writeBatch: {} batch={} points={}/{}", table.batchTable(), batchId, inserted,
                        points.size());
                return new BatchWriteResult(batchId, inserted, points.size());
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
    }

    private long createBatch(Connection c, TimeSeriesTable table, BatchHeader h, Instant createdAt)
            throws SQLException {
        String sql = "INSERT INTO " + table.batchTable()
                + " (location_id, model_id, reference_time, generation_time_ms, timezone, utc_offset_seconds,"
                + " created_at) VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, h.locationId());
            ps.setLong(2, h.modelId());
            Jdbc.setInstant(ps, 3, h.referenceTime());
            Jdbc.setDouble(ps, 4, h.generationTimeMs());
            ps.setString(5, h.timezone());
            Jdbc.setInteger(ps, 6, h.utcOffsetSeconds());
            Jdbc.setInstant(ps, 7, createdAt);
            ps.executeUpdate();
            long id = Jdbc.generatedId(ps);
            log.debug("createBatch: {} location={} -> {}", table.batchTable(), h.locationId(), id);
            return id;
        }
    }

    private int insertPoints(Connection c, TimeSeriesTable table, long batchId, List<DataPoint> points)
            throws SQLException {
        if (points.isEmpty())
            return 0;
        String sql = "INSERT INTO " + table.pointTable()
                + " (batch_id, parameter_id, valid_time, forecast_hour, value, unit, quality_flag)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?)"
                + " ON CONFLICT (batch_id, parameter_id, valid_time) DO NOTHING";
        int inserted = 0;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (DataPoint p : points) {
                ps.setLong(1, batchId);
                ps.setLong(2, p.parameterId());
                Jdbc.setInstant(ps, 3, p.validTime());
                ps.setInt(4, p.forecastHour());
                Jdbc.setDouble(ps, 5, p.value());
                ps.setString(6, p.unit());
                ps.setString(7, p.qualityFlag());
                ps.addBatch();
            }
            for (int n : ps.executeBatch()) {
                // drivers may report SUCCESS_NO_INFO (-2) instead of a count
                if (n > 0 || n == Statement.SUCCESS_NO_INFO)
                    inserted++;
            }
        }
        return inserted;
    }

    /**
     * Most recent batch for a location, if any.
     */
    public Optional<BatchHeader> latestBatch(TimeSeriesTable table, long locationId) throws Exception {
        String sql = "SELECT id, location_id, model_id, reference_time, generation_time_ms, timezone,"
                + " utc_offset_seconds FROM " + table.batchTable()
                + " WHERE location_id = ? ORDER BY reference_time DESC, id DESC LIMIT 1";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, locationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                return Optional.of(new BatchHeader(
                        rs.getLong("id"),
                        rs.getLong("location_id"),
                        rs.getLong("model_id"),
                        Jdbc.getInstant(rs, "reference_time"),
                        Jdbc.getDouble(rs, "generation_time_ms"),
                        rs.getString("timezone"),
                        Jdbc.getInteger(rs, "utc_offset_seconds")));
            }
        }
    }

    /**
     * Points of the latest batch for a location, ordered by time then
     * parameter. Empty when the location has no batches yet.
     */
    public List<StoredPoint> getHourly(TimeSeriesTable table, long locationId, int limit) throws Exception {
        Optional<BatchHeader> latest = latestBatch(table, locationId);
        if (latest.isEmpty())
            return Collections.emptyList();
        long batchId = latest.get().id();

        String sql = "SELECT p.batch_id, pr.code, p.valid_time, p.forecast_hour, p.value, p.unit, p.quality_flag"
                + " FROM " + table.pointTable() + " p JOIN parameter pr ON pr.id = p.parameter_id"
                + " WHERE p.batch_id = ? ORDER BY p.valid_time, pr.code LIMIT ?";
        List<StoredPoint> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, batchId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StoredPoint(
                            rs.getLong("batch_id"),
                            rs.getString("code"),
                            Jdbc.getInstant(rs, "valid_time"),
                            rs.getInt("forecast_hour"),
                            Jdbc.getDouble(rs, "value"),
                            rs.getString("unit"),
                            rs.getString("quality_flag")));
                }
            }
        }
        return out;
    }

    public int countPoints(TimeSeriesTable table, long batchId) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "SELECT COUNT(*) FROM " + table.pointTable() + " WHERE batch_id = ?")) {
            ps.setLong(1, batchId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    // ------------------------------------------------------------------
    // Retention
    // ------------------------------------------------------------------

    /**
     * Deletes up to {@code limit} batches whose reference time is before
     * {@code cutoff}, points first, in one transaction.
     *
     * @return deleted counts; both zero once nothing expired remains
     */
    public DeleteCounts deleteBatchesBefore(TimeSeriesTable table, Instant cutoff, int limit) throws Exception {
        try (Connection c = ds.getConnection()) {
            List<Long> ids = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("SELECT id FROM " + table.batchTable()
                    + " WHERE reference_time < ? ORDER BY id LIMIT ?")) {
                Jdbc.setInstant(ps, 1, cutoff);
                ps.setInt(2, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        ids.add(rs.getLong(1));
                }
            }
            if (ids.isEmpty())
                return new DeleteCounts(0, 0);

            String marks = String.join(", ", Collections.nCopies(ids.size(), "?"));
            c.setAutoCommit(false);
            try (PreparedStatement delPoints = c.prepareStatement(
                    "DELETE FROM " + table.pointTable() + " WHERE batch_id IN (" + marks + ")");
                    PreparedStatement delBatches = c.prepareStatement(
                            "DELETE FROM " + table.batchTable() + " WHERE id IN (" + marks + ")")) {
                for (int i = 0; i < ids.size(); i++) {
                    delPoints.setLong(i + 1, ids.get(i));
                    delBatches.setLong(i + 1, ids.get(i));
                }
                int points = delPoints.executeUpdate();
                int batches = delBatches.executeUpdate();
                c.commit();
                log.debug("deleteBatchesBefore: {} cutoff={} batches={} points={}", table.batchTable(), cutoff,
                        batches, points);
                return new DeleteCounts(batches, points);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
    }

    /**
     * Deletes up to {@code limit} points whose valid time is before
     * {@code cutoff}, regardless of batch age.
     */
    public int deletePointsBefore(TimeSeriesTable table, Instant cutoff, int limit) throws Exception {
        String sql = "DELETE FROM " + table.pointTable() + " WHERE id IN (SELECT id FROM " + table.pointTable()
                + " WHERE valid_time < ? ORDER BY id LIMIT ?)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            Jdbc.setInstant(ps, 1, cutoff);
            ps.setInt(2, limit);
            return ps.executeUpdate();
        }
    }

    /**
     * Rows removed by one retention chunk.
     */
    public record DeleteCounts(int batches, int points) {
    }
}
