package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Current-conditions persistence: one row per location per domain,
 * overwritten in place.
 */
public class SnapshotRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(SnapshotRepo.class);

    private final HikariDataSource ds;

    public SnapshotRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Inserts the snapshot or overwrites every column of the existing one, in
     * a single statement. Columns missing from {@code values} are written as
     * NULL; keys that are not columns of the table are rejected.
     */
    public void upsertCurrent(SnapshotTable table, long locationId, long modelId, Instant observedAt,
            Instant updatedAt, Map<String, Double> values) throws Exception {
        for (String key : values.keySet()) {
            if (!table.columns().contains(key)) {
                throw new IllegalArgumentException("Unknown column for " + table.table() + ": " + key);
            }
        }

        StringJoiner cols = new StringJoiner(", ");
        StringJoiner marks = new StringJoiner(", ");
        StringJoiner updates = new StringJoiner(", ");
        for (String col : table.columns()) {
            cols.add(col);
            marks.add("?");
            updates.add(col + " = excluded." + col);
        }
        String sql = "INSERT INTO " + table.table()
                + " (location_id, model_id, observation_time, " + cols + ", updated_at)"
                + " VALUES (?, ?, ?, " + marks + ", ?)"
                + " ON CONFLICT (location_id) DO UPDATE SET model_id = excluded.model_id,"
                + " observation_time = excluded.observation_time, " + updates
                + ", updated_at = excluded.updated_at";

        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setLong(i++, locationId);
            ps.setLong(i++, modelId);
            Jdbc.setInstant(ps, i++, observedAt);
            for (String col : table.columns()) {
                Jdbc.setDouble(ps, i++, values.get(col));
            }
            Jdbc.setInstant(ps, i, updatedAt);
            ps.executeUpdate();
        }
        log.debug("upsertCurrent: {} location={} observed={}", table.table(), locationId, observedAt);
    }

    public Optional<Snapshot> getCurrent(SnapshotTable table, long locationId) throws Exception {
        String sql = "SELECT location_id, model_id, observation_time, updated_at, "
                + String.join(", ", table.columns())
                + " FROM " + table.table() + " WHERE location_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, locationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                Map<String, Double> values = new LinkedHashMap<>();
                for (String col : table.columns()) {
                    values.put(col, Jdbc.getDouble(rs, col));
                }
                return Optional.of(new Snapshot(
                        rs.getLong("location_id"),
                        rs.getLong("model_id"),
                        Jdbc.getInstant(rs, "observation_time"),
                        Jdbc.getInstant(rs, "updated_at"),
                        Collections.unmodifiableMap(values)));
            }
        }
    }

    /**
     * Deletes up to {@code limit} snapshots not updated since {@code cutoff}.
     */
    public int deleteStale(SnapshotTable table, Instant cutoff, int limit) throws Exception {
        String sql = "DELETE FROM " + table.table() + " WHERE id IN (SELECT id FROM " + table.table()
                + " WHERE updated_at < ? ORDER BY id LIMIT ?)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            Jdbc.setInstant(ps, 1, cutoff);
            ps.setInt(2, limit);
            int n = ps.executeUpdate();
            log.debug("deleteStale: {} cutoff={} -> {}", table.table(), cutoff, n);
            return n;
        }
    }
}
