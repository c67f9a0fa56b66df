package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Daily aggregate persistence: one row per (location, model, day), later
 * fetches overwrite earlier ones.
 */
public class DailyAggregateRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(DailyAggregateRepo.class);

    private final HikariDataSource ds;

    public DailyAggregateRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Upserts every row in one transaction. On conflict every value column is
     * replaced, including with NULL where the new row has no value.
     *
     * @return number of rows written
     */
    public int upsertDaily(DailyTable table, long locationId, long modelId, List<DailyRow> rows, Instant fetchedAt)
            throws Exception {
        if (rows.isEmpty())
            return 0;
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                int n = upsertDaily(c, table, locationId, modelId, rows, fetchedAt);
                c.commit();
                return n;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
    }

    /**
     * Batched upsert on a connection the caller owns; commits nothing.
     */
    static int upsertDaily(Connection c, DailyTable table, long locationId, long modelId, List<DailyRow> rows,
            Instant fetchedAt) throws SQLException {
        if (rows.isEmpty())
            return 0;
        for (DailyRow row : rows) {
            for (String key : row.values().keySet()) {
                if (!table.hasColumn(key)) {
                    throw new IllegalArgumentException("Unknown column for " + table.table() + ": " + key);
                }
            }
        }

        StringJoiner cols = new StringJoiner(", ");
        StringJoiner marks = new StringJoiner(", ");
        StringJoiner updates = new StringJoiner(", ");
        for (DailyTable.Column col : table.columns()) {
            cols.add(col.name());
            marks.add("?");
            updates.add(col.name() + " = excluded." + col.name());
        }
        String sql = "INSERT INTO " + table.table()
                + " (location_id, model_id, valid_date, " + cols + ", fetched_at)"
                + " VALUES (?, ?, ?, " + marks + ", ?)"
                + " ON CONFLICT (location_id, model_id, valid_date) DO UPDATE SET " + updates
                + ", fetched_at = excluded.fetched_at";

        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (DailyRow row : rows) {
                int i = 1;
                ps.setLong(i++, locationId);
                ps.setLong(i++, modelId);
                Jdbc.setDate(ps, i++, row.validDate());
                for (DailyTable.Column col : table.columns()) {
                    bind(ps, i++, col, row.values().get(col.name()));
                }
                Jdbc.setInstant(ps, i, fetchedAt);
                ps.addBatch();
            }
            ps.executeBatch();
        }
        log.debug("upsertDaily: {} location={} model={} rows={}", table.table(), locationId, modelId, rows.size());
        return rows.size();
    }

    private static void bind(PreparedStatement ps, int idx, DailyTable.Column col, Object v) throws SQLException {
        switch (col.kind()) {
            case NUMBER -> Jdbc.setDouble(ps, idx, v == null ? null : ((Number) v).doubleValue());
            case INTEGER -> {
                if (v == null)
                    ps.setNull(idx, Types.BIGINT);
                else
                    ps.setLong(idx, ((Number) v).longValue());
            }
            case TEXT -> ps.setString(idx, v == null ? null : v.toString());
        }
    }

    /**
     * Rows for a location with valid_date in [from, to], oldest first. Either
     * bound may be null.
     */
    public List<DailyRow> getDaily(DailyTable table, long locationId, LocalDate from, LocalDate to)
            throws Exception {
        StringJoiner cols = new StringJoiner(", ");
        for (DailyTable.Column col : table.columns()) {
            cols.add(col.name());
        }
        StringBuilder sql = new StringBuilder("SELECT valid_date, ").append(cols)
                .append(" FROM ").append(table.table()).append(" WHERE location_id = ?");
        if (from != null)
            sql.append(" AND valid_date >= ?");
        if (to != null)
            sql.append(" AND valid_date <= ?");
        sql.append(" ORDER BY valid_date, model_id");

        List<DailyRow> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setLong(i++, locationId);
            if (from != null)
                Jdbc.setDate(ps, i++, from);
            if (to != null)
                Jdbc.setDate(ps, i, to);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Map<String, Object> values = new LinkedHashMap<>();
                    for (DailyTable.Column col : table.columns()) {
                        values.put(col.name(), read(rs, col));
                    }
                    out.add(new DailyRow(Jdbc.getDate(rs, "valid_date"), Collections.unmodifiableMap(values)));
                }
            }
        }
        return out;
    }

    private static Object read(ResultSet rs, DailyTable.Column col) throws SQLException {
        return switch (col.kind()) {
            case NUMBER -> Jdbc.getDouble(rs, col.name());
            case INTEGER -> {
                long v = rs.getLong(col.name());
                yield rs.wasNull() ? null : v;
            }
            case TEXT -> rs.getString(col.name());
        };
    }

    public int count(DailyTable table, long locationId) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "SELECT COUNT(*) FROM " + table.table() + " WHERE location_id = ?")) {
            ps.setLong(1, locationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    /**
     * Averages and DNI extremes over stored satellite days. Empty when the
     * location has no days in range.
     */
    public Optional<RadiationStatistics> getSatelliteStatistics(long locationId, LocalDate from, LocalDate to)
            throws Exception {
        String sql = """
                SELECT COUNT(*) AS days,
                       AVG(shortwave_radiation) AS avg_shortwave,
                       AVG(direct_radiation) AS avg_direct,
                       AVG(diffuse_radiation) AS avg_diffuse,
                       AVG(direct_normal_irradiance) AS avg_dni,
                       AVG(global_tilted_irradiance) AS avg_gti,
                       AVG(terrestrial_radiation) AS avg_terrestrial,
                       MAX(direct_normal_irradiance) AS max_dni,
                       MIN(direct_normal_irradiance) AS min_dni,
                       AVG(quality_score) AS avg_quality,
                       MIN(valid_date) AS first_date,
                       MAX(valid_date) AS last_date
                FROM satellite_daily
                WHERE location_id = ? AND valid_date >= ? AND valid_date <= ?
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, locationId);
            Jdbc.setDate(ps, 2, from);
            Jdbc.setDate(ps, 3, to);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || rs.getInt("days") == 0)
                    return Optional.empty();
                return Optional.of(new RadiationStatistics(
                        rs.getInt("days"),
                        Jdbc.getDouble(rs, "avg_shortwave"),
                        Jdbc.getDouble(rs, "avg_direct"),
                        Jdbc.getDouble(rs, "avg_diffuse"),
                        Jdbc.getDouble(rs, "avg_dni"),
                        Jdbc.getDouble(rs, "avg_gti"),
                        Jdbc.getDouble(rs, "avg_terrestrial"),
                        Jdbc.getDouble(rs, "max_dni"),
                        Jdbc.getDouble(rs, "min_dni"),
                        Jdbc.getDouble(rs, "avg_quality"),
                        Jdbc.getDate(rs, "first_date"),
                        Jdbc.getDate(rs, "last_date")));
            }
        }
    }

    /**
     * Deletes up to {@code limit} rows dated before {@code cutoff}.
     */
    public int deleteBefore(DailyTable table, LocalDate cutoff, int limit) throws Exception {
        String sql = "DELETE FROM " + table.table() + " WHERE id IN (SELECT id FROM " + table.table()
                + " WHERE valid_date < ? ORDER BY id LIMIT ?)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            Jdbc.setDate(ps, 1, cutoff);
            ps.setInt(2, limit);
            int n = ps.executeUpdate();
            log.debug("deleteBefore: {} cutoff={} -> {}", table.table(), cutoff, n);
            return n;
        }
    }
}
