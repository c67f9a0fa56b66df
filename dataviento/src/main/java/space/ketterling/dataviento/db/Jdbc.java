package space.ketterling.dataviento.db;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Null-aware JDBC binding helpers shared by the repos.
 */
final class Jdbc {
    private Jdbc() {
    }

    static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }

    static void setInteger(PreparedStatement ps, int idx, Integer v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.INTEGER);
        else
            ps.setInt(idx, v);
    }

    static void setInstant(PreparedStatement ps, int idx, Instant v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.TIMESTAMP);
        else
            ps.setTimestamp(idx, Timestamp.from(v));
    }

    static void setDate(PreparedStatement ps, int idx, LocalDate v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.DATE);
        else
            ps.setDate(idx, Date.valueOf(v));
    }

    static Double getDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }

    static Integer getInteger(ResultSet rs, String col) throws SQLException {
        int v = rs.getInt(col);
        return rs.wasNull() ? null : v;
    }

    static Instant getInstant(ResultSet rs, String col) throws SQLException {
        Timestamp ts = rs.getTimestamp(col);
        return ts == null ? null : ts.toInstant();
    }

    static LocalDate getDate(ResultSet rs, String col) throws SQLException {
        Date d = rs.getDate(col);
        return d == null ? null : d.toLocalDate();
    }

    /**
     * Reads the id generated by the last insert on {@code ps}. The id is
     * always the first column of our tables.
     */
    static long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("Insert returned no generated key");
            }
            return keys.getLong(1);
        }
    }
}
