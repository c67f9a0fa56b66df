package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Set;

/**
 * Row counts and oldest timestamps, for retention reports.
 */
public class TableStatsRepo {
    private static final Set<String> KNOWN_TABLES = Set.of(
            "weather_current", "air_quality_current", "marine_current",
            "weather_forecast_batch", "weather_forecast_point",
            "air_quality_batch", "air_quality_point",
            "marine_batch", "marine_point",
            "weather_daily", "marine_daily", "satellite_daily", "climate_daily");

    private final HikariDataSource ds;

    public TableStatsRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Count and oldest value of {@code timeColumn}. The oldest value is
     * returned as a string since the column may be a date or a timestamp.
     */
    public TableStats stats(String table, String timeColumn) throws Exception {
        if (!KNOWN_TABLES.contains(table)) {
            throw new IllegalArgumentException("Not a data table: " + table);
        }
        String sql = "SELECT COUNT(*) AS n, MIN(" + timeColumn + ") AS oldest FROM " + table;
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            long n = rs.getLong("n");
            String oldest = null;
            if (n > 0) {
                var ts = rs.getTimestamp("oldest");
                oldest = ts == null ? null : ts.toInstant().toString();
            }
            return new TableStats(table, n, oldest);
        }
    }

    public record TableStats(String table, long rows, String oldest) {
    }
}
