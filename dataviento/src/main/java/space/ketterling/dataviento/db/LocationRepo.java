package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.dataviento.registry.LocationAttributes;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database access for locations.
 */
public class LocationRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(LocationRepo.class);

    private static final String COLUMNS = "id, name, latitude, longitude, elevation, timezone, country_code, "
            + "country_name, state, admin1, admin2, population, created_at";

    private final HikariDataSource ds;

    public LocationRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Oldest location whose coordinates are each within {@code tolerance}
     * degrees of the given point.
     */
    public Optional<LocationRow> findWithin(double lat, double lon, double tolerance) throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM location "
                + "WHERE ABS(latitude - ?) < ? AND ABS(longitude - ?) < ? ORDER BY id LIMIT 1";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setDouble(1, lat);
            ps.setDouble(2, tolerance);
            ps.setDouble(3, lon);
            ps.setDouble(4, tolerance);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public Optional<LocationRow> findById(long id) throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM location WHERE id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * All locations, oldest first.
     */
    public List<LocationRow> list() throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM location ORDER BY id";
        List<LocationRow> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Inserts a location and returns its generated id.
     */
    public long insert(String name, double lat, double lon, LocationAttributes attrs, Instant createdAt)
            throws Exception {
        String sql = """
                INSERT INTO location (name, latitude, longitude, elevation, timezone, country_code,
                    country_name, state, admin1, admin2, population, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, name);
            ps.setDouble(2, lat);
            ps.setDouble(3, lon);
            Jdbc.setDouble(ps, 4, attrs.elevation());
            ps.setString(5, attrs.timezoneOrAuto());
            ps.setString(6, attrs.countryCode());
            ps.setString(7, attrs.countryName());
            ps.setString(8, attrs.state());
            ps.setString(9, attrs.admin1());
            ps.setString(10, attrs.admin2());
            if (attrs.population() == null)
                ps.setNull(11, Types.BIGINT);
            else
                ps.setLong(11, attrs.population());
            ps.setTimestamp(12, Timestamp.from(createdAt));
            ps.executeUpdate();
            long id = Jdbc.generatedId(ps);
            log.debug("insert location: {} ({}, {}) -> {}", name, lat, lon, id);
            return id;
        }
    }

    private static LocationRow map(ResultSet rs) throws Exception {
        long pop = rs.getLong("population");
        Long population = rs.wasNull() ? null : pop;
        return new LocationRow(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getDouble("latitude"),
                rs.getDouble("longitude"),
                Jdbc.getDouble(rs, "elevation"),
                rs.getString("timezone"),
                rs.getString("country_code"),
                rs.getString("country_name"),
                rs.getString("state"),
                rs.getString("admin1"),
                rs.getString("admin2"),
                population,
                Jdbc.getInstant(rs, "created_at"));
    }
}
