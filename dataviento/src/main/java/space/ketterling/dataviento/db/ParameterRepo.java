package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.dataviento.registry.ParameterDefinition;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Database access for parameters (physical quantities).
 */
public class ParameterRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ParameterRepo.class);

    private final HikariDataSource ds;

    public ParameterRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    public Optional<Long> findIdByCode(String code) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT id FROM parameter WHERE code = ?")) {
            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    /**
     * Inserts the catalog entry unless a row with its code already exists.
     */
    public void insertIfAbsent(ParameterDefinition def, Instant createdAt) throws Exception {
        String sql = """
                INSERT INTO parameter (code, name, unit, category, data_type, altitude_level, is_surface,
                    domain, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (code) DO NOTHING
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, def.code());
            ps.setString(2, def.name());
            ps.setString(3, def.unit());
            ps.setString(4, def.category());
            ps.setString(5, def.dataType());
            ps.setString(6, def.altitudeLevel());
            ps.setBoolean(7, def.surface());
            ps.setString(8, def.domain().tag());
            ps.setTimestamp(9, Timestamp.from(createdAt));
            int n = ps.executeUpdate();
            log.debug("insertIfAbsent parameter {} -> {} row(s)", def.code(), n);
        }
    }

    /**
     * Number of stored parameters.
     */
    public int count() throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM parameter");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }
}
