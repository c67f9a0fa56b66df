package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.dataviento.registry.ModelDefinition;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Database access for measurement models.
 */
public class ModelRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ModelRepo.class);

    private final HikariDataSource ds;

    public ModelRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    public Optional<Long> findIdByCode(String code) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT id FROM measurement_model WHERE code = ?")) {
            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    /**
     * Inserts the catalog entry unless a row with its code already exists.
     */
    public void insertIfAbsent(ModelDefinition def, Instant createdAt) throws Exception {
        String sql = """
                INSERT INTO measurement_model (code, name, provider, provider_country, resolution_km,
                    resolution_degrees, forecast_days, update_frequency_hours, temporal_resolution, coverage,
                    domain, description, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (code) DO NOTHING
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, def.code());
            ps.setString(2, def.name());
            ps.setString(3, def.provider());
            ps.setString(4, def.providerCountry());
            ps.setDouble(5, def.resolutionKm());
            ps.setDouble(6, def.resolutionDegrees());
            Jdbc.setInteger(ps, 7, def.forecastDays());
            Jdbc.setInteger(ps, 8, def.updateFrequencyHours());
            ps.setString(9, def.temporalResolution());
            ps.setString(10, def.coverage());
            ps.setString(11, def.domain().tag());
            ps.setString(12, def.description());
            ps.setTimestamp(13, Timestamp.from(createdAt));
            int n = ps.executeUpdate();
            log.debug("insertIfAbsent model {} -> {} row(s)", def.code(), n);
        }
    }
}
