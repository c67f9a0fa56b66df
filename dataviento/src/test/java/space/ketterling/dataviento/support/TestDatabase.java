package space.ketterling.dataviento.support;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.db.Database;
import space.ketterling.dataviento.db.SchemaInitializer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

/**
 * A throwaway SQLite file with the full schema applied.
 */
public final class TestDatabase implements AutoCloseable {
    private final Path file;
    private final AppConfig cfg;
    private final HikariDataSource ds;

    private TestDatabase(Path file, AppConfig cfg, HikariDataSource ds) {
        this.file = file;
        this.cfg = cfg;
        this.ds = ds;
    }

    public static TestDatabase create() throws Exception {
        Path file = Files.createTempFile("dataviento-test", ".db");
        AppConfig cfg = TestConfigs.load(TestConfigs.base(jdbcUrl(file)));
        HikariDataSource ds = Database.createDataSource(cfg, "test", 4);
        SchemaInitializer.apply(ds, cfg.dbSchemaScript());
        return new TestDatabase(file, cfg, ds);
    }

    public static String jdbcUrl(Path file) {
        return "jdbc:sqlite:" + file.toAbsolutePath()
                + "?foreign_keys=on&busy_timeout=10000&journal_mode=WAL";
    }

    public String jdbcUrl() {
        return jdbcUrl(file);
    }

    public AppConfig config() {
        return cfg;
    }

    public HikariDataSource dataSource() {
        return ds;
    }

    public long count(String table) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM " + table);
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    @Override
    public void close() throws Exception {
        ds.close();
        Files.deleteIfExists(file);
        Files.deleteIfExists(Path.of(file + "-wal"));
        Files.deleteIfExists(Path.of(file + "-shm"));
    }
}
