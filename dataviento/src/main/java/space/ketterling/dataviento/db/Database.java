package space.ketterling.dataviento.db;

import space.ketterling.dataviento.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds a connection pool for API reads.
     */
    public static HikariDataSource createApiDataSource(AppConfig cfg) {
        return createDataSource(cfg, "api", Math.max(2, cfg.dbPoolMax() / 2));
    }

    /**
     * Builds a connection pool for ingest workers, retention and run logging.
     * Sized so every worker can hold a connection while the run log writes.
     */
    public static HikariDataSource createIngestDataSource(AppConfig cfg) {
        return createDataSource(cfg, "ingest", Math.max(cfg.dbPoolMax(), cfg.ingestWorkers() + 2));
    }

    /**
     * Shared helper to build a configured pool with a named role.
     */
    public static HikariDataSource createDataSource(AppConfig cfg, String role, int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        if (!cfg.dbUsername().isBlank()) {
            hc.setUsername(cfg.dbUsername());
            hc.setPassword(cfg.dbPassword());
        }
        hc.setPoolName("dataviento-" + role);
        hc.setMaximumPoolSize(Math.max(2, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
