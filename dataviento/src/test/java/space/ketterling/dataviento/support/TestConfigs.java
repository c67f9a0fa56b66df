package space.ketterling.dataviento.support;

import space.ketterling.dataviento.config.AppConfig;

import java.util.Map;
import java.util.Properties;

/**
 * Builds configs from explicit properties so tests never see the developer's
 * environment.
 */
public final class TestConfigs {
    private TestConfigs() {
    }

    public static Properties base(String jdbcUrl) {
        Properties p = new Properties();
        p.setProperty("db.jdbcUrl", jdbcUrl);
        p.setProperty("db.schemaScript", "db/schema-sqlite.sql");
        p.setProperty("api.port", "0");
        p.setProperty("http.maxRetries", "3");
        p.setProperty("http.retryBaseDelay", "PT0.01S");
        p.setProperty("http.requestTimeout", "PT5S");
        p.setProperty("ingest.workers", "4");
        return p;
    }

    /**
     * Points every upstream endpoint family at a local server.
     */
    public static Properties withUpstream(Properties p, String baseUrl) {
        p.setProperty("openmeteo.forecastUrl", baseUrl + "/v1/forecast");
        p.setProperty("openmeteo.airQualityUrl", baseUrl + "/v1/air-quality");
        p.setProperty("openmeteo.marineUrl", baseUrl + "/v1/marine");
        p.setProperty("openmeteo.satelliteUrl", baseUrl + "/v1/archive");
        p.setProperty("openmeteo.climateUrl", baseUrl + "/v1/climate");
        return p;
    }

    public static AppConfig load(Properties file) {
        return AppConfig.load(Map.of(), new Properties(), file);
    }
}
