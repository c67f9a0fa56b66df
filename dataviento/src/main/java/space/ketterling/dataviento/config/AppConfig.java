package space.ketterling.dataviento.config;

import space.ketterling.dataviento.openmeteo.OpenMeteoEndpoint;

import java.io.InputStream;
import java.time.*;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, database, upstream
 * endpoints, HTTP retry policy, ingest schedules and retention windows.
 * </p>
 */
public record AppConfig(
        // API / DB
        boolean apiEnabled,
        int apiPort,
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,
        String dbSchemaScript,

        // Locations refreshed by the scheduler
        List<MonitoredLocation> monitoredLocations,

        // Upstream endpoints
        String forecastUrl,
        String airQualityUrl,
        String marineUrl,
        String satelliteUrl,
        String climateUrl,

        // HTTP client
        Duration httpConnectTimeout,
        Duration httpRequestTimeout,
        int httpMaxRetries,
        Duration httpRetryBaseDelay,

        // Ingest
        int ingestWorkers,
        int weatherForecastDays,
        int airQualityForecastDays,
        int marineForecastDays,
        int satelliteDaysBack,
        int satellitePanelTilt,
        int satellitePanelAzimuth,
        LocalDate climateStartDate,
        LocalDate climateEndDate,
        String climateModel,

        // Schedules (zero disables a job)
        Duration schedWeatherCurrent,
        Duration schedWeatherHourly,
        Duration schedWeatherDaily,
        Duration schedAirQualityCurrent,
        Duration schedAirQualityHourly,
        Duration schedMarineCurrent,
        Duration schedMarineHourly,
        Duration schedMarineDaily,
        Duration schedSatellite,
        Duration schedClimate,
        Duration schedRetention,

        // Retention
        int retentionWeatherBatchDays,
        int retentionWeatherPointHours,
        int retentionWeatherDailyDays,
        int retentionAirQualityBatchDays,
        int retentionMarineBatchDays,
        int retentionMarineDailyDays,
        int retentionSatelliteDays,
        int retentionSnapshotDays,
        int retentionChunkSize,

        // Time
        ZoneId clockZoneId) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties file = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                file.load(in);
        } catch (Exception e) {
            throw new IllegalStateException("Unable to read application.properties", e);
        }
        return load(System.getenv(), System.getProperties(), file);
    }

    /**
     * Loads configuration from explicit sources. Lookup order per key is env,
     * then sys, then file, then the built-in default.
     */
    public static AppConfig load(Map<String, String> env, Properties sys, Properties file) {
        Source s = new Source(env, sys, file);

        String dbUrl = requireNonBlank("db.jdbcUrl", s.get("DB_JDBC_URL", "db.jdbcUrl", ""));
        String dbUser = s.get("DB_USERNAME", "db.username", "");
        String dbPass = s.get("DB_PASSWORD", "db.password", ""); // ok empty if local trust auth
        int dbPoolMax = s.getInt("DB_POOL_MAX", "db.poolMax", 8);
        String schemaScript = s.get("DB_SCHEMA_SCRIPT", "db.schemaScript", "db/schema-postgres.sql");

        boolean apiEnabled = Boolean.parseBoolean(s.get("API_ENABLED", "api.enabled", "true"));
        int port = s.getInt("API_PORT", "api.port", 8080);
        List<MonitoredLocation> locations = MonitoredLocation.parseList(
                s.get("MONITORED_LOCATIONS", "monitored.locations", ""));

        String forecastUrl = s.get("OPENMETEO_FORECAST_URL", "openmeteo.forecastUrl",
                "https://api.open-meteo.com/v1/forecast");
        String airQualityUrl = s.get("OPENMETEO_AIR_QUALITY_URL", "openmeteo.airQualityUrl",
                "https://air-quality-api.open-meteo.com/v1/air-quality");
        String marineUrl = s.get("OPENMETEO_MARINE_URL", "openmeteo.marineUrl",
                "https://marine-api.open-meteo.com/v1/marine");
        String satelliteUrl = s.get("OPENMETEO_SATELLITE_URL", "openmeteo.satelliteUrl",
                "https://satellite-api.open-meteo.com/v1/archive");
        String climateUrl = s.get("OPENMETEO_CLIMATE_URL", "openmeteo.climateUrl",
                "https://climate-api.open-meteo.com/v1/climate");

        Duration connectTimeout = s.getDuration("HTTP_CONNECT_TIMEOUT", "http.connectTimeout", "PT10S");
        Duration requestTimeout = s.getDuration("HTTP_REQUEST_TIMEOUT", "http.requestTimeout", "PT30S");
        int maxRetries = s.getInt("HTTP_MAX_RETRIES", "http.maxRetries", 5);
        Duration retryBaseDelay = s.getDuration("HTTP_RETRY_BASE_DELAY", "http.retryBaseDelay", "PT1S");
        if (maxRetries < 1) {
            throw new IllegalStateException("http.maxRetries must be at least 1");
        }

        int workers = s.getInt("INGEST_WORKERS", "ingest.workers", 4);
        int weatherDays = s.getInt("WEATHER_FORECAST_DAYS", "weather.forecastDays", 5);
        int airQualityDays = s.getInt("AIR_QUALITY_FORECAST_DAYS", "airQuality.forecastDays", 5);
        int marineDays = s.getInt("MARINE_FORECAST_DAYS", "marine.forecastDays", 3);
        int satelliteDaysBack = s.getInt("SATELLITE_DAYS_BACK", "satellite.daysBack", 1);
        int panelTilt = s.getInt("SATELLITE_PANEL_TILT", "satellite.panelTilt", 35);
        int panelAzimuth = s.getInt("SATELLITE_PANEL_AZIMUTH", "satellite.panelAzimuth", 0);
        LocalDate climateStart = LocalDate.parse(s.get("CLIMATE_START_DATE", "climate.startDate", "2022-01-01"));
        LocalDate climateEnd = LocalDate.parse(s.get("CLIMATE_END_DATE", "climate.endDate", "2026-12-31"));
        String climateModel = s.get("CLIMATE_MODEL", "climate.model", "EC_Earth3P_HR");

        // Schedules
        Duration wCur = s.getDuration("SCHED_WEATHER_CURRENT", "schedule.weatherCurrent", "PT15M");
        Duration wHr = s.getDuration("SCHED_WEATHER_HOURLY", "schedule.weatherHourly", "PT3H");
        Duration wDay = s.getDuration("SCHED_WEATHER_DAILY", "schedule.weatherDaily", "PT24H");
        Duration aqCur = s.getDuration("SCHED_AIR_QUALITY_CURRENT", "schedule.airQualityCurrent", "PT15M");
        Duration aqHr = s.getDuration("SCHED_AIR_QUALITY_HOURLY", "schedule.airQualityHourly", "PT6H");
        Duration mCur = s.getDuration("SCHED_MARINE_CURRENT", "schedule.marineCurrent", "PT15M");
        Duration mHr = s.getDuration("SCHED_MARINE_HOURLY", "schedule.marineHourly", "PT12H");
        Duration mDay = s.getDuration("SCHED_MARINE_DAILY", "schedule.marineDaily", "PT24H");
        Duration sat = s.getDuration("SCHED_SATELLITE", "schedule.satellite", "PT24H");
        Duration climate = s.getDuration("SCHED_CLIMATE", "schedule.climate", "PT0S");
        Duration retention = s.getDuration("SCHED_RETENTION", "schedule.retention", "PT24H");

        // Retention
        int rWeatherBatch = s.getInt("RETENTION_WEATHER_BATCH_DAYS", "retention.weatherBatchDays", 7);
        int rWeatherPoints = s.getInt("RETENTION_WEATHER_POINT_HOURS", "retention.weatherPointHours", 168);
        int rWeatherDaily = s.getInt("RETENTION_WEATHER_DAILY_DAYS", "retention.weatherDailyDays", 30);
        int rAirQuality = s.getInt("RETENTION_AIR_QUALITY_BATCH_DAYS", "retention.airQualityBatchDays", 7);
        int rMarineBatch = s.getInt("RETENTION_MARINE_BATCH_DAYS", "retention.marineBatchDays", 7);
        int rMarineDaily = s.getInt("RETENTION_MARINE_DAILY_DAYS", "retention.marineDailyDays", 30);
        int rSatellite = s.getInt("RETENTION_SATELLITE_DAYS", "retention.satelliteDays", 180);
        int rSnapshot = s.getInt("RETENTION_SNAPSHOT_DAYS", "retention.snapshotDays", 30);
        int chunkSize = s.getInt("RETENTION_CHUNK_SIZE", "retention.chunkSize", 500);

        ZoneId zoneId = ZoneId.of(s.get("CLOCK_ZONE", "clock.zone", "UTC"));

        return new AppConfig(
                apiEnabled,
                port,
                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax,
                schemaScript,

                locations,

                forecastUrl,
                airQualityUrl,
                marineUrl,
                satelliteUrl,
                climateUrl,

                connectTimeout,
                requestTimeout,
                maxRetries,
                retryBaseDelay,

                Math.max(1, workers),
                weatherDays,
                airQualityDays,
                marineDays,
                satelliteDaysBack,
                panelTilt,
                panelAzimuth,
                climateStart,
                climateEnd,
                climateModel,

                wCur,
                wHr,
                wDay,
                aqCur,
                aqHr,
                mCur,
                mHr,
                mDay,
                sat,
                climate,
                retention,

                rWeatherBatch,
                rWeatherPoints,
                rWeatherDaily,
                rAirQuality,
                rMarineBatch,
                rMarineDaily,
                rSatellite,
                rSnapshot,
                Math.max(1, chunkSize),

                zoneId);
    }

    /**
     * Returns the configured base URL for an upstream endpoint family.
     */
    public String baseUrl(OpenMeteoEndpoint endpoint) {
        return switch (endpoint) {
            case FORECAST -> forecastUrl;
            case AIR_QUALITY -> airQualityUrl;
            case MARINE -> marineUrl;
            case SATELLITE -> satelliteUrl;
            case CLIMATE -> climateUrl;
        };
    }

    // ----------------------------
    // helpers
    // ----------------------------

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String key, String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value '" + key + "' (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    /**
     * Layered lookup: env, then JVM property, then properties file fallback.
     */
    private record Source(Map<String, String> env, Properties sys, Properties file) {
        String get(String envKey, String propKey, String def) {
            String v = env.get(envKey);
            if (v != null && !v.isBlank())
                return v.trim();
            String prop = sys.getProperty(propKey);
            if (prop != null && !prop.isBlank())
                return prop.trim();
            return file.getProperty(propKey, def).trim();
        }

        int getInt(String envKey, String propKey, int def) {
            String raw = get(envKey, propKey, Integer.toString(def));
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Config value '" + propKey + "' is not an integer: " + raw, e);
            }
        }

        Duration getDuration(String envKey, String propKey, String def) {
            String raw = get(envKey, propKey, def);
            try {
                return Duration.parse(raw);
            } catch (DateTimeException e) {
                throw new IllegalStateException("Config value '" + propKey + "' is not an ISO-8601 duration: " + raw,
                        e);
            }
        }
    }
}
