package space.ketterling.dataviento.retention;

import space.ketterling.dataviento.config.AppConfig;

import java.time.Duration;

/**
 * Table families with an age limit.
 */
public enum RetentionTarget {
    WEATHER_BATCHES,
    /** Hourly weather points by valid time, independent of batch age. */
    WEATHER_POINTS,
    AIR_QUALITY_BATCHES,
    MARINE_BATCHES,
    WEATHER_DAILY,
    MARINE_DAILY,
    SATELLITE_DAILY,
    /** Current rows not refreshed within the window, in every snapshot table. */
    SNAPSHOTS;

    /**
     * The configured window for this target.
     */
    public Duration window(AppConfig cfg) {
        return switch (this) {
            case WEATHER_BATCHES -> Duration.ofDays(cfg.retentionWeatherBatchDays());
            case WEATHER_POINTS -> Duration.ofHours(cfg.retentionWeatherPointHours());
            case AIR_QUALITY_BATCHES -> Duration.ofDays(cfg.retentionAirQualityBatchDays());
            case MARINE_BATCHES -> Duration.ofDays(cfg.retentionMarineBatchDays());
            case WEATHER_DAILY -> Duration.ofDays(cfg.retentionWeatherDailyDays());
            case MARINE_DAILY -> Duration.ofDays(cfg.retentionMarineDailyDays());
            case SATELLITE_DAILY -> Duration.ofDays(cfg.retentionSatelliteDays());
            case SNAPSHOTS -> Duration.ofDays(cfg.retentionSnapshotDays());
        };
    }
}
