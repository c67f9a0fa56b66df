package space.ketterling.dataviento.db;

import java.util.List;

/**
 * Current-conditions tables. Column names here are the only ones the
 * snapshot SQL is built from.
 */
public enum SnapshotTable {
    WEATHER("weather_current", List.of(
            "temperature_2m", "relative_humidity_2m", "apparent_temperature", "precipitation",
            "weather_code", "cloud_cover", "wind_speed_10m", "wind_direction_10m")),
    AIR_QUALITY("air_quality_current", List.of(
            "pm2_5", "pm10", "european_aqi", "us_aqi", "nitrogen_dioxide", "ozone",
            "sulphur_dioxide", "carbon_monoxide", "dust", "ammonia")),
    MARINE("marine_current", List.of(
            "wave_height", "wave_direction", "wave_period", "swell_wave_height", "swell_wave_direction",
            "swell_wave_period", "wind_wave_height", "sea_surface_temperature", "ocean_current_velocity",
            "ocean_current_direction"));

    private final String table;
    private final List<String> columns;

    SnapshotTable(String table, List<String> columns) {
        this.table = table;
        this.columns = columns;
    }

    public String table() {
        return table;
    }

    public List<String> columns() {
        return columns;
    }
}
