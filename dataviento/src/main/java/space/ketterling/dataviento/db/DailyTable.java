package space.ketterling.dataviento.db;

import java.util.List;

/**
 * Daily aggregate tables, keyed by (location, model, valid_date).
 */
public enum DailyTable {
    WEATHER("weather_daily", List.of(
            Column.number("temperature_2m_max"),
            Column.number("temperature_2m_min"),
            Column.number("precipitation_sum"),
            Column.number("precipitation_hours"),
            Column.number("precipitation_probability_max"),
            Column.number("weather_code"),
            Column.text("sunrise"),
            Column.text("sunset"),
            Column.number("sunshine_duration"),
            Column.number("uv_index_max"),
            Column.number("wind_speed_10m_max"),
            Column.number("wind_gusts_10m_max"),
            Column.number("wind_direction_10m_dominant"))),
    MARINE("marine_daily", List.of(
            Column.number("wave_height_max"),
            Column.number("wave_direction_dominant"),
            Column.number("wave_period_max"),
            Column.number("swell_wave_height_max"),
            Column.number("swell_wave_direction_dominant"),
            Column.number("wind_wave_height_max"))),
    SATELLITE("satellite_daily", List.of(
            Column.number("shortwave_radiation"),
            Column.number("direct_radiation"),
            Column.number("diffuse_radiation"),
            Column.number("direct_normal_irradiance"),
            Column.number("global_tilted_irradiance"),
            Column.number("terrestrial_radiation"),
            Column.number("panel_tilt_angle"),
            Column.number("panel_azimuth_angle"),
            Column.integer("total_records"),
            Column.integer("valid_records"),
            Column.number("quality_score"),
            Column.text("quality_flag"))),
    CLIMATE("climate_daily", List.of(
            Column.integer("projection_id"),
            Column.number("temperature_2m_max"),
            Column.number("temperature_2m_min"),
            Column.number("temperature_2m_mean"),
            Column.number("precipitation_sum"),
            Column.number("rain_sum"),
            Column.number("snowfall_sum"),
            Column.number("relative_humidity_2m_max"),
            Column.number("relative_humidity_2m_min"),
            Column.number("relative_humidity_2m_mean"),
            Column.number("wind_speed_10m_mean"),
            Column.number("wind_speed_10m_max"),
            Column.number("pressure_msl_mean"),
            Column.number("cloud_cover_mean"),
            Column.number("shortwave_radiation_sum"),
            Column.number("soil_moisture_0_to_10cm_mean")));

    private final String table;
    private final List<Column> columns;

    DailyTable(String table, List<Column> columns) {
        this.table = table;
        this.columns = columns;
    }

    public String table() {
        return table;
    }

    public List<Column> columns() {
        return columns;
    }

    public boolean hasColumn(String name) {
        return columns.stream().anyMatch(c -> c.name().equals(name));
    }

    public enum Kind {
        NUMBER,
        INTEGER,
        TEXT
    }

    public record Column(String name, Kind kind) {
        static Column number(String name) {
            return new Column(name, Kind.NUMBER);
        }

        static Column integer(String name) {
            return new Column(name, Kind.INTEGER);
        }

        static Column text(String name) {
            return new Column(name, Kind.TEXT);
        }
    }
}
