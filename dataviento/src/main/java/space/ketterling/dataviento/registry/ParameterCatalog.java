package space.ketterling.dataviento.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in catalog of every parameter the ingest path can write. Units and
 * categories come from here only.
 */
public final class ParameterCatalog {
    private static final Map<String, ParameterDefinition> BY_CODE;

    static {
        Map<String, ParameterDefinition> m = new LinkedHashMap<>();
        // weather: temperature
        add(m, "temp_2m", "Temperature at 2m", "°C", "temperature", "2m", Domain.WEATHER);
        add(m, "temp_2m_max", "Maximum Temperature at 2m", "°C", "temperature", "2m", Domain.WEATHER);
        add(m, "temp_2m_min", "Minimum Temperature at 2m", "°C", "temperature", "2m", Domain.WEATHER);
        add(m, "temp_2m_mean", "Mean Temperature at 2m", "°C", "temperature", "2m", Domain.WEATHER);
        add(m, "apparent_temp", "Apparent Temperature", "°C", "temperature", "2m", Domain.WEATHER);
        // weather: humidity
        add(m, "humidity_2m", "Relative Humidity at 2m", "%", "humidity", "2m", Domain.WEATHER);
        add(m, "humidity_2m_max", "Maximum Relative Humidity at 2m", "%", "humidity", "2m", Domain.WEATHER);
        add(m, "humidity_2m_min", "Minimum Relative Humidity at 2m", "%", "humidity", "2m", Domain.WEATHER);
        add(m, "humidity_2m_mean", "Mean Relative Humidity at 2m", "%", "humidity", "2m", Domain.WEATHER);
        // weather: precipitation
        add(m, "precip", "Precipitation", "mm", "precipitation", "surface", Domain.WEATHER);
        add(m, "precip_sum", "Precipitation Sum", "mm", "precipitation", "surface", Domain.WEATHER);
        add(m, "precip_prob", "Precipitation Probability", "%", "precipitation", "surface", Domain.WEATHER);
        add(m, "precip_prob_max", "Maximum Precipitation Probability", "%", "precipitation", "surface",
                Domain.WEATHER);
        add(m, "precip_hours", "Precipitation Hours", "hours", "precipitation", "surface", Domain.WEATHER);
        // weather: wind
        add(m, "wind_speed_10m", "Wind Speed at 10m", "km/h", "wind", "10m", Domain.WEATHER);
        add(m, "wind_speed_10m_max", "Maximum Wind Speed at 10m", "km/h", "wind", "10m", Domain.WEATHER);
        add(m, "wind_speed_10m_mean", "Mean Wind Speed at 10m", "km/h", "wind", "10m", Domain.WEATHER);
        add(m, "wind_dir_10m", "Wind Direction at 10m", "°", "wind", "10m", Domain.WEATHER);
        add(m, "wind_dir_10m_dominant", "Dominant Wind Direction at 10m", "°", "wind", "10m", Domain.WEATHER);
        add(m, "wind_gusts_10m_max", "Maximum Wind Gusts at 10m", "km/h", "wind", "10m", Domain.WEATHER);
        // weather: sky
        add(m, "cloud_cover", "Cloud Cover", "%", "clouds", "surface", Domain.WEATHER);
        add(m, "cloud_cover_mean", "Mean Cloud Cover", "%", "clouds", "surface", Domain.WEATHER);
        add(m, "sunshine_duration", "Sunshine Duration", "seconds", "solar", "surface", Domain.WEATHER);
        add(m, "uv_index_max", "Maximum UV Index", "index", "solar", "surface", Domain.WEATHER);
        m.put("weather_code", new ParameterDefinition("weather_code", "Weather Code", "code", "weather",
                "integer", "surface", true, Domain.WEATHER));

        // air quality
        add(m, "pm2_5", "PM2.5", "µg/m³", "air_quality", "surface", Domain.AIR_QUALITY);
        add(m, "pm10", "PM10", "µg/m³", "air_quality", "surface", Domain.AIR_QUALITY);
        m.put("aqi_european", new ParameterDefinition("aqi_european", "European AQI", "index", "air_quality",
                "integer", "surface", true, Domain.AIR_QUALITY));
        m.put("aqi_us", new ParameterDefinition("aqi_us", "US AQI", "index", "air_quality",
                "integer", "surface", true, Domain.AIR_QUALITY));
        add(m, "no2", "Nitrogen Dioxide", "µg/m³", "air_quality", "surface", Domain.AIR_QUALITY);
        add(m, "o3", "Ozone", "µg/m³", "air_quality", "surface", Domain.AIR_QUALITY);
        add(m, "so2", "Sulphur Dioxide", "µg/m³", "air_quality", "surface", Domain.AIR_QUALITY);
        add(m, "co", "Carbon Monoxide", "µg/m³", "air_quality", "surface", Domain.AIR_QUALITY);
        add(m, "dust", "Dust", "µg/m³", "air_quality", "surface", Domain.AIR_QUALITY);
        add(m, "nh3", "Ammonia", "µg/m³", "air_quality", "surface", Domain.AIR_QUALITY);

        // marine
        add(m, "wave_height", "Wave Height", "m", "marine", "surface", Domain.MARINE);
        add(m, "wave_height_max", "Maximum Wave Height", "m", "marine", "surface", Domain.MARINE);
        add(m, "wave_direction", "Wave Direction", "°", "marine", "surface", Domain.MARINE);
        add(m, "wave_direction_dominant", "Dominant Wave Direction", "°", "marine", "surface", Domain.MARINE);
        add(m, "wave_period", "Wave Period", "s", "marine", "surface", Domain.MARINE);
        add(m, "wave_period_max", "Maximum Wave Period", "s", "marine", "surface", Domain.MARINE);
        add(m, "swell_wave_height", "Swell Wave Height", "m", "marine", "surface", Domain.MARINE);
        add(m, "swell_wave_height_max", "Maximum Swell Wave Height", "m", "marine", "surface", Domain.MARINE);
        add(m, "swell_wave_direction", "Swell Wave Direction", "°", "marine", "surface", Domain.MARINE);
        add(m, "swell_wave_direction_dominant", "Dominant Swell Wave Direction", "°", "marine", "surface",
                Domain.MARINE);
        add(m, "swell_wave_period", "Swell Wave Period", "s", "marine", "surface", Domain.MARINE);
        add(m, "swell_wave_period_max", "Maximum Swell Wave Period", "s", "marine", "surface", Domain.MARINE);
        add(m, "wind_wave_height", "Wind Wave Height", "m", "marine", "surface", Domain.MARINE);
        add(m, "sea_temp", "Sea Surface Temperature", "°C", "marine", "surface", Domain.MARINE);
        add(m, "sea_temp_mean", "Mean Sea Surface Temperature", "°C", "marine", "surface", Domain.MARINE);
        add(m, "ocean_current_vel", "Ocean Current Velocity", "m/s", "marine", "surface", Domain.MARINE);
        add(m, "ocean_current_vel_max", "Maximum Ocean Current Velocity", "m/s", "marine", "surface",
                Domain.MARINE);
        add(m, "ocean_current_dir", "Ocean Current Direction", "°", "marine", "surface", Domain.MARINE);

        // satellite radiation
        add(m, "shortwave_rad", "Shortwave Solar Radiation", "W/m²", "solar", "surface", Domain.SATELLITE);
        add(m, "direct_rad", "Direct Solar Radiation", "W/m²", "solar", "surface", Domain.SATELLITE);
        add(m, "diffuse_rad", "Diffuse Solar Radiation", "W/m²", "solar", "surface", Domain.SATELLITE);
        add(m, "dni", "Direct Normal Irradiance", "W/m²", "solar", "surface", Domain.SATELLITE);
        add(m, "gti", "Global Tilted Irradiance", "W/m²", "solar", "surface", Domain.SATELLITE);
        add(m, "terrestrial_rad", "Terrestrial Radiation", "W/m²", "solar", "surface", Domain.SATELLITE);

        // climate daily
        add(m, "precip_rain_sum", "Rain Sum", "mm", "precipitation", "surface", Domain.CLIMATE);
        add(m, "precip_snow_sum", "Snowfall Sum", "mm", "precipitation", "surface", Domain.CLIMATE);
        add(m, "pressure_msl_mean", "Mean Sea Level Pressure", "hPa", "pressure", "msl", Domain.CLIMATE);
        add(m, "radiation_shortwave_sum", "Shortwave Radiation Sum", "MJ/m²", "solar", "surface", Domain.CLIMATE);
        m.put("soil_moisture_0_10cm", new ParameterDefinition("soil_moisture_0_10cm", "Soil Moisture 0-10cm",
                "m³/m³", "soil", "float", "0-10cm", false, Domain.CLIMATE));

        BY_CODE = Collections.unmodifiableMap(m);
    }

    private ParameterCatalog() {
    }

    private static void add(Map<String, ParameterDefinition> m, String code, String name, String unit,
            String category, String altitude, Domain domain) {
        m.put(code, new ParameterDefinition(code, name, unit, category, "float", altitude, true, domain));
    }

    public static Optional<ParameterDefinition> find(String code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Catalog entry for a code the caller knows must exist.
     *
     * @throws IllegalArgumentException if the code is not in the catalog
     */
    public static ParameterDefinition require(String code) {
        ParameterDefinition def = BY_CODE.get(code);
        if (def == null) {
            throw new IllegalArgumentException("Parameter code not in catalog: " + code);
        }
        return def;
    }

    public static Collection<ParameterDefinition> all() {
        return BY_CODE.values();
    }
}
