package space.ketterling.dataviento.openmeteo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import space.ketterling.dataviento.openmeteo.PayloadValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forecast endpoint payload: current conditions, hourly and daily forecast.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WeatherResponse(
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude,
        @JsonProperty("generationtime_ms") Double generationTimeMs,
        @JsonProperty("utc_offset_seconds") Integer utcOffsetSeconds,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("current") Current current,
        @JsonProperty("hourly") Hourly hourly,
        @JsonProperty("daily") Daily daily) implements OpenMeteoResponse {

    public static final List<String> CURRENT_FIELDS = List.of(
            "temperature_2m", "relative_humidity_2m", "apparent_temperature", "precipitation",
            "weather_code", "cloud_cover", "wind_speed_10m", "wind_direction_10m");
    public static final List<String> HOURLY_FIELDS = List.of(
            "temperature_2m", "relative_humidity_2m", "precipitation_probability", "precipitation",
            "weather_code", "wind_speed_10m", "wind_direction_10m");
    public static final List<String> DAILY_FIELDS = List.of(
            "temperature_2m_max", "temperature_2m_min", "precipitation_sum", "precipitation_hours",
            "precipitation_probability_max", "weather_code", "sunrise", "sunset", "sunshine_duration",
            "uv_index_max", "wind_speed_10m_max", "wind_gusts_10m_max", "wind_direction_10m_dominant");

    @Override
    public void validate() throws PayloadValidationException {
        Violations v = Violations.ofEnvelope(this);
        if (current != null) {
            v.range("current.temperature_2m", current.temperature2m, -60, 60)
                    .range("current.apparent_temperature", current.apparentTemperature, -60, 60)
                    .range("current.relative_humidity_2m", current.relativeHumidity2m, 0, 100)
                    .atLeast("current.precipitation", current.precipitation, 0)
                    .range("current.cloud_cover", current.cloudCover, 0, 100)
                    .atLeast("current.wind_speed_10m", current.windSpeed10m, 0)
                    .range("current.wind_direction_10m", current.windDirection10m, 0, 360);
        }
        if (hourly != null) {
            List<String> t = hourly.time;
            v.timeAxis("hourly", t)
                    .seriesRange("hourly.temperature_2m", t, hourly.temperature2m, -60, 60)
                    .seriesRange("hourly.relative_humidity_2m", t, hourly.relativeHumidity2m, 0, 100)
                    .seriesRange("hourly.precipitation_probability", t, hourly.precipitationProbability, 0, 100)
                    .seriesAtLeast("hourly.precipitation", t, hourly.precipitation, 0)
                    .sameLength("hourly.weather_code", t, hourly.weatherCode)
                    .seriesAtLeast("hourly.wind_speed_10m", t, hourly.windSpeed10m, 0)
                    .seriesRange("hourly.wind_direction_10m", t, hourly.windDirection10m, 0, 360);
        }
        if (daily != null) {
            List<String> t = daily.time;
            v.timeAxis("daily", t);
            for (var e : daily.columns().entrySet()) {
                v.sameLength("daily." + e.getKey(), t, e.getValue());
            }
            v.seriesAtLeast("daily.precipitation_sum", t, daily.precipitationSum, 0)
                    .seriesRange("daily.precipitation_probability_max", t, daily.precipitationProbabilityMax, 0, 100)
                    .seriesAtLeast("daily.uv_index_max", t, daily.uvIndexMax, 0)
                    .seriesRange("daily.wind_direction_10m_dominant", t, daily.windDirection10mDominant, 0, 360);
        }
        v.throwIfAny("weather response");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Current(
            @JsonProperty("time") String time,
            @JsonProperty("temperature_2m") Double temperature2m,
            @JsonProperty("relative_humidity_2m") Double relativeHumidity2m,
            @JsonProperty("apparent_temperature") Double apparentTemperature,
            @JsonProperty("precipitation") Double precipitation,
            @JsonProperty("weather_code") Double weatherCode,
            @JsonProperty("cloud_cover") Double cloudCover,
            @JsonProperty("wind_speed_10m") Double windSpeed10m,
            @JsonProperty("wind_direction_10m") Double windDirection10m) {

        /**
         * Values keyed by snapshot column.
         */
        public Map<String, Double> values() {
            Map<String, Double> out = new LinkedHashMap<>();
            out.put("temperature_2m", temperature2m);
            out.put("relative_humidity_2m", relativeHumidity2m);
            out.put("apparent_temperature", apparentTemperature);
            out.put("precipitation", precipitation);
            out.put("weather_code", weatherCode);
            out.put("cloud_cover", cloudCover);
            out.put("wind_speed_10m", windSpeed10m);
            out.put("wind_direction_10m", windDirection10m);
            return out;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Hourly(
            @JsonProperty("time") List<String> time,
            @JsonProperty("temperature_2m") List<Double> temperature2m,
            @JsonProperty("relative_humidity_2m") List<Double> relativeHumidity2m,
            @JsonProperty("precipitation_probability") List<Double> precipitationProbability,
            @JsonProperty("precipitation") List<Double> precipitation,
            @JsonProperty("weather_code") List<Double> weatherCode,
            @JsonProperty("wind_speed_10m") List<Double> windSpeed10m,
            @JsonProperty("wind_direction_10m") List<Double> windDirection10m) {

        /**
         * Present series keyed by parameter code.
         */
        public Map<String, List<Double>> seriesByParameter() {
            Map<String, List<Double>> out = new LinkedHashMap<>();
            Series.put(out, "temp_2m", temperature2m);
            Series.put(out, "humidity_2m", relativeHumidity2m);
            Series.put(out, "precip_prob", precipitationProbability);
            Series.put(out, "precip", precipitation);
            Series.put(out, "weather_code", weatherCode);
            Series.put(out, "wind_speed_10m", windSpeed10m);
            Series.put(out, "wind_dir_10m", windDirection10m);
            return out;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Daily(
            @JsonProperty("time") List<String> time,
            @JsonProperty("temperature_2m_max") List<Double> temperature2mMax,
            @JsonProperty("temperature_2m_min") List<Double> temperature2mMin,
            @JsonProperty("precipitation_sum") List<Double> precipitationSum,
            @JsonProperty("precipitation_hours") List<Double> precipitationHours,
            @JsonProperty("precipitation_probability_max") List<Double> precipitationProbabilityMax,
            @JsonProperty("weather_code") List<Double> weatherCode,
            @JsonProperty("sunrise") List<String> sunrise,
            @JsonProperty("sunset") List<String> sunset,
            @JsonProperty("sunshine_duration") List<Double> sunshineDuration,
            @JsonProperty("uv_index_max") List<Double> uvIndexMax,
            @JsonProperty("wind_speed_10m_max") List<Double> windSpeed10mMax,
            @JsonProperty("wind_gusts_10m_max") List<Double> windGusts10mMax,
            @JsonProperty("wind_direction_10m_dominant") List<Double> windDirection10mDominant) {

        /**
         * Present series keyed by daily table column.
         */
        public Map<String, List<?>> columns() {
            Map<String, List<?>> out = new LinkedHashMap<>();
            Series.putAny(out, "temperature_2m_max", temperature2mMax);
            Series.putAny(out, "temperature_2m_min", temperature2mMin);
            Series.putAny(out, "precipitation_sum", precipitationSum);
            Series.putAny(out, "precipitation_hours", precipitationHours);
            Series.putAny(out, "precipitation_probability_max", precipitationProbabilityMax);
            Series.putAny(out, "weather_code", weatherCode);
            Series.putAny(out, "sunrise", sunrise);
            Series.putAny(out, "sunset", sunset);
            Series.putAny(out, "sunshine_duration", sunshineDuration);
            Series.putAny(out, "uv_index_max", uvIndexMax);
            Series.putAny(out, "wind_speed_10m_max", windSpeed10mMax);
            Series.putAny(out, "wind_gusts_10m_max", windGusts10mMax);
            Series.putAny(out, "wind_direction_10m_dominant", windDirection10mDominant);
            return out;
        }
    }
}
