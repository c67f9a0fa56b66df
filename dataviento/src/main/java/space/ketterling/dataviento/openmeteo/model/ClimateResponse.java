package space.ketterling.dataviento.openmeteo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import space.ketterling.dataviento.openmeteo.PayloadValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Climate projection payload: one daily section for the requested model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClimateResponse(
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude,
        @JsonProperty("generationtime_ms") Double generationTimeMs,
        @JsonProperty("utc_offset_seconds") Integer utcOffsetSeconds,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("daily") Daily daily) implements OpenMeteoResponse {

    public static final List<String> DAILY_FIELDS = List.of(
            "temperature_2m_max", "temperature_2m_min", "temperature_2m_mean", "precipitation_sum",
            "rain_sum", "snowfall_sum", "relative_humidity_2m_max", "relative_humidity_2m_min",
            "relative_humidity_2m_mean", "wind_speed_10m_mean", "wind_speed_10m_max", "pressure_msl_mean",
            "cloud_cover_mean", "shortwave_radiation_sum", "soil_moisture_0_to_10cm_mean");

    @Override
    public void validate() throws PayloadValidationException {
        Violations v = Violations.ofEnvelope(this);
        v.required("daily", daily);
        if (daily != null) {
            List<String> t = daily.time;
            v.timeAxis("daily", t);
            for (var e : daily.columns().entrySet()) {
                v.sameLength("daily." + e.getKey(), t, e.getValue());
            }
            v.seriesAtLeast("daily.precipitation_sum", t, daily.precipitationSum, 0)
                    .seriesAtLeast("daily.rain_sum", t, daily.rainSum, 0)
                    .seriesAtLeast("daily.snowfall_sum", t, daily.snowfallSum, 0)
                    .seriesRange("daily.relative_humidity_2m_mean", t, daily.relativeHumidity2mMean, 0, 100)
                    .seriesRange("daily.cloud_cover_mean", t, daily.cloudCoverMean, 0, 100);
        }
        v.throwIfAny("climate response");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Daily(
            @JsonProperty("time") List<String> time,
            @JsonProperty("temperature_2m_max") List<Double> temperature2mMax,
            @JsonProperty("temperature_2m_min") List<Double> temperature2mMin,
            @JsonProperty("temperature_2m_mean") List<Double> temperature2mMean,
            @JsonProperty("precipitation_sum") List<Double> precipitationSum,
            @JsonProperty("rain_sum") List<Double> rainSum,
            @JsonProperty("snowfall_sum") List<Double> snowfallSum,
            @JsonProperty("relative_humidity_2m_max") List<Double> relativeHumidity2mMax,
            @JsonProperty("relative_humidity_2m_min") List<Double> relativeHumidity2mMin,
            @JsonProperty("relative_humidity_2m_mean") List<Double> relativeHumidity2mMean,
            @JsonProperty("wind_speed_10m_mean") List<Double> windSpeed10mMean,
            @JsonProperty("wind_speed_10m_max") List<Double> windSpeed10mMax,
            @JsonProperty("pressure_msl_mean") List<Double> pressureMslMean,
            @JsonProperty("cloud_cover_mean") List<Double> cloudCoverMean,
            @JsonProperty("shortwave_radiation_sum") List<Double> shortwaveRadiationSum,
            @JsonProperty("soil_moisture_0_to_10cm_mean") List<Double> soilMoisture0To10cmMean) {

        public Map<String, List<?>> columns() {
            Map<String, List<?>> out = new LinkedHashMap<>();
            Series.putAny(out, "temperature_2m_max", temperature2mMax);
            Series.putAny(out, "temperature_2m_min", temperature2mMin);
            Series.putAny(out, "temperature_2m_mean", temperature2mMean);
            Series.putAny(out, "precipitation_sum", precipitationSum);
            Series.putAny(out, "rain_sum", rainSum);
            Series.putAny(out, "snowfall_sum", snowfallSum);
            Series.putAny(out, "relative_humidity_2m_max", relativeHumidity2mMax);
            Series.putAny(out, "relative_humidity_2m_min", relativeHumidity2mMin);
            Series.putAny(out, "relative_humidity_2m_mean", relativeHumidity2mMean);
            Series.putAny(out, "wind_speed_10m_mean", windSpeed10mMean);
            Series.putAny(out, "wind_speed_10m_max", windSpeed10mMax);
            Series.putAny(out, "pressure_msl_mean", pressureMslMean);
            Series.putAny(out, "cloud_cover_mean", cloudCoverMean);
            Series.putAny(out, "shortwave_radiation_sum", shortwaveRadiationSum);
            Series.putAny(out, "soil_moisture_0_to_10cm_mean", soilMoisture0To10cmMean);
            return out;
        }
    }
}
