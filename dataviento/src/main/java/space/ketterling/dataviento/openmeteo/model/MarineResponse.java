package space.ketterling.dataviento.openmeteo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import space.ketterling.dataviento.openmeteo.PayloadValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Marine endpoint payload: sea state now, hourly and daily.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MarineResponse(
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude,
        @JsonProperty("generationtime_ms") Double generationTimeMs,
        @JsonProperty("utc_offset_seconds") Integer utcOffsetSeconds,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("current") Current current,
        @JsonProperty("hourly") Hourly hourly,
        @JsonProperty("daily") Daily daily) implements OpenMeteoResponse {

    public static final List<String> CURRENT_FIELDS = List.of(
            "wave_height", "wave_direction", "wave_period", "swell_wave_height", "swell_wave_direction",
            "swell_wave_period", "wind_wave_height", "sea_surface_temperature", "ocean_current_velocity",
            "ocean_current_direction");
    public static final List<String> HOURLY_FIELDS = List.of(
            "wave_height", "wave_direction", "wave_period", "swell_wave_height", "swell_wave_direction",
            "swell_wave_period", "wind_wave_height", "sea_surface_temperature");
    public static final List<String> DAILY_FIELDS = List.of(
            "wave_height_max", "wave_direction_dominant", "wave_period_max", "swell_wave_height_max",
            "swell_wave_direction_dominant", "wind_wave_height_max");

    @Override
    public void validate() throws PayloadValidationException {
        Violations v = Violations.ofEnvelope(this);
        if (current != null) {
            v.atLeast("current.wave_height", current.waveHeight, 0)
                    .range("current.wave_direction", current.waveDirection, 0, 360)
                    .atLeast("current.wave_period", current.wavePeriod, 0)
                    .atLeast("current.swell_wave_height", current.swellWaveHeight, 0)
                    .range("current.swell_wave_direction", current.swellWaveDirection, 0, 360)
                    .atLeast("current.swell_wave_period", current.swellWavePeriod, 0)
                    .atLeast("current.wind_wave_height", current.windWaveHeight, 0)
                    .atLeast("current.ocean_current_velocity", current.oceanCurrentVelocity, 0)
                    .range("current.ocean_current_direction", current.oceanCurrentDirection, 0, 360);
        }
        if (hourly != null) {
            List<String> t = hourly.time;
            v.timeAxis("hourly", t)
                    .seriesAtLeast("hourly.wave_height", t, hourly.waveHeight, 0)
                    .seriesRange("hourly.wave_direction", t, hourly.waveDirection, 0, 360)
                    .seriesAtLeast("hourly.wave_period", t, hourly.wavePeriod, 0)
                    .seriesAtLeast("hourly.swell_wave_height", t, hourly.swellWaveHeight, 0)
                    .seriesRange("hourly.swell_wave_direction", t, hourly.swellWaveDirection, 0, 360)
                    .seriesAtLeast("hourly.swell_wave_period", t, hourly.swellWavePeriod, 0)
                    .seriesAtLeast("hourly.wind_wave_height", t, hourly.windWaveHeight, 0)
                    .sameLength("hourly.sea_surface_temperature", t, hourly.seaSurfaceTemperature);
        }
        if (daily != null) {
            List<String> t = daily.time;
            v.timeAxis("daily", t)
                    .seriesAtLeast("daily.wave_height_max", t, daily.waveHeightMax, 0)
                    .seriesRange("daily.wave_direction_dominant", t, daily.waveDirectionDominant, 0, 360)
                    .seriesAtLeast("daily.wave_period_max", t, daily.wavePeriodMax, 0)
                    .seriesAtLeast("daily.swell_wave_height_max", t, daily.swellWaveHeightMax, 0)
                    .seriesRange("daily.swell_wave_direction_dominant", t, daily.swellWaveDirectionDominant, 0, 360)
                    .seriesAtLeast("daily.wind_wave_height_max", t, daily.windWaveHeightMax, 0);
        }
        v.throwIfAny("marine response");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Current(
            @JsonProperty("time") String time,
            @JsonProperty("wave_height") Double waveHeight,
            @JsonProperty("wave_direction") Double waveDirection,
            @JsonProperty("wave_period") Double wavePeriod,
            @JsonProperty("swell_wave_height") Double swellWaveHeight,
            @JsonProperty("swell_wave_direction") Double swellWaveDirection,
            @JsonProperty("swell_wave_period") Double swellWavePeriod,
            @JsonProperty("wind_wave_height") Double windWaveHeight,
            @JsonProperty("sea_surface_temperature") Double seaSurfaceTemperature,
            @JsonProperty("ocean_current_velocity") Double oceanCurrentVelocity,
            @JsonProperty("ocean_current_direction") Double oceanCurrentDirection) {

        public Map<String, Double> values() {
            Map<String, Double> out = new LinkedHashMap<>();
            out.put("wave_height", waveHeight);
            out.put("wave_direction", waveDirection);
            out.put("wave_period", wavePeriod);
            out.put("swell_wave_height", swellWaveHeight);
            out.put("swell_wave_direction", swellWaveDirection);
            out.put("swell_wave_period", swellWavePeriod);
            out.put("wind_wave_height", windWaveHeight);
            out.put("sea_surface_temperature", seaSurfaceTemperature);
            out.put("ocean_current_velocity", oceanCurrentVelocity);
            out.put("ocean_current_direction", oceanCurrentDirection);
            return out;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Hourly(
            @JsonProperty("time") List<String> time,
            @JsonProperty("wave_height") List<Double> waveHeight,
            @JsonProperty("wave_direction") List<Double> waveDirection,
            @JsonProperty("wave_period") List<Double> wavePeriod,
            @JsonProperty("swell_wave_height") List<Double> swellWaveHeight,
            @JsonProperty("swell_wave_direction") List<Double> swellWaveDirection,
            @JsonProperty("swell_wave_period") List<Double> swellWavePeriod,
            @JsonProperty("wind_wave_height") List<Double> windWaveHeight,
            @JsonProperty("sea_surface_temperature") List<Double> seaSurfaceTemperature) {

        public Map<String, List<Double>> seriesByParameter() {
            Map<String, List<Double>> out = new LinkedHashMap<>();
            Series.put(out, "wave_height", waveHeight);
            Series.put(out, "wave_direction", waveDirection);
            Series.put(out, "wave_period", wavePeriod);
            Series.put(out, "swell_wave_height", swellWaveHeight);
            Series.put(out, "swell_wave_direction", swellWaveDirection);
            Series.put(out, "swell_wave_period", swellWavePeriod);
            Series.put(out, "wind_wave_height", windWaveHeight);
            Series.put(out, "sea_temp", seaSurfaceTemperature);
            return out;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Daily(
            @JsonProperty("time") List<String> time,
            @JsonProperty("wave_height_max") List<Double> waveHeightMax,
            @JsonProperty("wave_direction_dominant") List<Double> waveDirectionDominant,
            @JsonProperty("wave_period_max") List<Double> wavePeriodMax,
            @JsonProperty("swell_wave_height_max") List<Double> swellWaveHeightMax,
            @JsonProperty("swell_wave_direction_dominant") List<Double> swellWaveDirectionDominant,
            @JsonProperty("wind_wave_height_max") List<Double> windWaveHeightMax) {

        public Map<String, List<?>> columns() {
            Map<String, List<?>> out = new LinkedHashMap<>();
            Series.putAny(out, "wave_height_max", waveHeightMax);
            Series.putAny(out, "wave_direction_dominant", waveDirectionDominant);
            Series.putAny(out, "wave_period_max", wavePeriodMax);
            Series.putAny(out, "swell_wave_height_max", swellWaveHeightMax);
            Series.putAny(out, "swell_wave_direction_dominant", swellWaveDirectionDominant);
            Series.putAny(out, "wind_wave_height_max", windWaveHeightMax);
            return out;
        }
    }
}
