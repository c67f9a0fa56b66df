package space.ketterling.dataviento.openmeteo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import space.ketterling.dataviento.openmeteo.PayloadValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Air-quality endpoint payload: current pollutant levels and hourly forecast.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AirQualityResponse(
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude,
        @JsonProperty("generationtime_ms") Double generationTimeMs,
        @JsonProperty("utc_offset_seconds") Integer utcOffsetSeconds,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("current") Current current,
        @JsonProperty("hourly") Hourly hourly) implements OpenMeteoResponse {

    public static final List<String> CURRENT_FIELDS = List.of(
            "pm2_5", "pm10", "european_aqi", "us_aqi", "nitrogen_dioxide", "ozone",
            "sulphur_dioxide", "carbon_monoxide", "dust", "ammonia");
    public static final List<String> HOURLY_FIELDS = List.of(
            "pm2_5", "pm10", "european_aqi", "us_aqi", "nitrogen_dioxide", "ozone",
            "sulphur_dioxide", "carbon_monoxide");

    @Override
    public void validate() throws PayloadValidationException {
        Violations v = Violations.ofEnvelope(this);
        if (current != null) {
            for (var e : current.values().entrySet()) {
                v.atLeast("current." + e.getKey(), e.getValue(), 0);
            }
            v.range("current.european_aqi", current.europeanAqi, 0, 500)
                    .range("current.us_aqi", current.usAqi, 0, 500);
        }
        if (hourly != null) {
            List<String> t = hourly.time;
            v.timeAxis("hourly", t);
            for (var e : hourly.seriesByParameter().entrySet()) {
                v.seriesAtLeast("hourly." + e.getKey(), t, e.getValue(), 0);
            }
            v.seriesRange("hourly.european_aqi", t, hourly.europeanAqi, 0, 500)
                    .seriesRange("hourly.us_aqi", t, hourly.usAqi, 0, 500);
        }
        v.throwIfAny("air quality response");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Current(
            @JsonProperty("time") String time,
            @JsonProperty("pm2_5") Double pm25,
            @JsonProperty("pm10") Double pm10,
            @JsonProperty("european_aqi") Double europeanAqi,
            @JsonProperty("us_aqi") Double usAqi,
            @JsonProperty("nitrogen_dioxide") Double nitrogenDioxide,
            @JsonProperty("ozone") Double ozone,
            @JsonProperty("sulphur_dioxide") Double sulphurDioxide,
            @JsonProperty("carbon_monoxide") Double carbonMonoxide,
            @JsonProperty("dust") Double dust,
            @JsonProperty("ammonia") Double ammonia) {

        public Map<String, Double> values() {
            Map<String, Double> out = new LinkedHashMap<>();
            out.put("pm2_5", pm25);
            out.put("pm10", pm10);
            out.put("european_aqi", europeanAqi);
            out.put("us_aqi", usAqi);
            out.put("nitrogen_dioxide", nitrogenDioxide);
            out.put("ozone", ozone);
            out.put("sulphur_dioxide", sulphurDioxide);
            out.put("carbon_monoxide", carbonMonoxide);
            out.put("dust", dust);
            out.put("ammonia", ammonia);
            return out;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Hourly(
            @JsonProperty("time") List<String> time,
            @JsonProperty("pm2_5") List<Double> pm25,
            @JsonProperty("pm10") List<Double> pm10,
            @JsonProperty("european_aqi") List<Double> europeanAqi,
            @JsonProperty("us_aqi") List<Double> usAqi,
            @JsonProperty("nitrogen_dioxide") List<Double> nitrogenDioxide,
            @JsonProperty("ozone") List<Double> ozone,
            @JsonProperty("sulphur_dioxide") List<Double> sulphurDioxide,
            @JsonProperty("carbon_monoxide") List<Double> carbonMonoxide) {

        public Map<String, List<Double>> seriesByParameter() {
            Map<String, List<Double>> out = new LinkedHashMap<>();
            Series.put(out, "pm2_5", pm25);
            Series.put(out, "pm10", pm10);
            Series.put(out, "aqi_european", europeanAqi);
            Series.put(out, "aqi_us", usAqi);
            Series.put(out, "no2", nitrogenDioxide);
            Series.put(out, "o3", ozone);
            Series.put(out, "so2", sulphurDioxide);
            Series.put(out, "co", carbonMonoxide);
            return out;
        }
    }
}
