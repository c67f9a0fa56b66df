package space.ketterling.dataviento.openmeteo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import space.ketterling.dataviento.openmeteo.PayloadValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Satellite archive payload. Only the hourly radiation section is used.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SatelliteResponse(
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude,
        @JsonProperty("generationtime_ms") Double generationTimeMs,
        @JsonProperty("utc_offset_seconds") Integer utcOffsetSeconds,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("hourly") Hourly hourly) implements OpenMeteoResponse {

    public static final List<String> HOURLY_FIELDS = List.of(
            "shortwave_radiation", "direct_radiation", "diffuse_radiation", "direct_normal_irradiance",
            "global_tilted_irradiance", "terrestrial_radiation");

    @Override
    public void validate() throws PayloadValidationException {
        Violations v = Violations.ofEnvelope(this);
        v.required("hourly", hourly);
        if (hourly != null) {
            List<String> t = hourly.time;
            v.timeAxis("hourly", t);
            for (var e : hourly.components().entrySet()) {
                if (e.getValue().isEmpty())
                    continue;
                v.seriesAtLeast("hourly." + e.getKey(), t, e.getValue(), 0);
            }
        }
        v.throwIfAny("satellite response");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Hourly(
            @JsonProperty("time") List<String> time,
            @JsonProperty("shortwave_radiation") List<Double> shortwaveRadiation,
            @JsonProperty("direct_radiation") List<Double> directRadiation,
            @JsonProperty("diffuse_radiation") List<Double> diffuseRadiation,
            @JsonProperty("direct_normal_irradiance") List<Double> directNormalIrradiance,
            @JsonProperty("global_tilted_irradiance") List<Double> globalTiltedIrradiance,
            @JsonProperty("terrestrial_radiation") List<Double> terrestrialRadiation) {

        /**
         * Radiation components keyed by the daily table column they end up in.
         * Missing components map to an empty list.
         */
        public Map<String, List<Double>> components() {
            Map<String, List<Double>> out = new LinkedHashMap<>();
            out.put("shortwave_radiation", orEmpty(shortwaveRadiation));
            out.put("direct_radiation", orEmpty(directRadiation));
            out.put("diffuse_radiation", orEmpty(diffuseRadiation));
            out.put("direct_normal_irradiance", orEmpty(directNormalIrradiance));
            out.put("global_tilted_irradiance", orEmpty(globalTiltedIrradiance));
            out.put("terrestrial_radiation", orEmpty(terrestrialRadiation));
            return out;
        }

        private static List<Double> orEmpty(List<Double> l) {
            return l == null ? List.of() : l;
        }
    }
}
