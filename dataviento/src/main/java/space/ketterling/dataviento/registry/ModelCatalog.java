package space.ketterling.dataviento.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in catalog of upstream models, one fixed model per forecast domain
 * plus the selectable climate models.
 */
public final class ModelCatalog {
    public static final String WEATHER = "OM_FORECAST";
    public static final String AIR_QUALITY = "CAMS_EUROPE";
    public static final String MARINE = "ECMWF_WAVES";
    public static final String SATELLITE = "CAMS_SOLAR";
    public static final String DEFAULT_CLIMATE = "EC_Earth3P_HR";

    private static final Map<String, ModelDefinition> BY_CODE;

    static {
        Map<String, ModelDefinition> m = new LinkedHashMap<>();
        m.put(WEATHER, new ModelDefinition(WEATHER, "Open-Meteo Forecast", "Open-Meteo", "Switzerland",
                11, 0.1, 16, 6, "hourly", "global", Domain.WEATHER,
                "Open-Meteo best-match weather forecast"));
        m.put(AIR_QUALITY, new ModelDefinition(AIR_QUALITY, "CAMS European Air Quality", "Copernicus",
                "European Union", 10, 0.1, 5, 6, "hourly", "regional", Domain.AIR_QUALITY,
                "Copernicus Atmosphere Monitoring Service air quality forecast"));
        m.put(MARINE, new ModelDefinition(MARINE, "ECMWF Wave Model", "ECMWF", "European Union",
                28, 0.25, 10, 12, "hourly", "global", Domain.MARINE,
                "ECMWF ocean wave forecast"));
        m.put(SATELLITE, new ModelDefinition(SATELLITE, "CAMS Solar Radiation", "Copernicus", "European Union",
                5, 0.05, 16, 3, "15minutely", "global", Domain.SATELLITE,
                "Satellite-derived solar radiation"));

        climate(m, "EC_Earth3P_HR", "EC-Earth3P-HR", "EC-Earth Consortium", "Europe", 29);
        climate(m, "CMCC_CM2_VHR4", "CMCC-CM2-VHR4", "CMCC Foundation", "Italy", 25);
        climate(m, "MRI_AGCM3_2_S", "MRI-AGCM3-2-S", "Meteorological Research Institute", "Japan", 20);
        climate(m, "FGOALS_f3_H", "FGOALS-f3-H", "Chinese Academy of Sciences", "China", 28);
        climate(m, "HiRAM_SIT_HR", "HiRAM-SIT-HR", "NOAA GFDL", "USA", 25);
        climate(m, "NICAM16_8S", "NICAM16-8S", "JAMSTEC", "Japan", 31);

        BY_CODE = Collections.unmodifiableMap(m);
    }

    private ModelCatalog() {
    }

    private static void climate(Map<String, ModelDefinition> m, String code, String name, String provider,
            String country, double km) {
        double degrees = Math.round(km / 111.0 * 1000.0) / 1000.0;
        m.put(code, new ModelDefinition(code, name, provider, country, km, degrees, null, null, "daily",
                "global", Domain.CLIMATE, "CMIP6 HighResMIP climate projection (" + name + ")"));
    }

    public static Optional<ModelDefinition> find(String code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * @throws IllegalArgumentException if the code is not in the catalog
     */
    public static ModelDefinition require(String code) {
        ModelDefinition def = BY_CODE.get(code);
        if (def == null) {
            throw new IllegalArgumentException("Model code not in catalog: " + code);
        }
        return def;
    }

    /**
     * True if the code names one of the selectable climate models.
     */
    public static boolean isClimateModel(String code) {
        return find(code).map(d -> d.domain() == Domain.CLIMATE).orElse(false);
    }

    public static Collection<ModelDefinition> all() {
        return BY_CODE.values();
    }
}
