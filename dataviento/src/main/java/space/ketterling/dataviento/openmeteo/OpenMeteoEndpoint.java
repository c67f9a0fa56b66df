package space.ketterling.dataviento.openmeteo;

/**
 * The upstream endpoint families. Each has its own host and forecast horizon.
 */
public enum OpenMeteoEndpoint {
    FORECAST("forecast", 16),
    AIR_QUALITY("air-quality", 5),
    MARINE("marine", 7),
    SATELLITE("satellite", 0),
    CLIMATE("climate", 0);

    private final String label;
    private final int maxForecastDays;

    OpenMeteoEndpoint(String label, int maxForecastDays) {
        this.label = label;
        this.maxForecastDays = maxForecastDays;
    }

    /**
     * Short name used in logs and metrics.
     */
    public String label() {
        return label;
    }

    public int maxForecastDays() {
        return maxForecastDays;
    }

    /**
     * Clamps a requested horizon to [1, max]. Archive endpoints take dates
     * instead of a day count, so asking them is a programming error.
     */
    public int clampForecastDays(int requested) {
        if (maxForecastDays == 0) {
            throw new IllegalStateException(label + " endpoint has no forecast horizon");
        }
        return Math.max(1, Math.min(requested, maxForecastDays));
    }
}
