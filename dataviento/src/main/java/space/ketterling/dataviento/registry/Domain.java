package space.ketterling.dataviento.registry;

/**
 * Data domains. Each has its own orchestrator and owns its own tables.
 */
public enum Domain {
    WEATHER("weather"),
    AIR_QUALITY("air_quality"),
    MARINE("marine"),
    SATELLITE("satellite_radiation"),
    CLIMATE("climate");

    private final String tag;

    Domain(String tag) {
        this.tag = tag;
    }

    /**
     * Value stored in the model and parameter tables.
     */
    public String tag() {
        return tag;
    }
}
