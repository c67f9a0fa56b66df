package space.ketterling.dataviento.registry;

/**
 * A named coordinate to ingest data for.
 */
public record LocationTarget(String name, double latitude, double longitude, LocationAttributes attributes) {

    public LocationTarget {
        if (attributes == null)
            attributes = LocationAttributes.withTimezone("auto");
    }

    public static LocationTarget of(String name, double latitude, double longitude) {
        return new LocationTarget(name, latitude, longitude, null);
    }

    public String timezone() {
        return attributes.timezoneOrAuto();
    }
}
