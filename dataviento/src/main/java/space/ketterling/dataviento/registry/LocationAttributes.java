package space.ketterling.dataviento.registry;

/**
 * Descriptive metadata stored with a new location. Only used on first
 * insert; later resolutions never merge attributes.
 */
public record LocationAttributes(
        Double elevation,
        String timezone,
        String countryCode,
        String countryName,
        String state,
        String admin1,
        String admin2,
        Long population) {

    public static LocationAttributes withTimezone(String timezone) {
        return new LocationAttributes(null, timezone, null, null, null, null, null, null);
    }

    /**
     * Timezone sent upstream and stored; Open-Meteo resolves "auto" from the
     * coordinates.
     */
    public String timezoneOrAuto() {
        return timezone == null || timezone.isBlank() ? "auto" : timezone;
    }
}
