package space.ketterling.dataviento.config;

import java.util.ArrayList;
import java.util.List;

/**
 * A location the scheduler refreshes, as declared in configuration.
 */
public record MonitoredLocation(String name, double latitude, double longitude, String timezone) {

    /**
     * Parses locations in the format "name|lat|lon|timezone;name|lat|lon".
     * Timezone is optional and defaults to "auto".
     */
    public static List<MonitoredLocation> parseList(String s) {
        if (s == null || s.isBlank())
            return List.of();
        List<MonitoredLocation> out = new ArrayList<>();
        for (String part : s.split(";")) {
            if (part.isBlank())
                continue;
            String[] bits = part.trim().split("\\|");
            if (bits.length < 3) {
                throw new IllegalStateException("Bad monitored location (want name|lat|lon[|tz]): " + part);
            }
            try {
                double lat = Double.parseDouble(bits[1].trim());
                double lon = Double.parseDouble(bits[2].trim());
                String tz = bits.length > 3 && !bits[3].isBlank() ? bits[3].trim() : "auto";
                out.add(new MonitoredLocation(bits[0].trim(), lat, lon, tz));
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Bad coordinates in monitored location: " + part, e);
            }
        }
        return List.copyOf(out);
    }
}
