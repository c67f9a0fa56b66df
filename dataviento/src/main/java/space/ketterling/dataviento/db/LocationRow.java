package space.ketterling.dataviento.db;

import java.time.Instant;

/**
 * A stored location.
 */
public record LocationRow(
        long id,
        String name,
        double latitude,
        double longitude,
        Double elevation,
        String timezone,
        String countryCode,
        String countryName,
        String state,
        String admin1,
        String admin2,
        Long population,
        Instant createdAt) {
}
