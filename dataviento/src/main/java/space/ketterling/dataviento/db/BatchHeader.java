package space.ketterling.dataviento.db;

import java.time.Instant;

/**
 * One fetch cycle's worth of hourly data for a location. {@code id} is null
 * until stored.
 */
public record BatchHeader(
        Long id,
        long locationId,
        long modelId,
        Instant referenceTime,
        Double generationTimeMs,
        String timezone,
        Integer utcOffsetSeconds) {
}
