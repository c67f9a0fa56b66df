package space.ketterling.dataviento.db;

import java.time.Instant;
import java.util.Map;

/**
 * The latest stored observation for one location in one domain.
 */
public record Snapshot(
        long locationId,
        long modelId,
        Instant observationTime,
        Instant updatedAt,
        Map<String, Double> values) {
}
