package space.ketterling.dataviento.db;

import java.time.Instant;

/**
 * A stored data point joined with its parameter code.
 */
public record StoredPoint(
        long batchId,
        String parameterCode,
        Instant validTime,
        int forecastHour,
        Double value,
        String unit,
        String qualityFlag) {
}
