package space.ketterling.dataviento.db;

import java.time.Instant;

/**
 * One value of one parameter at one time, to be stored under a batch.
 */
public record DataPoint(
        long parameterId,
        Instant validTime,
        int forecastHour,
        Double value,
        String unit,
        String qualityFlag) {

    public static final String GOOD = "good";
    public static final String MISSING = "missing";

    /**
     * Flags null values as missing; everything else is good.
     */
    public static DataPoint of(long parameterId, Instant validTime, int forecastHour, Double value, String unit) {
        return new DataPoint(parameterId, validTime, forecastHour, value, unit, value == null ? MISSING : GOOD);
    }
}
