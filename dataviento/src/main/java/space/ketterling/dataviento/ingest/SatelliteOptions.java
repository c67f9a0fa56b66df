package space.ketterling.dataviento.ingest;

import java.time.LocalDate;

/**
 * Archive window and panel orientation for a satellite radiation ingest.
 */
public record SatelliteOptions(LocalDate startDate, LocalDate endDate, int tilt, int azimuth) {

    public SatelliteOptions {
        if (startDate == null || endDate == null)
            throw new IllegalArgumentException("start and end dates are required");
        if (endDate.isBefore(startDate))
            throw new IllegalArgumentException("end date " + endDate + " is before start date " + startDate);
    }

    /**
     * The {@code days} complete days before {@code today}. The archive lags by
     * about a day so today itself is never requested.
     */
    public static SatelliteOptions lastDays(LocalDate today, int days, int tilt, int azimuth) {
        int n = Math.max(1, days);
        return new SatelliteOptions(today.minusDays(n), today.minusDays(1), tilt, azimuth);
    }
}
