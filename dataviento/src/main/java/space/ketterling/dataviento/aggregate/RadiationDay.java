package space.ketterling.dataviento.aggregate;

import java.time.LocalDate;
import java.util.Map;

/**
 * Daily means of the radiation components plus record counts for one date.
 * Component means are keyed by satellite_daily column and may be null.
 */
public record RadiationDay(
        LocalDate date,
        Map<String, Double> means,
        int totalRecords,
        int validRecords,
        double qualityScore,
        QualityFlag qualityFlag) {
}
