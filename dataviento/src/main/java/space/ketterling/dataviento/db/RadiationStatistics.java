package space.ketterling.dataviento.db;

import java.time.LocalDate;

/**
 * Summary of stored satellite days for a location over a date range.
 */
public record RadiationStatistics(
        int days,
        Double avgShortwave,
        Double avgDirect,
        Double avgDiffuse,
        Double avgDni,
        Double avgGti,
        Double avgTerrestrial,
        Double maxDni,
        Double minDni,
        Double avgQualityScore,
        LocalDate firstDate,
        LocalDate lastDate) {
}
