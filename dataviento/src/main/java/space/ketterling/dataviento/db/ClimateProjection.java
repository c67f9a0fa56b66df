package space.ketterling.dataviento.db;

import java.time.LocalDate;

/**
 * Header for one climate model run over a date range at one location.
 */
public record ClimateProjection(
        long locationId,
        long modelId,
        LocalDate startDate,
        LocalDate endDate,
        boolean disableBiasCorrection,
        String cellSelection,
        Double generationTimeMs,
        String timezone,
        Integer utcOffsetSeconds) {
}
