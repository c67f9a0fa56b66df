package space.ketterling.dataviento.ingest;

import java.time.LocalDate;

/**
 * Date range and model for a climate projection ingest.
 *
 * @param cellSelection one of land, sea or nearest
 */
public record ClimateOptions(
        LocalDate startDate,
        LocalDate endDate,
        String model,
        boolean disableBiasCorrection,
        String cellSelection) {

    public ClimateOptions {
        if (startDate == null || endDate == null)
            throw new IllegalArgumentException("start and end dates are required");
        if (endDate.isBefore(startDate))
            throw new IllegalArgumentException("end date " + endDate + " is before start date " + startDate);
        if (cellSelection == null || cellSelection.isBlank())
            cellSelection = "land";
    }

    public static ClimateOptions of(LocalDate startDate, LocalDate endDate, String model) {
        return new ClimateOptions(startDate, endDate, model, false, "land");
    }
}
