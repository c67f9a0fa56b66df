package space.ketterling.dataviento.ingest;

import space.ketterling.dataviento.registry.Domain;

/**
 * Outcome of ingesting one domain for one location.
 *
 * <p>
 * {@code failedStage} is null on success. For a persistence failure the other
 * sections may still have been saved; their flags say which.
 * </p>
 */
public record LocationIngestResult(
        Domain domain,
        String locationName,
        boolean success,
        Long locationId,
        boolean currentSaved,
        boolean hourlySaved,
        boolean dailySaved,
        int rowsWritten,
        String error,
        Stage failedStage) {

    static Builder builder(Domain domain, String locationName) {
        return new Builder(domain, locationName);
    }

    /**
     * Accumulates section outcomes while a location is processed.
     */
    static final class Builder {
        private final Domain domain;
        private final String locationName;
        private Long locationId;
        private boolean currentSaved;
        private boolean hourlySaved;
        private boolean dailySaved;
        private int rowsWritten;
        private String error;
        private Stage failedStage;

        private Builder(Domain domain, String locationName) {
            this.domain = domain;
            this.locationName = locationName;
        }

        String locationName() {
            return locationName;
        }

        Builder locationId(long id) {
            this.locationId = id;
            return this;
        }

        Builder saved(Section section, int rows) {
            switch (section) {
                case CURRENT -> currentSaved = true;
                case HOURLY -> hourlySaved = true;
                case DAILY -> dailySaved = true;
            }
            rowsWritten += rows;
            return this;
        }

        /**
         * Records a failure. The first stage that failed wins; errors from
         * later sections are appended.
         */
        Builder failed(Stage stage, String message) {
            if (failedStage == null)
                failedStage = stage;
            error = error == null ? message : error + "; " + message;
            return this;
        }

        LocationIngestResult build() {
            return new LocationIngestResult(domain, locationName, failedStage == null, locationId, currentSaved,
                    hourlySaved, dailySaved, rowsWritten, error, failedStage);
        }
    }
}
