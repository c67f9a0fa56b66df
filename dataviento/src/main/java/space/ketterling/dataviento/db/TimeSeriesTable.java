package space.ketterling.dataviento.db;

/**
 * Batch header / data point table pairs, one per forecast domain.
 */
public enum TimeSeriesTable {
    WEATHER("weather_forecast_batch", "weather_forecast_point"),
    AIR_QUALITY("air_quality_batch", "air_quality_point"),
    MARINE("marine_batch", "marine_point");

    private final String batchTable;
    private final String pointTable;

    TimeSeriesTable(String batchTable, String pointTable) {
        this.batchTable = batchTable;
        this.pointTable = pointTable;
    }

    public String batchTable() {
        return batchTable;
    }

    public String pointTable() {
        return pointTable;
    }
}
