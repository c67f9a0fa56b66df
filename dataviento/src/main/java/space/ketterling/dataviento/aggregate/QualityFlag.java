package space.ketterling.dataviento.aggregate;

import java.util.Locale;

/**
 * Bucketed data quality for a day of satellite records.
 */
public enum QualityFlag {
    GOOD,
    FAIR,
    POOR;

    public static QualityFlag of(double score) {
        if (score > 75)
            return GOOD;
        if (score > 50)
            return FAIR;
        return POOR;
    }

    /**
     * Value stored in the quality_flag column.
     */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
