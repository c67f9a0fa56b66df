package space.ketterling.dataviento.aggregate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Null-aware statistics used when hourly values are reduced to daily rows.
 */
public final class Aggregation {
    private Aggregation() {
    }

    /**
     * Mean of the non-null values, rounded to two decimals. Returns null for an
     * empty or all-null input.
     */
    public static Double meanSkipNulls(List<? extends Number> values) {
        if (values == null || values.isEmpty())
            return null;
        double sum = 0;
        int n = 0;
        for (Number v : values) {
            if (v == null)
                continue;
            sum += v.doubleValue();
            n++;
        }
        if (n == 0)
            return null;
        return round2(sum / n);
    }

    /**
     * Percentage of valid records, rounded to two decimals. Zero when there
     * were no records at all.
     */
    public static double qualityScore(int total, int valid) {
        if (total <= 0)
            return 0.0;
        return round2(valid * 100.0 / total);
    }

    static double round2(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
