package space.ketterling.dataviento.db;

import java.time.LocalDate;
import java.util.Map;

/**
 * One day's values keyed by column name. Values are Numbers or Strings
 * matching the column kind; absent keys are stored as NULL.
 */
public record DailyRow(LocalDate validDate, Map<String, Object> values) {

    public Double number(String column) {
        Object v = values.get(column);
        return v == null ? null : ((Number) v).doubleValue();
    }

    public String text(String column) {
        Object v = values.get(column);
        return v == null ? null : v.toString();
    }
}
