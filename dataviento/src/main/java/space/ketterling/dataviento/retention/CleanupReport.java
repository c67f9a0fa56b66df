package space.ketterling.dataviento.retention;

import java.time.Instant;
import java.util.Map;

/**
 * Rows deleted per table by one cleanup.
 */
public record CleanupReport(RetentionTarget target, Instant cutoff, Map<String, Integer> deleted) {

    public int total() {
        return deleted.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int deletedFrom(String table) {
        return deleted.getOrDefault(table, 0);
    }
}
