package space.ketterling.dataviento.openmeteo.model;

import java.util.List;
import java.util.Map;

final class Series {
    private Series() {
    }

    /**
     * Adds a series under its key if the payload carried it.
     */
    static <T> void put(Map<String, List<T>> out, String key, List<T> series) {
        if (series != null)
            out.put(key, series);
    }

    static void putAny(Map<String, List<?>> out, String key, List<?> series) {
        if (series != null)
            out.put(key, series);
    }
}
