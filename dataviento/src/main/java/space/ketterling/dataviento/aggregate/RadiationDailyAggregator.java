package space.ketterling.dataviento.aggregate;

import space.ketterling.dataviento.openmeteo.OpenMeteoTime;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces hourly radiation series to one row per calendar date.
 *
 * <p>
 * A timestamp counts as valid when at least one component has a value at that
 * index. Components missing from the payload (empty series) yield a null mean.
 * </p>
 */
public final class RadiationDailyAggregator {

    /**
     * @param time       local timestamps of the hourly axis
     * @param components series keyed by column name, each empty or as long as
     *                   {@code time}
     */
    public List<RadiationDay> aggregate(List<String> time, Map<String, List<Double>> components) {
        if (time == null || time.isEmpty())
            return List.of();

        // date -> indices into the hourly axis
        Map<LocalDate, List<Integer>> byDate = new TreeMap<>();
        for (int i = 0; i < time.size(); i++) {
            String t = time.get(i);
            if (t == null)
                continue;
            byDate.computeIfAbsent(OpenMeteoTime.toDate(t), d -> new ArrayList<>()).add(i);
        }

        List<RadiationDay> out = new ArrayList<>(byDate.size());
        for (var e : byDate.entrySet()) {
            List<Integer> idx = e.getValue();
            Map<String, Double> means = new LinkedHashMap<>();
            for (var c : components.entrySet()) {
                means.put(c.getKey(), Aggregation.meanSkipNulls(slice(c.getValue(), idx)));
            }

            int valid = 0;
            for (int i : idx) {
                if (anyValue(components, i))
                    valid++;
            }
            double score = Aggregation.qualityScore(idx.size(), valid);
            out.add(new RadiationDay(e.getKey(), means, idx.size(), valid, score, QualityFlag.of(score)));
        }
        return out;
    }

    private static List<Double> slice(List<Double> series, List<Integer> idx) {
        if (series == null || series.isEmpty())
            return List.of();
        List<Double> out = new ArrayList<>(idx.size());
        for (int i : idx) {
            out.add(i < series.size() ? series.get(i) : null);
        }
        return out;
    }

    private static boolean anyValue(Map<String, List<Double>> components, int i) {
        for (List<Double> s : components.values()) {
            if (s != null && i < s.size() && s.get(i) != null)
                return true;
        }
        return false;
    }
}
