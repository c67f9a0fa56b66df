package space.ketterling.dataviento.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling per-endpoint call health for the upstream Open-Meteo APIs.
 *
 * <p>
 * Every fetch attempt is recorded under its endpoint family. Counts are kept
 * in one-minute buckets over a 60-minute window.
 * </p>
 */
public final class ExternalApiMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, EndpointBuckets> ENDPOINTS = new ConcurrentHashMap<>();

    /**
     * Utility class; no instances.
     */
    private ExternalApiMetrics() {
    }

    /**
     * Outcome of a single attempt.
     */
    public enum Outcome {
        SUCCESS,
        /** Failed, another attempt follows. */
        RETRIED,
        /** Failed on the last attempt. */
        FAILED
    }

    /**
     * Records one attempt outcome for an endpoint family.
     */
    public static void record(String endpoint, Outcome outcome) {
        if (endpoint == null || endpoint.isBlank())
            return;
        ENDPOINTS.computeIfAbsent(endpoint, k -> new EndpointBuckets())
                .record(outcome, System.currentTimeMillis() / 60000L);
    }

    /**
     * Returns health per endpoint family, ordered by name.
     */
    public static Map<String, EndpointSnapshot> snapshot() {
        long nowMin = System.currentTimeMillis() / 60000L;
        Map<String, EndpointSnapshot> out = new TreeMap<>();
        for (var e : ENDPOINTS.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot(nowMin));
        }
        return out;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /**
     * Window totals for one endpoint family. A retried attempt counts as a
     * failure for the status.
     */
    public record EndpointSnapshot(long attempts, long retried, long failed, double failurePct, String status) {
    }

    private static final class EndpointBuckets {
        private final long[] minute = new long[WINDOW_MINUTES];
        private final long[] attempts = new long[WINDOW_MINUTES];
        private final long[] retried = new long[WINDOW_MINUTES];
        private final long[] failed = new long[WINDOW_MINUTES];

        private synchronized void record(Outcome outcome, long nowMin) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                attempts[idx] = 0L;
                retried[idx] = 0L;
                failed[idx] = 0L;
            }
            attempts[idx]++;
            switch (outcome) {
                case RETRIED -> retried[idx]++;
                case FAILED -> failed[idx]++;
                case SUCCESS -> {
                }
            }
        }

        private synchronized EndpointSnapshot snapshot(long nowMin) {
            long a = 0L;
            long r = 0L;
            long f = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (minute[i] == 0L || (nowMin - minute[i]) >= WINDOW_MINUTES)
                    continue;
                a += attempts[i];
                r += retried[i];
                f += failed[i];
            }
            double pct = a == 0 ? 0.0 : ((r + f) * 100.0) / a;
            String status;
            if (a == 0) {
                status = "no-data";
            } else if (pct >= 50.0) {
                status = "down";
            } else if (pct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new EndpointSnapshot(a, r, f, pct, status);
        }
    }
}
