package space.ketterling.dataviento.openmeteo.model;

import space.ketterling.dataviento.openmeteo.OpenMeteoTime;
import space.ketterling.dataviento.openmeteo.PayloadValidationException;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects field constraint failures so a payload reports all of them at once.
 */
final class Violations {
    private final List<String> problems = new ArrayList<>();

    static Violations ofEnvelope(OpenMeteoResponse r) {
        Violations v = new Violations();
        v.required("latitude", r.latitude());
        v.required("longitude", r.longitude());
        v.required("generationtime_ms", r.generationTimeMs());
        v.required("utc_offset_seconds", r.utcOffsetSeconds());
        v.required("timezone", r.timezone());
        v.range("latitude", r.latitude(), -90, 90);
        v.range("longitude", r.longitude(), -180, 180);
        return v;
    }

    Violations required(String field, Object value) {
        if (value == null)
            problems.add(field + " is required");
        return this;
    }

    /**
     * Null values pass; only present numbers are checked.
     */
    Violations range(String field, Number value, double min, double max) {
        if (value != null && (value.doubleValue() < min || value.doubleValue() > max)) {
            problems.add(field + "=" + value + " outside [" + min + ", " + max + "]");
        }
        return this;
    }

    Violations atLeast(String field, Number value, double min) {
        if (value != null && value.doubleValue() < min) {
            problems.add(field + "=" + value + " below " + min);
        }
        return this;
    }

    /**
     * A section's time axis: required, at least one entry, every entry
     * parseable as local time. Dates and date-times are both accepted.
     */
    Violations timeAxis(String section, List<String> time) {
        if (time == null) {
            problems.add(section + ".time is required");
            return this;
        }
        if (time.isEmpty()) {
            problems.add(section + ".time is empty");
            return this;
        }
        for (int i = 0; i < time.size(); i++) {
            String t = time.get(i);
            try {
                if (t == null)
                    throw new DateTimeException("null");
                if (t.length() > 10)
                    OpenMeteoTime.toInstant(t, 0);
                else
                    OpenMeteoTime.toDate(t);
            } catch (DateTimeException e) {
                problems.add(section + ".time[" + i + "] is not a valid time: " + t);
                break;
            }
        }
        return this;
    }

    /**
     * A series must line up with its time axis. Absent series are allowed.
     */
    Violations sameLength(String field, List<?> time, List<?> series) {
        if (time != null && series != null && series.size() != time.size()) {
            problems.add(field + " has " + series.size() + " values but time has " + time.size());
        }
        return this;
    }

    Violations seriesRange(String field, List<String> time, List<? extends Number> series, double min, double max) {
        sameLength(field, time, series);
        if (series != null) {
            for (int i = 0; i < series.size(); i++) {
                Number n = series.get(i);
                if (n != null && (n.doubleValue() < min || n.doubleValue() > max)) {
                    problems.add(field + "[" + i + "]=" + n + " outside [" + min + ", " + max + "]");
                    break;
                }
            }
        }
        return this;
    }

    Violations seriesAtLeast(String field, List<String> time, List<? extends Number> series, double min) {
        return seriesRange(field, time, series, min, Double.MAX_VALUE);
    }

    void throwIfAny(String what) throws PayloadValidationException {
        if (!problems.isEmpty()) {
            throw new PayloadValidationException(what, problems);
        }
    }
}
