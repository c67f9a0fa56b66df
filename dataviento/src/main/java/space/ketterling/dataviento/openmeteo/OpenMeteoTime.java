package space.ketterling.dataviento.openmeteo;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the local time strings Open-Meteo returns into absolute values.
 */
public final class OpenMeteoTime {
    private OpenMeteoTime() {
    }

    /**
     * "2025-10-30T14:00" in a response with the given utc offset.
     */
    public static Instant toInstant(String localTime, int utcOffsetSeconds) {
        return LocalDateTime.parse(localTime).toInstant(ZoneOffset.ofTotalSeconds(utcOffsetSeconds));
    }

    /**
     * Zone the local times of a response are written in. The response's
     * {@code timezone} is used when it is a known region id; otherwise the
     * fixed {@code utc_offset_seconds} applies.
     */
    public static ZoneId zoneOf(String timezone, Integer utcOffsetSeconds) {
        ZoneOffset fixed = ZoneOffset.ofTotalSeconds(utcOffsetSeconds == null ? 0 : utcOffsetSeconds);
        if (timezone == null || timezone.isBlank())
            return fixed;
        try {
            ZoneId zone = ZoneId.of(timezone);
            return zone.getRules().isFixedOffset() ? fixed : zone;
        } catch (DateTimeException e) {
            return fixed;
        }
    }

    /**
     * Converts an ascending axis of local times. A local hour repeated when
     * clocks go back resolves to the later offset on its second occurrence,
     * so the result stays strictly increasing.
     */
    public static List<Instant> toInstants(List<String> localTimes, ZoneId zone) {
        List<Instant> out = new ArrayList<>(localTimes.size());
        Instant prev = null;
        for (String t : localTimes) {
            ZonedDateTime z = LocalDateTime.parse(t).atZone(zone);
            if (prev != null && !z.toInstant().isAfter(prev))
                z = z.withLaterOffsetAtOverlap();
            prev = z.toInstant();
            out.add(prev);
        }
        return out;
    }

    public static LocalDate toDate(String localDate) {
        return LocalDate.parse(localDate.length() > 10 ? localDate.substring(0, 10) : localDate);
    }
}
