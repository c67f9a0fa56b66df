package space.ketterling.dataviento.openmeteo;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OpenMeteoTimeTest {

    @Test
    void regionIdsWinOverTheFixedOffset() {
        assertEquals(ZoneId.of("Europe/Madrid"), OpenMeteoTime.zoneOf("Europe/Madrid", 7200));
        assertEquals(ZoneOffset.ofHours(-5), OpenMeteoTime.zoneOf("GMT", -18000));
        assertEquals(ZoneOffset.ofHours(2), OpenMeteoTime.zoneOf("Not/AZone", 7200));
        assertEquals(ZoneOffset.UTC, OpenMeteoTime.zoneOf(null, null));
    }

    @Test
    void springForwardShiftsTheOffset() {
        List<Instant> out = OpenMeteoTime.toInstants(List.of("2025-03-30T01:00", "2025-03-30T03:00"),
                ZoneId.of("Europe/Madrid"));

        assertEquals(Instant.parse("2025-03-30T00:00:00Z"), out.get(0));
        assertEquals(Instant.parse("2025-03-30T01:00:00Z"), out.get(1));
    }

    @Test
    void repeatedHourWhenClocksGoBackStaysDistinct() {
        List<Instant> out = OpenMeteoTime.toInstants(
                List.of("2025-10-26T01:00", "2025-10-26T02:00", "2025-10-26T02:00", "2025-10-26T03:00"),
                ZoneId.of("Europe/Madrid"));

        assertEquals(List.of(
                Instant.parse("2025-10-25T23:00:00Z"),
                Instant.parse("2025-10-26T00:00:00Z"),
                Instant.parse("2025-10-26T01:00:00Z"),
                Instant.parse("2025-10-26T02:00:00Z")), out);
    }
}
