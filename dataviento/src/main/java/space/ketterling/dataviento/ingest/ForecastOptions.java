package space.ketterling.dataviento.ingest;

import java.util.EnumSet;
import java.util.Set;

/**
 * Sections to request and the forecast horizon, for weather, air quality and
 * marine ingests. The horizon is clamped per endpoint when the request is
 * built.
 */
public record ForecastOptions(Set<Section> sections, int forecastDays) {

    public ForecastOptions {
        if (sections == null || sections.isEmpty())
            throw new IllegalArgumentException("at least one section is required");
        sections = Set.copyOf(EnumSet.copyOf(sections));
    }

    public static ForecastOptions of(int forecastDays, Section first, Section... rest) {
        return new ForecastOptions(EnumSet.of(first, rest), forecastDays);
    }

    public static ForecastOptions all(int forecastDays) {
        return new ForecastOptions(EnumSet.allOf(Section.class), forecastDays);
    }

    public boolean includes(Section s) {
        return sections.contains(s);
    }
}
