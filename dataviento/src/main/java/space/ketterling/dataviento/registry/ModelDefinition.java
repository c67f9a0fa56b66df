package space.ketterling.dataviento.registry;

/**
 * Catalog metadata for one upstream data source or model.
 */
public record ModelDefinition(
        String code,
        String name,
        String provider,
        String providerCountry,
        double resolutionKm,
        double resolutionDegrees,
        Integer forecastDays,
        Integer updateFrequencyHours,
        String temporalResolution,
        String coverage,
        Domain domain,
        String description) {
}
