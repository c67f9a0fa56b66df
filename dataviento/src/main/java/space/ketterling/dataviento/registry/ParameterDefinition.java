package space.ketterling.dataviento.registry;

/**
 * Catalog metadata for one physical quantity.
 */
public record ParameterDefinition(
        String code,
        String name,
        String unit,
        String category,
        String dataType,
        String altitudeLevel,
        boolean surface,
        Domain domain) {
}
