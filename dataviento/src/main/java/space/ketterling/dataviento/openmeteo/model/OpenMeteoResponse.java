package space.ketterling.dataviento.openmeteo.model;

import space.ketterling.dataviento.openmeteo.PayloadValidationException;

/**
 * Metadata envelope shared by every endpoint family.
 */
public interface OpenMeteoResponse {
    Double latitude();

    Double longitude();

    Double generationTimeMs();

    Integer utcOffsetSeconds();

    String timezone();

    /**
     * Checks the envelope and every present section.
     */
    void validate() throws PayloadValidationException;
}
