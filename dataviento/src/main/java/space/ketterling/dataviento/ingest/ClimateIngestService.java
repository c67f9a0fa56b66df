package space.ketterling.dataviento.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.dataviento.db.ClimateProjection;
import space.ketterling.dataviento.db.ClimateProjectionRepo;
import space.ketterling.dataviento.db.DailyRow;
import space.ketterling.dataviento.openmeteo.OpenMeteoClient;
import space.ketterling.dataviento.openmeteo.OpenMeteoEndpoint;
import space.ketterling.dataviento.openmeteo.PayloadValidationException;
import space.ketterling.dataviento.openmeteo.model.ClimateResponse;
import space.ketterling.dataviento.registry.Domain;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.registry.ModelCatalog;
import space.ketterling.dataviento.registry.ModelRegistry;
import space.ketterling.dataviento.registry.ParameterRegistry;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Climate projection ingest. Stores one projection header per (location,
 * model, range) and its daily rows.
 */
public class ClimateIngestService extends DomainIngestService<ClimateResponse, ClimateOptions> {
    private static final Set<String> CELL_SELECTIONS = Set.of("land", "sea", "nearest");

    private final ModelRegistry models;
    private final ClimateProjectionRepo projections;

    public ClimateIngestService(OpenMeteoClient client,
            ObjectMapper om,
            LocationRegistry locations,
            ParameterRegistry parameters,
            ModelRegistry models,
            ClimateProjectionRepo projections,
            Clock clock) {
        super(client, om, locations, parameters, clock, ClimateResponse.class);
        this.models = models;
        this.projections = projections;
    }

    @Override
    public Domain domain() {
        return Domain.CLIMATE;
    }

    @Override
    protected OpenMeteoEndpoint endpoint() {
        return OpenMeteoEndpoint.CLIMATE;
    }

    @Override
    protected void checkOptions(ClimateOptions options) throws PayloadValidationException {
        if (options.model() == null || !ModelCatalog.isClimateModel(options.model())) {
            throw new PayloadValidationException("climate options",
                    List.of("unknown climate model: " + options.model()));
        }
        if (!CELL_SELECTIONS.contains(options.cellSelection())) {
            throw new PayloadValidationException("climate options",
                    List.of("cell_selection must be one of " + CELL_SELECTIONS + ": " + options.cellSelection()));
        }
    }

    @Override
    protected Map<String, String> queryParams(LocationTarget target, ClimateOptions options) {
        Map<String, String> p = baseParams(target);
        p.put("start_date", options.startDate().toString());
        p.put("end_date", options.endDate().toString());
        p.put("daily", joined(ClimateResponse.DAILY_FIELDS));
        p.put("models", options.model());
        p.put("cell_selection", options.cellSelection());
        if (options.disableBiasCorrection())
            p.put("disable_bias_correction", "true");
        return p;
    }

    @Override
    protected void persist(ClimateResponse r, long locationId, ClimateOptions options,
            LocationIngestResult.Builder result) {
        section(result, Section.DAILY, "upsertClimateDaily", () -> {
            long modelId = models.resolveOrCreate(options.model());
            ClimateProjection projection = new ClimateProjection(
                    locationId,
                    modelId,
                    options.startDate(),
                    options.endDate(),
                    options.disableBiasCorrection(),
                    options.cellSelection(),
                    r.generationTimeMs(),
                    r.timezone(),
                    r.utcOffsetSeconds());
            List<DailyRow> rows = dailyRows(r.daily().time(), r.daily().columns());
            return projections.writeProjection(projection, rows, clock.instant()).dailyRows();
        });
    }
}
