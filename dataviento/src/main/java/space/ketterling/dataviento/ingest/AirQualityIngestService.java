package space.ketterling.dataviento.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.dataviento.db.SnapshotRepo;
import space.ketterling.dataviento.db.SnapshotTable;
import space.ketterling.dataviento.db.TimeSeriesRepo;
import space.ketterling.dataviento.db.TimeSeriesTable;
import space.ketterling.dataviento.openmeteo.OpenMeteoClient;
import space.ketterling.dataviento.openmeteo.OpenMeteoEndpoint;
import space.ketterling.dataviento.openmeteo.model.AirQualityResponse;
import space.ketterling.dataviento.registry.Domain;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.registry.ModelCatalog;
import space.ketterling.dataviento.registry.ModelRegistry;
import space.ketterling.dataviento.registry.ParameterRegistry;

import java.time.Clock;
import java.util.Map;

/**
 * Air quality ingest: current pollutant levels and an hourly batch. The
 * endpoint has no daily section; a DAILY option is ignored.
 */
public class AirQualityIngestService extends DomainIngestService<AirQualityResponse, ForecastOptions> {
    private final SnapshotRepo snapshots;
    private final TimeSeriesRepo timeSeries;
    private final long modelId;

    public AirQualityIngestService(OpenMeteoClient client,
            ObjectMapper om,
            LocationRegistry locations,
            ParameterRegistry parameters,
            ModelRegistry models,
            SnapshotRepo snapshots,
            TimeSeriesRepo timeSeries,
            Clock clock) throws Exception {
        super(client, om, locations, parameters, clock, AirQualityResponse.class);
        this.snapshots = snapshots;
        this.timeSeries = timeSeries;
        this.modelId = models.resolveOrCreate(ModelCatalog.AIR_QUALITY);
    }

    @Override
    public Domain domain() {
        return Domain.AIR_QUALITY;
    }

    @Override
    protected OpenMeteoEndpoint endpoint() {
        return OpenMeteoEndpoint.AIR_QUALITY;
    }

    @Override
    protected Map<String, String> queryParams(LocationTarget target, ForecastOptions options) {
        Map<String, String> p = baseParams(target);
        p.put("forecast_days", Integer.toString(endpoint().clampForecastDays(options.forecastDays())));
        if (options.includes(Section.CURRENT))
            p.put("current", joined(AirQualityResponse.CURRENT_FIELDS));
        if (options.includes(Section.HOURLY))
            p.put("hourly", joined(AirQualityResponse.HOURLY_FIELDS));
        return p;
    }

    @Override
    protected void persist(AirQualityResponse r, long locationId, ForecastOptions options,
            LocationIngestResult.Builder result) {
        if (options.includes(Section.CURRENT) && r.current() != null) {
            section(result, Section.CURRENT, "upsertAirQualityCurrent",
                    () -> writeSnapshot(snapshots, SnapshotTable.AIR_QUALITY, locationId, modelId,
                            observedAt(r.current().time(), r), r.current().values()));
        }
        if (options.includes(Section.HOURLY) && r.hourly() != null) {
            section(result, Section.HOURLY, "writeAirQualityBatch",
                    () -> writeHourly(timeSeries, TimeSeriesTable.AIR_QUALITY, r, locationId, modelId,
                            r.hourly().time(), r.hourly().seriesByParameter()));
        }
    }
}
