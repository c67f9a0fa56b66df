package space.ketterling.dataviento.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.dataviento.db.DailyAggregateRepo;
import space.ketterling.dataviento.db.DailyTable;
import space.ketterling.dataviento.db.SnapshotRepo;
import space.ketterling.dataviento.db.SnapshotTable;
import space.ketterling.dataviento.db.TimeSeriesRepo;
import space.ketterling.dataviento.db.TimeSeriesTable;
import space.ketterling.dataviento.openmeteo.OpenMeteoClient;
import space.ketterling.dataviento.openmeteo.OpenMeteoEndpoint;
import space.ketterling.dataviento.openmeteo.model.MarineResponse;
import space.ketterling.dataviento.registry.Domain;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.registry.ModelCatalog;
import space.ketterling.dataviento.registry.ModelRegistry;
import space.ketterling.dataviento.registry.ParameterRegistry;

import java.time.Clock;
import java.util.Map;

/**
 * Marine ingest: sea state now, an hourly wave batch and daily maxima.
 */
public class MarineIngestService extends DomainIngestService<MarineResponse, ForecastOptions> {
    private final SnapshotRepo snapshots;
    private final TimeSeriesRepo timeSeries;
    private final DailyAggregateRepo daily;
    private final long modelId;

    public MarineIngestService(OpenMeteoClient client,
            ObjectMapper om,
            LocationRegistry locations,
            ParameterRegistry parameters,
            ModelRegistry models,
            SnapshotRepo snapshots,
            TimeSeriesRepo timeSeries,
            DailyAggregateRepo daily,
            Clock clock) throws Exception {
        super(client, om, locations, parameters, clock, MarineResponse.class);
        this.snapshots = snapshots;
        this.timeSeries = timeSeries;
        this.daily = daily;
        this.modelId = models.resolveOrCreate(ModelCatalog.MARINE);
    }

    /**
     * Current and daily only; the hourly wave batch is opt-in.
     */
    public static ForecastOptions defaultOptions(int forecastDays) {
        return ForecastOptions.of(forecastDays, Section.CURRENT, Section.DAILY);
    }

    @Override
    public Domain domain() {
        return Domain.MARINE;
    }

    @Override
    protected OpenMeteoEndpoint endpoint() {
        return OpenMeteoEndpoint.MARINE;
    }

    @Override
    protected Map<String, String> queryParams(LocationTarget target, ForecastOptions options) {
        Map<String, String> p = baseParams(target);
        p.put("forecast_days", Integer.toString(endpoint().clampForecastDays(options.forecastDays())));
        if (options.includes(Section.CURRENT))
            p.put("current", joined(MarineResponse.CURRENT_FIELDS));
        if (options.includes(Section.HOURLY))
            p.put("hourly", joined(MarineResponse.HOURLY_FIELDS));
        if (options.includes(Section.DAILY))
            p.put("daily", joined(MarineResponse.DAILY_FIELDS));
        return p;
    }

    @Override
    protected void persist(MarineResponse r, long locationId, ForecastOptions options,
            LocationIngestResult.Builder result) {
        if (options.includes(Section.CURRENT) && r.current() != null) {
            section(result, Section.CURRENT, "upsertMarineCurrent",
                    () -> writeSnapshot(snapshots, SnapshotTable.MARINE, locationId, modelId,
                            observedAt(r.current().time(), r), r.current().values()));
        }
        if (options.includes(Section.HOURLY) && r.hourly() != null) {
            section(result, Section.HOURLY, "writeMarineBatch",
                    () -> writeHourly(timeSeries, TimeSeriesTable.MARINE, r, locationId, modelId,
                            r.hourly().time(), r.hourly().seriesByParameter()));
        }
        if (options.includes(Section.DAILY) && r.daily() != null) {
            section(result, Section.DAILY, "upsertMarineDaily",
                    () -> daily.upsertDaily(DailyTable.MARINE, locationId, modelId,
                            dailyRows(r.daily().time(), r.daily().columns()), clock.instant()));
        }
    }
}
