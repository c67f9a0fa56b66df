package space.ketterling.dataviento.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.dataviento.aggregate.RadiationDailyAggregator;
import space.ketterling.dataviento.aggregate.RadiationDay;
import space.ketterling.dataviento.db.DailyAggregateRepo;
import space.ketterling.dataviento.db.DailyRow;
import space.ketterling.dataviento.db.DailyTable;
import space.ketterling.dataviento.openmeteo.OpenMeteoClient;
import space.ketterling.dataviento.openmeteo.OpenMeteoEndpoint;
import space.ketterling.dataviento.openmeteo.model.SatelliteResponse;
import space.ketterling.dataviento.registry.Domain;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.registry.ModelCatalog;
import space.ketterling.dataviento.registry.ModelRegistry;
import space.ketterling.dataviento.registry.ParameterRegistry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Satellite radiation ingest. Hourly archive values are reduced to daily
 * means with a quality score; only the daily rows are stored.
 */
public class SatelliteIngestService extends DomainIngestService<SatelliteResponse, SatelliteOptions> {
    private final DailyAggregateRepo daily;
    private final RadiationDailyAggregator aggregator = new RadiationDailyAggregator();
    private final long modelId;

    public SatelliteIngestService(OpenMeteoClient client,
            ObjectMapper om,
            LocationRegistry locations,
            ParameterRegistry parameters,
            ModelRegistry models,
            DailyAggregateRepo daily,
            Clock clock) throws Exception {
        super(client, om, locations, parameters, clock, SatelliteResponse.class);
        this.daily = daily;
        this.modelId = models.resolveOrCreate(ModelCatalog.SATELLITE);
    }

    @Override
    public Domain domain() {
        return Domain.SATELLITE;
    }

    @Override
    protected OpenMeteoEndpoint endpoint() {
        return OpenMeteoEndpoint.SATELLITE;
    }

    @Override
    protected Map<String, String> queryParams(LocationTarget target, SatelliteOptions options) {
        Map<String, String> p = baseParams(target);
        p.put("start_date", options.startDate().toString());
        p.put("end_date", options.endDate().toString());
        p.put("hourly", joined(SatelliteResponse.HOURLY_FIELDS));
        p.put("tilt", Integer.toString(options.tilt()));
        p.put("azimuth", Integer.toString(options.azimuth()));
        return p;
    }

    @Override
    protected void persist(SatelliteResponse r, long locationId, SatelliteOptions options,
            LocationIngestResult.Builder result) {
        section(result, Section.DAILY, "upsertSatelliteDaily", () -> {
            List<RadiationDay> days = aggregator.aggregate(r.hourly().time(), r.hourly().components());
            if (days.isEmpty())
                throw new IllegalStateException("no radiation days in payload");
            return daily.upsertDaily(DailyTable.SATELLITE, locationId, modelId, toRows(days, options),
                    clock.instant());
        });
    }

    static List<DailyRow> toRows(List<RadiationDay> days, SatelliteOptions options) {
        List<DailyRow> rows = new ArrayList<>(days.size());
        for (RadiationDay d : days) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (var m : d.means().entrySet()) {
                if (m.getValue() != null)
                    values.put(m.getKey(), m.getValue());
            }
            values.put("panel_tilt_angle", options.tilt());
            values.put("panel_azimuth_angle", options.azimuth());
            values.put("total_records", d.totalRecords());
            values.put("valid_records", d.validRecords());
            values.put("quality_score", d.qualityScore());
            values.put("quality_flag", d.qualityFlag().dbValue());
            rows.add(new DailyRow(d.date(), values));
        }
        return rows;
    }
}
