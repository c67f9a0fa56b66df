/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for DataViento, an environmental data ingestion application.
*
* Initializes configuration, database pools, the Open-Meteo client, registries, per-domain
* ingest services and the retention job, then starts the scheduler and the read-only API.
* The program also handles a graceful shutdown.
*/

package space.ketterling.dataviento;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.dataviento.api.ApiServer;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.config.MonitoredLocation;
import space.ketterling.dataviento.db.*;
import space.ketterling.dataviento.ingest.*;
import space.ketterling.dataviento.openmeteo.OpenMeteoClient;
import space.ketterling.dataviento.registry.LocationAttributes;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;
import space.ketterling.dataviento.registry.ModelRegistry;
import space.ketterling.dataviento.registry.ParameterRegistry;
import space.ketterling.dataviento.retention.RetentionService;

import java.time.Clock;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        Clock clock = Clock.system(cfg.clockZoneId());

        HikariDataSource apiDs = Database.createApiDataSource(cfg);
        HikariDataSource ingestDs = Database.createIngestDataSource(cfg);
        SchemaInitializer.apply(ingestDs, cfg.dbSchemaScript());

        ObjectMapper om = new ObjectMapper();
        OpenMeteoClient client = new OpenMeteoClient(cfg, om);

        // Registries
        LocationRegistry locations = new LocationRegistry(new LocationRepo(ingestDs), clock);
        ParameterRegistry parameters = new ParameterRegistry(new ParameterRepo(ingestDs), clock);
        ModelRegistry models = new ModelRegistry(new ModelRepo(ingestDs), clock);

        // Repos
        IngestLogRepo ingestLog = new IngestLogRepo(ingestDs, clock);
        SnapshotRepo snapshots = new SnapshotRepo(ingestDs);
        TimeSeriesRepo timeSeries = new TimeSeriesRepo(ingestDs);
        DailyAggregateRepo daily = new DailyAggregateRepo(ingestDs);
        ClimateProjectionRepo projections = new ClimateProjectionRepo(ingestDs);

        for (MonitoredLocation m : cfg.monitoredLocations()) {
            try {
                long id = locations.resolveOrCreate(new LocationTarget(m.name(), m.latitude(), m.longitude(),
                        LocationAttributes.withTimezone(m.timezone())));
                log.info("Monitoring {} ({}, {}) as location {}", m.name(), m.latitude(), m.longitude(), id);
            } catch (Exception e) {
                log.warn("Failed to seed monitored location {}", m.name(), e);
            }
        }

        // Ingest services
        WeatherIngestService weather = new WeatherIngestService(client, om, locations, parameters, models,
                snapshots, timeSeries, daily, clock);
        AirQualityIngestService airQuality = new AirQualityIngestService(client, om, locations, parameters, models,
                snapshots, timeSeries, clock);
        MarineIngestService marine = new MarineIngestService(client, om, locations, parameters, models,
                snapshots, timeSeries, daily, clock);
        SatelliteIngestService satellite = new SatelliteIngestService(client, om, locations, parameters, models,
                daily, clock);
        ClimateIngestService climate = new ClimateIngestService(client, om, locations, parameters, models,
                projections, clock);
        RetentionService retention = new RetentionService(cfg, timeSeries, daily, snapshots,
                new TableStatsRepo(ingestDs), clock);

        IngestRunner runner = new IngestRunner(locations, ingestLog, cfg.ingestWorkers());

        // Scheduler
        IngestScheduler scheduler = new IngestScheduler(cfg, clock, runner, weather, airQuality, marine,
                satellite, climate, retention);
        scheduler.start();

        // API server (ingestion runs in background)
        final ApiServer api;
        if (cfg.apiEnabled()) {
            api = new ApiServer(cfg, om, apiDs, clock);
            api.start();
            log.info("API server started on port {}", api.port());
        } else {
            log.info("API disabled by config");
            api = null;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                if (api != null)
                    api.stop();
                scheduler.stop();
                runner.close();
                client.close();
                apiDs.close();
                ingestDs.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
