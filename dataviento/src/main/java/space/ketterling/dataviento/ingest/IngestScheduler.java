package space.ketterling.dataviento.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.retention.RetentionService;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic jobs. Each domain has its own single-threaded slot, so two jobs of
 * the same domain never overlap; the locations within a job are spread over
 * the shared {@link IngestRunner} pool.
 */
public final class IngestScheduler {
    private static final Logger log = LoggerFactory.getLogger(IngestScheduler.class);

    // One slot per domain, plus retention
    private final ScheduledExecutorService weatherExec = slot("ingest-weather");
    private final ScheduledExecutorService airQualityExec = slot("ingest-air-quality");
    private final ScheduledExecutorService marineExec = slot("ingest-marine");
    private final ScheduledExecutorService satelliteExec = slot("ingest-satellite");
    private final ScheduledExecutorService climateExec = slot("ingest-climate");
    private final ScheduledExecutorService retentionExec = slot("retention");

    private final AppConfig cfg;
    private final Clock clock;
    private final IngestRunner runner;
    private final WeatherIngestService weather;
    private final AirQualityIngestService airQuality;
    private final MarineIngestService marine;
    private final SatelliteIngestService satellite;
    private final ClimateIngestService climate;
    private final RetentionService retention;

    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();

    public IngestScheduler(AppConfig cfg,
            Clock clock,
            IngestRunner runner,
            WeatherIngestService weather,
            AirQualityIngestService airQuality,
            MarineIngestService marine,
            SatelliteIngestService satellite,
            ClimateIngestService climate,
            RetentionService retention) {
        this.cfg = cfg;
        this.clock = clock;
        this.runner = runner;
        this.weather = weather;
        this.airQuality = airQuality;
        this.marine = marine;
        this.satellite = satellite;
        this.climate = climate;
        this.retention = retention;
    }

    private static ScheduledExecutorService slot(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, name));
    }

    public void start() {
        int wDays = cfg.weatherForecastDays();
        schedule(weatherExec, "weatherCurrent", cfg.schedWeatherCurrent(), 0,
                () -> runner.run("weather_current", weather, ForecastOptions.of(wDays, Section.CURRENT)));
        schedule(weatherExec, "weatherHourly", cfg.schedWeatherHourly(), 30,
                () -> runner.run("weather_hourly", weather, ForecastOptions.of(wDays, Section.HOURLY)));
        schedule(weatherExec, "weatherDaily", cfg.schedWeatherDaily(), 60,
                () -> runner.run("weather_daily", weather, ForecastOptions.of(wDays, Section.DAILY)));

        int aqDays = cfg.airQualityForecastDays();
        schedule(airQualityExec, "airQualityCurrent", cfg.schedAirQualityCurrent(), 10,
                () -> runner.run("air_quality_current", airQuality, ForecastOptions.of(aqDays, Section.CURRENT)));
        schedule(airQualityExec, "airQualityHourly", cfg.schedAirQualityHourly(), 40,
                () -> runner.run("air_quality_hourly", airQuality, ForecastOptions.of(aqDays, Section.HOURLY)));

        int mDays = cfg.marineForecastDays();
        schedule(marineExec, "marineCurrent", cfg.schedMarineCurrent(), 20,
                () -> runner.run("marine_current", marine, ForecastOptions.of(mDays, Section.CURRENT)));
        schedule(marineExec, "marineHourly", cfg.schedMarineHourly(), 50,
                () -> runner.run("marine_hourly", marine, ForecastOptions.of(mDays, Section.HOURLY)));
        schedule(marineExec, "marineDaily", cfg.schedMarineDaily(), 70,
                () -> runner.run("marine_daily", marine, ForecastOptions.of(mDays, Section.DAILY)));

        schedule(satelliteExec, "satellite", cfg.schedSatellite(), 90,
                () -> runner.run("satellite_daily", satellite, SatelliteOptions.lastDays(
                        LocalDate.now(clock), cfg.satelliteDaysBack(), cfg.satellitePanelTilt(),
                        cfg.satellitePanelAzimuth())));

        schedule(climateExec, "climate", cfg.schedClimate(), 120,
                () -> runner.run("climate_projection", climate, ClimateOptions.of(
                        cfg.climateStartDate(), cfg.climateEndDate(), cfg.climateModel())));

        schedule(retentionExec, "retention", cfg.schedRetention(), 300, retention::cleanupAll);

        log.info("Ingest scheduler started ({} jobs).", tasks.size());
    }

    private void schedule(ScheduledExecutorService exec, String name, Duration every, long initialDelaySeconds,
            ThrowingRunnable job) {
        if (every == null || every.isZero() || every.isNegative()) {
            log.info("Job {} disabled (interval {})", name, every);
            return;
        }
        tasks.add(exec.scheduleWithFixedDelay(safe(name, job), initialDelaySeconds, every.toSeconds(),
                TimeUnit.SECONDS));
    }

    public void stop() {
        for (ScheduledFuture<?> t : tasks) {
            t.cancel(true);
        }
        tasks.clear();

        shutdown(weatherExec, "weatherExec");
        shutdown(airQualityExec, "airQualityExec");
        shutdown(marineExec, "marineExec");
        shutdown(satelliteExec, "satelliteExec");
        shutdown(climateExec, "climateExec");
        shutdown(retentionExec, "retentionExec");
    }

    private void shutdown(ScheduledExecutorService es, String name) {
        es.shutdownNow();
        try {
            if (!es.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Scheduled job interrupted: {}", name);
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
