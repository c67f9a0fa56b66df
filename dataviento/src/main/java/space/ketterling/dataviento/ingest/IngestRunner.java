package space.ketterling.dataviento.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.dataviento.db.IngestLogRepo;
import space.ketterling.dataviento.db.LocationRow;
import space.ketterling.dataviento.registry.LocationAttributes;
import space.ketterling.dataviento.registry.LocationRegistry;
import space.ketterling.dataviento.registry.LocationTarget;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one domain ingest over every registered location on a bounded worker
 * pool and records the run.
 *
 * <p>
 * One location's failure never affects the others. The pool is shared by all
 * domains, so the number of concurrent upstream requests is capped by
 * {@code ingest.workers} regardless of how many scheduler slots fire at once.
 * </p>
 */
public class IngestRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestRunner.class);

    private final LocationRegistry locations;
    private final IngestLogRepo logRepo;
    private final ExecutorService workers;

    public IngestRunner(LocationRegistry locations, IngestLogRepo logRepo, int workerCount) {
        this.locations = locations;
        this.logRepo = logRepo;
        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount), r -> {
            Thread t = new Thread(r, "ingest-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Ingests every location with {@code svc} and waits for all of them.
     */
    public <O> RunSummary run(String jobName, DomainIngestService<?, O> svc, O options) throws Exception {
        log.info("Starting job: {}", jobName);
        long t0 = System.nanoTime();
        UUID runId = logRepo.startRun(jobName);
        MDC.put("runId", runId.toString());

        try {
            List<LocationRow> rows = locations.list();
            if (rows.isEmpty()) {
                RunSummary empty = RunSummary.of(jobName, List.of(), elapsedSince(t0));
                log.warn("No locations registered; nothing to ingest for {}", jobName);
                logRepo.finishRun(runId, empty.status().name(), 0, 0, 0, "no locations");
                return empty;
            }

            Map<String, String> mdc = MDC.getCopyOfContextMap();
            List<Future<LocationIngestResult>> futures = new ArrayList<>(rows.size());
            for (LocationRow row : rows) {
                LocationTarget target = new LocationTarget(row.name(), row.latitude(), row.longitude(),
                        LocationAttributes.withTimezone(row.timezone()));
                futures.add(workers.submit(() -> {
                    if (mdc != null)
                        MDC.setContextMap(mdc);
                    MDC.put("domain", svc.domain().tag());
                    try {
                        return svc.fetchAndSave(target, options);
                    } finally {
                        MDC.clear();
                    }
                }));
            }

            List<LocationIngestResult> results = new ArrayList<>(futures.size());
            try {
                for (Future<LocationIngestResult> f : futures) {
                    results.add(f.get());
                }
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                throw e;
            } catch (ExecutionException e) {
                // fetchAndSave catches everything, so this is an Error from a worker
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Ingest worker died during " + jobName, e.getCause());
            }

            for (LocationIngestResult r : results) {
                if (!r.success()) {
                    logRepo.logEvent(runId, r.domain().tag(), r.locationName(), r.locationId(),
                            r.failedStage() == null ? null : r.failedStage().name(), r.error());
                }
            }

            RunSummary summary = RunSummary.of(jobName, results, elapsedSince(t0));
            logRepo.finishRun(runId, summary.status().name(), summary.attempted(), summary.succeeded(),
                    summary.failed(), "ok=" + summary.succeeded() + " fail=" + summary.failed());
            log.info("Finished {}: status={} ok={} fail={} ({} ms)", jobName, summary.status(),
                    summary.succeeded(), summary.failed(), summary.elapsed().toMillis());
            return summary;
        } catch (Exception outer) {
            try {
                logRepo.finishRun(runId, RunSummary.Status.FAILED.name(), 0, 0, 0, "fatal: " + outer.getMessage());
            } catch (Exception e) {
                outer.addSuppressed(e);
            }
            throw outer;
        } finally {
            MDC.remove("runId");
        }
    }

    private static Duration elapsedSince(long t0) {
        return Duration.ofNanos(System.nanoTime() - t0);
    }

    /**
     * Stops the worker pool. In-flight locations are interrupted after a short
     * grace period.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
