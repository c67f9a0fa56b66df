package space.ketterling.dataviento.retention;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.dataviento.config.AppConfig;
import space.ketterling.dataviento.db.DailyAggregateRepo;
import space.ketterling.dataviento.db.DailyTable;
import space.ketterling.dataviento.db.SnapshotRepo;
import space.ketterling.dataviento.db.SnapshotTable;
import space.ketterling.dataviento.db.TableStatsRepo;
import space.ketterling.dataviento.db.TimeSeriesRepo;
import space.ketterling.dataviento.db.TimeSeriesTable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deletes rows older than their retention window, in chunks.
 *
 * <p>
 * Batch cleanups remove a chunk's points before the chunk's batches, inside
 * one transaction per chunk, and repeat until no expired batch remains. A
 * rerun with the same clock deletes nothing.
 * </p>
 */
public class RetentionService {
    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final AppConfig cfg;
    private final TimeSeriesRepo timeSeries;
    private final DailyAggregateRepo daily;
    private final SnapshotRepo snapshots;
    private final TableStatsRepo stats;
    private final Clock clock;

    public RetentionService(AppConfig cfg,
            TimeSeriesRepo timeSeries,
            DailyAggregateRepo daily,
            SnapshotRepo snapshots,
            TableStatsRepo stats,
            Clock clock) {
        this.cfg = cfg;
        this.timeSeries = timeSeries;
        this.daily = daily;
        this.snapshots = snapshots;
        this.stats = stats;
        this.clock = clock;
    }

    /**
     * Deletes everything in {@code target} older than {@code window}.
     */
    public CleanupReport cleanup(RetentionTarget target, Duration window) throws Exception {
        if (window.isNegative())
            throw new IllegalArgumentException("retention window must not be negative: " + window);
        Instant cutoff = clock.instant().minus(window);
        int chunk = cfg.retentionChunkSize();
        Map<String, Integer> deleted = new LinkedHashMap<>();

        switch (target) {
            case WEATHER_BATCHES -> batches(TimeSeriesTable.WEATHER, cutoff, chunk, deleted);
            case AIR_QUALITY_BATCHES -> batches(TimeSeriesTable.AIR_QUALITY, cutoff, chunk, deleted);
            case MARINE_BATCHES -> batches(TimeSeriesTable.MARINE, cutoff, chunk, deleted);
            case WEATHER_POINTS -> {
                int total = 0;
                int n;
                do {
                    n = timeSeries.deletePointsBefore(TimeSeriesTable.WEATHER, cutoff, chunk);
                    total += n;
                } while (n > 0);
                deleted.put(TimeSeriesTable.WEATHER.pointTable(), total);
            }
            case WEATHER_DAILY -> dailyRows(DailyTable.WEATHER, cutoff, chunk, deleted);
            case MARINE_DAILY -> dailyRows(DailyTable.MARINE, cutoff, chunk, deleted);
            case SATELLITE_DAILY -> dailyRows(DailyTable.SATELLITE, cutoff, chunk, deleted);
            case SNAPSHOTS -> {
                for (SnapshotTable t : SnapshotTable.values()) {
                    int total = 0;
                    int n;
                    do {
                        n = snapshots.deleteStale(t, cutoff, chunk);
                        total += n;
                    } while (n > 0);
                    deleted.put(t.table(), total);
                }
            }
        }

        CleanupReport report = new CleanupReport(target, cutoff, Map.copyOf(deleted));
        log.info("Cleanup {} (window {}, cutoff {}): deleted {}", target, window, cutoff, deleted);
        return report;
    }

    private void batches(TimeSeriesTable table, Instant cutoff, int chunk, Map<String, Integer> deleted)
            throws Exception {
        int batches = 0;
        int points = 0;
        while (true) {
            TimeSeriesRepo.DeleteCounts dc = timeSeries.deleteBatchesBefore(table, cutoff, chunk);
            if (dc.batches() == 0)
                break;
            batches += dc.batches();
            points += dc.points();
        }
        deleted.put(table.pointTable(), points);
        deleted.put(table.batchTable(), batches);
    }

    private void dailyRows(DailyTable table, Instant cutoff, int chunk, Map<String, Integer> deleted)
            throws Exception {
        LocalDate cutoffDate = LocalDate.ofInstant(cutoff, clock.getZone());
        int total = 0;
        int n;
        do {
            n = daily.deleteBefore(table, cutoffDate, chunk);
            total += n;
        } while (n > 0);
        deleted.put(table.table(), total);
    }

    /**
     * Runs every target with its configured window. A failing target is logged
     * and the rest still run; the first failure is rethrown at the end.
     */
    public List<CleanupReport> cleanupAll() throws Exception {
        log.info("Starting job: retention cleanup");
        List<CleanupReport> reports = new ArrayList<>();
        Exception first = null;
        for (RetentionTarget target : RetentionTarget.values()) {
            try {
                reports.add(cleanup(target, target.window(cfg)));
            } catch (Exception e) {
                log.warn("Cleanup {} failed: {}", target, e.toString());
                if (first == null)
                    first = e;
                else
                    first.addSuppressed(e);
            }
        }
        int total = reports.stream().mapToInt(CleanupReport::total).sum();
        log.info("Finished retention cleanup: {} targets, {} rows deleted", reports.size(), total);
        logStats();
        if (first != null)
            throw first;
        return reports;
    }

    /**
     * Row count and oldest remaining value for every retained table.
     */
    public List<TableStatsRepo.TableStats> stats() throws Exception {
        List<TableStatsRepo.TableStats> out = new ArrayList<>();
        for (TimeSeriesTable t : TimeSeriesTable.values()) {
            out.add(stats.stats(t.batchTable(), "reference_time"));
            out.add(stats.stats(t.pointTable(), "valid_time"));
        }
        for (DailyTable t : List.of(DailyTable.WEATHER, DailyTable.MARINE, DailyTable.SATELLITE)) {
            out.add(stats.stats(t.table(), "valid_date"));
        }
        for (SnapshotTable t : SnapshotTable.values()) {
            out.add(stats.stats(t.table(), "updated_at"));
        }
        return out;
    }

    private void logStats() {
        if (!log.isDebugEnabled())
            return;
        try {
            for (TableStatsRepo.TableStats s : stats()) {
                log.debug("{}: rows={} oldest={}", s.table(), s.rows(), s.oldest());
            }
        } catch (Exception e) {
            log.warn("Unable to read table stats: {}", e.toString());
        }
    }
}
