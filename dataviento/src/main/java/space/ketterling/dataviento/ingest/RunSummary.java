package space.ketterling.dataviento.ingest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one multi-location ingest run.
 */
public record RunSummary(
        String jobName,
        Status status,
        int attempted,
        int succeeded,
        int failed,
        List<LocationFailure> failures,
        Duration elapsed) {

    public enum Status {
        /** Nothing to do: the registry had no locations. */
        NO_LOCATIONS,
        SUCCESS,
        PARTIAL,
        FAILED
    }

    public record LocationFailure(String locationName, Stage stage, String message) {
    }

    static RunSummary of(String jobName, List<LocationIngestResult> results, Duration elapsed) {
        int ok = 0;
        List<LocationFailure> failures = new ArrayList<>();
        for (LocationIngestResult r : results) {
            if (r.success())
                ok++;
            else
                failures.add(new LocationFailure(r.locationName(), r.failedStage(), r.error()));
        }

        Status status;
        if (results.isEmpty())
            status = Status.NO_LOCATIONS;
        else if (ok == results.size())
            status = Status.SUCCESS;
        else if (ok > 0)
            status = Status.PARTIAL;
        else
            status = Status.FAILED;

        return new RunSummary(jobName, status, results.size(), ok, failures.size(), List.copyOf(failures), elapsed);
    }

    /**
     * True when at least one location succeeded.
     */
    public boolean anySucceeded() {
        return succeeded > 0;
    }
}
