package space.ketterling.dataviento.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.dataviento.db.LocationRepo;
import space.ketterling.dataviento.db.LocationRow;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Resolves coordinates to location ids, creating locations on first sight.
 *
 * <p>
 * Two coordinates are the same location when latitude and longitude each
 * differ by less than {@link #TOLERANCE_DEGREES}. This is a per-axis box, not
 * a distance: near the poles, or for points that happen to fall inside the box
 * on both axes, distinct places coalesce into the first one stored.
 * </p>
 */
public class LocationRegistry {
    private static final Logger log = LoggerFactory.getLogger(LocationRegistry.class);

    /** Roughly 1 km at mid latitudes. */
    public static final double TOLERANCE_DEGREES = 0.01;

    private final LocationRepo repo;
    private final Clock clock;

    public LocationRegistry(LocationRepo repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    /**
     * Returns the id of the stored location within tolerance, or inserts a new
     * one. An existing row is returned unchanged: its name and attributes are
     * those of the first write.
     *
     * <p>
     * Synchronized so two workers resolving the same new coordinate cannot
     * both insert.
     * </p>
     */
    public synchronized long resolveOrCreate(LocationTarget target) throws Exception {
        Optional<LocationRow> existing = repo.findWithin(target.latitude(), target.longitude(), TOLERANCE_DEGREES);
        if (existing.isPresent()) {
            LocationRow row = existing.get();
            log.debug("Location ({}, {}) resolved to id={} '{}'", target.latitude(), target.longitude(),
                    row.id(), row.name());
            return row.id();
        }
        long id = repo.insert(target.name(), target.latitude(), target.longitude(), target.attributes(),
                clock.instant());
        log.info("Created location id={} '{}' at ({}, {})", id, target.name(), target.latitude(),
                target.longitude());
        return id;
    }

    public Optional<LocationRow> findById(long id) throws Exception {
        return repo.findById(id);
    }

    public List<LocationRow> list() throws Exception {
        return repo.list();
    }
}
