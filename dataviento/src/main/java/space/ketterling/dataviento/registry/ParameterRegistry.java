package space.ketterling.dataviento.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.dataviento.db.ParameterRepo;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves parameter codes to ids, inserting catalog entries lazily the first
 * time a code is written.
 */
public class ParameterRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParameterRegistry.class);

    private final ParameterRepo repo;
    private final Clock clock;
    private final Map<String, Long> ids = new ConcurrentHashMap<>();

    public ParameterRegistry(ParameterRepo repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if {@code code} is not in
     *                                  {@link ParameterCatalog}
     */
    public long resolveOrCreate(String code) throws Exception {
        Long cached = ids.get(code);
        if (cached != null)
            return cached;

        ParameterDefinition def = ParameterCatalog.require(code);
        Long id = repo.findIdByCode(code).orElse(null);
        if (id == null) {
            // insert is a no-op if another worker got there first
            repo.insertIfAbsent(def, clock.instant());
            id = repo.findIdByCode(code)
                    .orElseThrow(() -> new IllegalStateException("Parameter vanished after insert: " + code));
            log.info("Registered parameter {} ({}, {}) -> id={}", code, def.name(), def.unit(), id);
        }
        ids.put(code, id);
        return id;
    }

    /**
     * Unit recorded with each data point for this code.
     */
    public String unitOf(String code) {
        return ParameterCatalog.require(code).unit();
    }
}
