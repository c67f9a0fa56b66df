package space.ketterling.dataviento.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.dataviento.db.ModelRepo;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves model codes to ids. Same pattern as {@link ParameterRegistry},
 * over {@link ModelCatalog}.
 */
public class ModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final ModelRepo repo;
    private final Clock clock;
    private final Map<String, Long> ids = new ConcurrentHashMap<>();

    public ModelRegistry(ModelRepo repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if {@code code} is not in
     *                                  {@link ModelCatalog}
     */
    public long resolveOrCreate(String code) throws Exception {
        Long cached = ids.get(code);
        if (cached != null)
            return cached;

        ModelDefinition def = ModelCatalog.require(code);
        Long id = repo.findIdByCode(code).orElse(null);
        if (id == null) {
            repo.insertIfAbsent(def, clock.instant());
            id = repo.findIdByCode(code)
                    .orElseThrow(() -> new IllegalStateException("Model vanished after insert: " + code));
            log.info("Registered model {} ({}, {}) -> id={}", code, def.provider(), def.domain().tag(), id);
        }
        ids.put(code, id);
        return id;
    }
}
