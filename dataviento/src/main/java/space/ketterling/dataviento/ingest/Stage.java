package space.ketterling.dataviento.ingest;

/**
 * Steps of a single location ingest, in order. A failed result names the step
 * that stopped it.
 */
public enum Stage {
    FETCH,
    VALIDATE,
    RESOLVE,
    PERSIST
}
