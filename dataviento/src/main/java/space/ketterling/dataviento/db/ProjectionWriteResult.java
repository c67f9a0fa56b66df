package space.ketterling.dataviento.db;

/**
 * Outcome of writing one climate projection: its id and the daily rows stored
 * under it.
 */
public record ProjectionWriteResult(long projectionId, int dailyRows) {
}
