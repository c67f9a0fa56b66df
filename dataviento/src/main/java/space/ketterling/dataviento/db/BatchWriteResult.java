package space.ketterling.dataviento.db;

/**
 * Outcome of writing one batch: its id and how many points were new.
 */
public record BatchWriteResult(long batchId, int pointsInserted, int pointsSubmitted) {
}
