package space.ketterling.dataviento.ingest;

/**
 * Payload sections a forecast-style endpoint can return.
 */
public enum Section {
    CURRENT,
    HOURLY,
    DAILY
}
