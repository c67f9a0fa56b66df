package space.ketterling.dataviento.openmeteo;

/**
 * Raised once the fetch client has used up its retries.
 */
public class OpenMeteoException extends Exception {
    private final Integer statusCode;
    private final int attempts;
    private final String url;

    public OpenMeteoException(String message, Integer statusCode, int attempts, String url, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.attempts = attempts;
        this.url = url;
    }

    /**
     * HTTP status of the last attempt, or null when it failed in transport.
     */
    public Integer statusCode() {
        return statusCode;
    }

    public int attempts() {
        return attempts;
    }

    public String url() {
        return url;
    }
}
