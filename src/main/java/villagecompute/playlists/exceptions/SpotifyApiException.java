package villagecompute.playlists.exceptions;

/**
 * Base exception for failed calls to the Spotify Web API.
 *
 * <p>
 * Thrown directly for non-retryable client errors (400, 403, ...) carrying the server's error message. Subclasses
 * distinguish the cases handlers may want to react to: {@link PlaylistNotFoundException},
 * {@link RateLimitException} and {@link TransientApiException}.
 */
public class SpotifyApiException extends RuntimeException {

    private final int statusCode;

    public SpotifyApiException(String message) {
        this(message, 0);
    }

    public SpotifyApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SpotifyApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /**
     * Returns the HTTP status of the final response, or 0 when the failure happened below HTTP (connect, timeout).
     */
    public int getStatusCode() {
        return statusCode;
    }
}
