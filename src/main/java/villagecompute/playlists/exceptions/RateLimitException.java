package villagecompute.playlists.exceptions;

/**
 * Exception thrown when the Spotify API keeps answering 429 after the retry budget is exhausted.
 *
 * <p>
 * Carries the last {@code Retry-After} value seen so callers can report when the API expects traffic again.
 */
public class RateLimitException extends SpotifyApiException {

    private final long retryAfterSeconds;

    public RateLimitException(String message, long retryAfterSeconds) {
        super(message, 429);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
