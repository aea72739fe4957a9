package villagecompute.playlists.exceptions;

/**
 * Exception thrown when 5xx responses or network failures persist after every retry.
 */
public class TransientApiException extends SpotifyApiException {

    public TransientApiException(String message, int statusCode) {
        super(message, statusCode);
    }

    public TransientApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
