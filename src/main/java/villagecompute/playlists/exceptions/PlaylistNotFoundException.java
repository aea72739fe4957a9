package villagecompute.playlists.exceptions;

/**
 * Exception thrown when the Spotify API answers 404 for a playlist (or any other resource). Never retried.
 */
public class PlaylistNotFoundException extends SpotifyApiException {

    public PlaylistNotFoundException(String message) {
        super(message, 404);
    }
}
