package villagecompute.playlists.exceptions;

/**
 * Exception thrown when a requested local resource is not found (schedule, user, playlist pairing).
 *
 * <p>
 * Extends RuntimeException per project standards. Schedule lookups also raise it when the schedule exists but is
 * owned by another user.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
