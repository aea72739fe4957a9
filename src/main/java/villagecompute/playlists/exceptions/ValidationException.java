package villagecompute.playlists.exceptions;

/**
 * Exception thrown when a schedule configuration fails validation (unknown interval token, malformed cron
 * expression, missing source playlists, unknown shuffle algorithm).
 *
 * <p>
 * Raised at creation/update time only. The trigger translator never raises it: a schedule that reached the
 * scheduler always registers, degrading to a daily trigger when its stored value is unusable.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
