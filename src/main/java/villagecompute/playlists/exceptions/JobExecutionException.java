package villagecompute.playlists.exceptions;

/**
 * Exception raised when a playlist job fails.
 *
 * <p>
 * Handlers use it to wrap remote failures with job context ("Target playlist X not found"). The manual run path
 * raises it to the caller with the recorded error message; the scheduled path records it and never rethrows.
 */
public class JobExecutionException extends RuntimeException {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
