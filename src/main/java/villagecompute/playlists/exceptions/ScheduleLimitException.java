package villagecompute.playlists.exceptions;

/**
 * Exception thrown when a user already owns the maximum number of schedules.
 */
public class ScheduleLimitException extends ValidationException {

    private final int limit;

    public ScheduleLimitException(int limit) {
        super("Maximum of " + limit + " schedules per user reached");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
