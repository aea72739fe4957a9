package villagecompute.playlists.jobs;

import java.time.Duration;
import java.util.Optional;

/**
 * Closed set of named interval tokens accepted for {@link ScheduleType#INTERVAL} schedules.
 */
public enum IntervalValue {

    EVERY_6H("every_6h", Duration.ofHours(6)),

    EVERY_12H("every_12h", Duration.ofHours(12)),

    DAILY("daily", Duration.ofDays(1)),

    EVERY_3D("every_3d", Duration.ofDays(3)),

    WEEKLY("weekly", Duration.ofDays(7));

    private final String token;
    private final Duration duration;

    IntervalValue(String token, Duration duration) {
        this.token = token;
        this.duration = duration;
    }

    public String getToken() {
        return token;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Looks up a token exactly as stored (tokens are lowercase and never padded).
     */
    public static Optional<IntervalValue> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        for (IntervalValue value : values()) {
            if (value.token.equals(token)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
