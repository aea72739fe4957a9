package villagecompute.playlists.jobs;

import java.util.Locale;
import java.util.Optional;

/**
 * How a schedule's value string is interpreted: a named interval token or a 5-field cron expression.
 */
public enum ScheduleType {

    INTERVAL("interval"),

    CRON("cron");

    private final String value;

    ScheduleType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ScheduleType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScheduleType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
