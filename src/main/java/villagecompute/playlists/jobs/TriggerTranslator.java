package villagecompute.playlists.jobs;

import org.jboss.logging.Logger;
import org.quartz.CronExpression;

/**
 * Maps a schedule's declared type and value onto a {@link TriggerSpec}.
 *
 * <p>
 * Translation never fails. Anything it cannot interpret degrades to a daily trigger and a warning, so a bad row can
 * not block the scheduler from registering the rest. Rejecting malformed input is the job of
 * {@code ScheduleValidator} at creation time.
 *
 * <ul>
 * <li>Interval: one of the {@link IntervalValue} tokens; unknown tokens become {@link IntervalValue#DAILY}</li>
 * <li>Cron: exactly five whitespace-separated fields; any other count, a number outside its field's range, or fields
 * Quartz cannot parse, become daily at 00:00</li>
 * <li>Unknown or missing type: daily</li>
 * </ul>
 */
public final class TriggerTranslator {

    private static final Logger LOG = Logger.getLogger(TriggerTranslator.class);

    public static final TriggerSpec DAILY = TriggerSpec.interval(IntervalValue.DAILY.getDuration());

    public static final TriggerSpec DAILY_AT_MIDNIGHT = TriggerSpec.cron("0", "0", "*", "*", "*");

    // minute, hour, day of month, month, day of week
    private static final int[][] FIELD_RANGES = {{0, 59}, {0, 23}, {1, 31}, {1, 12}, {0, 7}};

    private TriggerTranslator() {
        // Utility class
    }

    public static TriggerSpec translate(ScheduleType type, String value) {
        if (type == null) {
            LOG.warnf("Unknown schedule type for value '%s', defaulting to daily", value);
            return DAILY.asFallback();
        }
        return switch (type) {
            case INTERVAL -> translateInterval(value);
            case CRON -> translateCron(value);
        };
    }

    /**
     * Overload for callers holding the raw stored type string.
     */
    public static TriggerSpec translate(String type, String value) {
        return translate(ScheduleType.fromValue(type).orElse(null), value);
    }

    static TriggerSpec translateInterval(String value) {
        return IntervalValue.fromToken(value).map(interval -> TriggerSpec.interval(interval.getDuration()))
                .orElseGet(() -> {
                    LOG.warnf("Unknown interval value '%s', defaulting to daily", value);
                    return DAILY.asFallback();
                });
    }

    static TriggerSpec translateCron(String value) {
        String[] parts = splitCron(value);
        if (parts.length != 5) {
            LOG.warnf("Invalid cron expression '%s' (expected 5 fields, got %d), defaulting to daily at 00:00", value,
                    parts.length);
            return DAILY_AT_MIDNIGHT.asFallback();
        }
        TriggerSpec spec = TriggerSpec.cron(parts[0], parts[1], parts[2], parts[3], parts[4]);
        if (!fieldsInRange(parts) || !isQuartzCompatible(spec)) {
            LOG.warnf("Cron expression '%s' cannot be scheduled, defaulting to daily at 00:00", value);
            return DAILY_AT_MIDNIGHT.asFallback();
        }
        return spec;
    }

    /**
     * Whether the value is a five-field cron expression the scheduler can run as given.
     */
    public static boolean isSupportedCron(String value) {
        String[] parts = splitCron(value);
        return parts.length == 5 && fieldsInRange(parts)
                && isQuartzCompatible(TriggerSpec.cron(parts[0], parts[1], parts[2], parts[3], parts[4]));
    }

    private static String[] splitCron(String value) {
        if (value == null || value.isBlank()) {
            return new String[0];
        }
        return value.trim().split("\\s+");
    }

    /**
     * Range-checks every number in the five fields, including range bounds, list members and step values. Quartz
     * alone accepts some out-of-range values, such as a minute of 99. Names such as {@code MON} are left to Quartz.
     */
    static boolean fieldsInRange(String[] parts) {
        for (int i = 0; i < parts.length; i++) {
            int min = FIELD_RANGES[i][0];
            int max = FIELD_RANGES[i][1];
            for (String item : parts[i].split(",", -1)) {
                if (!itemInRange(item, min, max)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean itemInRange(String item, int min, int max) {
        if (item.isEmpty()) {
            return false;
        }
        String base = item;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            base = item.substring(0, slash);
            Integer step = parseNumber(item.substring(slash + 1));
            if (step == null || step < 1 || step > max) {
                return false;
            }
        }
        if (base.equals("*") || base.equals("?")) {
            return true;
        }
        String[] bounds = base.split("-", -1);
        if (bounds.length > 2) {
            return false;
        }
        for (String bound : bounds) {
            if (bound.isEmpty()) {
                return false;
            }
            if (Character.isDigit(bound.charAt(0))) {
                Integer number = parseNumber(bound);
                if (number == null || number < min || number > max) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Integer parseNumber(String value) {
        if (value.isEmpty() || value.length() > 4 || !value.chars().allMatch(Character::isDigit)) {
            return null;
        }
        return Integer.parseInt(value);
    }

    private static boolean isQuartzCompatible(TriggerSpec spec) {
        try {
            return CronExpression.isValidExpression(spec.toQuartzCronExpression());
        } catch (RuntimeException e) {
            return false;
        }
    }
}
