package villagecompute.playlists.jobs;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Concrete recurrence rule derived from a schedule: either a fixed interval or the five standard cron fields.
 *
 * <p>
 * Instances are produced by {@link TriggerTranslator} and consumed by {@link PlaylistJobScheduler}. They are never
 * persisted; the scheduler rebuilds them from the schedule row on every registration.
 */
public final class TriggerSpec {

    public enum Kind {
        INTERVAL, CRON
    }

    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN"};

    private final Kind kind;
    private final Duration interval;
    private final String minute;
    private final String hour;
    private final String dayOfMonth;
    private final String month;
    private final String dayOfWeek;
    private final boolean fallback;

    private TriggerSpec(Kind kind, Duration interval, String[] cronFields, boolean fallback) {
        this.kind = kind;
        this.interval = interval;
        this.minute = cronFields == null ? null : cronFields[0];
        this.hour = cronFields == null ? null : cronFields[1];
        this.dayOfMonth = cronFields == null ? null : cronFields[2];
        this.month = cronFields == null ? null : cronFields[3];
        this.dayOfWeek = cronFields == null ? null : cronFields[4];
        this.fallback = fallback;
    }

    public static TriggerSpec interval(Duration interval) {
        return new TriggerSpec(Kind.INTERVAL, Objects.requireNonNull(interval, "interval"), null, false);
    }

    public static TriggerSpec cron(String minute, String hour, String dayOfMonth, String month, String dayOfWeek) {
        return new TriggerSpec(Kind.CRON, null, new String[]{minute, hour, dayOfMonth, month, dayOfWeek}, false);
    }

    /**
     * Returns a copy flagged as a fallback, so callers can tell a degraded registration apart from a requested one.
     */
    TriggerSpec asFallback() {
        String[] fields = kind == Kind.CRON ? new String[]{minute, hour, dayOfMonth, month, dayOfWeek} : null;
        return new TriggerSpec(kind, interval, fields, true);
    }

    public Kind getKind() {
        return kind;
    }

    public Duration getInterval() {
        return interval;
    }

    public String getMinute() {
        return minute;
    }

    public String getHour() {
        return hour;
    }

    public String getDayOfMonth() {
        return dayOfMonth;
    }

    public String getMonth() {
        return month;
    }

    public String getDayOfWeek() {
        return dayOfWeek;
    }

    public boolean isFallback() {
        return fallback;
    }

    /**
     * Renders the cron fields as a Quartz expression.
     *
     * <p>
     * Quartz wants a seconds field, numbers day-of-week 1-7 from Sunday, and requires {@code ?} on whichever day field
     * is unrestricted. Numeric weekdays are rewritten to their names so {@code 0} and {@code 7} both mean Sunday.
     * Step values after {@code /} are left numeric.
     *
     * @throws IllegalStateException
     *             if this is an interval spec
     */
    public String toQuartzCronExpression() {
        if (kind != Kind.CRON) {
            throw new IllegalStateException("Interval trigger has no cron expression");
        }
        String dom = dayOfMonth;
        String dow = toQuartzDayOfWeek(dayOfWeek);
        if (isUnrestricted(dayOfWeek)) {
            dow = "?";
        } else if (isUnrestricted(dayOfMonth)) {
            dom = "?";
        }
        return String.join(" ", "0", minute, hour, dom, month.toUpperCase(Locale.ROOT), dow);
    }

    /**
     * Computes the first fire time strictly after {@code after}.
     *
     * @param after
     *            reference instant
     * @param zone
     *            zone the cron fields are evaluated in (ignored for intervals)
     * @return next fire, or {@code null} if the cron expression never fires again
     */
    public Instant nextFireAfter(Instant after, ZoneId zone) {
        if (kind == Kind.INTERVAL) {
            return after.plus(interval);
        }
        try {
            CronExpression expression = new CronExpression(toQuartzCronExpression());
            expression.setTimeZone(TimeZone.getTimeZone(zone));
            Date next = expression.getNextValidTimeAfter(Date.from(after));
            return next == null ? null : next.toInstant();
        } catch (ParseException e) {
            throw new IllegalStateException("Invalid cron trigger " + describe() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Human-readable form used in log lines.
     */
    public String describe() {
        if (kind == Kind.INTERVAL) {
            return "interval[" + interval + "]";
        }
        return "cron[" + String.join(" ", minute, hour, dayOfMonth, month, dayOfWeek) + "]";
    }

    private static boolean isUnrestricted(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    static String toQuartzDayOfWeek(String field) {
        StringBuilder out = new StringBuilder(field.length() + 8);
        int i = 0;
        while (i < field.length()) {
            char c = field.charAt(i);
            if (Character.isDigit(c)) {
                int start = i;
                while (i < field.length() && Character.isDigit(field.charAt(i))) {
                    i++;
                }
                String number = field.substring(start, i);
                boolean isStep = start > 0 && field.charAt(start - 1) == '/';
                boolean isNth = start > 0 && field.charAt(start - 1) == '#';
                int value = Integer.parseInt(number);
                if (!isStep && !isNth && value >= 0 && value <= 7) {
                    out.append(DAY_NAMES[value]);
                } else {
                    out.append(number);
                }
            } else {
                out.append(Character.toUpperCase(c));
                i++;
            }
        }
        return out.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TriggerSpec)) {
            return false;
        }
        TriggerSpec that = (TriggerSpec) o;
        return kind == that.kind && Objects.equals(interval, that.interval) && Objects.equals(minute, that.minute)
                && Objects.equals(hour, that.hour) && Objects.equals(dayOfMonth, that.dayOfMonth)
                && Objects.equals(month, that.month) && Objects.equals(dayOfWeek, that.dayOfWeek);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, interval, minute, hour, dayOfMonth, month, dayOfWeek);
    }

    @Override
    public String toString() {
        return describe() + (fallback ? " (fallback)" : "");
    }
}
