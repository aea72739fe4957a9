package villagecompute.playlists.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Table-driven tests for {@link TriggerTranslator}.
 */
class TriggerTranslatorTest {

    @ParameterizedTest
    @CsvSource({"every_6h, PT6H", "every_12h, PT12H", "daily, PT24H", "every_3d, PT72H", "weekly, PT168H"})
    void testTranslate_intervalTokens(String token, String expected) {
        TriggerSpec spec = TriggerTranslator.translate(ScheduleType.INTERVAL, token);

        assertEquals(TriggerSpec.Kind.INTERVAL, spec.getKind());
        assertEquals(Duration.parse(expected), spec.getInterval());
        assertFalse(spec.isFallback());
    }

    @ParameterizedTest
    @ValueSource(strings = {"hourly", "every_5m", "Daily", "every 6 hours", "0 0 * * *"})
    @NullAndEmptySource
    void testTranslate_unknownIntervalFallsBackToDaily(String token) {
        TriggerSpec spec = TriggerTranslator.translate(ScheduleType.INTERVAL, token);

        assertEquals(TriggerTranslator.DAILY, spec);
        assertEquals(Duration.ofDays(1), spec.getInterval());
        assertTrue(spec.isFallback());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {"0 9 * * 1-5|0|9|*|*|1-5", "*/15 * * * *|*/15|*|*|*|*",
            "30 2 1 * *|30|2|1|*|*", "  0   0   *  *  0 |0|0|*|*|0"})
    void testTranslate_validCron(String value, String minute, String hour, String dom, String month, String dow) {
        TriggerSpec spec = TriggerTranslator.translate(ScheduleType.CRON, value);

        assertEquals(TriggerSpec.Kind.CRON, spec.getKind());
        assertEquals(minute, spec.getMinute());
        assertEquals(hour, spec.getHour());
        assertEquals(dom, spec.getDayOfMonth());
        assertEquals(month, spec.getMonth());
        assertEquals(dow, spec.getDayOfWeek());
        assertFalse(spec.isFallback());
    }

    @ParameterizedTest
    @ValueSource(strings = {"0 9 * *", "0 9 * * * *", "daily", "0 0 0 * * * *"})
    @NullAndEmptySource
    void testTranslate_wrongFieldCountFallsBackToMidnight(String value) {
        TriggerSpec spec = TriggerTranslator.translate(ScheduleType.CRON, value);

        assertEquals(TriggerTranslator.DAILY_AT_MIDNIGHT, spec);
        assertEquals("0", spec.getMinute());
        assertEquals("0", spec.getHour());
        assertTrue(spec.isFallback());
    }

    @ParameterizedTest
    @ValueSource(
            strings = {"61 * * * *", "99 * * * *", "0 25 * * *", "0 9 32 * *", "0 9 0 * *", "0 9 * 13 *", "0 9 * * 8",
                    "0-70 * * * *", "0,75 * * * *", "*/0 * * * *", "0 9-24 * * *", "x y z w v"})
    void testTranslate_unschedulableCronFallsBackToMidnight(String value) {
        TriggerSpec spec = TriggerTranslator.translate(ScheduleType.CRON, value);

        assertEquals(TriggerTranslator.DAILY_AT_MIDNIGHT, spec);
        assertTrue(spec.isFallback());
    }

    @Test
    void testTranslate_unknownTypeFallsBackToDaily() {
        assertEquals(TriggerTranslator.DAILY, TriggerTranslator.translate((ScheduleType) null, "every_6h"));
        assertEquals(TriggerTranslator.DAILY, TriggerTranslator.translate("sometimes", "every_6h"));
    }

    @Test
    void testTranslate_rawTypeString() {
        assertEquals(Duration.ofHours(12), TriggerTranslator.translate("interval", "every_12h").getInterval());
        assertEquals("15", TriggerTranslator.translate("cron", "15 * * * *").getMinute());
    }

    @ParameterizedTest
    @CsvSource({"0 9 * * 1-5, true", "0 0 1 1 *, true", "0 9 * *, false", "99 * * * *, false",
            "59 23 31 12 *, true", "0 9 * * 7, true", "'0,30 */6 1-15 * *', true", "0 9 * 0 *, false",
            "0 9 * * 1-9, false"})
    void testIsSupportedCron(String value, boolean expected) {
        assertEquals(expected, TriggerTranslator.isSupportedCron(value));
    }
}
