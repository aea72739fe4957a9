package villagecompute.playlists.services;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.exceptions.ValidationException;
import villagecompute.playlists.jobs.JobType;
import villagecompute.playlists.jobs.ScheduleType;
import villagecompute.playlists.shuffle.ShuffleAlgorithm;

/**
 * Unit tests for {@link ScheduleValidator}.
 */
class ScheduleValidatorTest {

    @Mock
    ShuffleAlgorithmRegistry algorithmRegistry;

    @InjectMocks
    ScheduleValidator validator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(algorithmRegistry.find("BasicShuffle")).thenReturn(Optional.of(mock(ShuffleAlgorithm.class)));
        when(algorithmRegistry.find("Missing")).thenReturn(Optional.empty());
        when(algorithmRegistry.names()).thenReturn(Set.of("BasicShuffle"));
    }

    private static Schedule schedule(JobType jobType) {
        Schedule schedule = new Schedule();
        schedule.jobType = jobType;
        schedule.targetPlaylistId = "target";
        schedule.scheduleType = ScheduleType.INTERVAL;
        schedule.scheduleValue = "daily";
        schedule.sourcePlaylistIds = new ArrayList<>(List.of("source-a"));
        schedule.algorithmName = "BasicShuffle";
        schedule.algorithmParams = new HashMap<>(Map.of("rotation_mode", "swap"));
        return schedule;
    }

    private String rejection(Schedule schedule) {
        return assertThrows(ValidationException.class, () -> validator.validate(schedule)).getMessage();
    }

    @Test
    void testValidate_validSchedulesPass() {
        for (JobType type : JobType.values()) {
            assertDoesNotThrow(() -> validator.validate(schedule(type)), type.getValue());
        }
    }

    @Test
    void testValidate_requiredFields() {
        Schedule noType = schedule(JobType.SHUFFLE);
        noType.jobType = null;
        assertEquals("job_type is required", rejection(noType));

        Schedule noTarget = schedule(JobType.SHUFFLE);
        noTarget.targetPlaylistId = " ";
        assertEquals("target_playlist_id is required", rejection(noTarget));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {"hourly", "Daily", "every_2h", ""})
    void testValidate_rejectsUnknownIntervals(String value) {
        Schedule schedule = schedule(JobType.SHUFFLE);
        schedule.scheduleValue = value;

        assertThrows(ValidationException.class, () -> validator.validate(schedule));
    }

    @Test
    void testValidate_intervalMessageListsTokens() {
        Schedule schedule = schedule(JobType.SHUFFLE);
        schedule.scheduleValue = "hourly";

        assertEquals("Invalid interval 'hourly'. Must be one of: daily, every_12h, every_3d, every_6h, weekly",
                rejection(schedule));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {"0 9 * * *", "*/15 * * * *", "0 8 * * 1-5", "30 6 1 * *"})
    void testValidate_acceptsCron(String value) {
        Schedule schedule = schedule(JobType.SHUFFLE);
        schedule.scheduleType = ScheduleType.CRON;
        schedule.scheduleValue = value;

        assertDoesNotThrow(() -> validator.validate(schedule));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {"0 9 * *", "0 9 * * * *", "every tuesday", "99 9 * * *", "0 24 * * *", "0 9 * * 8",
                    "0 9 1-40 * *"})
    void testValidate_rejectsCron(String value) {
        Schedule schedule = schedule(JobType.SHUFFLE);
        schedule.scheduleType = ScheduleType.CRON;
        schedule.scheduleValue = value;

        assertTrue(rejection(schedule).startsWith("Invalid cron expression"));
    }

    @Test
    void testValidate_raidNeedsSources() {
        Schedule schedule = schedule(JobType.RAID);
        schedule.sourcePlaylistIds = new ArrayList<>();

        assertEquals("source_playlist_ids required for job_type 'raid'", rejection(schedule));
    }

    @Test
    void testValidate_raidSourcesCannotIncludeTarget() {
        Schedule schedule = schedule(JobType.RAID_AND_SHUFFLE);
        schedule.sourcePlaylistIds = new ArrayList<>(List.of("source-a", "target"));

        assertEquals("source_playlist_ids cannot include the target playlist", rejection(schedule));
    }

    @Test
    void testValidate_shuffleNeedsKnownAlgorithm() {
        Schedule missing = schedule(JobType.SHUFFLE);
        missing.algorithmName = null;
        assertEquals("algorithm_name required for job_type 'shuffle'", rejection(missing));

        Schedule unknown = schedule(JobType.RAID_AND_SHUFFLE);
        unknown.algorithmName = "Missing";
        assertEquals("Invalid algorithm 'Missing'. Must be one of: BasicShuffle", rejection(unknown));
    }

    @Test
    void testValidate_rotateSettings() {
        Schedule noMode = schedule(JobType.ROTATE);
        noMode.algorithmParams = new HashMap<>();
        assertEquals("algorithm_params.rotation_mode required for job_type 'rotate'", rejection(noMode));

        Schedule badMode = schedule(JobType.ROTATE);
        badMode.algorithmParams = new HashMap<>(Map.of("rotation_mode", "shuffle"));
        assertEquals("Invalid rotation_mode 'shuffle'. Must be one of: archive_oldest, refresh, swap",
                rejection(badMode));

        Schedule zeroCount = schedule(JobType.ROTATE);
        zeroCount.algorithmParams = new HashMap<>(Map.of("rotation_mode", "refresh", "rotation_count", 0));
        assertEquals("rotation_count must be a positive integer", rejection(zeroCount));

        Schedule textCount = schedule(JobType.ROTATE);
        textCount.algorithmParams = new HashMap<>(Map.of("rotation_mode", "refresh", "rotation_count", "three"));
        assertEquals("rotation_count must be a positive integer", rejection(textCount));

        Schedule stringCount = schedule(JobType.ROTATE);
        stringCount.algorithmParams = new HashMap<>(Map.of("rotation_mode", "refresh", "rotation_count", "3"));
        assertDoesNotThrow(() -> validator.validate(stringCount));
    }
}
