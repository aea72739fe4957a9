package villagecompute.playlists.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import villagecompute.playlists.api.types.JobResult;
import villagecompute.playlists.data.models.ActivityLog;
import villagecompute.playlists.data.models.ActivityType;
import villagecompute.playlists.data.models.ExecutionStatus;
import villagecompute.playlists.data.models.JobExecution;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.data.models.User;
import villagecompute.playlists.jobs.JobType;
import villagecompute.playlists.jobs.ScheduleType;

/**
 * Persistence tests for run bookkeeping against the in-memory database.
 */
@QuarkusTest
class JobExecutionRecorderTest {

    @Inject
    JobExecutionRecorder recorder;

    @Inject
    UserCredentialStore credentialStore;

    @Inject
    ActivityLogService activityLogService;

    private Long userId;

    private Long scheduleId;

    @BeforeEach
    void setUp() {
        Instant now = Instant.now();
        userId = QuarkusTransaction.requiringNew().call(() -> {
            User user = new User();
            user.spotifyId = "listener-" + UUID.randomUUID();
            user.encryptedRefreshToken = "enc-original";
            user.createdAt = now;
            user.updatedAt = now;
            user.persist();
            return user.id;
        });
        scheduleId = QuarkusTransaction.requiringNew().call(() -> {
            Schedule schedule = new Schedule();
            schedule.userId = userId;
            schedule.jobType = JobType.RAID;
            schedule.targetPlaylistId = "target";
            schedule.sourcePlaylistIds = new ArrayList<>(List.of("source-a", "source-b"));
            schedule.scheduleType = ScheduleType.INTERVAL;
            schedule.scheduleValue = "daily";
            schedule.createdAt = now;
            schedule.updatedAt = now;
            schedule.persist();
            return schedule.id;
        });
    }

    private JobExecution execution(Long id) {
        return QuarkusTransaction.requiringNew().call(() -> JobExecution.findById(id));
    }

    private Schedule schedule() {
        return recorder.findSchedule(scheduleId).orElseThrow();
    }

    @Test
    void testStart_commitsRunningRow() {
        JobExecution started = recorder.start(scheduleId);

        JobExecution loaded = execution(started.id);
        assertEquals(ExecutionStatus.RUNNING, loaded.status);
        assertNotNull(loaded.startedAt);
        assertNull(loaded.completedAt);
    }

    @Test
    void testRecordSuccess_updatesExecutionAndSchedule() {
        JobExecution started = recorder.start(scheduleId);

        recorder.recordSuccess(started.id, scheduleId, new JobResult(4, 24));

        JobExecution loaded = execution(started.id);
        assertEquals(ExecutionStatus.SUCCESS, loaded.status);
        assertEquals(4, loaded.tracksAdded);
        assertEquals(24, loaded.tracksTotal);
        assertNotNull(loaded.completedAt);

        Schedule schedule = schedule();
        assertEquals(ExecutionStatus.SUCCESS, schedule.lastStatus);
        assertNotNull(schedule.lastRunAt);
        assertNull(schedule.lastError);
        assertEquals(List.of("source-a", "source-b"), schedule.sourcePlaylistIds);
    }

    @Test
    void testRecordFailure_afterSuccessLeavesExecutionTerminal() {
        JobExecution started = recorder.start(scheduleId);
        recorder.recordSuccess(started.id, scheduleId, new JobResult(1, 10));

        recorder.recordFailure(started.id, scheduleId, "late failure");

        assertEquals(ExecutionStatus.SUCCESS, execution(started.id).status);
        assertNull(execution(started.id).errorMessage);
    }

    @Test
    void testRecordFailure_truncatesMessage() {
        JobExecution started = recorder.start(scheduleId);

        recorder.recordFailure(started.id, scheduleId, "x".repeat(1500));

        JobExecution loaded = execution(started.id);
        assertEquals(ExecutionStatus.FAILED, loaded.status);
        assertEquals(1000, loaded.errorMessage.length());
        Schedule schedule = schedule();
        assertEquals(ExecutionStatus.FAILED, schedule.lastStatus);
        assertEquals(1000, schedule.lastError.length());
    }

    @Test
    void testTruncate_neverWiderThanErrorColumns() {
        JobExecutionRecorder configured = new JobExecutionRecorder();
        configured.errorMessageMaxLength = 5000;

        assertEquals(Schedule.ERROR_MAX_LENGTH, configured.truncate("x".repeat(3000)).length());

        configured.errorMessageMaxLength = 200;
        assertEquals(200, configured.truncate("x".repeat(3000)).length());
        assertEquals("short", configured.truncate("short"));
    }

    @Test
    void testRecordSuccess_returnsCompletionTime() {
        JobExecution started = recorder.start(scheduleId);

        Instant completedAt = recorder.recordSuccess(started.id, scheduleId, new JobResult(0, 3));

        assertNotNull(completedAt);
        Instant stored = execution(started.id).completedAt;
        assertTrue(Duration.between(stored, completedAt).abs().toMillis() <= 1);
    }

    @Test
    void testRecordFailure_withoutExecutionRowStillMarksSchedule() {
        recorder.recordFailure(null, scheduleId, "User 7 not found");

        Schedule schedule = schedule();
        assertEquals(ExecutionStatus.FAILED, schedule.lastStatus);
        assertEquals("User 7 not found", schedule.lastError);
    }

    @Test
    void testFindScheduleForUser_scopesByOwner() {
        assertTrue(recorder.findScheduleForUser(scheduleId, userId).isPresent());
        assertTrue(recorder.findScheduleForUser(scheduleId, userId + 1000).isEmpty());
    }

    @Test
    void testCredentialStore_roundTrip() {
        assertEquals("enc-original", credentialStore.loadEncryptedRefreshToken(userId).orElseThrow());

        credentialStore.storeEncryptedRefreshToken(userId, "enc-rotated");

        assertEquals("enc-rotated", credentialStore.loadEncryptedRefreshToken(userId).orElseThrow());
        assertEquals("enc-rotated", recorder.findUser(userId).orElseThrow().encryptedRefreshToken);
    }

    @Test
    void testActivityLog_persistsAndTruncates() {
        assertTrue(activityLogService.log(userId, ActivityType.SCHEDULE_RUN, "d".repeat(700), "target", "Morning Mix",
                Map.of("schedule_id", scheduleId, "tracks_added", 3)));

        List<ActivityLog> recent = activityLogService.recentActivity(userId, 5);
        assertEquals(1, recent.size());
        assertEquals(500, recent.get(0).description.length());
        assertEquals(ActivityType.SCHEDULE_RUN, recent.get(0).activityType);
        assertEquals(3, ((Number) recent.get(0).metadata.get("tracks_added")).intValue());
    }
}
