package villagecompute.playlists.services;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.playlists.api.types.ExecuteNowResultType;
import villagecompute.playlists.api.types.JobResult;
import villagecompute.playlists.data.models.ActivityType;
import villagecompute.playlists.data.models.ExecutionStatus;
import villagecompute.playlists.data.models.JobExecution;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.data.models.User;
import villagecompute.playlists.exceptions.CredentialException;
import villagecompute.playlists.exceptions.JobExecutionException;
import villagecompute.playlists.integration.spotify.PlaylistApi;
import villagecompute.playlists.jobs.JobType;
import villagecompute.playlists.jobs.PlaylistJobHandler;
import villagecompute.playlists.jobs.ScheduleType;
import villagecompute.playlists.observability.LoggingConfig;

/**
 * Unit tests for {@link JobExecutorService}.
 */
class JobExecutorServiceTest {

    @Mock
    JobExecutionRecorder recorder;

    @Mock
    SpotifyCredentialService credentialService;

    @Mock
    ActivityLogService activityLogService;

    @Mock
    Tracer tracer;

    @Mock
    PlaylistApi api;

    private PlaylistJobHandler raidHandler;
    private PlaylistJobHandler shuffleHandler;
    private PlaylistJobHandler rotateHandler;
    private PlaylistJobHandler raidAndShuffleHandler;

    private SimpleMeterRegistry meterRegistry;

    private JobExecutorService executor;

    private Schedule schedule;

    private User user;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));

        raidHandler = handler(JobType.RAID);
        shuffleHandler = handler(JobType.SHUFFLE);
        rotateHandler = handler(JobType.ROTATE);
        raidAndShuffleHandler = handler(JobType.RAID_AND_SHUFFLE);

        meterRegistry = new SimpleMeterRegistry();
        executor = new JobExecutorService(List.of(raidHandler, shuffleHandler, rotateHandler, raidAndShuffleHandler));
        executor.recorder = recorder;
        executor.credentialService = credentialService;
        executor.activityLogService = activityLogService;
        executor.tracer = tracer;
        executor.meterRegistry = meterRegistry;

        schedule = new Schedule();
        schedule.id = 1L;
        schedule.userId = 7L;
        schedule.jobType = JobType.SHUFFLE;
        schedule.targetPlaylistId = "target";
        schedule.targetPlaylistName = "Morning Mix";
        schedule.algorithmName = "BasicShuffle";
        schedule.scheduleType = ScheduleType.INTERVAL;
        schedule.scheduleValue = "daily";
        schedule.enabled = true;

        user = new User();
        user.id = 7L;
        user.spotifyId = "listener";
        user.encryptedRefreshToken = "encrypted";

        JobExecution execution = new JobExecution();
        execution.id = 100L;
        execution.scheduleId = 1L;
        execution.status = ExecutionStatus.RUNNING;

        when(recorder.findSchedule(1L)).thenReturn(Optional.of(schedule));
        when(recorder.findScheduleForUser(1L, 7L)).thenReturn(Optional.of(schedule));
        when(recorder.findUser(7L)).thenReturn(Optional.of(user));
        when(recorder.start(1L)).thenReturn(execution);
        when(credentialService.buildClientForUser(user)).thenReturn(api);
    }

    private static PlaylistJobHandler handler(JobType type) {
        PlaylistJobHandler handler = mock(PlaylistJobHandler.class);
        when(handler.handlesType()).thenReturn(type);
        return handler;
    }

    private double executions(String status) {
        return meterRegistry.counter("playlist.job.executions", "job_type", "shuffle", "status", status).count();
    }

    @Test
    void testExecute_success() {
        JobResult result = new JobResult(0, 10);
        when(shuffleHandler.execute(schedule, api)).thenReturn(result);

        executor.execute(1L);

        verify(recorder).start(1L);
        verify(recorder).recordSuccess(100L, 1L, result);
        verify(recorder, never()).recordFailure(any(), anyLong(), anyString());
        verify(activityLogService).log(eq(7L), eq(ActivityType.SCHEDULE_RUN), anyString(), eq("target"),
                eq("Morning Mix"), anyMap());
        verify(raidHandler, never()).execute(any(), any());
        assertEquals(1.0, executions("success"));
        assertFalse(executor.isRunning(1L));
    }

    @Test
    void testExecute_dispatchesByJobType() {
        schedule.jobType = JobType.ROTATE;
        when(rotateHandler.execute(schedule, api)).thenReturn(new JobResult(3, 20));

        executor.execute(1L);

        verify(rotateHandler).execute(schedule, api);
        verify(shuffleHandler, never()).execute(any(), any());
        verify(recorder).recordSuccess(100L, 1L, new JobResult(3, 20));
    }

    @Test
    void testExecute_handlerFailureIsRecorded() {
        when(shuffleHandler.execute(schedule, api))
                .thenThrow(new JobExecutionException("Target playlist target not found"));

        assertDoesNotThrow(() -> executor.execute(1L));

        verify(recorder).recordFailure(100L, 1L, "Target playlist target not found");
        verify(recorder, never()).recordSuccess(anyLong(), anyLong(), any());
        verify(activityLogService, never()).log(anyLong(), any(), anyString(), anyString(), anyString(), anyMap());
        assertEquals(1.0, executions("failed"));
    }

    @Test
    void testExecute_credentialFailureIsRecorded() {
        when(credentialService.buildClientForUser(user))
                .thenThrow(new CredentialException("User listener has no stored refresh token"));

        executor.execute(1L);

        verify(recorder).recordFailure(100L, 1L, "User listener has no stored refresh token");
        verify(shuffleHandler, never()).execute(any(), any());
    }

    @Test
    void testExecute_missingUserIsRecorded() {
        when(recorder.findUser(7L)).thenReturn(Optional.empty());

        executor.execute(1L);

        verify(recorder).recordFailure(100L, 1L, "User 7 not found");
    }

    @Test
    void testExecute_missingScheduleRecordsNothing() {
        when(recorder.findSchedule(1L)).thenReturn(Optional.empty());

        executor.execute(1L);

        verify(recorder, never()).start(anyLong());
        verify(recorder, never()).recordFailure(any(), anyLong(), anyString());
    }

    @Test
    void testExecute_disabledScheduleRecordsNothing() {
        schedule.enabled = false;

        executor.execute(1L);

        verify(recorder, never()).start(anyLong());
        verify(shuffleHandler, never()).execute(any(), any());
    }

    @Test
    void testExecute_recorderFailureIsSwallowed() {
        when(shuffleHandler.execute(schedule, api)).thenThrow(new IllegalStateException("boom"));
        doThrow(new IllegalStateException("database down")).when(recorder).recordFailure(100L, 1L, "boom");

        assertDoesNotThrow(() -> executor.execute(1L));
        assertFalse(executor.isRunning(1L));
    }

    @Test
    void testRunIfIdle_skipsWhileInFlight() {
        AtomicBoolean nestedRan = new AtomicBoolean(true);
        when(shuffleHandler.execute(schedule, api)).thenAnswer(invocation -> {
            assertTrue(executor.isRunning(1L));
            nestedRan.set(executor.runIfIdle(1L, LoggingConfig.ORIGIN_MANUAL));
            return JobResult.EMPTY;
        });

        assertTrue(executor.runIfIdle(1L, LoggingConfig.ORIGIN_SCHEDULER));

        assertFalse(nestedRan.get());
        verify(recorder).start(1L);
    }

    @Test
    void testExecuteNow_notFound() {
        when(recorder.findScheduleForUser(1L, 8L)).thenReturn(Optional.empty());

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> executor.executeNow(1L, 8L));
        assertEquals("Schedule 1 not found", e.getMessage());
        verify(recorder, never()).start(anyLong());
    }

    @Test
    void testExecuteNow_disabled() {
        schedule.enabled = false;

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> executor.executeNow(1L, 7L));
        assertEquals("Schedule 1 is disabled", e.getMessage());
    }

    @Test
    void testExecuteNow_success() {
        Instant ranAt = Instant.parse("2025-03-04T09:00:00Z");
        when(shuffleHandler.execute(schedule, api)).thenReturn(new JobResult(0, 4));
        when(recorder.recordSuccess(100L, 1L, new JobResult(0, 4))).thenReturn(ranAt);

        ExecuteNowResultType result = executor.executeNow(1L, 7L);

        assertEquals("success", result.status());
        assertEquals(ranAt, result.lastRunAt());
        assertFalse(executor.isRunning(1L));
    }

    @Test
    void testExecuteNow_failureIsRaised() {
        when(shuffleHandler.execute(schedule, api))
                .thenThrow(new JobExecutionException("Spotify API error during shuffle: rate limited"));

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> executor.executeNow(1L, 7L));
        assertEquals("Execution failed: Spotify API error during shuffle: rate limited", e.getMessage());
    }

    @Test
    void testExecuteNow_failureIsRaisedWhenFailureCannotBeStored() {
        Schedule previous = new Schedule();
        previous.id = 1L;
        previous.lastStatus = ExecutionStatus.SUCCESS;
        previous.lastRunAt = Instant.parse("2025-01-01T00:00:00Z");
        when(recorder.findSchedule(1L)).thenReturn(Optional.of(schedule), Optional.of(previous));
        when(shuffleHandler.execute(schedule, api)).thenThrow(new IllegalStateException("boom"));
        doThrow(new IllegalStateException("db down")).when(recorder).recordFailure(100L, 1L, "boom");

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> executor.executeNow(1L, 7L));
        assertEquals("Execution failed: boom", e.getMessage());
        assertFalse(executor.isRunning(1L));
    }

    @Test
    void testExecuteNow_successCommitFailureIsRaised() {
        when(shuffleHandler.execute(schedule, api)).thenReturn(new JobResult(0, 4));
        when(recorder.recordSuccess(100L, 1L, new JobResult(0, 4)))
                .thenThrow(new IllegalStateException("commit failed"));

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> executor.executeNow(1L, 7L));
        assertEquals("Execution failed: commit failed", e.getMessage());
        verify(recorder).recordFailure(100L, 1L, "commit failed");
    }

    @Test
    void testExecuteNow_scheduleDisabledBeforeRunStarts() {
        Schedule disabled = new Schedule();
        disabled.id = 1L;
        disabled.enabled = false;
        when(recorder.findSchedule(1L)).thenReturn(Optional.of(disabled));

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> executor.executeNow(1L, 7L));
        assertEquals("Schedule 1 was not run", e.getMessage());
        verify(recorder, never()).start(anyLong());
    }

    @Test
    void testExecute_errorStillCountedAsFailed() {
        when(shuffleHandler.execute(schedule, api)).thenThrow(new NoClassDefFoundError("spotify/Track"));

        assertThrows(NoClassDefFoundError.class, () -> executor.execute(1L));

        assertEquals(1.0, executions("failed"));
        assertFalse(executor.isRunning(1L));
    }

    @Test
    void testConstructor_rejectsDuplicateHandlers() {
        List<PlaylistJobHandler> handlers = List.of(raidHandler, shuffleHandler, rotateHandler, raidAndShuffleHandler,
                handler(JobType.RAID));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new JobExecutorService(handlers));
        assertTrue(e.getMessage().contains("Duplicate handlers registered for JobType.RAID"));
    }

    @Test
    void testConstructor_rejectsMissingHandler() {
        List<PlaylistJobHandler> handlers = List.of(raidHandler, shuffleHandler, rotateHandler);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new JobExecutorService(handlers));
        assertEquals("No handler registered for JobType.RAID_AND_SHUFFLE", e.getMessage());
    }

    @Test
    void testExecute_activityMetadata() {
        when(shuffleHandler.execute(schedule, api)).thenReturn(new JobResult(0, 10));

        executor.runIfIdle(1L, LoggingConfig.ORIGIN_MANUAL);

        verify(activityLogService).log(eq(7L), eq(ActivityType.SCHEDULE_RUN), anyString(), eq("target"),
                eq("Morning Mix"), eq(Map.of("schedule_id", 1L, "job_type", "shuffle", "tracks_added", 0,
                        "tracks_total", 10, "triggered_by", "manual")));
    }
}
