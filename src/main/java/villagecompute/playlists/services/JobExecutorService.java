package villagecompute.playlists.services;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.playlists.api.types.ExecuteNowResultType;
import villagecompute.playlists.api.types.JobResult;
import villagecompute.playlists.data.models.ActivityType;
import villagecompute.playlists.data.models.ExecutionStatus;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.data.models.User;
import villagecompute.playlists.exceptions.JobExecutionException;
import villagecompute.playlists.integration.spotify.PlaylistApi;
import villagecompute.playlists.jobs.JobType;
import villagecompute.playlists.jobs.PlaylistJobHandler;
import villagecompute.playlists.observability.LoggingConfig;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one schedule: loads it, builds a client for its owner, dispatches to the handler for its {@link JobType} and
 * records the outcome.
 *
 * <p>
 * <b>Lifecycle of a run:</b>
 * <ol>
 * <li>Missing or disabled schedule: logged, nothing recorded</li>
 * <li>RUNNING {@code JobExecution} committed before any remote call</li>
 * <li>Owner loaded and client built; credential problems fail the run</li>
 * <li>Handler dispatched</li>
 * <li>SUCCESS or FAILED committed on both the execution and the schedule</li>
 * </ol>
 *
 * <p>
 * {@link #execute(Long)} never throws. {@link #executeNow(Long, Long)} raises {@link JobExecutionException} so the
 * caller can show the failure.
 *
 * <p>
 * <b>Concurrency:</b> at most one run per schedule is in flight in this process. Scheduler fires and manual runs share
 * the same in-flight set; a second request for a running schedule is skipped (scheduler) or rejected (manual).
 *
 * <p>
 * <b>Telemetry:</b> each run is wrapped in a {@code job.schedule_execution} span ({@code schedule.id},
 * {@code job.type}, {@code job.trigger}) and recorded in {@code playlist.job.duration} and
 * {@code playlist.job.executions}.
 */
@ApplicationScoped
public class JobExecutorService {

    private static final Logger LOG = Logger.getLogger(JobExecutorService.class);

    private final Map<JobType, PlaylistJobHandler> handlerRegistry;

    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    @Inject
    JobExecutionRecorder recorder;

    @Inject
    SpotifyCredentialService credentialService;

    @Inject
    ActivityLogService activityLogService;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    public JobExecutorService(Instance<PlaylistJobHandler> handlers) {
        this((Iterable<PlaylistJobHandler>) handlers);
    }

    JobExecutorService(Iterable<PlaylistJobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized JobExecutorService with %d registered handlers", handlerRegistry.size());
    }

    private static Map<JobType, PlaylistJobHandler> buildHandlerRegistry(Iterable<PlaylistJobHandler> handlers) {
        Map<JobType, PlaylistJobHandler> registry = new EnumMap<>(JobType.class);
        for (PlaylistJobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
        }
        for (JobType type : JobType.values()) {
            if (!registry.containsKey(type)) {
                throw new IllegalStateException("No handler registered for JobType." + type);
            }
        }
        return registry;
    }

    /**
     * Scheduler entry point. Never throws; every outcome is recorded or logged.
     */
    public void execute(Long scheduleId) {
        runIfIdle(scheduleId, LoggingConfig.ORIGIN_SCHEDULER);
    }

    /**
     * Runs the schedule unless a run for it is already in flight.
     *
     * @return false if the run was skipped because another one is in progress
     */
    public boolean runIfIdle(Long scheduleId, String origin) {
        return runExclusive(scheduleId, origin).isPresent();
    }

    private Optional<RunOutcome> runExclusive(Long scheduleId, String origin) {
        if (!inFlight.add(scheduleId)) {
            LOG.warnf("Schedule %d is already running, skipping %s run", scheduleId, origin);
            return Optional.empty();
        }
        try {
            return Optional.of(run(scheduleId, origin));
        } finally {
            inFlight.remove(scheduleId);
        }
    }

    public boolean isRunning(Long scheduleId) {
        return inFlight.contains(scheduleId);
    }

    /**
     * Runs a schedule synchronously on behalf of its owner.
     *
     * @return the run's status and completion time
     * @throws JobExecutionException
     *             if the schedule does not exist for this user, is disabled, is already running, or the run failed
     */
    public ExecuteNowResultType executeNow(Long scheduleId, Long userId) {
        Schedule schedule = recorder.findScheduleForUser(scheduleId, userId)
                .orElseThrow(() -> new JobExecutionException("Schedule " + scheduleId + " not found"));
        if (!schedule.enabled) {
            throw new JobExecutionException("Schedule " + scheduleId + " is disabled");
        }

        RunOutcome outcome = runExclusive(scheduleId, LoggingConfig.ORIGIN_MANUAL)
                .orElseThrow(() -> new JobExecutionException("Schedule " + scheduleId + " is already running"));
        if (outcome.status() == ExecutionStatus.FAILED) {
            throw new JobExecutionException("Execution failed: " + outcome.errorMessage());
        }
        if (outcome.status() != ExecutionStatus.SUCCESS) {
            throw new JobExecutionException("Schedule " + scheduleId + " was not run");
        }
        return new ExecuteNowResultType(outcome.status().getValue(), outcome.completedAt());
    }

    /**
     * What one call to {@link #run(Long, String)} did. {@code status} is null when the schedule was skipped.
     */
    record RunOutcome(ExecutionStatus status, Instant completedAt, String errorMessage) {

        static final RunOutcome SKIPPED = new RunOutcome(null, null, null);
    }

    RunOutcome run(Long scheduleId, String origin) {
        Span span = tracer.spanBuilder("job.schedule_execution").setAttribute("schedule.id", scheduleId)
                .setAttribute("job.trigger", origin).startSpan();

        Long executionId = null;
        Schedule schedule = null;
        Timer.Sample sample = null;
        ExecutionStatus status = ExecutionStatus.FAILED;

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setScheduleId(scheduleId);
            LoggingConfig.setRequestOrigin(origin);

            schedule = recorder.findSchedule(scheduleId).orElse(null);
            if (schedule == null) {
                LOG.errorf("Schedule %d not found, skipping", scheduleId);
                span.addEvent("job.skipped");
                return RunOutcome.SKIPPED;
            }
            if (!schedule.enabled) {
                LOG.infof("Schedule %d is disabled, skipping", scheduleId);
                span.addEvent("job.skipped");
                return RunOutcome.SKIPPED;
            }

            span.setAttribute("job.type", schedule.jobType.getValue());
            LoggingConfig.setUserId(schedule.userId);
            LoggingConfig.setJobType(schedule.jobType.getValue());
            sample = Timer.start(meterRegistry);

            executionId = recorder.start(scheduleId).id;
            LoggingConfig.setJobExecutionId(executionId);

            JobResult result = dispatch(schedule);
            Instant completedAt = recorder.recordSuccess(executionId, scheduleId, result);
            status = ExecutionStatus.SUCCESS;

            span.addEvent("job.completed");
            LOG.infof("Schedule %d executed successfully: added=%d, total=%d", scheduleId, result.tracksAdded(),
                    result.tracksTotal());
            logRun(schedule, result, origin);
            return new RunOutcome(status, completedAt, null);

        } catch (Exception e) {
            span.recordException(e);
            span.addEvent("job.failed");
            LOG.errorf(e, "Schedule %d execution failed", scheduleId);
            String message = recordFailure(executionId, scheduleId, e);
            return new RunOutcome(status, null, message);

        } finally {
            if (sample != null) {
                String jobType = schedule.jobType.getValue();
                sample.stop(meterRegistry.timer("playlist.job.duration", "job_type", jobType));
                meterRegistry.counter("playlist.job.executions", "job_type", jobType, "status", status.getValue())
                        .increment();
            }
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private JobResult dispatch(Schedule schedule) {
        User user = recorder.findUser(schedule.userId)
                .orElseThrow(() -> new JobExecutionException("User " + schedule.userId + " not found"));
        PlaylistApi api = credentialService.buildClientForUser(user);
        return handlerRegistry.get(schedule.jobType).execute(schedule, api);
    }

    /**
     * @return the failure message, whether or not it could be stored
     */
    private String recordFailure(Long executionId, Long scheduleId, Exception error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        try {
            recorder.recordFailure(executionId, scheduleId, message);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record execution failure for schedule %d", scheduleId);
        }
        return message;
    }

    private void logRun(Schedule schedule, JobResult result, String origin) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("schedule_id", schedule.id);
        metadata.put("job_type", schedule.jobType.getValue());
        metadata.put("tracks_added", result.tracksAdded());
        metadata.put("tracks_total", result.tracksTotal());
        metadata.put("triggered_by", origin);
        activityLogService.log(schedule.userId, ActivityType.SCHEDULE_RUN,
                "Scheduled " + schedule.jobType.getValue() + " on '" + schedule.targetDisplayName() + "' completed",
                schedule.targetPlaylistId, schedule.targetPlaylistName, metadata);
    }
}
