package villagecompute.playlists.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.playlists.api.types.JobResult;
import villagecompute.playlists.data.models.ExecutionStatus;
import villagecompute.playlists.data.models.JobExecution;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.data.models.User;

import java.time.Instant;
import java.util.Optional;

/**
 * Database side of a job run. Each method commits on return ({@code REQUIRES_NEW}) so a run's progress is visible to
 * other readers while remote calls are still in flight, and no transaction is held open across them.
 *
 * <p>
 * The recorder enforces the execution lifecycle: a row is created RUNNING and finalized once. Finalizing a row that
 * is already terminal is logged and ignored.
 */
@ApplicationScoped
public class JobExecutionRecorder {

    private static final Logger LOG = Logger.getLogger(JobExecutionRecorder.class);

    @ConfigProperty(
            name = "playlistjobs.jobs.error-message-max-length",
            defaultValue = "1000")
    int errorMessageMaxLength;

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Optional<Schedule> findSchedule(Long scheduleId) {
        return Schedule.findByIdOptional(scheduleId);
    }

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Optional<Schedule> findScheduleForUser(Long scheduleId, Long userId) {
        return Schedule.findByIdAndUser(scheduleId, userId);
    }

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Optional<User> findUser(Long userId) {
        return User.findByIdOptional(userId);
    }

    /**
     * Creates the RUNNING row for a new run.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public JobExecution start(Long scheduleId) {
        JobExecution execution = new JobExecution();
        execution.scheduleId = scheduleId;
        execution.startedAt = Instant.now();
        execution.status = ExecutionStatus.RUNNING;
        execution.persist();
        return execution;
    }

    /**
     * Marks the run and its schedule successful.
     *
     * @return completion time written to both rows
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Instant recordSuccess(Long executionId, Long scheduleId, JobResult result) {
        Instant now = Instant.now();
        Optional<JobExecution> running = JobExecution.findByIdOptional(executionId);
        running.ifPresent(execution -> {
            if (execution.status.isTerminal()) {
                LOG.warnf("Execution %d already finalized as %s, not marking success", executionId,
                        execution.status);
                return;
            }
            execution.status = ExecutionStatus.SUCCESS;
            execution.completedAt = now;
            execution.tracksAdded = result.tracksAdded();
            execution.tracksTotal = result.tracksTotal();
        });
        Optional<Schedule> owner = Schedule.findByIdOptional(scheduleId);
        owner.ifPresent(schedule -> {
            schedule.lastRunAt = now;
            schedule.lastStatus = ExecutionStatus.SUCCESS;
            schedule.lastError = null;
        });
        return now;
    }

    /**
     * Marks the run and its schedule failed.
     *
     * @param executionId
     *            RUNNING row, or null when the run failed before its row was committed
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void recordFailure(Long executionId, Long scheduleId, String errorMessage) {
        Instant now = Instant.now();
        String truncated = truncate(errorMessage);
        if (executionId != null) {
            Optional<JobExecution> running = JobExecution.findByIdOptional(executionId);
            running.ifPresent(execution -> {
                if (execution.status.isTerminal()) {
                    LOG.warnf("Execution %d already finalized as %s, not marking failure", executionId,
                            execution.status);
                    return;
                }
                execution.status = ExecutionStatus.FAILED;
                execution.completedAt = now;
                execution.errorMessage = truncated;
            });
        }
        Optional<Schedule> owner = Schedule.findByIdOptional(scheduleId);
        owner.ifPresent(schedule -> {
            schedule.lastRunAt = now;
            schedule.lastStatus = ExecutionStatus.FAILED;
            schedule.lastError = truncated;
        });
    }

    /**
     * Cuts a message to the configured maximum, never wider than the error columns.
     */
    String truncate(String message) {
        if (message == null) {
            return null;
        }
        int limit = Math.min(errorMessageMaxLength, Schedule.ERROR_MAX_LENGTH);
        return message.length() > limit ? message.substring(0, limit) : message;
    }
}
