package villagecompute.playlists.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.playlists.api.types.ExecutionHistoryType;
import villagecompute.playlists.api.types.ScheduleRequestType;
import villagecompute.playlists.data.models.ActivityType;
import villagecompute.playlists.data.models.JobExecution;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.exceptions.ResourceNotFoundException;
import villagecompute.playlists.exceptions.ScheduleLimitException;
import villagecompute.playlists.jobs.IntervalValue;
import villagecompute.playlists.jobs.PlaylistJobScheduler;
import villagecompute.playlists.jobs.ScheduleType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Schedule management: CRUD with ownership checks, the per-user cap, validation, and keeping the
 * {@link PlaylistJobScheduler} in step with the stored rows.
 *
 * <p>
 * Every lookup is scoped to the owning user; an id belonging to someone else is reported as not found.
 */
@ApplicationScoped
public class ScheduleService {

    private static final Logger LOG = Logger.getLogger(ScheduleService.class);

    static final int DEFAULT_HISTORY_LIMIT = 10;

    @Inject
    ScheduleValidator validator;

    @Inject
    PlaylistJobScheduler jobScheduler;

    @Inject
    ActivityLogService activityLogService;

    @ConfigProperty(
            name = "playlistjobs.schedules.max-per-user",
            defaultValue = "5")
    int maxSchedulesPerUser;

    @Transactional
    public List<Schedule> getUserSchedules(Long userId) {
        return Schedule.findByUser(userId);
    }

    /**
     * @throws ResourceNotFoundException
     *             if the schedule does not exist or belongs to another user
     */
    @Transactional
    public Schedule getSchedule(Long scheduleId, Long userId) {
        return Schedule.findByIdAndUser(scheduleId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule " + scheduleId + " not found"));
    }

    /**
     * Creates a schedule and registers it when enabled. Schedule type defaults to interval, value to daily.
     *
     * @throws ScheduleLimitException
     *             if the user already has the maximum number of schedules
     * @throws villagecompute.playlists.exceptions.ValidationException
     *             if the request is malformed
     */
    @Transactional
    public Schedule createSchedule(Long userId, ScheduleRequestType request) {
        long existing = Schedule.countByUser(userId);
        if (existing >= maxSchedulesPerUser) {
            throw new ScheduleLimitException(maxSchedulesPerUser);
        }

        Instant now = Instant.now();
        Schedule schedule = new Schedule();
        schedule.userId = userId;
        schedule.jobType = request.jobType();
        schedule.targetPlaylistId = request.targetPlaylistId();
        schedule.targetPlaylistName = request.targetPlaylistName();
        schedule.sourcePlaylistIds = request.sourcePlaylistIds() != null
                ? new ArrayList<>(request.sourcePlaylistIds())
                : new ArrayList<>();
        schedule.algorithmName = request.algorithmName();
        schedule.algorithmParams = request.algorithmParams() != null
                ? new HashMap<>(request.algorithmParams())
                : new HashMap<>();
        schedule.scheduleType = request.scheduleType() != null ? request.scheduleType() : ScheduleType.INTERVAL;
        schedule.scheduleValue = request.scheduleValue() != null
                ? request.scheduleValue()
                : IntervalValue.DAILY.getToken();
        schedule.enabled = request.enabled() == null || request.enabled();
        schedule.createdAt = now;
        schedule.updatedAt = now;

        validator.validate(schedule);
        schedule.persist();

        if (schedule.enabled) {
            jobScheduler.addSchedule(schedule);
        }
        LOG.infof("Created schedule %d for user %d: %s on %s", schedule.id, userId, schedule.jobType,
                schedule.targetPlaylistId);
        logActivity(schedule, ActivityType.SCHEDULE_CREATE,
                "Created " + schedule.jobType.getValue() + " schedule for '" + schedule.targetDisplayName() + "'");
        return schedule;
    }

    /**
     * Applies the non-null fields of {@code request}, re-validates, and re-registers or removes the trigger.
     */
    @Transactional
    public Schedule updateSchedule(Long scheduleId, Long userId, ScheduleRequestType request) {
        Schedule schedule = getSchedule(scheduleId, userId);

        if (request.jobType() != null) {
            schedule.jobType = request.jobType();
        }
        if (request.targetPlaylistId() != null) {
            schedule.targetPlaylistId = request.targetPlaylistId();
        }
        if (request.targetPlaylistName() != null) {
            schedule.targetPlaylistName = request.targetPlaylistName();
        }
        if (request.sourcePlaylistIds() != null) {
            schedule.sourcePlaylistIds = new ArrayList<>(request.sourcePlaylistIds());
        }
        if (request.algorithmName() != null) {
            schedule.algorithmName = request.algorithmName();
        }
        if (request.algorithmParams() != null) {
            schedule.algorithmParams = new HashMap<>(request.algorithmParams());
        }
        if (request.scheduleType() != null) {
            schedule.scheduleType = request.scheduleType();
        }
        if (request.scheduleValue() != null) {
            schedule.scheduleValue = request.scheduleValue();
        }
        if (request.enabled() != null) {
            schedule.enabled = request.enabled();
        }

        validator.validate(schedule);
        schedule.updatedAt = Instant.now();

        jobScheduler.toggle(schedule);
        LOG.infof("Updated schedule %d", scheduleId);
        logActivity(schedule, ActivityType.SCHEDULE_UPDATE,
                "Updated " + schedule.jobType.getValue() + " schedule for '" + schedule.targetDisplayName() + "'");
        return schedule;
    }

    /**
     * Deletes a schedule together with its execution history and removes its trigger.
     */
    @Transactional
    public void deleteSchedule(Long scheduleId, Long userId) {
        Schedule schedule = getSchedule(scheduleId, userId);

        long executions = JobExecution.deleteBySchedule(scheduleId);
        schedule.delete();
        jobScheduler.removeSchedule(scheduleId);

        LOG.infof("Deleted schedule %d and %d executions", scheduleId, executions);
        logActivity(schedule, ActivityType.SCHEDULE_DELETE,
                "Deleted " + schedule.jobType.getValue() + " schedule for '" + schedule.targetDisplayName() + "'");
    }

    /**
     * Flips the enabled flag; enabling registers the trigger, disabling removes it.
     */
    @Transactional
    public Schedule toggleSchedule(Long scheduleId, Long userId) {
        Schedule schedule = getSchedule(scheduleId, userId);
        schedule.enabled = !schedule.enabled;
        schedule.updatedAt = Instant.now();

        jobScheduler.toggle(schedule);
        String state = schedule.enabled ? "enabled" : "disabled";
        LOG.infof("Schedule %d %s", scheduleId, state);
        logActivity(schedule, ActivityType.SCHEDULE_TOGGLE,
                "Schedule for '" + schedule.targetDisplayName() + "' " + state);
        return schedule;
    }

    public List<ExecutionHistoryType> getExecutionHistory(Long scheduleId, Long userId) {
        return getExecutionHistory(scheduleId, userId, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * Most recent runs of a schedule, newest first.
     */
    @Transactional
    public List<ExecutionHistoryType> getExecutionHistory(Long scheduleId, Long userId, int limit) {
        getSchedule(scheduleId, userId);
        return JobExecution.findBySchedule(scheduleId, limit).stream().map(ExecutionHistoryType::fromEntity)
                .collect(Collectors.toList());
    }

    private void logActivity(Schedule schedule, ActivityType type, String description) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("schedule_id", schedule.id);
        metadata.put("job_type", schedule.jobType.getValue());
        activityLogService.log(schedule.userId, type, description, schedule.targetPlaylistId,
                schedule.targetPlaylistName, metadata);
    }
}
