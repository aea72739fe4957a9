package villagecompute.playlists.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.exceptions.ValidationException;
import villagecompute.playlists.jobs.IntervalValue;
import villagecompute.playlists.jobs.JobType;
import villagecompute.playlists.jobs.RotationMode;
import villagecompute.playlists.jobs.ScheduleType;
import villagecompute.playlists.jobs.TriggerTranslator;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rejects malformed schedules when they are created or updated. Fire-time code never validates; the trigger
 * translator falls back to a default instead.
 */
@ApplicationScoped
public class ScheduleValidator {

    @Inject
    ShuffleAlgorithmRegistry algorithmRegistry;

    /**
     * @throws ValidationException
     *             describing the first problem found
     */
    public void validate(Schedule schedule) {
        if (schedule.jobType == null) {
            throw new ValidationException("job_type is required");
        }
        if (schedule.targetPlaylistId == null || schedule.targetPlaylistId.isBlank()) {
            throw new ValidationException("target_playlist_id is required");
        }
        validateTrigger(schedule.scheduleType, schedule.scheduleValue);

        JobType jobType = schedule.jobType;
        if (jobType.raids()) {
            if (schedule.sourceIds().isEmpty()) {
                throw new ValidationException("source_playlist_ids required for job_type '" + jobType.getValue() + "'");
            }
            if (schedule.sourceIds().contains(schedule.targetPlaylistId)) {
                throw new ValidationException("source_playlist_ids cannot include the target playlist");
            }
        }
        if (jobType.shuffles()) {
            validateAlgorithm(schedule.algorithmName, jobType);
        }
        if (jobType == JobType.ROTATE) {
            validateRotation(schedule.params());
        }
    }

    void validateTrigger(ScheduleType type, String value) {
        if (type == null) {
            throw new ValidationException("schedule_type is required");
        }
        if (value == null || value.isBlank()) {
            throw new ValidationException("schedule_value cannot be empty");
        }
        if (type == ScheduleType.INTERVAL && IntervalValue.fromToken(value).isEmpty()) {
            String allowed = Arrays.stream(IntervalValue.values()).map(IntervalValue::getToken).sorted()
                    .collect(Collectors.joining(", "));
            throw new ValidationException("Invalid interval '" + value + "'. Must be one of: " + allowed);
        }
        if (type == ScheduleType.CRON && !TriggerTranslator.isSupportedCron(value)) {
            throw new ValidationException(
                    "Invalid cron expression '" + value + "'. Must have 5 fields: minute hour day month day_of_week");
        }
    }

    private void validateAlgorithm(String algorithmName, JobType jobType) {
        if (algorithmName == null || algorithmName.isBlank()) {
            throw new ValidationException("algorithm_name required for job_type '" + jobType.getValue() + "'");
        }
        if (algorithmRegistry.find(algorithmName).isEmpty()) {
            throw new ValidationException("Invalid algorithm '" + algorithmName + "'. Must be one of: "
                    + String.join(", ", algorithmRegistry.names()));
        }
    }

    private void validateRotation(Map<String, Object> params) {
        Object mode = params.get(RotationMode.PARAM_MODE);
        if (mode == null || mode.toString().isBlank()) {
            throw new ValidationException("algorithm_params.rotation_mode required for job_type 'rotate'");
        }
        if (RotationMode.fromValue(mode.toString()).isEmpty()) {
            String allowed = Arrays.stream(RotationMode.values()).map(RotationMode::getValue).sorted()
                    .collect(Collectors.joining(", "));
            throw new ValidationException("Invalid rotation_mode '" + mode + "'. Must be one of: " + allowed);
        }

        Object count = params.get(RotationMode.PARAM_COUNT);
        if (count == null) {
            return;
        }
        int parsed;
        try {
            parsed = count instanceof Number ? ((Number) count).intValue() : Integer.parseInt(count.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("rotation_count must be a positive integer", e);
        }
        if (parsed < 1) {
            throw new ValidationException("rotation_count must be a positive integer");
        }
    }
}
