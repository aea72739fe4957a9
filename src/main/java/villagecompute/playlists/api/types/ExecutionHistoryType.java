package villagecompute.playlists.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.playlists.data.models.JobExecution;

import java.time.Instant;

/**
 * One row of a schedule's execution history, newest first.
 */
public record ExecutionHistoryType(Long id, @JsonProperty("schedule_id") Long scheduleId,
        @JsonProperty("started_at") Instant startedAt, @JsonProperty("completed_at") Instant completedAt,
        String status, @JsonProperty("tracks_added") int tracksAdded, @JsonProperty("tracks_total") int tracksTotal,
        @JsonProperty("error_message") String errorMessage) {

    public static ExecutionHistoryType fromEntity(JobExecution execution) {
        return new ExecutionHistoryType(execution.id, execution.scheduleId, execution.startedAt,
                execution.completedAt, execution.status.getValue(), execution.tracksAdded, execution.tracksTotal,
                execution.errorMessage);
    }
}
