package villagecompute.playlists.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.playlists.jobs.JobType;
import villagecompute.playlists.jobs.ScheduleType;

import java.util.List;
import java.util.Map;

/**
 * Schedule fields for create and update requests. On update, null fields keep their current value.
 */
public record ScheduleRequestType(@JsonProperty("job_type") JobType jobType,
        @JsonProperty("target_playlist_id") String targetPlaylistId,
        @JsonProperty("target_playlist_name") String targetPlaylistName,
        @JsonProperty("source_playlist_ids") List<String> sourcePlaylistIds,
        @JsonProperty("algorithm_name") String algorithmName,
        @JsonProperty("algorithm_params") Map<String, Object> algorithmParams,
        @JsonProperty("schedule_type") ScheduleType scheduleType,
        @JsonProperty("schedule_value") String scheduleValue, @JsonProperty("is_enabled") Boolean enabled) {
}
