package villagecompute.playlists.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Result of a manual "run now" request.
 *
 * @param status
 *            the schedule's last status after the run ({@code success})
 * @param lastRunAt
 *            completion time recorded on the schedule
 */
public record ExecuteNowResultType(String status, @JsonProperty("last_run_at") Instant lastRunAt) {
}
