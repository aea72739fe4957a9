package villagecompute.playlists.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one handler run.
 *
 * @param tracksAdded
 *            tracks newly placed in the target playlist (for swap rotations, the swapped count)
 * @param tracksTotal
 *            target playlist size after the run
 */
public record JobResult(@JsonProperty("tracks_added") int tracksAdded, @JsonProperty("tracks_total") int tracksTotal) {

    public static final JobResult EMPTY = new JobResult(0, 0);
}
