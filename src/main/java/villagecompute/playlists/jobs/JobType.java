package villagecompute.playlists.jobs;

/**
 * Enumeration of the playlist operations a schedule can drive. Each fire runs exactly one job type.
 *
 * <p>
 * Every constant must have exactly one {@link PlaylistJobHandler}. The executor checks this when it starts, so a
 * missing handler fails at boot rather than surfacing as an "unknown job type" at fire time.
 *
 * @see PlaylistJobHandler for the handler contract
 */
public enum JobType {

    /**
     * Pulls tracks from the configured source playlists that the target does not already contain.
     * <p>
     * <b>Handler:</b> RaidJobHandler
     */
    RAID("raid", "Raid source playlists into target"),

    /**
     * Reorders the target playlist with the schedule's shuffle algorithm.
     * <p>
     * <b>Handler:</b> ShuffleJobHandler
     */
    SHUFFLE("shuffle", "Shuffle target playlist"),

    /**
     * Moves tracks between the target (production) playlist and its paired archive playlist.
     * <p>
     * <b>Handler:</b> RotateJobHandler
     */
    ROTATE("rotate", "Rotate tracks with archive playlist"),

    /**
     * Raid followed by shuffle in the same run. A failure in either half fails the run.
     * <p>
     * <b>Handler:</b> RaidAndShuffleJobHandler
     */
    RAID_AND_SHUFFLE("raid_and_shuffle", "Raid then shuffle target playlist");

    private final String value;
    private final String description;

    JobType(String value, String description) {
        this.value = value;
        this.description = description;
    }

    /**
     * Returns the lowercase wire value used in logs, metrics tags and activity metadata.
     */
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether this job type pulls from source playlists.
     */
    public boolean raids() {
        return this == RAID || this == RAID_AND_SHUFFLE;
    }

    /**
     * Whether this job type needs a shuffle algorithm.
     */
    public boolean shuffles() {
        return this == SHUFFLE || this == RAID_AND_SHUFFLE;
    }
}
