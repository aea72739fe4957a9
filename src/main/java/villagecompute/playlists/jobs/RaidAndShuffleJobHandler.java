package villagecompute.playlists.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.playlists.api.types.JobResult;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.integration.spotify.PlaylistApi;

/**
 * Raid followed by shuffle on the same target. Reports the raid's added count and the shuffle's total. A failure in
 * either half fails the run; a failed shuffle does not undo the raid.
 */
@ApplicationScoped
public class RaidAndShuffleJobHandler implements PlaylistJobHandler {

    @Inject
    RaidJobHandler raidHandler;

    @Inject
    ShuffleJobHandler shuffleHandler;

    @Override
    public JobType handlesType() {
        return JobType.RAID_AND_SHUFFLE;
    }

    @Override
    public JobResult execute(Schedule schedule, PlaylistApi api) {
        JobResult raid = raidHandler.execute(schedule, api);
        JobResult shuffle = shuffleHandler.execute(schedule, api);
        return new JobResult(raid.tracksAdded(), shuffle.tracksTotal());
    }
}
