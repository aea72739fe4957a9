package villagecompute.playlists.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.playlists.api.types.JobResult;
import villagecompute.playlists.api.types.TrackType;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.data.models.SnapshotType;
import villagecompute.playlists.exceptions.JobExecutionException;
import villagecompute.playlists.exceptions.PlaylistNotFoundException;
import villagecompute.playlists.exceptions.SpotifyApiException;
import villagecompute.playlists.integration.spotify.PlaylistApi;
import villagecompute.playlists.services.PlaylistSnapshotService;
import villagecompute.playlists.services.ShuffleAlgorithmRegistry;
import villagecompute.playlists.shuffle.ShuffleAlgorithm;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reorders the target playlist with the schedule's shuffle algorithm and writes the full new order back.
 */
@ApplicationScoped
public class ShuffleJobHandler implements PlaylistJobHandler {

    private static final Logger LOG = Logger.getLogger(ShuffleJobHandler.class);

    @Inject
    ShuffleAlgorithmRegistry algorithmRegistry;

    @Inject
    PlaylistSnapshotService snapshotService;

    @Override
    public JobType handlesType() {
        return JobType.SHUFFLE;
    }

    @Override
    public JobResult execute(Schedule schedule, PlaylistApi api) {
        String targetId = schedule.targetPlaylistId;
        String algorithmName = schedule.algorithmName;

        if (algorithmName == null || algorithmName.isBlank()) {
            throw new JobExecutionException("Schedule " + schedule.id + ": no algorithm configured for shuffle");
        }
        ShuffleAlgorithm algorithm = algorithmRegistry.find(algorithmName).orElseThrow(
                () -> new JobExecutionException("Invalid algorithm '" + algorithmName + "': not registered"));

        try {
            List<TrackType> tracks = api.getPlaylistTracks(targetId).stream().filter(TrackType::hasUri)
                    .collect(Collectors.toList());
            if (tracks.isEmpty()) {
                return JobResult.EMPTY;
            }

            snapshotService.autoSnapshot(schedule, tracks.stream().map(TrackType::uri).collect(Collectors.toList()),
                    SnapshotType.SCHEDULED_PRE_EXECUTION, "Before scheduled " + algorithmName);

            List<String> shuffled = algorithm.shuffle(tracks, schedule.params());
            api.replacePlaylistTracks(targetId, shuffled);

            LOG.infof("Schedule %d: shuffled '%s' with %s", schedule.id, schedule.targetDisplayName(),
                    algorithmName);
            return new JobResult(0, shuffled.size());

        } catch (PlaylistNotFoundException e) {
            throw new JobExecutionException("Target playlist " + targetId + " not found", e);
        } catch (IllegalArgumentException e) {
            throw new JobExecutionException("Invalid algorithm '" + algorithmName + "': " + e.getMessage(), e);
        } catch (SpotifyApiException e) {
            throw new JobExecutionException("Spotify API error during shuffle: " + e.getMessage(), e);
        }
    }
}
