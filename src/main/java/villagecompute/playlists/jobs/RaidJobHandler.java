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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls tracks from the schedule's source playlists into its target.
 *
 * <p>
 * New tracks are collected in source-list order; the first occurrence of a URI wins and URIs already in the target are
 * skipped. They are appended after the existing tracks, so the target's existing order is untouched. A source that no
 * longer exists is skipped with a warning.
 */
@ApplicationScoped
public class RaidJobHandler implements PlaylistJobHandler {

    private static final Logger LOG = Logger.getLogger(RaidJobHandler.class);

    @Inject
    PlaylistSnapshotService snapshotService;

    @Override
    public JobType handlesType() {
        return JobType.RAID;
    }

    @Override
    public JobResult execute(Schedule schedule, PlaylistApi api) {
        String targetId = schedule.targetPlaylistId;
        List<String> sourceIds = schedule.sourceIds();

        try {
            List<String> targetUris = uris(api.getPlaylistTracks(targetId));

            if (sourceIds.isEmpty()) {
                LOG.infof("Schedule %d: no source playlists configured, skipping raid", schedule.id);
                return new JobResult(0, targetUris.size());
            }

            snapshotService.autoSnapshot(schedule, targetUris, SnapshotType.AUTO_PRE_RAID, "Before scheduled raid");

            List<String> newUris = collectNewTracks(schedule, api, sourceIds, new HashSet<>(targetUris));
            if (newUris.isEmpty()) {
                LOG.infof("Schedule %d: no new tracks to add", schedule.id);
                return new JobResult(0, targetUris.size());
            }

            api.addTracks(targetId, newUris);

            int total = targetUris.size() + newUris.size();
            LOG.infof("Schedule %d: added %d tracks to '%s' (total: %d)", schedule.id, newUris.size(),
                    schedule.targetDisplayName(), total);
            return new JobResult(newUris.size(), total);

        } catch (PlaylistNotFoundException e) {
            throw new JobExecutionException(
                    "Target playlist " + targetId + " not found. It may have been deleted.", e);
        } catch (SpotifyApiException e) {
            throw new JobExecutionException("Spotify API error during raid: " + e.getMessage(), e);
        }
    }

    /**
     * Returns URIs from {@code sourceIds} that are not in {@code exclude}, deduplicated, first occurrence first.
     */
    List<String> collectNewTracks(Schedule schedule, PlaylistApi api, List<String> sourceIds, Set<String> exclude) {
        Set<String> collected = new LinkedHashSet<>();
        for (String sourceId : sourceIds) {
            List<TrackType> sourceTracks;
            try {
                sourceTracks = api.getPlaylistTracks(sourceId);
            } catch (PlaylistNotFoundException e) {
                LOG.warnf("Schedule %d: source playlist %s not found, skipping", schedule.id, sourceId);
                continue;
            }
            for (TrackType track : sourceTracks) {
                if (track.hasUri() && !exclude.contains(track.uri())) {
                    collected.add(track.uri());
                }
            }
        }
        return new ArrayList<>(collected);
    }

    static List<String> uris(List<TrackType> tracks) {
        List<String> uris = new ArrayList<>(tracks.size());
        for (TrackType track : tracks) {
            if (track.hasUri()) {
                uris.add(track.uri());
            }
        }
        return uris;
    }
}
