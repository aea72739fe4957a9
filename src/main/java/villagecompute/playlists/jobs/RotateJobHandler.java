package villagecompute.playlists.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.playlists.api.types.JobResult;
import villagecompute.playlists.data.models.PlaylistPair;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.data.models.SnapshotType;
import villagecompute.playlists.exceptions.JobExecutionException;
import villagecompute.playlists.exceptions.PlaylistNotFoundException;
import villagecompute.playlists.exceptions.SpotifyApiException;
import villagecompute.playlists.integration.spotify.PlaylistApi;
import villagecompute.playlists.services.PlaylistPairService;
import villagecompute.playlists.services.PlaylistSnapshotService;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moves tracks between a production playlist and its paired archive.
 *
 * <p>
 * The schedule's target is the production side; the archive comes from the user's {@link PlaylistPair}. The
 * {@code rotation_count} oldest production tracks (playlist order, capped at the playlist size) are the rotation
 * candidates. See {@link RotationMode} for what each mode does with them.
 */
@ApplicationScoped
public class RotateJobHandler implements PlaylistJobHandler {

    private static final Logger LOG = Logger.getLogger(RotateJobHandler.class);

    @Inject
    PlaylistPairService pairService;

    @Inject
    PlaylistSnapshotService snapshotService;

    @Override
    public JobType handlesType() {
        return JobType.ROTATE;
    }

    @Override
    public JobResult execute(Schedule schedule, PlaylistApi api) {
        RotationMode mode = rotationMode(schedule.params());
        int rotationCount = rotationCount(schedule.params());

        String targetId = schedule.targetPlaylistId;
        PlaylistPair pair = pairService.findPairForPlaylist(schedule.userId, targetId)
                .orElseThrow(() -> new JobExecutionException("No archive pair found for playlist " + targetId
                        + ". Create a playlist pair first."));
        String archiveId = pair.archivePlaylistId;

        try {
            List<String> productionUris = RaidJobHandler.uris(api.getPlaylistTracks(targetId));
            if (productionUris.isEmpty()) {
                return JobResult.EMPTY;
            }

            snapshotService.autoSnapshot(schedule, productionUris, SnapshotType.AUTO_PRE_ROTATE,
                    "Before scheduled " + mode.getValue() + " rotation");

            int count = Math.min(rotationCount, productionUris.size());
            List<String> oldest = new ArrayList<>(productionUris.subList(0, count));

            return switch (mode) {
                case ARCHIVE_OLDEST -> archiveOldest(schedule, api, archiveId, productionUris, oldest);
                case REFRESH -> refresh(schedule, api, archiveId, productionUris, count);
                case SWAP -> swap(schedule, api, archiveId, productionUris, oldest);
            };

        } catch (PlaylistNotFoundException e) {
            throw new JobExecutionException(
                    "Playlist not found during rotation. Target: " + targetId + ", Archive: " + archiveId, e);
        } catch (SpotifyApiException e) {
            throw new JobExecutionException("Spotify API error during rotation: " + e.getMessage(), e);
        }
    }

    private JobResult archiveOldest(Schedule schedule, PlaylistApi api, String archiveId, List<String> productionUris,
            List<String> oldest) {
        api.addTracks(archiveId, oldest);
        api.removeTracks(schedule.targetPlaylistId, oldest);

        // removal drops every occurrence of a URI, not just the oldest one
        Set<String> removed = new HashSet<>(oldest);
        int remaining = (int) productionUris.stream().filter(uri -> !removed.contains(uri)).count();

        LOG.infof("Schedule %d: archived %d oldest tracks from '%s'", schedule.id, oldest.size(),
                schedule.targetDisplayName());
        return new JobResult(0, remaining);
    }

    private JobResult refresh(Schedule schedule, PlaylistApi api, String archiveId, List<String> productionUris,
            int count) {
        List<String> incoming = newestEligible(api, archiveId, productionUris, count);
        List<String> outgoing = new ArrayList<>(productionUris.subList(0, incoming.size()));

        if (!incoming.isEmpty()) {
            api.removeTracks(schedule.targetPlaylistId, outgoing);
            api.addTracks(schedule.targetPlaylistId, incoming);
        }

        int total = productionUris.size() - outgoing.size() + incoming.size();
        LOG.infof("Schedule %d: refreshed %d tracks in '%s'", schedule.id, incoming.size(),
                schedule.targetDisplayName());
        return new JobResult(incoming.size(), total);
    }

    private JobResult swap(Schedule schedule, PlaylistApi api, String archiveId, List<String> productionUris,
            List<String> oldest) {
        List<String> incoming = newestEligible(api, archiveId, productionUris, oldest.size());
        List<String> outgoing = new ArrayList<>(oldest.subList(0, incoming.size()));

        if (!incoming.isEmpty()) {
            api.addTracks(archiveId, outgoing);
            api.removeTracks(schedule.targetPlaylistId, outgoing);
            api.addTracks(schedule.targetPlaylistId, incoming);
            api.removeTracks(archiveId, incoming);
        }

        LOG.infof("Schedule %d: swapped %d tracks between '%s' and archive", schedule.id, incoming.size(),
                schedule.targetDisplayName());
        return new JobResult(incoming.size(), productionUris.size());
    }

    /**
     * The last {@code count} archive tracks that are not already in production, in archive order.
     */
    private List<String> newestEligible(PlaylistApi api, String archiveId, List<String> productionUris, int count) {
        Set<String> inProduction = new HashSet<>(productionUris);
        Set<String> eligible = new LinkedHashSet<>();
        for (String uri : RaidJobHandler.uris(api.getPlaylistTracks(archiveId))) {
            if (!inProduction.contains(uri)) {
                eligible.add(uri);
            }
        }
        List<String> candidates = new ArrayList<>(eligible);
        return new ArrayList<>(candidates.subList(Math.max(0, candidates.size() - count), candidates.size()));
    }

    static RotationMode rotationMode(Map<String, Object> params) {
        Object raw = params.get(RotationMode.PARAM_MODE);
        if (raw == null) {
            return RotationMode.ARCHIVE_OLDEST;
        }
        return RotationMode.fromValue(raw.toString())
                .orElseThrow(() -> new JobExecutionException("Invalid rotation_mode: " + raw));
    }

    static int rotationCount(Map<String, Object> params) {
        Object raw = params.get(RotationMode.PARAM_COUNT);
        if (raw == null) {
            return RotationMode.DEFAULT_COUNT;
        }
        if (raw instanceof Number number) {
            return Math.max(1, number.intValue());
        }
        try {
            return Math.max(1, Integer.parseInt(raw.toString().trim()));
        } catch (NumberFormatException e) {
            throw new JobExecutionException("Invalid rotation_count: " + raw, e);
        }
    }
}
