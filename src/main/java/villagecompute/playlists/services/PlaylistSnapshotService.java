package villagecompute.playlists.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.playlists.data.models.PlaylistSnapshot;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.data.models.SnapshotType;
import villagecompute.playlists.data.models.UserSettings;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures a playlist's order before a job changes it, and prunes old snapshots past the user's retention limit.
 */
@ApplicationScoped
public class PlaylistSnapshotService {

    private static final Logger LOG = Logger.getLogger(PlaylistSnapshotService.class);

    @Transactional
    public boolean isAutoSnapshotEnabled(Long userId) {
        return UserSettings.findByUser(userId).map(settings -> settings.autoSnapshotEnabled)
                .orElse(UserSettings.DEFAULT_AUTO_SNAPSHOT);
    }

    @Transactional
    public PlaylistSnapshot createSnapshot(Long userId, String playlistId, String playlistName, List<String> trackUris,
            SnapshotType type, String triggerDescription) {
        PlaylistSnapshot snapshot = new PlaylistSnapshot();
        snapshot.userId = userId;
        snapshot.playlistId = playlistId;
        snapshot.playlistName = playlistName;
        snapshot.trackUris = new ArrayList<>(trackUris);
        snapshot.trackCount = trackUris.size();
        snapshot.snapshotType = type;
        snapshot.triggerDescription = triggerDescription;
        snapshot.createdAt = Instant.now();
        snapshot.persist();

        LOG.infof("Created %s snapshot for user %d, playlist %s (%d tracks)", type, userId, playlistId,
                trackUris.size());

        int limit = UserSettings.findByUser(userId).map(settings -> settings.maxSnapshotsPerPlaylist)
                .filter(max -> max > 0).orElse(UserSettings.DEFAULT_MAX_SNAPSHOTS_PER_PLAYLIST);
        pruneOldSnapshots(userId, playlistId, limit);
        return snapshot;
    }

    /**
     * Snapshot hook for job handlers: captures {@code trackUris} when the user has auto-snapshots on. Empty playlists
     * are not captured. Failures are logged and swallowed; a snapshot problem never fails the job.
     *
     * @return true if a snapshot was written
     */
    public boolean autoSnapshot(Schedule schedule, List<String> trackUris, SnapshotType type, String description) {
        if (trackUris.isEmpty()) {
            return false;
        }
        try {
            if (!isAutoSnapshotEnabled(schedule.userId)) {
                return false;
            }
            createSnapshot(schedule.userId, schedule.targetPlaylistId, schedule.targetDisplayName(), trackUris, type,
                    description);
            return true;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Auto-snapshot before %s failed for schedule %d", type, schedule.id);
            return false;
        }
    }

    private void pruneOldSnapshots(Long userId, String playlistId, int limit) {
        List<PlaylistSnapshot> snapshots = PlaylistSnapshot.findByPlaylist(userId, playlistId);
        for (int i = limit; i < snapshots.size(); i++) {
            snapshots.get(i).delete();
        }
        if (snapshots.size() > limit) {
            LOG.debugf("Pruned %d snapshots of playlist %s", snapshots.size() - limit, playlistId);
        }
    }
}
