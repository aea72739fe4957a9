package villagecompute.playlists.data.models;

/**
 * Why a {@link PlaylistSnapshot} was captured.
 */
public enum SnapshotType {
    AUTO_PRE_RAID, AUTO_PRE_ROTATE, SCHEDULED_PRE_EXECUTION, MANUAL
}
