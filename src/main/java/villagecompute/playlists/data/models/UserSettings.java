package villagecompute.playlists.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-user preferences consulted by background jobs. A user without a row gets the defaults.
 */
@Entity
@Table(
        name = "user_settings")
public class UserSettings extends PanacheEntityBase {

    public static final boolean DEFAULT_AUTO_SNAPSHOT = true;
    public static final int DEFAULT_MAX_SNAPSHOTS_PER_PLAYLIST = 50;

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "user_id",
            nullable = false,
            unique = true)
    public Long userId;

    @Column(
            name = "auto_snapshot_enabled",
            nullable = false)
    public boolean autoSnapshotEnabled = DEFAULT_AUTO_SNAPSHOT;

    @Column(
            name = "max_snapshots_per_playlist",
            nullable = false)
    public int maxSnapshotsPerPlaylist = DEFAULT_MAX_SNAPSHOTS_PER_PLAYLIST;

    @Column(
            name = "updated_at")
    public Instant updatedAt;

    public static Optional<UserSettings> findByUser(Long userId) {
        return find("userId", userId).firstResultOptional();
    }
}
