package villagecompute.playlists.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered copy of a playlist's track URIs taken before a job mutates it, so the previous order can be restored.
 */
@Entity
@Table(
        name = "playlist_snapshots")
@NamedQuery(
        name = PlaylistSnapshot.QUERY_FIND_BY_PLAYLIST,
        query = "FROM PlaylistSnapshot WHERE userId = :userId AND playlistId = :playlistId"
                + " ORDER BY createdAt DESC, id DESC")
public class PlaylistSnapshot extends PanacheEntityBase {

    public static final String QUERY_FIND_BY_PLAYLIST = "PlaylistSnapshot.findByPlaylist";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "user_id",
            nullable = false)
    public Long userId;

    @Column(
            name = "playlist_id",
            nullable = false,
            length = 64)
    public String playlistId;

    @Column(
            name = "playlist_name")
    public String playlistName;

    @Column(
            name = "track_uris",
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> trackUris = new ArrayList<>();

    @Column(
            name = "track_count",
            nullable = false)
    public int trackCount;

    @Column(
            name = "snapshot_type",
            nullable = false,
            length = 32)
    @Enumerated(EnumType.STRING)
    public SnapshotType snapshotType;

    @Column(
            name = "trigger_description")
    public String triggerDescription;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Snapshots of one playlist, newest first.
     */
    public static List<PlaylistSnapshot> findByPlaylist(Long userId, String playlistId) {
        return find("#" + QUERY_FIND_BY_PLAYLIST, Parameters.with("userId", userId).and("playlistId", playlistId))
                .list();
    }
}
