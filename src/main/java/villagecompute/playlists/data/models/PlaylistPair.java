package villagecompute.playlists.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.Optional;

/**
 * Links a production playlist to the archive playlist that rotation jobs move tracks in and out of.
 */
@Entity
@Table(
        name = "playlist_pairs",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_playlist_pairs_user_production",
                columnNames = {"user_id", "production_playlist_id"}))
public class PlaylistPair extends PanacheEntityBase {

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
            name = "production_playlist_id",
            nullable = false,
            length = 64)
    public String productionPlaylistId;

    @Column(
            name = "production_playlist_name")
    public String productionPlaylistName;

    @Column(
            name = "archive_playlist_id",
            nullable = false,
            length = 64)
    public String archivePlaylistId;

    @Column(
            name = "archive_playlist_name")
    public String archivePlaylistName;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * The archive pairing for a production playlist, if the user created one.
     */
    public static Optional<PlaylistPair> findByProduction(Long userId, String productionPlaylistId) {
        return find("userId = ?1 and productionPlaylistId = ?2", userId, productionPlaylistId).firstResultOptional();
    }
}
