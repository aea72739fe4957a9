package villagecompute.playlists.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Spotify account linked to this service. Only the fields background jobs need are mapped here.
 *
 * <p>
 * {@code encrypted_refresh_token} holds the TokenService ciphertext of the long-lived refresh token. It is replaced
 * whenever Spotify rotates the token during a refresh. Never log it.
 */
@Entity
@Table(
        name = "users")
public class User extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "spotify_id",
            nullable = false,
            unique = true,
            length = 128)
    public String spotifyId;

    @Column(
            name = "display_name")
    public String displayName;

    @Column(
            name = "email")
    public String email;

    @Column(
            name = "encrypted_refresh_token",
            length = 2048)
    public String encryptedRefreshToken;

    @Column(
            name = "last_login_at")
    public Instant lastLoginAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;
}
