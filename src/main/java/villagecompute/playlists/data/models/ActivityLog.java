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
import java.util.List;
import java.util.Map;

/**
 * User-facing activity feed entry. Writes are best effort and never fail the operation being logged.
 */
@Entity
@Table(
        name = "activity_log")
@NamedQuery(
        name = ActivityLog.QUERY_FIND_RECENT_BY_USER,
        query = "FROM ActivityLog WHERE userId = :userId ORDER BY createdAt DESC, id DESC")
public class ActivityLog extends PanacheEntityBase {

    public static final String QUERY_FIND_RECENT_BY_USER = "ActivityLog.findRecentByUser";

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
            name = "activity_type",
            nullable = false,
            length = 32)
    @Enumerated(EnumType.STRING)
    public ActivityType activityType;

    @Column(
            nullable = false,
            length = 500)
    public String description;

    @Column(
            name = "playlist_id",
            length = 64)
    public String playlistId;

    @Column(
            name = "playlist_name")
    public String playlistName;

    @Column(
            name = "metadata")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static List<ActivityLog> findRecentByUser(Long userId, int limit) {
        return find("#" + QUERY_FIND_RECENT_BY_USER, Parameters.with("userId", userId)).page(0, limit).list();
    }
}
