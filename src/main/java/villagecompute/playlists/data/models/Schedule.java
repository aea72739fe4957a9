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
import villagecompute.playlists.jobs.JobType;
import villagecompute.playlists.jobs.ScheduleType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A user's recurring playlist job: what to run, against which playlist, and how often.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGINT, PK) - Primary identifier, also the scheduler job identity suffix</li>
 * <li>{@code user_id} (BIGINT) - Owning user</li>
 * <li>{@code job_type} (TEXT) - {@link JobType} name</li>
 * <li>{@code target_playlist_id} / {@code target_playlist_name} - Playlist the job mutates</li>
 * <li>{@code source_playlist_ids} (JSON) - Raid inputs, may be empty</li>
 * <li>{@code algorithm_name} / {@code algorithm_params} (JSON) - Shuffle algorithm and its parameters; rotate
 * settings ({@code rotation_mode}, {@code rotation_count}) also live in the params</li>
 * <li>{@code schedule_type} / {@code schedule_value} - Interval token or 5-field cron string</li>
 * <li>{@code is_enabled} - Disabled schedules are never registered with the scheduler</li>
 * <li>{@code last_run_at} / {@code last_status} / {@code last_error} - Outcome of the latest run</li>
 * </ul>
 *
 * @see JobExecution for per-run history
 */
@Entity
@Table(
        name = "schedules")
@NamedQuery(
        name = Schedule.QUERY_FIND_ENABLED,
        query = "FROM Schedule WHERE enabled = true ORDER BY id")
@NamedQuery(
        name = Schedule.QUERY_FIND_BY_USER,
        query = "FROM Schedule WHERE userId = :userId ORDER BY createdAt DESC, id DESC")
public class Schedule extends PanacheEntityBase {

    public static final String QUERY_FIND_ENABLED = "Schedule.findEnabled";
    public static final String QUERY_FIND_BY_USER = "Schedule.findByUser";

    /** Width of the error columns here and on {@link JobExecution}; failure messages are truncated to fit. */
    public static final int ERROR_MAX_LENGTH = 1000;

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
            name = "job_type",
            nullable = false,
            length = 32)
    @Enumerated(EnumType.STRING)
    public JobType jobType;

    @Column(
            name = "target_playlist_id",
            nullable = false,
            length = 64)
    public String targetPlaylistId;

    @Column(
            name = "target_playlist_name")
    public String targetPlaylistName;

    @Column(
            name = "source_playlist_ids")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> sourcePlaylistIds = new ArrayList<>();

    @Column(
            name = "algorithm_name",
            length = 64)
    public String algorithmName;

    @Column(
            name = "algorithm_params")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> algorithmParams = new HashMap<>();

    @Column(
            name = "schedule_type",
            nullable = false,
            length = 16)
    @Enumerated(EnumType.STRING)
    public ScheduleType scheduleType;

    @Column(
            name = "schedule_value",
            nullable = false,
            length = 100)
    public String scheduleValue;

    @Column(
            name = "is_enabled",
            nullable = false)
    public boolean enabled = true;

    @Column(
            name = "last_run_at")
    public Instant lastRunAt;

    @Column(
            name = "last_status",
            length = 16)
    @Enumerated(EnumType.STRING)
    public ExecutionStatus lastStatus;

    @Column(
            name = "last_error",
            length = ERROR_MAX_LENGTH)
    public String lastError;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Target name for log lines and snapshots, falling back to the id when the name was never captured.
     */
    public String targetDisplayName() {
        return targetPlaylistName != null && !targetPlaylistName.isBlank() ? targetPlaylistName : targetPlaylistId;
    }

    public List<String> sourceIds() {
        return sourcePlaylistIds == null ? List.of() : sourcePlaylistIds;
    }

    public Map<String, Object> params() {
        return algorithmParams == null ? Map.of() : algorithmParams;
    }

    /**
     * All schedules the registrar should have a trigger for.
     */
    public static List<Schedule> findEnabled() {
        return find("#" + QUERY_FIND_ENABLED).list();
    }

    /**
     * A user's schedules, newest first.
     */
    public static List<Schedule> findByUser(Long userId) {
        if (userId == null) {
            return List.of();
        }
        return find("#" + QUERY_FIND_BY_USER, Parameters.with("userId", userId)).list();
    }

    public static long countByUser(Long userId) {
        return count("userId", userId);
    }

    public static Optional<Schedule> findByIdAndUser(Long id, Long userId) {
        if (id == null || userId == null) {
            return Optional.empty();
        }
        return find("id = ?1 and userId = ?2", id, userId).firstResultOptional();
    }
}
