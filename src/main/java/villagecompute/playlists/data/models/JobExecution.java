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
import jakarta.persistence.Index;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;

/**
 * One audited run of a {@link Schedule}. Created as RUNNING when the run starts and finalized exactly once.
 *
 * <p>
 * A row left in RUNNING means the process died mid-run; nothing repairs it.
 */
@Entity
@Table(
        name = "job_executions",
        indexes = @Index(
                name = "idx_job_executions_schedule_started",
                columnList = "schedule_id, started_at"))
@NamedQuery(
        name = JobExecution.QUERY_FIND_BY_SCHEDULE,
        query = "FROM JobExecution WHERE scheduleId = :scheduleId ORDER BY startedAt DESC, id DESC")
public class JobExecution extends PanacheEntityBase {

    public static final String QUERY_FIND_BY_SCHEDULE = "JobExecution.findBySchedule";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "schedule_id",
            nullable = false)
    public Long scheduleId;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            nullable = false,
            length = 16)
    @Enumerated(EnumType.STRING)
    public ExecutionStatus status;

    @Column(
            name = "tracks_added",
            nullable = false)
    public int tracksAdded;

    @Column(
            name = "tracks_total",
            nullable = false)
    public int tracksTotal;

    @Column(
            name = "error_message",
            length = Schedule.ERROR_MAX_LENGTH)
    public String errorMessage;

    /**
     * Most recent executions of a schedule, newest first.
     *
     * @param scheduleId
     *            schedule primary key
     * @param limit
     *            maximum rows to return
     */
    public static List<JobExecution> findBySchedule(Long scheduleId, int limit) {
        return find("#" + QUERY_FIND_BY_SCHEDULE, Parameters.with("scheduleId", scheduleId)).page(0, limit).list();
    }

    public static long deleteBySchedule(Long scheduleId) {
        return delete("scheduleId", scheduleId);
    }
}
