package locaposty.worker.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import locaposty.worker.jobs.JobType;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Panache entity backing the durable job queue.
 *
 * <p>
 * Workers poll this table for ready jobs and claim them with {@code locked_at}/{@code locked_by}. A job is addressed
 * by its deterministic key (for publish jobs {@code post-{postId}}). The key is stored in {@code active_key} only while
 * the job is live (PENDING or PROCESSING) and nulled when it finishes, so the unique constraint allows at most one
 * live job per key while finished rows stay around for inspection.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK) - Primary identifier</li>
 * <li>{@code job_key} (TEXT) - Deterministic key, kept after completion</li>
 * <li>{@code active_key} (TEXT, UNIQUE) - Copy of job_key while live, NULL once finished</li>
 * <li>{@code job_type} (TEXT) - JobType enum value</li>
 * <li>{@code subject_id} (TEXT) - Entity the job acts on (post id for publish jobs)</li>
 * <li>{@code requested_by} (TEXT) - Audit identity of the requester, nullable</li>
 * <li>{@code status} (TEXT) - PENDING, PROCESSING, COMPLETED, FAILED</li>
 * <li>{@code attempts} (INT) - Started attempts</li>
 * <li>{@code max_attempts} (INT) - Attempt limit before FAILED</li>
 * <li>{@code scheduled_at} (TIMESTAMPTZ) - Earliest execution time (also used for backoff)</li>
 * <li>{@code locked_at} / {@code locked_by} (TIMESTAMPTZ / TEXT) - Claim by a worker (hostname:pid)</li>
 * <li>{@code completed_at} / {@code failed_at} (TIMESTAMPTZ) - Terminal timestamps</li>
 * <li>{@code last_error} (TEXT) - Error message from the last failed attempt</li>
 * </ul>
 *
 * @see locaposty.worker.jobs.JobStore for queue operations
 * @see locaposty.worker.services.DelayedJobService for job orchestration
 */
@Entity
@Table(
        name = "delayed_jobs",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_delayed_jobs_active_key",
                columnNames = "active_key"))
public class DelayedJob extends PanacheEntityBase {

    public static final String PAYLOAD_SUBJECT_ID = "subjectId";
    public static final String PAYLOAD_REQUESTED_BY = "requestedBy";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "job_key",
            nullable = false)
    public String jobKey;

    @Column(
            name = "active_key")
    public String activeKey;

    @Column(
            name = "job_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobType jobType;

    @Column(
            name = "subject_id",
            nullable = false)
    public String subjectId;

    @Column(
            name = "requested_by")
    public String requestedBy;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "attempts",
            nullable = false)
    public int attempts;

    @Column(
            name = "max_attempts",
            nullable = false)
    public int maxAttempts;

    @Column(
            name = "scheduled_at",
            nullable = false)
    public Instant scheduledAt;

    @Column(
            name = "locked_at")
    public Instant lockedAt;

    @Column(
            name = "locked_by")
    public String lockedBy;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "failed_at")
    public Instant failedAt;

    @Column(
            name = "last_error",
            length = 4096)
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
     * Job lifecycle statuses.
     */
    public enum JobStatus {
        /**
         * Job created or waiting for a retry, not yet claimed.
         */
        PENDING,

        /**
         * Job claimed by a worker and executing.
         */
        PROCESSING,

        /**
         * Job completed successfully.
         */
        COMPLETED,

        /**
         * Job failed after exhausting its attempts (dead).
         */
        FAILED;

        public boolean isLive() {
            return this == PENDING || this == PROCESSING;
        }
    }

    /**
     * Builds the handler payload from the job columns.
     */
    public Map<String, Object> payload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put(PAYLOAD_SUBJECT_ID, subjectId);
        if (requestedBy != null) {
            payload.put(PAYLOAD_REQUESTED_BY, requestedBy);
        }
        return payload;
    }
}
