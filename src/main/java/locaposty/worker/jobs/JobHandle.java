package locaposty.worker.jobs;

import locaposty.worker.data.models.DelayedJob;
import locaposty.worker.data.models.DelayedJob.JobStatus;

import java.time.Instant;

/**
 * Read-only view of a queued job.
 *
 * @param jobId
 *            database id
 * @param jobKey
 *            deterministic key, e.g. {@code post-abc}
 * @param subjectId
 *            entity the job acts on
 * @param runAt
 *            earliest next execution time
 * @param status
 *            lifecycle status
 * @param attempts
 *            attempts started so far
 * @param lastError
 *            message of the last failed attempt, or null
 */
public record JobHandle(Long jobId, String jobKey, String subjectId, Instant runAt, JobStatus status, int attempts,
        String lastError) {

    public static JobHandle of(DelayedJob job) {
        return new JobHandle(job.id, job.jobKey, job.subjectId, job.scheduledAt, job.status, job.attempts,
                job.lastError);
    }
}
