package locaposty.worker.jobs;

import locaposty.worker.data.models.DelayedJob;
import locaposty.worker.data.models.DelayedJob.JobStatus;
import locaposty.worker.exceptions.DuplicateJobException;
import locaposty.worker.exceptions.JobActiveException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage seam under the job queue.
 *
 * <p>
 * At most one live (PENDING or PROCESSING) job exists per key. The terminal writes ({@link #complete},
 * {@link #retry}, {@link #fail}) only apply while the job is still PROCESSING under the given worker's claim, so a
 * worker whose claim was taken over after a stall cannot overwrite the new owner's state.
 */
public interface JobStore {

    Optional<DelayedJob> findById(Long jobId);

    /**
     * Returns the live job holding the key, if any.
     */
    Optional<DelayedJob> findLive(String jobKey);

    /**
     * Inserts a PENDING job.
     *
     * @throws DuplicateJobException
     *             if a live job already holds the key
     */
    DelayedJob insert(NewJob newJob, Instant now);

    /**
     * Removes the PENDING job holding the key and inserts the replacement in one transaction.
     *
     * @throws JobActiveException
     *             if the live job is PROCESSING
     */
    DelayedJob replacePending(NewJob newJob, Instant now);

    /**
     * Deletes the PENDING job holding the key.
     *
     * @return true if a job was deleted
     */
    boolean removePending(String jobKey);

    /**
     * Claims up to {@code limit} jobs that are PENDING and due, or PROCESSING with a claim older than
     * {@code staleBefore}. Each claimed job is moved to PROCESSING and its attempt counter incremented.
     */
    List<DelayedJob> claimReady(Instant now, Instant staleBefore, String workerId, int limit);

    boolean complete(Long jobId, String workerId, Instant now);

    boolean retry(Long jobId, String workerId, Instant runAt, String error, Instant now);

    boolean fail(Long jobId, String workerId, String error, Instant now);

    long countByStatus(JobStatus status);
}
