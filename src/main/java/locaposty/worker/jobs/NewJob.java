package locaposty.worker.jobs;

import java.time.Instant;

/**
 * Parameters for inserting a job into the queue.
 */
public record NewJob(JobType type, String subjectId, String requestedBy, Instant runAt, int maxAttempts) {

    public String jobKey() {
        return type.keyFor(subjectId);
    }
}
