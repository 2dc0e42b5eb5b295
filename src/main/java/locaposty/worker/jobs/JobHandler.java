package locaposty.worker.jobs;

import java.util.Map;

/**
 * Contract for async job handler implementations.
 *
 * <p>
 * Handlers are CDI beans annotated with {@code @ApplicationScoped}. The
 * {@link locaposty.worker.services.DelayedJobService} discovers them at startup and routes jobs by {@link JobType}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Handlers run on the worker pool, at most {@code locaposty.worker.concurrency} at a time</li>
 * <li>Thrown exceptions are classified by {@link RetryPolicy#of(Throwable)}; retries use exponential backoff</li>
 * <li>When a job dies, {@link #onExhausted} runs exactly once</li>
 * </ul>
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes one attempt of the job.
     *
     * <p>
     * <b>Thread Safety:</b> May be called concurrently for different jobs.
     *
     * @param jobId
     *            the database primary key from {@code delayed_jobs.id}
     * @param payload
     *            job parameters, see {@link locaposty.worker.data.models.DelayedJob#payload()}
     * @throws Exception
     *             any error during execution; triggers retry logic
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;

    /**
     * Called once after the final attempt of a job failed and the job was moved to FAILED.
     *
     * @param jobId
     *            the dead job
     * @param payload
     *            job parameters
     * @param lastFailure
     *            the error of the final attempt
     */
    default void onExhausted(Long jobId, Map<String, Object> payload, Throwable lastFailure) {
    }
}
