package locaposty.worker.jobs;

/**
 * Implemented by failures that know whether retrying can succeed.
 */
public interface RetryAware {

    RetryPolicy retryPolicy();
}
