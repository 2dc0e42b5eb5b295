package locaposty.worker.exceptions;

/**
 * Exception thrown when scheduling a job whose key already belongs to a live job.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class DuplicateJobException extends RuntimeException {

    private final String jobKey;

    public DuplicateJobException(String jobKey) {
        super("A live job already exists for key " + jobKey);
        this.jobKey = jobKey;
    }

    public DuplicateJobException(String jobKey, Throwable cause) {
        super("A live job already exists for key " + jobKey, cause);
        this.jobKey = jobKey;
    }

    public String getJobKey() {
        return jobKey;
    }
}
