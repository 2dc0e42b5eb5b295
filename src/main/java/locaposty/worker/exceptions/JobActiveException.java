package locaposty.worker.exceptions;

/**
 * Exception thrown when a job cannot be replaced because a worker is executing it.
 */
public class JobActiveException extends RuntimeException {

    private final String jobKey;

    public JobActiveException(String jobKey) {
        super("Job " + jobKey + " is being processed and cannot be replaced");
        this.jobKey = jobKey;
    }

    public String getJobKey() {
        return jobKey;
    }
}
