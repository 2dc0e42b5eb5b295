package locaposty.worker.exceptions;

import locaposty.worker.jobs.RetryPolicy;

/**
 * Exception thrown when a location has no Google Business Profile account or location id.
 */
public class LocationConfigurationException extends PublishException {

    public LocationConfigurationException(String message) {
        super(message, FailureReason.CONFIGURATION, RetryPolicy.NEVER);
    }
}
