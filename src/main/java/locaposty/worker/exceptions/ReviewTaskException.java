package locaposty.worker.exceptions;

/**
 * Exception thrown when a periodic review task call to the web application fails.
 */
public class ReviewTaskException extends RuntimeException {

    public ReviewTaskException(String message) {
        super(message);
    }

    public ReviewTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
