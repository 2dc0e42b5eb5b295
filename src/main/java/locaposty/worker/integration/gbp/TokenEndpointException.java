package locaposty.worker.integration.gbp;

/**
 * Error response from the OAuth token endpoint, before it is classified by {@link GbpOAuthClient}.
 */
public class TokenEndpointException extends RuntimeException {

    private final int status;
    private final String body;

    public TokenEndpointException(int status, String body) {
        super("OAuth token endpoint returned status " + status);
        this.status = status;
        this.body = body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }
}
