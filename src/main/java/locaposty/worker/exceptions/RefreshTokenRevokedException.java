package locaposty.worker.exceptions;

/**
 * Exception thrown when the token endpoint answers {@code invalid_grant}: the refresh token was revoked or has
 * expired and only a reconnect restores access. Final.
 */
public class RefreshTokenRevokedException extends LocationAuthException {

    public RefreshTokenRevokedException(String message) {
        super(message);
    }
}
