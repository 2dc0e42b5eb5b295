package locaposty.worker.jobs;

import locaposty.worker.exceptions.InvalidPostRequestException;
import locaposty.worker.exceptions.LocationAuthException;
import locaposty.worker.exceptions.ProviderServerException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RetryPolicyTest {

    @Test
    void testAttemptLimit_perPolicy() {
        assertEquals(1, RetryPolicy.NEVER.attemptLimit(3));
        assertEquals(2, RetryPolicy.ONCE.attemptLimit(3));
        assertEquals(1, RetryPolicy.ONCE.attemptLimit(1));
        assertEquals(3, RetryPolicy.BACKOFF.attemptLimit(3));
    }

    @Test
    void testOf_undeclaredFailure_backoff() {
        assertEquals(RetryPolicy.BACKOFF, RetryPolicy.of(new IllegalStateException("boom")));
    }

    @Test
    void testOf_declaredFailure_usesDeclaredPolicy() {
        assertEquals(RetryPolicy.NEVER, RetryPolicy.of(new InvalidPostRequestException("bad summary", 400)));
        assertEquals(RetryPolicy.NEVER, RetryPolicy.of(new LocationAuthException("no refresh token")));
        assertEquals(RetryPolicy.ONCE,
                RetryPolicy.of(new LocationAuthException("rejected", RetryPolicy.ONCE)));
        assertEquals(RetryPolicy.BACKOFF, RetryPolicy.of(new ProviderServerException("unavailable", 503)));
    }
}
