package locaposty.worker.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import locaposty.worker.api.types.GbpTokenResponseType;
import locaposty.worker.data.models.Location;
import locaposty.worker.exceptions.LocationAuthException;
import locaposty.worker.exceptions.OAuthClientRejectedException;
import locaposty.worker.exceptions.RefreshTokenRevokedException;
import locaposty.worker.exceptions.ResourceNotFoundException;
import locaposty.worker.integration.gbp.GbpOAuthClient;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out a valid bearer token for a location, refreshing it through the OAuth refresh_token grant when needed.
 *
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 * <li>Load the location ({@link ResourceNotFoundException} if missing)</li>
 * <li>No refresh token: {@link LocationAuthException} without any network call</li>
 * <li>Cached access token valid beyond the expiry margin: return it as is</li>
 * <li>Otherwise refresh, persist the new triple, return the new token</li>
 * <li>Refresh token revoked ({@code invalid_grant}): clear all three credential fields so later attempts fail fast,
 * then {@link LocationAuthException}</li>
 * </ol>
 * Every other token-endpoint failure (client misconfiguration, 5xx, network) propagates unchanged and leaves the
 * credentials alone.
 *
 * <p>
 * The read-check-refresh-write sequence is serialized per location within this process, so two publishes for the same
 * location never refresh twice or overwrite a fresher token with an older one. A location's lock is dropped once no
 * caller holds or waits for it.
 */
@ApplicationScoped
public class CredentialRefresher {

    private static final Logger LOG = Logger.getLogger(CredentialRefresher.class);

    @Inject
    LocationCredentialStore locationStore;

    @Inject
    GbpOAuthClient oauthClient;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "locaposty.token.expiry-margin-seconds",
            defaultValue = "300")
    long expiryMarginSeconds;

    @ConfigProperty(
            name = "locaposty.token.default-lifetime-seconds",
            defaultValue = "3600")
    long defaultLifetimeSeconds;

    private final Map<String, LocationLock> locationLocks = new ConcurrentHashMap<>();

    /**
     * Returns an access token that stays valid for at least the expiry margin.
     *
     * @param locationId
     *            the location to authenticate as
     * @return bearer token
     * @throws ResourceNotFoundException
     *             if the location does not exist
     * @throws LocationAuthException
     *             if the location has no usable refresh token
     */
    public String getValidToken(String locationId) {
        LocationLock lock = acquire(locationId);
        try {
            Location location = locationStore.findById(locationId)
                    .orElseThrow(() -> new ResourceNotFoundException("Location " + locationId + " not found"));

            if (location.refreshToken == null || location.refreshToken.isBlank()) {
                throw new LocationAuthException(
                        "Location " + locationId + " has no refresh token, reconnect it to Google Business Profile");
            }

            Instant now = clock.instant();
            if (location.accessToken != null && location.tokenExpiresAt != null
                    && location.tokenExpiresAt.isAfter(now.plusSeconds(expiryMarginSeconds))) {
                return location.accessToken;
            }

            return refresh(location, now);
        } finally {
            release(locationId, lock);
        }
    }

    /**
     * Drops the cached access token of a location so the next {@link #getValidToken} refreshes it. The refresh token
     * is kept.
     */
    public void invalidateAccessToken(String locationId) {
        LocationLock lock = acquire(locationId);
        try {
            locationStore.findById(locationId).ifPresent(location -> {
                locationStore.updateTokens(locationId, new LocationTokens(null, location.refreshToken, null),
                        clock.instant());
                LOG.infof("Dropped cached access token for location %s", locationId);
            });
        } finally {
            release(locationId, lock);
        }
    }

    int activeLockCount() {
        return locationLocks.size();
    }

    // Holder count is only touched inside compute, which runs atomically per key.
    private LocationLock acquire(String locationId) {
        LocationLock lock = locationLocks.compute(locationId, (id, existing) -> {
            LocationLock l = existing != null ? existing : new LocationLock();
            l.holders++;
            return l;
        });
        lock.mutex.lock();
        return lock;
    }

    private void release(String locationId, LocationLock lock) {
        lock.mutex.unlock();
        locationLocks.computeIfPresent(locationId, (id, existing) -> --existing.holders == 0 ? null : existing);
    }

    private String refresh(Location location, Instant now) {
        LOG.infof("Refreshing access token for location %s (expired at %s)", location.id, location.tokenExpiresAt);

        GbpTokenResponseType token;
        try {
            token = oauthClient.refreshAccessToken(location.refreshToken);
        } catch (RefreshTokenRevokedException e) {
            locationStore.updateTokens(location.id, LocationTokens.cleared(), now);
            countRefresh("revoked");
            LOG.warnf("Cleared revoked credentials for location %s: %s", location.id, e.getMessage());
            throw new LocationAuthException("Google Business Profile access for location " + location.id
                    + " was revoked, reconnect the location", e);
        } catch (OAuthClientRejectedException e) {
            countRefresh("rejected");
            throw e;
        } catch (RuntimeException e) {
            countRefresh("failure");
            throw e;
        }

        long lifetime = token.expiresIn() != null ? token.expiresIn() : defaultLifetimeSeconds;
        Instant expiresAt = now.plusSeconds(lifetime);
        String refreshToken = token.refreshToken() != null ? token.refreshToken() : location.refreshToken;

        locationStore.updateTokens(location.id, new LocationTokens(token.accessToken(), refreshToken, expiresAt), now);
        countRefresh("success");
        LOG.infof("Refreshed access token for location %s (expires: %s)", location.id, expiresAt);
        return token.accessToken();
    }

    private void countRefresh(String status) {
        Counter.builder("locaposty.token.refresh.total").tag("status", status).register(meterRegistry).increment();
    }

    private static final class LocationLock {
        final ReentrantLock mutex = new ReentrantLock();
        int holders;
    }
}
