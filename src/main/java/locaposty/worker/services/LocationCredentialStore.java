package locaposty.worker.services;

import locaposty.worker.data.models.Location;

import java.time.Instant;
import java.util.Optional;

/**
 * The worker's view of the location table: provider ids and OAuth credentials.
 */
public interface LocationCredentialStore {

    Optional<Location> findById(String locationId);

    /**
     * Replaces the access token, refresh token and expiry of a location in one write.
     *
     * @return true if the location exists
     */
    boolean updateTokens(String locationId, LocationTokens tokens, Instant updatedAt);
}
