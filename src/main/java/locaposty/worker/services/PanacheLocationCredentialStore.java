package locaposty.worker.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import locaposty.worker.data.models.Location;

import java.time.Instant;
import java.util.Optional;

/**
 * {@link LocationCredentialStore} backed by the {@code locations} table.
 */
@ApplicationScoped
public class PanacheLocationCredentialStore implements LocationCredentialStore {

    @Override
    @Transactional
    public Optional<Location> findById(String locationId) {
        return Location.findByIdOptional(locationId);
    }

    @Override
    @Transactional
    public boolean updateTokens(String locationId, LocationTokens tokens, Instant updatedAt) {
        return Location.update(
                "accessToken = ?1, refreshToken = ?2, tokenExpiresAt = ?3, updatedAt = ?4 where id = ?5",
                tokens.accessToken(), tokens.refreshToken(), tokens.expiresAt(), updatedAt, locationId) > 0;
    }
}
