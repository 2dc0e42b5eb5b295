package locaposty.worker.services;

import java.time.Instant;

/**
 * The OAuth credential triple of a location. Always written as a whole.
 */
public record LocationTokens(String accessToken, String refreshToken, Instant expiresAt) {

    /**
     * Credentials of a location that has to be reconnected.
     */
    public static LocationTokens cleared() {
        return new LocationTokens(null, null, null);
    }

    @Override
    public String toString() {
        return "LocationTokens[accessToken=" + (accessToken == null ? "null" : "***") + ", refreshToken="
                + (refreshToken == null ? "null" : "***") + ", expiresAt=" + expiresAt + "]";
    }
}
