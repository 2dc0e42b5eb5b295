package locaposty.worker.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Business location connected to a Google Business Profile account.
 *
 * <p>
 * Rows are created and owned by the web application's Prisma schema. The worker only reads the provider identifiers and
 * maintains the OAuth credential triple ({@code accessToken}, {@code refreshToken}, {@code tokenExpiresAt}), which is
 * always written as a whole through {@link locaposty.worker.services.LocationCredentialStore#updateTokens}. Columns the
 * worker does not use (address, review settings and so on) are left unmapped.
 *
 * <p>
 * <b>Schema Mapping</b> (table {@code "Location"}, quoted camelCase identifiers):
 * <ul>
 * <li>{@code id} (TEXT, PK) - Opaque identifier assigned by the web application</li>
 * <li>{@code name} (TEXT) - Display name</li>
 * <li>{@code gmbAccountId} (TEXT) - Provider account id, bare or {@code accounts/}-prefixed</li>
 * <li>{@code gmbLocationId} (TEXT) - Provider location id, bare or {@code locations/}-prefixed</li>
 * <li>{@code accessToken} (TEXT) - Current OAuth access token (never logged)</li>
 * <li>{@code refreshToken} (TEXT) - Long-lived OAuth refresh token (never logged)</li>
 * <li>{@code tokenExpiresAt} (TIMESTAMP) - Access token expiry</li>
 * <li>{@code updatedAt} (TIMESTAMP) - Last modification timestamp</li>
 * </ul>
 */
@Entity
@Table(
        name = "Location")
public class Location extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public String id;

    @Column(
            name = "name")
    public String name;

    @Column(
            name = "gmbAccountId")
    public String gmbAccountId;

    @Column(
            name = "gmbLocationId")
    public String gmbLocationId;

    @Column(
            name = "accessToken")
    public String accessToken;

    @Column(
            name = "refreshToken")
    public String refreshToken;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "tokenExpiresAt")
    public Instant tokenExpiresAt;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "updatedAt")
    public Instant updatedAt;

    /**
     * Returns true when the location can be addressed on the provider API.
     */
    public boolean hasProviderIdentifiers() {
        return gmbAccountId != null && !gmbAccountId.isBlank() && gmbLocationId != null && !gmbLocationId.isBlank();
    }
}
