package locaposty.worker.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Google OAuth 2.0 token response for the refresh_token grant.
 *
 * <p>
 * Returned by POST https://oauth2.googleapis.com/token.
 *
 * @param accessToken
 *            the new access token
 * @param expiresIn
 *            token lifetime in seconds, null when the provider omits it
 * @param refreshToken
 *            rotated refresh token, usually absent
 * @param scope
 *            the granted scopes (space-separated)
 * @param tokenType
 *            token type (always "Bearer")
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record GbpTokenResponseType(@JsonProperty("access_token") String accessToken,
        @JsonProperty("expires_in") Integer expiresIn, @JsonProperty("refresh_token") String refreshToken, String scope,
        @JsonProperty("token_type") String tokenType) {

    @Override
    public String toString() {
        return "GbpTokenResponseType[expiresIn=" + expiresIn + ", scope=" + scope + ", tokenType=" + tokenType + "]";
    }
}
