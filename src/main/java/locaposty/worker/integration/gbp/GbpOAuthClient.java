package locaposty.worker.integration.gbp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import locaposty.worker.api.types.GbpTokenResponseType;
import locaposty.worker.exceptions.OAuthClientRejectedException;
import locaposty.worker.exceptions.ProviderNetworkException;
import locaposty.worker.exceptions.ProviderServerException;
import locaposty.worker.exceptions.PublishException;
import locaposty.worker.exceptions.RefreshTokenRevokedException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Client for the Google OAuth 2.0 token endpoint, refresh_token grant only.
 *
 * <p>
 * Uses the Business Profile client credentials ({@code GOOGLE_CLIENT_ID_GMB} / {@code GOOGLE_CLIENT_SECRET_GMB}),
 * which are distinct from the web application's sign-in client.
 *
 * <p>
 * <b>Failure mapping:</b>
 * <ul>
 * <li>{@code invalid_grant} - {@link RefreshTokenRevokedException}, the refresh token is unusable</li>
 * <li>any other 4xx (e.g. {@code invalid_client}) - {@link OAuthClientRejectedException}, the location's tokens are
 * not at fault</li>
 * <li>429/5xx, or a 200 without {@code access_token} - {@link ProviderServerException}</li>
 * <li>no response - {@link ProviderNetworkException}</li>
 * </ul>
 */
@ApplicationScoped
public class GbpOAuthClient {

    private static final Logger LOG = Logger.getLogger(GbpOAuthClient.class);

    static final String INVALID_GRANT = "invalid_grant";

    @ConfigProperty(
            name = "locaposty.gbp.oauth.client-id")
    String clientId;

    @ConfigProperty(
            name = "locaposty.gbp.oauth.client-secret")
    String clientSecret;

    @Inject
    @RestClient
    GbpOAuthRestClient restClient;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Exchanges a refresh token for a new access token.
     *
     * @param refreshToken
     *            the stored refresh token
     * @return token response with a non-blank access token
     */
    public GbpTokenResponseType refreshAccessToken(String refreshToken) {
        GbpTokenResponseType token;
        try {
            token = restClient.refreshToken("refresh_token", refreshToken, clientId, clientSecret);
        } catch (TokenEndpointException e) {
            throw classify(e);
        } catch (ProcessingException e) {
            throw new ProviderNetworkException("OAuth token endpoint unreachable: " + e.getMessage(), e);
        }

        if (token == null || token.accessToken() == null || token.accessToken().isBlank()) {
            throw new ProviderServerException("OAuth token response did not contain an access token", 200);
        }
        return token;
    }

    private PublishException classify(TokenEndpointException e) {
        int status = e.getStatus();
        if (status == 429 || status >= 500) {
            LOG.warnf("OAuth token endpoint returned %d", status);
            return new ProviderServerException("OAuth token endpoint returned status " + status, status);
        }

        String error = errorCode(e.getBody());
        if (INVALID_GRANT.equals(error)) {
            LOG.warnf("OAuth token endpoint rejected refresh token: %d %s", status, error);
            return new RefreshTokenRevokedException("Refresh token rejected (" + status + " " + error + ")");
        }
        LOG.errorf("OAuth token endpoint rejected client request: %d %s, check locaposty.gbp.oauth.*", status, error);
        return new OAuthClientRejectedException(status, error);
    }

    private String errorCode(String body) {
        if (body == null || body.isBlank()) {
            return "no body";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root.hasNonNull("error")) {
                return root.get("error").asText();
            }
        } catch (IOException e) {
            LOG.debugf("OAuth error body is not JSON: %s", e.getMessage());
        }
        return "unparseable body";
    }
}
