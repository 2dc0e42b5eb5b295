package locaposty.worker.integration.gbp;

import io.quarkus.rest.client.reactive.ClientExceptionMapper;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import locaposty.worker.api.types.GbpTokenResponseType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the Google OAuth 2.0 token endpoint.
 *
 * <p>
 * The base URL is configured as {@code quarkus.rest-client.google-oauth.url}.
 *
 * <p>
 * See: https://developers.google.com/identity/protocols/oauth2/web-server#offline
 */
@RegisterRestClient(
        configKey = "google-oauth")
@Path("/")
public interface GbpOAuthRestClient {

    /**
     * Exchange a refresh token for a new access token.
     *
     * <p>
     * Calls POST https://oauth2.googleapis.com/token with form-encoded parameters per RFC 6749 Section 6.
     *
     * @param grantType
     *            always "refresh_token"
     * @param refreshToken
     *            the stored refresh token
     * @param clientId
     *            Business Profile OAuth client ID
     * @param clientSecret
     *            Business Profile OAuth client secret
     * @return token response with access_token, expires_in and, when rotated, refresh_token
     * @throws TokenEndpointException
     *             for any status of 400 or above
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    GbpTokenResponseType refreshToken(@FormParam("grant_type") String grantType,
            @FormParam("refresh_token") String refreshToken, @FormParam("client_id") String clientId,
            @FormParam("client_secret") String clientSecret);

    @ClientExceptionMapper
    static TokenEndpointException toException(Response response) {
        String body = response.hasEntity() ? response.readEntity(String.class) : null;
        return new TokenEndpointException(response.getStatus(), body);
    }
}
