package locaposty.worker.integration.gbp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import locaposty.worker.api.types.LocalPostRequestType;
import locaposty.worker.api.types.LocalPostResponseType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the Google Business Profile (My Business v4) local posts endpoint.
 *
 * <p>
 * Never throws for HTTP or transport failures: every outcome is returned as a {@link PublishResult} so the caller can
 * classify it exhaustively.
 */
@ApplicationScoped
public class BusinessProfileClient {

    private static final Logger LOG = Logger.getLogger(BusinessProfileClient.class);

    private static final String ACCOUNT_PREFIX = "accounts/";
    private static final String LOCATION_PREFIX = "locations/";
    private static final int MAX_MESSAGE_LENGTH = 500;

    @ConfigProperty(
            name = "locaposty.gbp.api-url",
            defaultValue = "https://mybusiness.googleapis.com/v4")
    String apiUrl;

    @ConfigProperty(
            name = "locaposty.http.timeout-seconds",
            defaultValue = "20")
    int timeoutSeconds;

    @Inject
    ObjectMapper objectMapper;

    private HttpClient httpClient;

    @PostConstruct
    void init() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(timeoutSeconds)).build();
    }

    /**
     * Creates a local post.
     *
     * @param accountId
     *            provider account id, with or without the {@code accounts/} prefix
     * @param locationId
     *            provider location id, with or without the {@code locations/} prefix
     * @param accessToken
     *            bearer token
     * @param body
     *            the post payload
     * @return classified outcome
     */
    public PublishResult createLocalPost(String accountId, String locationId, String accessToken,
            LocalPostRequestType body) {
        String url = localPostsUrl(accountId, locationId);

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return PublishResult.failure(400, "Could not serialize post payload: " + e.getOriginalMessage());
        }

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(Duration.ofSeconds(timeoutSeconds))
                .header("Authorization", "Bearer " + accessToken).header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json)).build();

        LOG.debugf("Sending local post to %s", url);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.warnf("Business Profile API unreachable: %s", e.toString());
            return PublishResult.networkFailure(e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PublishResult.networkFailure("Interrupted while publishing");
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return PublishResult.success(status, postName(response.body()));
        }
        return PublishResult.failure(status, "Business Profile API error (" + status + "): "
                + errorMessage(response.body()));
    }

    String localPostsUrl(String accountId, String locationId) {
        return String.format("%s/accounts/%s/locations/%s/localPosts", apiUrl, stripPrefix(accountId, ACCOUNT_PREFIX),
                stripPrefix(locationId, LOCATION_PREFIX));
    }

    /**
     * Removes a leading resource-name segment such as {@code accounts/} from a stored id.
     */
    public static String stripPrefix(String id, String prefix) {
        return id.startsWith(prefix) ? id.substring(prefix.length()) : id;
    }

    private String postName(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, LocalPostResponseType.class).name();
        } catch (IOException e) {
            LOG.debugf("Local post response is not JSON: %s", e.getMessage());
            return null;
        }
    }

    /**
     * Extracts {@code error.message} from a Google error body, falling back to the raw body.
     */
    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no response body";
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            if (message.isTextual()) {
                return message.asText();
            }
        } catch (IOException e) {
            LOG.debugf("Error body is not JSON: %s", e.getMessage());
        }
        return body.length() > MAX_MESSAGE_LENGTH ? body.substring(0, MAX_MESSAGE_LENGTH) : body;
    }
}
