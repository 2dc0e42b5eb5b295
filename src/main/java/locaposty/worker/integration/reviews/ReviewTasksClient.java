package locaposty.worker.integration.reviews;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import locaposty.worker.api.types.ReviewTaskResultType;
import locaposty.worker.exceptions.ReviewTaskException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * HTTP client for the web application's review maintenance endpoints.
 *
 * <ul>
 * <li>{@code GET /api/reviews/latest} - pulls new reviews from Google for every location</li>
 * <li>{@code POST /api/reviews/autoReply/process} - sends automatic replies to new reviews</li>
 * </ul>
 */
@ApplicationScoped
public class ReviewTasksClient {

    private static final Logger LOG = Logger.getLogger(ReviewTasksClient.class);

    public static final String FETCH_LATEST_REVIEWS = "fetch-latest-reviews";
    public static final String PROCESS_AUTO_REPLIES = "process-auto-replies";

    @ConfigProperty(
            name = "locaposty.reviews.app-url")
    String appUrl;

    @ConfigProperty(
            name = "locaposty.reviews.api-token")
    Optional<String> apiToken;

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

    public ReviewTaskResultType fetchLatestReviews() {
        return call(FETCH_LATEST_REVIEWS, "/api/reviews/latest", HttpRequest.newBuilder().GET());
    }

    public ReviewTaskResultType processAutoReplies() {
        return call(PROCESS_AUTO_REPLIES, "/api/reviews/autoReply/process",
                HttpRequest.newBuilder().POST(HttpRequest.BodyPublishers.noBody()));
    }

    private ReviewTaskResultType call(String task, String path, HttpRequest.Builder builder) {
        builder.uri(URI.create(appUrl + path)).timeout(Duration.ofSeconds(timeoutSeconds)).header("Content-Type",
                "application/json");
        apiToken.filter(token -> !token.isBlank())
                .ifPresent(token -> builder.header("Authorization", "Bearer " + token));

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ReviewTaskException("Task " + task + " could not reach " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReviewTaskException("Task " + task + " interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ReviewTaskException("Task " + task + " failed: " + path + " returned " + response.statusCode());
        }

        JsonNode results = MissingNode.getInstance();
        String body = response.body();
        if (body != null && !body.isBlank()) {
            try {
                results = objectMapper.readTree(body).path("results");
            } catch (IOException e) {
                LOG.warnf("Task %s returned a non-JSON body", task);
            }
        }
        return new ReviewTaskResultType(task, response.statusCode(), results);
    }
}
