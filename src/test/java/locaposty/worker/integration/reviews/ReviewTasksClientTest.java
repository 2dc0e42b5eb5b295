package locaposty.worker.integration.reviews;

import com.github.tomakehurst.wiremock.client.WireMock;
import locaposty.worker.WireMockTestBase;
import locaposty.worker.api.types.ReviewTaskResultType;
import locaposty.worker.exceptions.ReviewTaskException;
import locaposty.worker.testing.TestClients;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ReviewTasksClient} against stubbed web application endpoints.
 */
class ReviewTasksClientTest extends WireMockTestBase {

    @Test
    void testFetchLatestReviews_returnsResults() {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo("/api/reviews/latest"))
                .willReturn(WireMock.aResponse().withStatus(200).withHeader("Content-Type", "application/json")
                        .withBody(loadStubFile("wiremock/reviews/latest-success.json"))));
        ReviewTasksClient client = TestClients.reviewTasksClient(wireMockServer.baseUrl(), "cron-secret");

        ReviewTaskResultType result = client.fetchLatestReviews();

        assertEquals(ReviewTasksClient.FETCH_LATEST_REVIEWS, result.task());
        assertEquals(200, result.statusCode());
        assertEquals(5, result.results().path("newReviews").asInt());
        wireMockServer.verify(WireMock.getRequestedFor(WireMock.urlPathEqualTo("/api/reviews/latest"))
                .withHeader("Authorization", WireMock.equalTo("Bearer cron-secret")));
    }

    @Test
    void testProcessAutoReplies_postsWithoutAuthorizationWhenNoToken() {
        wireMockServer.stubFor(WireMock.post(WireMock.urlPathEqualTo("/api/reviews/autoReply/process"))
                .willReturn(WireMock.aResponse().withStatus(200).withBody("{\"results\":{\"replied\":1}}")));
        ReviewTasksClient client = TestClients.reviewTasksClient(wireMockServer.baseUrl(), null);

        ReviewTaskResultType result = client.processAutoReplies();

        assertEquals(ReviewTasksClient.PROCESS_AUTO_REPLIES, result.task());
        assertEquals(1, result.results().path("replied").asInt());
        wireMockServer.verify(WireMock.postRequestedFor(WireMock.urlPathEqualTo("/api/reviews/autoReply/process"))
                .withoutHeader("Authorization"));
    }

    @Test
    void testProcessAutoReplies_emptyBody_missingResults() {
        wireMockServer.stubFor(WireMock.post(WireMock.urlPathEqualTo("/api/reviews/autoReply/process"))
                .willReturn(WireMock.aResponse().withStatus(204)));
        ReviewTasksClient client = TestClients.reviewTasksClient(wireMockServer.baseUrl(), null);

        assertTrue(client.processAutoReplies().results().isMissingNode());
    }

    @Test
    void testFetchLatestReviews_serverError_throws() {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo("/api/reviews/latest"))
                .willReturn(WireMock.aResponse().withStatus(500)));
        ReviewTasksClient client = TestClients.reviewTasksClient(wireMockServer.baseUrl(), null);

        ReviewTaskException e = assertThrows(ReviewTaskException.class, client::fetchLatestReviews);
        assertTrue(e.getMessage().contains("500"));
    }
}
