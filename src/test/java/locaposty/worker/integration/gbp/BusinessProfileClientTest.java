package locaposty.worker.integration.gbp;

import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.http.Fault;
import locaposty.worker.WireMockTestBase;
import locaposty.worker.api.types.LocalPostRequestType;
import locaposty.worker.integration.gbp.PublishResult.Outcome;
import locaposty.worker.testing.TestClients;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static locaposty.worker.testing.TestFixtures.ACCOUNT_ID;
import static locaposty.worker.testing.TestFixtures.GBP_LOCATION_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link BusinessProfileClient} against a stubbed local posts endpoint.
 */
class BusinessProfileClientTest extends WireMockTestBase {

    private static final LocalPostRequestType BODY = new LocalPostRequestType("en-US", "Hello", "STANDARD", null, null,
            null, null);

    private BusinessProfileClient client;

    @BeforeEach
    @Override
    protected void setUp() {
        super.setUp();
        client = TestClients.profileClient(gbpApiUrl());
    }

    @Test
    void testCreateLocalPost_success_returnsPostName() {
        stubLocalPostSuccess(ACCOUNT_ID, GBP_LOCATION_ID);

        PublishResult result = client.createLocalPost("accounts/" + ACCOUNT_ID, "locations/" + GBP_LOCATION_ID,
                "token-1", BODY);

        assertTrue(result.isSuccess());
        assertEquals(200, result.statusCode());
        assertEquals("accounts/111/locations/222/localPosts/987654321", result.message());
        wireMockServer.verify(WireMock
                .postRequestedFor(WireMock.urlPathEqualTo(localPostsPath(ACCOUNT_ID, GBP_LOCATION_ID)))
                .withHeader("Authorization", WireMock.equalTo("Bearer token-1"))
                .withHeader("Content-Type", WireMock.containing("application/json"))
                .withRequestBody(WireMock.equalToJson(
                        "{\"languageCode\":\"en-US\",\"summary\":\"Hello\",\"topicType\":\"STANDARD\"}")));
    }

    @Test
    void testLocalPostsUrl_prefixedAndBareIdsResolveToSamePath() {
        String expected = gbpApiUrl() + "/accounts/111/locations/222/localPosts";

        assertEquals(expected, client.localPostsUrl("accounts/111", "locations/222"));
        assertEquals(expected, client.localPostsUrl("111", "222"));
    }

    @Test
    void testCreateLocalPost_badRequest_invalidWithProviderMessage() {
        stubLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, 400, loadStubFile("wiremock/gbp/local-post-invalid.json"));

        PublishResult result = client.createLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, "token-1", BODY);

        assertEquals(Outcome.INVALID_REQUEST, result.outcome());
        assertEquals(400, result.statusCode());
        assertEquals("Business Profile API error (400): Request contains an invalid argument.", result.message());
    }

    @Test
    void testCreateLocalPost_unauthorizedAndForbidden_authFailure() {
        stubLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, 401, "{}");
        assertEquals(Outcome.AUTH_FAILURE, client.createLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, "t", BODY).outcome());

        stubLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, 403, "{}");
        assertEquals(Outcome.AUTH_FAILURE, client.createLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, "t", BODY).outcome());
    }

    @Test
    void testCreateLocalPost_notFound() {
        stubLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, 404,
                "{\"error\":{\"message\":\"Requested entity was not found.\"}}");

        assertEquals(Outcome.NOT_FOUND, client.createLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, "t", BODY).outcome());
    }

    @Test
    void testCreateLocalPost_serverErrorAndRateLimit_serverError() {
        stubLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, 502, "<html>Bad Gateway</html>");
        PublishResult result = client.createLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, "t", BODY);
        assertEquals(Outcome.SERVER_ERROR, result.outcome());
        assertEquals("Business Profile API error (502): <html>Bad Gateway</html>", result.message());

        stubLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, 429, "{}");
        assertEquals(Outcome.SERVER_ERROR, client.createLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, "t", BODY).outcome());
    }

    @Test
    void testCreateLocalPost_connectionReset_networkFailure() {
        wireMockServer.stubFor(WireMock.post(WireMock.urlPathEqualTo(localPostsPath(ACCOUNT_ID, GBP_LOCATION_ID)))
                .willReturn(WireMock.aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        PublishResult result = client.createLocalPost(ACCOUNT_ID, GBP_LOCATION_ID, "t", BODY);

        assertEquals(Outcome.NETWORK_FAILURE, result.outcome());
        assertEquals(0, result.statusCode());
        assertFalse(result.isSuccess());
    }

    @Test
    void testFailure_classification() {
        assertEquals(Outcome.INVALID_REQUEST, PublishResult.failure(409, "conflict").outcome());
        assertEquals(Outcome.SERVER_ERROR, PublishResult.failure(503, "unavailable").outcome());
    }
}
