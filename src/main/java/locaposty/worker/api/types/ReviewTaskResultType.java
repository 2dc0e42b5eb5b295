package locaposty.worker.api.types;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response of a review task endpoint of the web application.
 *
 * @param task
 *            task identifier, e.g. {@code fetch-latest-reviews}
 * @param statusCode
 *            HTTP status
 * @param results
 *            the {@code results} member of the response body, or a missing node
 */
public record ReviewTaskResultType(String task, int statusCode, JsonNode results) {
}
