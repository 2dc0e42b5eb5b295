package locaposty.worker.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The subset of the created local post the worker reads back.
 *
 * @param name
 *            provider resource name, {@code accounts/{a}/locations/{l}/localPosts/{id}}
 * @param state
 *            provider-side post state, e.g. LIVE or PROCESSING
 * @param searchUrl
 *            public link to the post
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record LocalPostResponseType(String name, String state, String searchUrl) {
}
