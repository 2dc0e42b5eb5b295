package locaposty.worker.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Body of {@code POST /v4/accounts/{accountId}/locations/{locationId}/localPosts}.
 *
 * <p>
 * Absent optional sections are omitted from the JSON. Timestamps are ISO-8601 UTC strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocalPostRequestType(String languageCode, String summary, String topicType,
        CallToActionType callToAction, List<MediaItemType> media, EventDetailsType eventDetails,
        OfferDetailsType offerDetails) {

    public record CallToActionType(String actionType) {
    }

    public record MediaItemType(String mediaFormat, String sourceUrl) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EventDetailsType(String title, ScheduleType schedule) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ScheduleType(String startTime, String endTime) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OfferDetailsType(String couponCode, String startTime, String endTime) {
    }
}
