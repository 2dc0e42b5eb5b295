package locaposty.worker.integration.gbp;

import locaposty.worker.api.types.LocalPostRequestType;
import locaposty.worker.api.types.LocalPostRequestType.CallToActionType;
import locaposty.worker.api.types.LocalPostRequestType.EventDetailsType;
import locaposty.worker.api.types.LocalPostRequestType.MediaItemType;
import locaposty.worker.api.types.LocalPostRequestType.OfferDetailsType;
import locaposty.worker.api.types.LocalPostRequestType.ScheduleType;
import locaposty.worker.data.models.Post;
import locaposty.worker.data.models.Post.CallToAction;
import locaposty.worker.data.models.Post.PostType;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Maps a {@link Post} to the Business Profile local post payload.
 */
public final class LocalPostMapper {

    static final String LANGUAGE_CODE = "en-US";

    private LocalPostMapper() {
    }

    public static LocalPostRequestType toRequest(Post post) {
        EventDetailsType eventDetails = null;
        OfferDetailsType offerDetails = null;

        if (post.type == PostType.EVENT) {
            ScheduleType schedule = post.eventStart == null
                    ? null
                    : new ScheduleType(iso(post.eventStart), iso(post.eventEnd));
            eventDetails = new EventDetailsType(post.title, schedule);
        } else if (post.type == PostType.OFFER) {
            offerDetails = new OfferDetailsType(post.couponCode, iso(post.offerStart), iso(post.offerEnd));
        }

        return new LocalPostRequestType(LANGUAGE_CODE, post.content, topicTypeFor(post.type),
                callToActionFor(post.callToAction), mediaFor(post.mediaUrls), eventDetails, offerDetails);
    }

    public static String topicTypeFor(PostType type) {
        return switch (type) {
            case WHATS_NEW -> "STANDARD";
            case EVENT -> "EVENT";
            case OFFER -> "OFFER";
        };
    }

    /**
     * Provider action type for an internal call to action. Kinds without a provider alias pass through by name.
     */
    public static String actionTypeFor(CallToAction callToAction) {
        return switch (callToAction) {
            case SHOP -> "BUY";
            case CALL_NOW -> "CALL";
            case GET_DIRECTIONS -> "DIRECTIONS";
            default -> callToAction.name();
        };
    }

    /**
     * {@code VIDEO} for {@code .mp4} URLs (any case), {@code PHOTO} otherwise.
     */
    public static String mediaFormatFor(String url) {
        return url.toLowerCase(Locale.ROOT).endsWith(".mp4") ? "VIDEO" : "PHOTO";
    }

    private static CallToActionType callToActionFor(CallToAction callToAction) {
        if (callToAction == null || callToAction == CallToAction.NONE) {
            return null;
        }
        return new CallToActionType(actionTypeFor(callToAction));
    }

    private static List<MediaItemType> mediaFor(List<String> mediaUrls) {
        if (mediaUrls == null || mediaUrls.isEmpty()) {
            return null;
        }
        return mediaUrls.stream().map(url -> new MediaItemType(mediaFormatFor(url), url)).toList();
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
