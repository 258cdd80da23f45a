package com.delta.adsync.sync.creative;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Fills title, body, description, call to action and link from the creative's own fields first.
 * The originating post is consulted only when a field is still empty after that.
 */
@Component
public class TextResolver {
    private final CreativeLookups lookups;

    public TextResolver(CreativeLookups lookups) {
        this.lookups = lookups;
    }

    record ResolvedTexts(String title, String body, String description, String callToAction, String linkUrl) {
        boolean complete() {
            return title != null && body != null && description != null && callToAction != null && linkUrl != null;
        }
    }

    ResolvedTexts resolve(CreativePayload payload, ResolutionContext context) {
        JsonNode creative = payload.creative();
        JsonNode link = payload.linkData();
        JsonNode video = payload.videoData();
        JsonNode feed = payload.assetFeed();
        List<JsonNode> children = payload.carouselChildren();
        JsonNode firstChild = children.isEmpty() ? null : children.get(0);

        ResolvedTexts own = new ResolvedTexts(
            CreativePayload.firstNonBlank(
                CreativePayload.text(creative, "title"),
                CreativePayload.text(link, "name"),
                CreativePayload.text(video, "title"),
                CreativePayload.firstAssetText(feed, "titles"),
                CreativePayload.text(firstChild, "name")
            ),
            CreativePayload.firstNonBlank(
                CreativePayload.text(creative, "body"),
                CreativePayload.text(link, "message"),
                CreativePayload.text(video, "message"),
                CreativePayload.text(payload.photoData(), "caption"),
                CreativePayload.firstAssetText(feed, "bodies")
            ),
            CreativePayload.firstNonBlank(
                CreativePayload.text(link, "description"),
                CreativePayload.text(video, "link_description"),
                CreativePayload.firstAssetText(feed, "descriptions"),
                CreativePayload.text(firstChild, "description")
            ),
            CreativePayload.firstNonBlank(
                CreativePayload.text(creative, "call_to_action_type"),
                CreativePayload.text(link.path("call_to_action"), "type"),
                CreativePayload.text(video.path("call_to_action"), "type"),
                CreativePayload.text(feed.path("call_to_action_types"), 0)
            ),
            CreativePayload.firstNonBlank(
                CreativePayload.text(link, "link"),
                CreativePayload.text(video.path("call_to_action").path("value"), "link"),
                CreativePayload.text(feed.path("link_urls").path(0), "website_url")
            )
        );
        if (own.complete() || payload.postId() == null) {
            return own;
        }

        Optional<JsonNode> post = lookups.post(context, payload.postId());
        if (post.isEmpty()) {
            return own;
        }
        JsonNode p = post.get();
        JsonNode attachment = p.path("attachments").path("data").path(0);
        return new ResolvedTexts(
            CreativePayload.firstNonBlank(own.title(), CreativePayload.text(p, "name"), CreativePayload.text(attachment, "title")),
            CreativePayload.firstNonBlank(own.body(), CreativePayload.text(p, "message"), CreativePayload.text(p, "story")),
            CreativePayload.firstNonBlank(
                own.description(),
                CreativePayload.text(p, "description"),
                CreativePayload.text(p, "caption"),
                CreativePayload.text(attachment, "description")
            ),
            CreativePayload.firstNonBlank(own.callToAction(), CreativePayload.text(p.path("call_to_action"), "type")),
            CreativePayload.firstNonBlank(
                own.linkUrl(),
                CreativePayload.text(p.path("call_to_action").path("value"), "link"),
                CreativePayload.text(attachment, "url")
            )
        );
    }
}
