package com.delta.adsync.sync.creative;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view over one ad node returned by the platform, exposing the creative sub-objects the
 * resolution steps look at.
 */
final class CreativePayload {
    private final JsonNode ad;
    private final JsonNode creative;

    CreativePayload(JsonNode ad) {
        this.ad = ad == null ? MissingNode.getInstance() : ad;
        JsonNode direct = this.ad.path("creative");
        if (direct.isObject() && !direct.isEmpty()) {
            this.creative = direct;
        } else {
            JsonNode first = this.ad.path("adcreatives").path("data").path(0);
            this.creative = first.isObject() ? first : MissingNode.getInstance();
        }
    }

    JsonNode ad() {
        return ad;
    }

    JsonNode creative() {
        return creative;
    }

    boolean hasCreative() {
        return creative.isObject();
    }

    String adId() {
        return text(ad, "id");
    }

    String adName() {
        return text(ad, "name");
    }

    String creativeId() {
        return text(creative, "id");
    }

    JsonNode storySpec() {
        return creative.path("object_story_spec");
    }

    JsonNode linkData() {
        return storySpec().path("link_data");
    }

    JsonNode videoData() {
        return storySpec().path("video_data");
    }

    JsonNode photoData() {
        return storySpec().path("photo_data");
    }

    JsonNode templateData() {
        return storySpec().path("template_data");
    }

    JsonNode assetFeed() {
        return creative.path("asset_feed_spec");
    }

    List<JsonNode> carouselChildren() {
        List<JsonNode> out = new ArrayList<>();
        linkData().path("child_attachments").forEach(out::add);
        if (out.isEmpty()) {
            templateData().path("child_attachments").forEach(out::add);
        }
        return out;
    }

    JsonNode firstTemplateChild() {
        return templateData().path("child_attachments").path(0);
    }

    String videoId() {
        String id = firstNonBlank(text(creative, "video_id"), text(videoData(), "video_id"));
        if (id != null) {
            return id;
        }
        return text(assetFeed().path("videos").path(0), "video_id");
    }

    boolean hasAssetFeedVideos() {
        return assetFeed().path("videos").size() > 0;
    }

    /** Post backing the creative, if any. */
    String postId() {
        return firstNonBlank(text(creative, "effective_object_story_id"), text(creative, "object_story_id"));
    }

    String instagramMediaId() {
        return text(creative, "effective_instagram_media_id");
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    static String text(JsonNode array, int index) {
        if (array == null) {
            return null;
        }
        JsonNode value = array.path(index);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    /** {@code text} field of the first entry of an asset-feed array such as titles or bodies. */
    static String firstAssetText(JsonNode feed, String arrayField) {
        return text(feed.path(arrayField).path(0), "text");
    }

    static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
