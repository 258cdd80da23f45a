package com.delta.adsync.sync.creative;

import com.delta.adsync.sync.model.CreativeType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

final class CreativeTypeDetector {
    private CreativeTypeDetector() {
    }

    /**
     * Video reference, then carousel (more than one child), then asset feed, then image fields.
     * Catalog templates count as dynamic; a creative backed only by a post is an image post.
     */
    static CreativeType detect(CreativePayload payload) {
        if (!payload.hasCreative()) {
            return CreativeType.UNKNOWN;
        }
        if (payload.videoId() != null || payload.hasAssetFeedVideos()) {
            return CreativeType.VIDEO;
        }
        if (payload.carouselChildren().size() > 1) {
            return CreativeType.CAROUSEL;
        }
        if (hasAssetFeed(payload.assetFeed())) {
            return CreativeType.DYNAMIC;
        }
        if (hasImageFields(payload)) {
            return CreativeType.IMAGE;
        }
        if (isCatalogTemplate(payload)) {
            return CreativeType.DYNAMIC;
        }
        if (payload.postId() != null || payload.instagramMediaId() != null) {
            return CreativeType.IMAGE;
        }
        return CreativeType.UNKNOWN;
    }

    private static boolean hasAssetFeed(JsonNode feed) {
        return feed.path("images").size() > 0
            || feed.path("videos").size() > 0
            || feed.path("bodies").size() > 0
            || feed.path("titles").size() > 0;
    }

    private static boolean hasImageFields(CreativePayload payload) {
        JsonNode creative = payload.creative();
        return CreativePayload.text(creative, "image_url") != null
            || CreativePayload.text(creative, "image_hash") != null
            || CreativePayload.text(payload.linkData(), "picture") != null
            || CreativePayload.text(payload.linkData(), "image_hash") != null
            || CreativePayload.text(payload.photoData(), "url") != null
            || CreativePayload.text(payload.photoData(), "image_hash") != null
            || CreativePayload.text(creative, "thumbnail_url") != null;
    }

    private static boolean isCatalogTemplate(CreativePayload payload) {
        String name = CreativePayload.text(payload.creative(), "name");
        if (name != null && name.toLowerCase(Locale.ROOT).contains("{{product.")) {
            return true;
        }
        return payload.templateData().isObject() && !payload.templateData().isEmpty();
    }
}
