package com.delta.adsync.sync.creative;

import com.delta.adsync.sync.http.GraphApiClient;
import com.delta.adsync.sync.http.GraphApiException;
import com.delta.adsync.sync.http.GraphAuthException;
import com.delta.adsync.sync.util.GraphIds;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remote lookups used by the media and text waterfalls, memoized in the run's
 * {@link ResolutionContext}. Auth failures propagate; any other failure counts as "no data".
 */
@Component
public class CreativeLookups {
    private static final Logger log = LoggerFactory.getLogger(CreativeLookups.class);
    static final String POST_FIELDS =
        "message,story,description,name,caption,full_picture,picture,call_to_action,attachments{title,description,url,media}";
    static final String IMAGE_FIELDS = "url,url_128,url_256,permalink_url,width,height";
    static final String VIDEO_FIELDS = "thumbnails,picture,source";

    private final GraphApiClient graphApiClient;

    public CreativeLookups(GraphApiClient graphApiClient) {
        this.graphApiClient = graphApiClient;
    }

    /** Resolves an image hash through the account's image library. */
    public Optional<MediaCandidate> imageByHash(ResolutionContext context, String hash) {
        if (hash == null || hash.isBlank() || context.accountId() == null) {
            return Optional.empty();
        }
        Optional<MediaCandidate> cached = context.imageHashes().get(hash);
        if (cached != null) {
            return cached;
        }
        Optional<MediaCandidate> resolved = Optional.empty();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("hashes", "[\"" + hash + "\"]");
        params.put("fields", IMAGE_FIELDS);
        params.put("access_token", context.accessToken());
        JsonNode reply = fetch(context, GraphIds.accountNode(context.accountId()) + "/adimages", params, "image hash " + hash);
        if (reply != null) {
            JsonNode image = reply.path("data").path(0);
            String url = CreativePayload.firstNonBlank(
                CreativePayload.text(image, "url"),
                CreativePayload.text(image, "permalink_url"),
                CreativePayload.text(image, "url_256"),
                CreativePayload.text(image, "url_128")
            );
            if (url != null) {
                Integer width = image.hasNonNull("width") ? image.get("width").asInt() : null;
                Integer height = image.hasNonNull("height") ? image.get("height").asInt() : null;
                resolved = Optional.of(MediaCandidate.of(url, width, height, "image_hash"));
            }
        }
        context.imageHashes().put(hash, resolved);
        return resolved;
    }

    public Optional<JsonNode> post(ResolutionContext context, String postId) {
        if (postId == null || postId.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> cached = context.posts().get(postId);
        if (cached != null) {
            return cached;
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("fields", POST_FIELDS);
        params.put("access_token", context.accessToken());
        Optional<JsonNode> resolved = Optional.ofNullable(fetch(context, postId, params, "post " + postId));
        context.posts().put(postId, resolved);
        return resolved;
    }

    public Optional<JsonNode> video(ResolutionContext context, String videoId) {
        if (videoId == null || videoId.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> cached = context.videos().get(videoId);
        if (cached != null) {
            return cached;
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("fields", VIDEO_FIELDS);
        params.put("access_token", context.accessToken());
        Optional<JsonNode> resolved = Optional.ofNullable(fetch(context, videoId, params, "video " + videoId));
        context.videos().put(videoId, resolved);
        return resolved;
    }

    private JsonNode fetch(ResolutionContext context, String path, Map<String, String> params, String what) {
        context.countLookup();
        try {
            return graphApiClient.getJson(graphApiClient.graphUrl(path, params));
        } catch (GraphAuthException e) {
            throw e;
        } catch (GraphApiException e) {
            log.warn("Lookup of {} failed ({}): {}", what, e.getCategory(), e.getMessage());
            return null;
        }
    }
}
