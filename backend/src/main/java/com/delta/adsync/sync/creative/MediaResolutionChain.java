package com.delta.adsync.sync.creative;

import com.delta.adsync.sync.model.CreativeType;
import com.delta.adsync.sync.util.MediaUrls;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered media waterfall:
 * <ol>
 *   <li>video thumbnails (video creatives only)</li>
 *   <li>the originating post's pictures (non-video creatives)</li>
 *   <li>direct, full-size URL fields on the creative</li>
 *   <li>image-hash lookups</li>
 *   <li>whatever low-resolution URL is left, upgraded where the CDN allows it</li>
 * </ol>
 * The first step returning a candidate wins.
 */
@Component
public class MediaResolutionChain {
    private static final int HD_WIDTH = 1280;
    private static final int HD_HEIGHT = 720;

    private final CreativeLookups lookups;
    private final List<MediaSource> sources;

    public MediaResolutionChain(CreativeLookups lookups) {
        this.lookups = lookups;
        this.sources = List.of(
            this::videoThumbnails,
            this::originatingPost,
            this::directUrls,
            this::imageHashes,
            this::lowResolutionFallback
        );
    }

    Optional<MediaCandidate> resolve(CreativePayload payload, CreativeType type, ResolutionContext context) {
        if (!payload.hasCreative()) {
            return Optional.empty();
        }
        for (MediaSource source : sources) {
            Optional<MediaCandidate> candidate = source.resolve(payload, type, context);
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    private Optional<MediaCandidate> directUrls(CreativePayload payload, CreativeType type, ResolutionContext context) {
        JsonNode creative = payload.creative();
        List<MediaCandidate> candidates = new ArrayList<>();
        addDirect(candidates, CreativePayload.text(creative, "image_url"), "creative_image_url");
        addDirect(candidates, CreativePayload.text(payload.linkData(), "picture"), "link_data_picture");
        addDirect(candidates, CreativePayload.text(payload.photoData(), "url"), "photo_data_url");
        addDirect(candidates, CreativePayload.text(payload.videoData(), "image_url"), "video_data_image_url");
        for (JsonNode image : payload.assetFeed().path("images")) {
            addDirect(candidates, CreativePayload.text(image, "url"), "asset_feed_image_url");
        }
        List<JsonNode> children = payload.carouselChildren();
        if (!children.isEmpty()) {
            addDirect(candidates, CreativePayload.text(children.get(0), "picture"), "carousel_picture");
        }
        addDirect(candidates, CreativePayload.text(payload.firstTemplateChild(), "picture"), "template_picture");
        return candidates.stream().findFirst();
    }

    private Optional<MediaCandidate> videoThumbnails(CreativePayload payload, CreativeType type, ResolutionContext context) {
        if (type != CreativeType.VIDEO) {
            return Optional.empty();
        }
        Optional<JsonNode> video = lookups.video(context, payload.videoId());
        if (video.isEmpty()) {
            return Optional.empty();
        }
        List<MediaCandidate> thumbnails = new ArrayList<>();
        for (JsonNode thumb : video.get().path("thumbnails").path("data")) {
            String uri = CreativePayload.text(thumb, "uri");
            if (uri != null) {
                Integer width = thumb.hasNonNull("width") ? thumb.get("width").asInt() : null;
                Integer height = thumb.hasNonNull("height") ? thumb.get("height").asInt() : null;
                thumbnails.add(MediaCandidate.of(uri, width, height, "video_thumbnail_best"));
            }
        }
        thumbnails.sort(Comparator.comparingLong(MediaResolutionChain::area).reversed());
        if (!thumbnails.isEmpty()) {
            MediaCandidate best = thumbnails.get(0);
            if (isHd(best)) {
                return Optional.of(new MediaCandidate(best.url(), best.width(), best.height(), "video_thumbnail_hd"));
            }
            return Optional.of(best);
        }
        String picture = CreativePayload.text(video.get(), "picture");
        return picture == null ? Optional.empty() : Optional.of(MediaCandidate.of(picture, "video_picture"));
    }

    private Optional<MediaCandidate> originatingPost(CreativePayload payload, CreativeType type, ResolutionContext context) {
        if (type == CreativeType.VIDEO) {
            return Optional.empty();
        }
        Optional<JsonNode> post = lookups.post(context, payload.postId());
        if (post.isEmpty()) {
            return Optional.empty();
        }
        String fullPicture = CreativePayload.text(post.get(), "full_picture");
        if (fullPicture != null) {
            return Optional.of(MediaCandidate.of(fullPicture, "post_full_picture"));
        }
        JsonNode image = post.get().path("attachments").path("data").path(0).path("media").path("image");
        String src = CreativePayload.text(image, "src");
        if (src != null) {
            Integer width = image.hasNonNull("width") ? image.get("width").asInt() : null;
            Integer height = image.hasNonNull("height") ? image.get("height").asInt() : null;
            return Optional.of(MediaCandidate.of(src, width, height, "post_attachment_image"));
        }
        String picture = CreativePayload.text(post.get(), "picture");
        if (picture != null && !MediaUrls.isLowQualityUrl(picture)) {
            return Optional.of(MediaCandidate.of(picture, "post_picture"));
        }
        return Optional.empty();
    }

    private Optional<MediaCandidate> imageHashes(CreativePayload payload, CreativeType type, ResolutionContext context) {
        List<String> hashes = new ArrayList<>();
        addHash(hashes, CreativePayload.text(payload.creative(), "image_hash"));
        addHash(hashes, CreativePayload.text(payload.linkData(), "image_hash"));
        addHash(hashes, CreativePayload.text(payload.photoData(), "image_hash"));
        addHash(hashes, CreativePayload.text(payload.videoData(), "image_hash"));
        List<JsonNode> children = payload.carouselChildren();
        if (!children.isEmpty()) {
            addHash(hashes, CreativePayload.text(children.get(0), "image_hash"));
        }
        addHash(hashes, CreativePayload.text(payload.firstTemplateChild(), "image_hash"));
        for (JsonNode image : payload.assetFeed().path("images")) {
            addHash(hashes, CreativePayload.text(image, "hash"));
        }
        for (String hash : hashes) {
            Optional<MediaCandidate> candidate = lookups.imageByHash(context, hash);
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    private Optional<MediaCandidate> lowResolutionFallback(CreativePayload payload, CreativeType type, ResolutionContext context) {
        JsonNode creative = payload.creative();
        String imageUrl = CreativePayload.text(creative, "image_url");
        if (imageUrl != null) {
            return Optional.of(MediaCandidate.of(MediaUrls.upgradeResolution(imageUrl), "creative_image_url_upgraded"));
        }
        String thumbnail = CreativePayload.text(creative, "thumbnail_url");
        if (thumbnail != null) {
            return Optional.of(MediaCandidate.of(MediaUrls.upgradeResolution(thumbnail), "thumbnail_upgraded"));
        }
        String videoThumbnail = CreativePayload.text(payload.assetFeed().path("videos").path(0), "thumbnail_url");
        if (videoThumbnail != null) {
            return Optional.of(MediaCandidate.of(videoThumbnail, "asset_feed_video_thumbnail"));
        }
        String postPicture = payload.postId() == null
            ? null
            : lookups.post(context, payload.postId()).map(post -> CreativePayload.text(post, "picture")).orElse(null);
        if (postPicture != null) {
            return Optional.of(MediaCandidate.of(MediaUrls.upgradeResolution(postPicture), "post_picture_upgraded"));
        }
        return Optional.empty();
    }

    private static void addDirect(List<MediaCandidate> candidates, String url, String source) {
        if (url != null && !MediaUrls.isLowQualityUrl(url)) {
            candidates.add(MediaCandidate.of(url, source));
        }
    }

    private static void addHash(List<String> hashes, String hash) {
        if (hash != null && !hashes.contains(hash)) {
            hashes.add(hash);
        }
    }

    private static long area(MediaCandidate candidate) {
        if (candidate.width() == null || candidate.height() == null) {
            return 0L;
        }
        return (long) candidate.width() * candidate.height();
    }

    private static boolean isHd(MediaCandidate candidate) {
        return candidate.width() != null
            && candidate.height() != null
            && ((candidate.width() >= HD_WIDTH && candidate.height() >= HD_HEIGHT)
            || (candidate.width() >= HD_HEIGHT && candidate.height() >= HD_WIDTH));
    }
}
