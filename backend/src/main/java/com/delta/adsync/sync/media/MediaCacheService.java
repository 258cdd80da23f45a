package com.delta.adsync.sync.media;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.http.GraphApiClient;
import com.delta.adsync.sync.model.CachedMedia;
import com.delta.adsync.sync.model.HttpFetchResult;
import com.delta.adsync.sync.util.HashUtils;
import com.delta.adsync.sync.util.MediaUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Copies remote creative media into our own storage so downstream consumers are not left with
 * expiring CDN links.
 */
@Service
public class MediaCacheService {
    private static final Logger log = LoggerFactory.getLogger(MediaCacheService.class);

    private final GraphApiClient graphApiClient;
    private final MediaStorage storage;
    private final AdSyncProperties properties;
    private final Clock clock;

    public MediaCacheService(GraphApiClient graphApiClient, MediaStorage storage, AdSyncProperties properties, Clock clock) {
        this.graphApiClient = graphApiClient;
        this.storage = storage;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Downloads {@code sourceUrl} and stores it under
     * {@code tenants/{tenant}/{mediaType}s/{adId}/{timestamp}_{hash}.{ext}}.
     *
     * @throws MediaCacheException when the download fails, exceeds the size limit or cannot be stored
     */
    public CachedMedia cache(String tenantId, String adId, String mediaType, String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new MediaCacheException("No source url for ad " + adId);
        }
        String type = mediaType == null || mediaType.isBlank() ? "image" : mediaType.trim().toLowerCase(Locale.ROOT);
        long maxBytes = properties.getMedia().getMaxBytes();
        HttpFetchResult result = graphApiClient.download(sourceUrl, maxBytes);
        if ("too_large".equals(result.errorCode())) {
            throw new MediaCacheException("Media for ad " + adId + " exceeds " + maxBytes + " bytes");
        }
        if (!result.isSuccessful() || result.bodyBytes() == null) {
            String reason = result.errorCode() != null ? result.errorCode() : "HTTP " + result.statusCode();
            throw new MediaCacheException("Download failed for ad " + adId + ": " + reason);
        }

        Instant now = clock.instant();
        String extension = extensionFor(result.contentType());
        String relativePath = "tenants/" + safeSegment(tenantId)
            + "/" + type + "s/" + safeSegment(adId)
            + "/" + now.toEpochMilli() + "_" + HashUtils.shortHash(sourceUrl, 12) + "." + extension;
        String storedUrl = storage.store(relativePath, result.bodyBytes(), result.contentType());
        log.info(
            "Cached {} for ad {} ({} bytes) from {}",
            type,
            adId,
            result.bodyBytes().length,
            MediaUrls.redactToken(sourceUrl)
        );
        return new CachedMedia(
            storedUrl,
            relativePath,
            result.bodyBytes().length,
            result.contentType(),
            now.plus(Duration.ofDays(properties.getMedia().getExpiryDays()))
        );
    }

    static String extensionFor(String contentType) {
        if (contentType == null) {
            return "bin";
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        if (lower.contains("jpeg") || lower.contains("jpg")) {
            return "jpg";
        }
        if (lower.contains("png")) {
            return "png";
        }
        if (lower.contains("gif")) {
            return "gif";
        }
        if (lower.contains("webp")) {
            return "webp";
        }
        if (lower.contains("mp4")) {
            return "mp4";
        }
        if (lower.contains("webm")) {
            return "webm";
        }
        if (lower.contains("quicktime")) {
            return "mov";
        }
        return "bin";
    }

    private static String safeSegment(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
