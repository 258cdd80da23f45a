package com.delta.adsync.sync.model;

import java.time.Instant;

public record CreativeRecord(
    String tenantId,
    String adId,
    String externalAccountId,
    String adName,
    String creativeId,
    CreativeType creativeType,
    String imageUrl,
    String imageUrlHd,
    String thumbnailUrl,
    Integer imageWidth,
    Integer imageHeight,
    ResolutionQuality resolutionQuality,
    String imageSource,
    String videoId,
    String videoUrl,
    String previewUrl,
    String title,
    String body,
    String description,
    String callToAction,
    String linkUrl,
    FetchStatus fetchStatus,
    boolean carousel,
    int carouselCount,
    String cachedImageUrl,
    Long cachedFileSize,
    String rawSnapshot,
    String errorMessage,
    int fetchAttempts,
    Instant fetchedAt
) {
    public boolean hasText() {
        return notBlank(title) || notBlank(body) || notBlank(description) || notBlank(callToAction) || notBlank(linkUrl);
    }

    public CreativeRecord withCachedImage(String storedUrl, long sizeBytes) {
        return new CreativeRecord(
            tenantId, adId, externalAccountId, adName, creativeId, creativeType,
            imageUrl, imageUrlHd, thumbnailUrl, imageWidth, imageHeight, resolutionQuality, imageSource,
            videoId, videoUrl, previewUrl, title, body, description, callToAction, linkUrl,
            fetchStatus, carousel, carouselCount, storedUrl, sizeBytes, rawSnapshot, errorMessage,
            fetchAttempts, fetchedAt
        );
    }

    /**
     * Record for an ad whose payload could not be fetched at all. Still upserted so the failure is
     * visible downstream.
     */
    public static CreativeRecord failed(
        String tenantId,
        String adId,
        String accountId,
        String errorMessage,
        int fetchAttempts,
        Instant fetchedAt
    ) {
        return new CreativeRecord(
            tenantId, adId, accountId, null, null, CreativeType.UNKNOWN,
            null, null, null, null, null, ResolutionQuality.UNKNOWN, null,
            null, null, null, null, null, null, null, null,
            FetchStatus.FAILED, false, 0, null, null, null, errorMessage, fetchAttempts, fetchedAt
        );
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
