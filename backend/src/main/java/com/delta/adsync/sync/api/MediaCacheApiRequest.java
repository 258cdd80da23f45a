package com.delta.adsync.sync.api;

public record MediaCacheApiRequest(String tenantId, String adId, String mediaType, String sourceUrl) {
}
