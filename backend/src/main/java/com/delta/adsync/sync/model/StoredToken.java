package com.delta.adsync.sync.model;

/**
 * A persisted access token. {@code encrypted=false} only ever comes from the explicit plaintext
 * fallback.
 */
public record StoredToken(String value, boolean encrypted) {
}
