package com.delta.adsync.sync.token;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.http.GraphApiClient;
import com.delta.adsync.sync.http.GraphApiException;
import com.delta.adsync.sync.model.StoredToken;
import com.delta.adsync.sync.model.TokenExchangeResult;
import com.delta.adsync.sync.util.HashUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encrypts access tokens at rest (AES-256-GCM, tenant id as associated data) and talks to the
 * OAuth token endpoints.
 */
@Service
public class TokenVault {
    private static final Logger log = LoggerFactory.getLogger(TokenVault.class);
    private static final String PREFIX = "v1:";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final AdSyncProperties properties;
    private final GraphApiClient graphApiClient;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final SecretKeySpec key;

    public TokenVault(AdSyncProperties properties, GraphApiClient graphApiClient, Clock clock) {
        this.properties = properties;
        this.graphApiClient = graphApiClient;
        this.clock = clock;
        this.key = deriveKey(properties.getToken().getEncryptionKey());
        if (key == null) {
            log.warn("No token encryption key configured; tokens can only be stored through the plaintext fallback");
        }
    }

    public boolean isEncryptionAvailable() {
        return key != null;
    }

    /**
     * Encrypts a raw token for one tenant.
     *
     * @throws TokenEncryptionException when no key is configured or the cipher fails
     */
    public StoredToken store(String tenantId, String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new IllegalArgumentException("Token is required");
        }
        if (key == null) {
            throw new TokenEncryptionException("Token encryption key is not configured");
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(aad(tenantId));
            byte[] sealed = cipher.doFinal(rawToken.getBytes(StandardCharsets.UTF_8));
            ByteBuffer out = ByteBuffer.allocate(iv.length + sealed.length);
            out.put(iv).put(sealed);
            return new StoredToken(PREFIX + Base64.getEncoder().encodeToString(out.array()), true);
        } catch (GeneralSecurityException e) {
            throw new TokenEncryptionException("Token encryption failed", e);
        }
    }

    /**
     * Explicit fallback: encrypts when possible, otherwise keeps the token in plaintext and says
     * so both in the log and in the returned flag.
     */
    public StoredToken storeAllowingPlaintext(String tenantId, String rawToken) {
        try {
            return store(tenantId, rawToken);
        } catch (TokenEncryptionException e) {
            log.warn("Storing access token for tenant {} in PLAINTEXT: {}", tenantId, e.getMessage());
            return new StoredToken(rawToken, false);
        }
    }

    public String reveal(String tenantId, StoredToken stored) {
        if (stored == null || stored.value() == null) {
            throw new TokenEncryptionException("No stored token");
        }
        if (!stored.encrypted()) {
            return stored.value();
        }
        if (!stored.value().startsWith(PREFIX)) {
            throw new TokenEncryptionException("Unsupported ciphertext format");
        }
        if (key == null) {
            throw new TokenEncryptionException("Token encryption key is not configured");
        }
        try {
            byte[] payload = Base64.getDecoder().decode(stored.value().substring(PREFIX.length()));
            if (payload.length <= IV_LENGTH) {
                throw new TokenEncryptionException("Ciphertext is truncated");
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, payload, 0, IV_LENGTH));
            cipher.updateAAD(aad(tenantId));
            byte[] plain = cipher.doFinal(payload, IV_LENGTH, payload.length - IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new TokenEncryptionException("Token decryption failed", e);
        }
    }

    public TokenExchangeResult exchangeCodeForToken(String code, String redirectUri) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Authorization code is required");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", requireAppId());
        form.put("client_secret", requireAppSecret());
        form.put("redirect_uri", redirectUri);
        form.put("code", code);
        JsonNode reply = graphApiClient.postForm(graphApiClient.graphUrl("oauth/access_token", Map.of()), form);
        String token = reply.path("access_token").asText(null);
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("Token endpoint returned no access_token");
        }
        long ttl = reply.path("expires_in").asLong(0L);
        if (ttl <= 0) {
            ttl = properties.getToken().getShortLivedDefaultTtlSeconds();
        }
        return new TokenExchangeResult(token, Instant.now(clock).plusSeconds(ttl), false, null);
    }

    /**
     * Trades a short-lived token for a long-lived one. When the exchange fails the short-lived
     * token comes back with {@code longLived=false} and a short expiry instead of an error.
     */
    public TokenExchangeResult exchangeShortLivedForLongLived(String rawToken) {
        return exchangeShortLivedForLongLived(rawToken, null);
    }

    public TokenExchangeResult exchangeShortLivedForLongLived(String rawToken, Long shortLivedTtlSeconds) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new IllegalArgumentException("Token is required");
        }
        Instant now = Instant.now(clock);
        try {
            TokenExchangeResult result = requestLongLivedToken(rawToken);
            if (result == null) {
                return shortLivedFallback(rawToken, shortLivedTtlSeconds, now, "Exchange returned no access_token");
            }
            return result;
        } catch (GraphApiException | IllegalStateException e) {
            log.warn("Long-lived token exchange failed, keeping short-lived token: {}", e.getMessage());
            return shortLivedFallback(rawToken, shortLivedTtlSeconds, now, e.getMessage());
        }
    }

    /**
     * Calls the {@code fb_exchange_token} grant. Also used to extend an existing long-lived token.
     * Returns null when the endpoint answers without a token; upstream failures propagate.
     */
    public TokenExchangeResult requestLongLivedToken(String rawToken) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "fb_exchange_token");
        form.put("client_id", requireAppId());
        form.put("client_secret", requireAppSecret());
        form.put("fb_exchange_token", rawToken);
        JsonNode reply = graphApiClient.postForm(graphApiClient.graphUrl("oauth/access_token", Map.of()), form);
        String longLived = reply.path("access_token").asText(null);
        if (longLived == null || longLived.isBlank()) {
            return null;
        }
        long ttl = reply.path("expires_in").asLong(0L);
        if (ttl <= 0) {
            ttl = properties.getToken().getLongLivedDefaultTtlSeconds();
        }
        return new TokenExchangeResult(longLived, Instant.now(clock).plusSeconds(ttl), true, null);
    }

    private TokenExchangeResult shortLivedFallback(String rawToken, Long ttlSeconds, Instant now, String error) {
        long ttl = ttlSeconds == null || ttlSeconds <= 0 ? properties.getToken().getShortLivedDefaultTtlSeconds() : ttlSeconds;
        return new TokenExchangeResult(rawToken, now.plusSeconds(ttl), false, error);
    }

    private String requireAppId() {
        String appId = properties.getGraph().getAppId();
        if (appId == null || appId.isBlank()) {
            throw new IllegalStateException("adsync.graph.app-id is not configured");
        }
        return appId;
    }

    private String requireAppSecret() {
        String secret = properties.getGraph().getAppSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("adsync.graph.app-secret is not configured");
        }
        return secret;
    }

    private static byte[] aad(String tenantId) {
        return ("tenant:" + (tenantId == null ? "" : tenantId)).getBytes(StandardCharsets.UTF_8);
    }

    /** A base64 value of exactly 32 bytes is used as-is; anything else is hashed to 32 bytes. */
    static SecretKeySpec deriveKey(String configured) {
        if (configured == null || configured.isBlank()) {
            return null;
        }
        String trimmed = configured.trim();
        byte[] material;
        try {
            material = Base64.getDecoder().decode(trimmed);
        } catch (IllegalArgumentException e) {
            material = null;
        }
        if (material == null || material.length != 32) {
            material = HashUtils.sha256(trimmed.getBytes(StandardCharsets.UTF_8));
        }
        return new SecretKeySpec(material, "AES");
    }
}
