package com.delta.adsync.sync.token;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.http.GraphApiClient;
import com.delta.adsync.sync.http.GraphApiException;
import com.delta.adsync.sync.http.GraphErrorCategory;
import com.delta.adsync.sync.model.StoredToken;
import com.delta.adsync.sync.model.TokenExchangeResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenVaultTest {
    private static final String KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private GraphApiClient graphApiClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void encryptsAndRevealsForTheSameTenant() {
        TokenVault vault = newVault(KEY);

        StoredToken stored = vault.store("tenant-a", "EAAB-raw-token");

        assertThat(stored.encrypted()).isTrue();
        assertThat(stored.value()).startsWith("v1:").doesNotContain("EAAB-raw-token");
        assertThat(vault.reveal("tenant-a", stored)).isEqualTo("EAAB-raw-token");
    }

    @Test
    void sameTokenEncryptsDifferentlyEachTime() {
        TokenVault vault = newVault(KEY);

        StoredToken first = vault.store("tenant-a", "tok");
        StoredToken second = vault.store("tenant-a", "tok");

        assertThat(first.value()).isNotEqualTo(second.value());
    }

    @Test
    void ciphertextIsBoundToTheTenant() {
        TokenVault vault = newVault(KEY);
        StoredToken stored = vault.store("tenant-a", "tok");

        assertThatThrownBy(() -> vault.reveal("tenant-b", stored))
            .isInstanceOf(TokenEncryptionException.class)
            .hasMessageContaining("decryption failed");
    }

    @Test
    void tamperedCiphertextIsRejected() {
        TokenVault vault = newVault(KEY);
        StoredToken stored = vault.store("tenant-a", "tok");
        StoredToken tampered = new StoredToken(stored.value().substring(0, stored.value().length() - 4) + "AAAA", true);

        assertThatThrownBy(() -> vault.reveal("tenant-a", tampered)).isInstanceOf(TokenEncryptionException.class);
        assertThatThrownBy(() -> vault.reveal("tenant-a", new StoredToken("v2:abc", true)))
            .isInstanceOf(TokenEncryptionException.class);
    }

    @Test
    void missingKeyRefusesToEncryptButAllowsExplicitPlaintextFallback() {
        TokenVault vault = newVault("");

        assertThat(vault.isEncryptionAvailable()).isFalse();
        assertThatThrownBy(() -> vault.store("tenant-a", "tok")).isInstanceOf(TokenEncryptionException.class);

        StoredToken fallback = vault.storeAllowingPlaintext("tenant-a", "tok");
        assertThat(fallback.encrypted()).isFalse();
        assertThat(fallback.value()).isEqualTo("tok");
        assertThat(vault.reveal("tenant-a", fallback)).isEqualTo("tok");
    }

    @Test
    void nonBase64KeyIsHashedToAValidKey() {
        TokenVault vault = newVault("a passphrase that is not base64!");

        StoredToken stored = vault.store("tenant-a", "tok");

        assertThat(vault.reveal("tenant-a", stored)).isEqualTo("tok");
    }

    @Test
    void exchangeReturnsLongLivedTokenWithReportedExpiry() throws Exception {
        when(graphApiClient.graphUrl(eq("oauth/access_token"), anyMap())).thenReturn("https://graph.test/v21.0/oauth/access_token");
        when(graphApiClient.postForm(anyString(), anyMap()))
            .thenReturn(objectMapper.readTree("{\"access_token\":\"long\",\"expires_in\":5184000}"));
        TokenVault vault = newVault(KEY);

        TokenExchangeResult result = vault.exchangeShortLivedForLongLived("short");

        assertThat(result.accessToken()).isEqualTo("long");
        assertThat(result.longLived()).isTrue();
        assertThat(result.expiresAt()).isEqualTo(NOW.plusSeconds(5184000));
    }

    @Test
    void failedExchangeDegradesToShortLivedToken() {
        when(graphApiClient.graphUrl(eq("oauth/access_token"), anyMap())).thenReturn("https://graph.test/v21.0/oauth/access_token");
        when(graphApiClient.postForm(anyString(), anyMap()))
            .thenThrow(new GraphApiException(GraphErrorCategory.TRANSIENT, 500, 2, null, "Service temporarily unavailable"));
        TokenVault vault = newVault(KEY);

        TokenExchangeResult result = vault.exchangeShortLivedForLongLived("short", 7200L);

        assertThat(result.accessToken()).isEqualTo("short");
        assertThat(result.degraded()).isTrue();
        assertThat(result.expiresAt()).isEqualTo(NOW.plusSeconds(7200));
        assertThat(result.error()).contains("temporarily unavailable");
    }

    @Test
    void exchangeWithoutAppCredentialsDegradesInsteadOfThrowing() {
        AdSyncProperties properties = new AdSyncProperties();
        properties.getToken().setEncryptionKey(KEY);
        TokenVault vault = new TokenVault(properties, graphApiClient, Clock.fixed(NOW, ZoneOffset.UTC));

        TokenExchangeResult result = vault.exchangeShortLivedForLongLived("short");

        assertThat(result.degraded()).isTrue();
        assertThat(result.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(result.error()).contains("app-id");
    }

    private TokenVault newVault(String key) {
        AdSyncProperties properties = new AdSyncProperties();
        properties.getToken().setEncryptionKey(key);
        properties.getGraph().setAppId("app");
        properties.getGraph().setAppSecret("secret");
        return new TokenVault(properties, graphApiClient, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
