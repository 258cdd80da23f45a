package com.delta.adsync.sync.creative;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.TestFixtures;
import com.delta.adsync.sync.http.BatchRequest;
import com.delta.adsync.sync.http.BatchResponse;
import com.delta.adsync.sync.http.GraphApiClient;
import com.delta.adsync.sync.http.GraphApiException;
import com.delta.adsync.sync.http.GraphAuthException;
import com.delta.adsync.sync.http.GraphErrorCategory;
import com.delta.adsync.sync.http.GraphNotFoundException;
import com.delta.adsync.sync.media.MediaCacheException;
import com.delta.adsync.sync.media.MediaCacheService;
import com.delta.adsync.sync.model.BatchResolutionResult;
import com.delta.adsync.sync.model.CachedMedia;
import com.delta.adsync.sync.model.CreativeRecord;
import com.delta.adsync.sync.model.CreativeType;
import com.delta.adsync.sync.model.FetchStatus;
import com.delta.adsync.sync.model.ResolutionQuality;
import com.delta.adsync.sync.persistence.CreativeJdbcRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CreativeResolverTest {
    private static final Instant NOW = Instant.parse("2024-05-02T08:00:00Z");

    @Mock
    private GraphApiClient graphApiClient;
    @Mock
    private CreativeJdbcRepository repository;
    @Mock
    private MediaCacheService mediaCacheService;

    private AdSyncProperties properties;
    private CreativeResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new AdSyncProperties();
        properties.getGraph().setInterBatchDelayMs(0);
        CreativeLookups lookups = new CreativeLookups(graphApiClient);
        resolver = new CreativeResolver(
            graphApiClient,
            new MediaResolutionChain(lookups),
            new TextResolver(lookups),
            repository,
            mediaCacheService,
            properties,
            new ObjectMapper(),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void failingSubRequestOnlyAffectsItsOwnAd() {
        when(repository.findCreatives(eq("tenant-a"), anyCollection())).thenReturn(Map.of());
        when(graphApiClient.fetchBatch(eq("tok"), anyList())).thenReturn(List.of(
            new BatchResponse(200, TestFixtures.text("ad_link_image.json")),
            new BatchResponse(400, "{\"error\":{\"message\":\"Invalid parameter\",\"code\":100}}"),
            new BatchResponse(0, null),
            new BatchResponse(200, "not json")
        ));

        BatchResolutionResult result = resolver.resolveCreativesBatch(
            "tenant-a",
            List.of("2385001", "bad_ad", "slow_ad", "garbled_ad"),
            "act_42",
            "tok"
        );

        assertThat(result.records()).containsOnlyKeys("2385001");
        assertThat(result.errors()).containsEntry("bad_ad", "Invalid parameter");
        assertThat(result.errors()).containsEntry("slow_ad", "No response for sub-request");
        assertThat(result.errors()).containsEntry("garbled_ad", "Failed to parse response");
        verify(repository, times(1)).upsertCreative(any(CreativeRecord.class));

        CreativeRecord record = result.records().get("2385001");
        assertThat(record.externalAccountId()).isEqualTo("42");
        assertThat(record.creativeType()).isEqualTo(CreativeType.IMAGE);
        assertThat(record.fetchStatus()).isEqualTo(FetchStatus.SUCCESS);
        assertThat(record.imageSource()).isEqualTo("link_data_picture");
        assertThat(record.title()).isEqualTo("Spring sale");
        assertThat(record.previewUrl()).isEqualTo("https://fb.me/preview/2385001");
        assertThat(record.fetchAttempts()).isEqualTo(1);
        assertThat(record.fetchedAt()).isEqualTo(NOW);
    }

    @Test
    void errorEnvelopeInsideSuccessfulSlotIsReportedAsError() {
        when(repository.findCreatives(eq("tenant-a"), anyCollection())).thenReturn(Map.of());
        when(graphApiClient.fetchBatch(eq("tok"), anyList())).thenReturn(List.of(
            new BatchResponse(200, "{\"error\":{\"message\":\"Object does not exist\",\"code\":100}}")
        ));

        BatchResolutionResult result = resolver.resolveCreativesBatch("tenant-a", List.of("gone_ad"), "42", "tok");

        assertThat(result.records()).isEmpty();
        assertThat(result.errors()).containsEntry("gone_ad", "Object does not exist");
        verify(repository, never()).upsertCreative(any());
    }

    @Test
    void duplicateIdsAreResolvedOnceAndChunkedByBatchSize() {
        properties.getGraph().setBatchSize(2);
        when(repository.findCreatives(eq("tenant-a"), anyCollection())).thenReturn(Map.of());
        when(graphApiClient.fetchBatch(eq("tok"), anyList())).thenAnswer(invocation -> {
            List<BatchRequest> requests = invocation.getArgument(1);
            return requests.stream()
                .map(request -> new BatchResponse(200, adWithDirectImage(request.relativeUrl().substring(0, request.relativeUrl().indexOf('?')))))
                .collect(Collectors.toList());
        });

        BatchResolutionResult result = resolver.resolveCreativesBatch("tenant-a", List.of("a1", "a2", "a1", "a3", " "), "42", "tok");

        assertThat(result.records()).containsOnlyKeys("a1", "a2", "a3");
        assertThat(result.errors()).isEmpty();
        verify(graphApiClient, times(2)).fetchBatch(eq("tok"), anyList());
    }

    @Test
    void batchTransportFailureMarksEveryAdInTheChunk() {
        when(repository.findCreatives(eq("tenant-a"), anyCollection())).thenReturn(Map.of());
        when(graphApiClient.fetchBatch(eq("tok"), anyList()))
            .thenThrow(new GraphApiException(GraphErrorCategory.TRANSIENT, 503, null, null, "HTTP 503"));

        BatchResolutionResult result = resolver.resolveCreativesBatch("tenant-a", List.of("a1", "a2"), "42", "tok");

        assertThat(result.records()).isEmpty();
        assertThat(result.errors()).containsOnlyKeys("a1", "a2");
        assertThat(result.errors().get("a1")).isEqualTo("Batch request failed: HTTP 503");
        verify(repository, never()).upsertCreative(any());
    }

    @Test
    void authFailureAbortsTheBatch() {
        when(repository.findCreatives(eq("tenant-a"), anyCollection())).thenReturn(Map.of());
        when(graphApiClient.fetchBatch(eq("tok"), anyList())).thenThrow(new GraphAuthException(400, 190, null, "Session expired"));

        assertThatThrownBy(() -> resolver.resolveCreativesBatch("tenant-a", List.of("a1"), "42", "tok"))
            .isInstanceOf(GraphAuthException.class);
    }

    @Test
    void finalStoredRecordsAreReusedWithoutUpstreamCalls() {
        CreativeRecord finalRecord = storedRecord("a1", FetchStatus.SUCCESS, ResolutionQuality.SD, 1);
        CreativeRecord lowRecord = storedRecord("a2", FetchStatus.SUCCESS, ResolutionQuality.LOW, 1);
        when(repository.findCreatives(eq("tenant-a"), anyCollection())).thenReturn(Map.of("a1", finalRecord, "a2", lowRecord));
        when(graphApiClient.fetchBatch(eq("tok"), anyList())).thenReturn(List.of(new BatchResponse(200, adWithDirectImage("a2"))));

        BatchResolutionResult result = resolver.resolveCreativesBatch("tenant-a", List.of("a1", "a2"), "42", "tok", true);

        assertThat(result.reusedStored()).isEqualTo(1);
        assertThat(result.records().get("a1")).isSameAs(finalRecord);
        assertThat(result.records().get("a2").fetchAttempts()).isEqualTo(2);
        ArgumentCaptor<List<BatchRequest>> requests = captorOfRequests();
        verify(graphApiClient).fetchBatch(eq("tok"), requests.capture());
        assertThat(requests.getValue()).hasSize(1);
        assertThat(requests.getValue().get(0).relativeUrl())
            .startsWith("a2?fields=")
            .contains("creative%7B")
            .doesNotContain("{");
    }

    @Test
    void recordsPastMaxAttemptsAreFinal() {
        properties.getSync().setCreativeMaxAttempts(3);

        assertThat(resolver.isFinal(storedRecord("a", FetchStatus.FAILED, ResolutionQuality.UNKNOWN, 3))).isTrue();
        assertThat(resolver.isFinal(storedRecord("a", FetchStatus.FAILED, ResolutionQuality.UNKNOWN, 2))).isFalse();
        assertThat(resolver.isFinal(storedRecord("a", FetchStatus.PARTIAL, ResolutionQuality.HD, 1))).isFalse();
        assertThat(resolver.isFinal(storedRecord("a", FetchStatus.SUCCESS, ResolutionQuality.LOW, 1))).isFalse();
        assertThat(resolver.isFinal(storedRecord("a", FetchStatus.SUCCESS, ResolutionQuality.HD, 1))).isTrue();
        assertThat(resolver.isFinal(null)).isFalse();
    }

    @Test
    void persistenceFailureIsReportedButKeepsTheRecord() {
        when(repository.findCreatives(eq("tenant-a"), anyCollection())).thenReturn(Map.of());
        when(graphApiClient.fetchBatch(eq("tok"), anyList())).thenReturn(List.of(new BatchResponse(200, adWithDirectImage("a1"))));
        doThrow(new DataAccessResourceFailureException("db down")).when(repository).upsertCreative(any());

        BatchResolutionResult result = resolver.resolveCreativesBatch("tenant-a", List.of("a1"), "42", "tok");

        assertThat(result.records()).containsKey("a1");
        assertThat(result.unpersistedAdIds()).containsExactly("a1");
    }

    @Test
    void singleResolveStoresFailedRecordOnUpstreamError() {
        when(graphApiClient.graphUrl(eq("a9"), anyMap())).thenReturn("a9");
        when(repository.findCreative("tenant-a", "a9")).thenReturn(storedRecord("a9", FetchStatus.FAILED, ResolutionQuality.UNKNOWN, 1));
        when(graphApiClient.getJson("a9")).thenThrow(new GraphNotFoundException(400, 100, 33, "Object does not exist"));

        CreativeRecord record = resolver.resolveCreative("tenant-a", "a9", "act_42", "tok");

        assertThat(record.fetchStatus()).isEqualTo(FetchStatus.FAILED);
        assertThat(record.errorMessage()).isEqualTo("Object does not exist");
        assertThat(record.fetchAttempts()).isEqualTo(2);
        verify(repository).upsertCreative(record);
    }

    @Test
    void adWithoutCreativeIsRecordedAsFailed() {
        when(graphApiClient.graphUrl(eq("a5"), anyMap())).thenReturn("a5");
        when(graphApiClient.getJson("a5")).thenReturn(TestFixtures.parse("{\"id\":\"a5\",\"name\":\"Orphan\"}"));

        CreativeRecord record = resolver.resolveCreative("tenant-a", "a5", "42", "tok");

        assertThat(record.fetchStatus()).isEqualTo(FetchStatus.FAILED);
        assertThat(record.errorMessage()).isEqualTo("Ad has no creative");
        assertThat(record.adName()).isEqualTo("Orphan");
        assertThat(record.rawSnapshot()).contains("Orphan");
    }

    @Test
    void videoRecordsCarryVideoPageUrl() {
        when(graphApiClient.graphUrl(anyString(), anyMap())).thenAnswer(invocation -> invocation.getArgument(0));
        when(graphApiClient.getJson("2385002")).thenReturn(TestFixtures.json("ad_video.json"));
        when(graphApiClient.getJson("vid_77")).thenReturn(TestFixtures.json("video_thumbnails.json"));

        CreativeRecord record = resolver.resolveCreative("tenant-a", "2385002", "42", "tok");

        assertThat(record.creativeType()).isEqualTo(CreativeType.VIDEO);
        assertThat(record.videoId()).isEqualTo("vid_77");
        assertThat(record.videoUrl()).isEqualTo("https://www.facebook.com/ads/videos/vid_77");
        assertThat(record.resolutionQuality()).isEqualTo(ResolutionQuality.HD);
        assertThat(record.imageUrlHd()).isEqualTo(record.imageUrl());
    }

    @Test
    void cachesResolvedImageWhenEnabled() {
        properties.getMedia().setCacheOnResolve(true);
        when(graphApiClient.graphUrl(eq("a1"), anyMap())).thenReturn("a1");
        when(graphApiClient.getJson("a1")).thenReturn(TestFixtures.parse(adWithDirectImage("a1")));
        when(mediaCacheService.cache("tenant-a", "a1", "image", "https://cdn.example.com/a1.jpg?w=1080&h=1080"))
            .thenReturn(new CachedMedia("http://localhost:8080/media/x.jpg", "x.jpg", 2048L, "image/jpeg", NOW.plusSeconds(60)));

        CreativeRecord record = resolver.resolveCreative("tenant-a", "a1", "42", "tok");

        assertThat(record.cachedImageUrl()).isEqualTo("http://localhost:8080/media/x.jpg");
        assertThat(record.cachedFileSize()).isEqualTo(2048L);
    }

    @Test
    void cacheFailureKeepsTheUpstreamUrl() {
        properties.getMedia().setCacheOnResolve(true);
        when(graphApiClient.graphUrl(eq("a1"), anyMap())).thenReturn("a1");
        when(graphApiClient.getJson("a1")).thenReturn(TestFixtures.parse(adWithDirectImage("a1")));
        when(mediaCacheService.cache(anyString(), anyString(), anyString(), anyString()))
            .thenThrow(new MediaCacheException("Download failed"));

        CreativeRecord record = resolver.resolveCreative("tenant-a", "a1", "42", "tok");

        assertThat(record.imageUrl()).isEqualTo("https://cdn.example.com/a1.jpg?w=1080&h=1080");
        assertThat(record.cachedImageUrl()).isNull();
    }

    private static String adWithDirectImage(String adId) {
        return "{\"id\":\"" + adId + "\",\"creative\":{\"id\":\"c_" + adId + "\",\"title\":\"Title " + adId + "\","
            + "\"image_url\":\"https://cdn.example.com/" + adId + ".jpg?w=1080&h=1080\"}}";
    }

    private static CreativeRecord storedRecord(String adId, FetchStatus status, ResolutionQuality quality, int attempts) {
        return new CreativeRecord(
            "tenant-a", adId, "42", null, null, CreativeType.IMAGE,
            "https://cdn.example.com/" + adId + ".jpg", null, null, null, null, quality, "creative_image_url",
            null, null, null, "t", null, null, null, null,
            status, false, 0, null, null, null, null, attempts, NOW.minusSeconds(3600)
        );
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<List<BatchRequest>> captorOfRequests() {
        return ArgumentCaptor.forClass((Class<List<BatchRequest>>) (Class<?>) List.class);
    }
}
