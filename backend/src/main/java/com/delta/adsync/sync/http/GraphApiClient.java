package com.delta.adsync.sync.http;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.model.HttpFetchResult;
import com.delta.adsync.sync.util.MediaUrls;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * HTTP access to the Graph API. Transient failures (throttling codes, 5xx, network errors) are
 * retried with exponential backoff; everything else fails fast with a typed
 * {@link GraphApiException}.
 */
@Service
public class GraphApiClient {
    private static final Logger log = LoggerFactory.getLogger(GraphApiClient.class);
    private static final String USER_AGENT = "delta-ad-sync/0.1";
    private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private final AdSyncProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;
    private final Semaphore globalLimiter;

    public GraphApiClient(
        AdSyncProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getGraph().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGraph().getGlobalConcurrency());
    }

    public String versionedBaseUrl() {
        AdSyncProperties.Graph graph = properties.getGraph();
        return graph.getBaseUrl() + "/" + graph.getApiVersion() + "/";
    }

    public String graphUrl(String path, Map<String, String> params) {
        String cleanPath = path == null ? "" : path.startsWith("/") ? path.substring(1) : path;
        String query = encodeForm(params);
        return versionedBaseUrl() + cleanPath + (query.isEmpty() ? "" : "?" + query);
    }

    public JsonNode getJson(String url) {
        return executeWithRetry("GET", url, null);
    }

    public JsonNode postForm(String url, Map<String, String> form) {
        return executeWithRetry("POST", url, encodeForm(form));
    }

    public GraphPage fetchPage(String url) {
        JsonNode node = getJson(url);
        List<JsonNode> rows = new ArrayList<>();
        JsonNode data = node.path("data");
        if (data.isArray()) {
            data.forEach(rows::add);
        }
        JsonNode next = node.path("paging").path("next");
        String nextUrl = next.isTextual() && !next.asText().isBlank() ? next.asText() : null;
        return new GraphPage(rows, nextUrl);
    }

    /**
     * Follows {@code paging.next} until the upstream stops advertising a next page or the
     * configured page cap is reached.
     */
    public PagedRows fetchAllPages(String firstUrl) {
        int maxPages = properties.getGraph().getMaxPages();
        List<JsonNode> rows = new ArrayList<>();
        String url = firstUrl;
        String previousUrl = null;
        int pages = 0;
        while (url != null && pages < maxPages) {
            if (url.equals(previousUrl)) {
                log.warn("Upstream repeated the same next page url, stopping pagination at page {}", pages);
                return new PagedRows(rows, pages, true);
            }
            GraphPage page = fetchPage(url);
            pages++;
            rows.addAll(page.rows());
            previousUrl = url;
            url = page.hasNext() ? page.nextPageUrl() : null;
        }
        boolean truncated = url != null;
        if (truncated) {
            log.warn("Pagination stopped at page cap {} for {}", maxPages, MediaUrls.redactToken(firstUrl));
        }
        return new PagedRows(rows, pages, truncated);
    }

    /**
     * Issues one composite request. Sub-request failures are returned in their slot, only a
     * failure of the batch call itself throws.
     */
    public List<BatchResponse> fetchBatch(String accessToken, List<BatchRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        if (requests.size() > AdSyncProperties.MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(
                "Batch holds " + requests.size() + " sub-requests, limit is " + AdSyncProperties.MAX_BATCH_SIZE
            );
        }
        List<BatchResponse> responses = sendBatch(accessToken, requests);
        int maxAttempts = 1 + properties.getGraph().getMaxRetries();
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            List<Integer> retryable = retryableSlots(responses);
            if (retryable.isEmpty()) {
                break;
            }
            log.info(
                "Retrying {} throttled batch sub-request(s) (attempt {}/{})",
                retryable.size(),
                attempt + 1,
                maxAttempts
            );
            if (!sleepBackoff(attempt)) {
                break;
            }
            List<BatchRequest> again = new ArrayList<>(retryable.size());
            for (int index : retryable) {
                again.add(requests.get(index));
            }
            List<BatchResponse> retried = sendBatch(accessToken, again);
            for (int i = 0; i < retryable.size(); i++) {
                responses.set(retryable.get(i), retried.get(i));
            }
        }
        return responses;
    }

    private List<BatchResponse> sendBatch(String accessToken, List<BatchRequest> requests) {
        List<Map<String, String>> payload = new ArrayList<>();
        for (BatchRequest request : requests) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("method", request.method());
            entry.put("relative_url", request.relativeUrl());
            payload.add(entry);
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("access_token", accessToken);
        form.put("include_headers", "false");
        try {
            form.put("batch", objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize batch payload", e);
        }

        JsonNode reply = postForm(versionedBaseUrl(), form);
        if (!reply.isArray()) {
            throw new GraphApiException(GraphErrorCategory.INVALID_REQUEST, 200, null, null, "Batch reply is not an array");
        }
        List<BatchResponse> responses = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            JsonNode slot = i < reply.size() ? reply.get(i) : null;
            if (slot == null || slot.isNull()) {
                responses.add(new BatchResponse(0, null));
                continue;
            }
            JsonNode body = slot.get("body");
            String bodyText = body == null || body.isNull() ? null : body.isTextual() ? body.asText() : body.toString();
            responses.add(new BatchResponse(slot.path("code").asInt(0), bodyText));
        }
        return responses;
    }

    /** Slots whose error envelope classifies as throttling or a transient upstream failure. */
    private List<Integer> retryableSlots(List<BatchResponse> responses) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < responses.size(); i++) {
            BatchResponse response = responses.get(i);
            if (response.code() == 0 || response.body() == null) {
                continue;
            }
            JsonNode node = parse(response.body());
            JsonNode error = node == null ? null : node.get("error");
            if (error == null || !error.isObject()) {
                continue;
            }
            Integer code = error.hasNonNull("code") ? error.get("code").asInt() : null;
            Integer subcode = error.hasNonNull("error_subcode") ? error.get("error_subcode").asInt() : null;
            if (GraphErrorClassifier.classify(response.code(), code, subcode).isRetryable()) {
                out.add(i);
            }
        }
        return out;
    }

    /**
     * Raw GET used for media downloads. Retries like the JSON calls; the caller inspects the
     * returned result.
     */
    public HttpFetchResult download(String url, long maxBytes) {
        int maxAttempts = 1 + properties.getGraph().getMaxRetries();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce("GET", url, null, maxBytes);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private JsonNode executeWithRetry(String method, String url, String formBody) {
        int maxAttempts = 1 + properties.getGraph().getMaxRetries();
        GraphApiException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            HttpFetchResult result = executeOnce(method, url, formBody, 0);
            try {
                return interpret(result);
            } catch (GraphApiException e) {
                lastError = e;
                if (!e.getCategory().isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                log.info(
                    "Graph call {} {} failed with {} (attempt {}/{}), backing off",
                    method,
                    MediaUrls.redactToken(url),
                    e.getCategory(),
                    attempt,
                    maxAttempts
                );
                if (!sleepBackoff(attempt)) {
                    throw e;
                }
            }
        }
        throw lastError;
    }

    private JsonNode interpret(HttpFetchResult result) {
        if (result.errorCode() != null) {
            throw new GraphApiException(
                "invalid_url".equals(result.errorCode()) ? GraphErrorCategory.INVALID_REQUEST : GraphErrorCategory.TRANSIENT,
                0,
                null,
                null,
                result.errorCode() + ": " + result.errorMessage()
            );
        }
        JsonNode node = parse(result.body());
        JsonNode error = node == null ? null : node.get("error");
        if (error != null && error.isObject()) {
            Integer code = error.hasNonNull("code") ? error.get("code").asInt() : null;
            Integer subcode = error.hasNonNull("error_subcode") ? error.get("error_subcode").asInt() : null;
            String message = error.path("message").asText("Graph API error");
            GraphErrorCategory category = GraphErrorClassifier.classify(result.statusCode(), code, subcode);
            throw GraphApiException.of(category, result.statusCode(), code, subcode, message);
        }
        if (!result.isSuccessful()) {
            GraphErrorCategory category = GraphErrorClassifier.fromHttpStatus(result.statusCode());
            throw GraphApiException.of(category, result.statusCode(), null, null, "HTTP " + result.statusCode());
        }
        if (node == null) {
            throw new GraphApiException(GraphErrorCategory.INVALID_REQUEST, result.statusCode(), null, null, "Unparseable response body");
        }
        return node;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private HttpFetchResult executeOnce(String method, String url, String formBody, long maxBytes) {
        Instant startedAt = Instant.now();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException | NullPointerException e) {
            return errorResult(url, startedAt, "invalid_url", "Malformed url");
        }
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getGraph().getRequestTimeoutSeconds()))
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json, */*;q=0.8");
            HttpRequest request = "POST".equals(method)
                ? builder.header("Content-Type", FORM_CONTENT_TYPE)
                    .POST(HttpRequest.BodyPublishers.ofString(formBody == null ? "" : formBody, StandardCharsets.UTF_8))
                    .build()
                : builder.GET().build();

            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            byte[] bytes;
            try (InputStream in = response.body()) {
                bytes = maxBytes > 0 ? in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, maxBytes + 1)) : in.readAllBytes();
            }
            if (maxBytes > 0 && bytes.length > maxBytes) {
                return errorResult(url, startedAt, "too_large", "Body exceeds " + maxBytes + " bytes");
            }
            return new HttpFetchResult(
                url,
                response.statusCode(),
                new String(bytes, StandardCharsets.UTF_8),
                bytes,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null) {
            return errorCode.equals("timeout") || errorCode.equals("io_error");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    /**
     * Sleeps {@code base * 2^(attempt-1)} capped at the configured ceiling. Returns false when
     * interrupted.
     */
    private boolean sleepBackoff(int attempt) {
        AdSyncProperties.Graph graph = properties.getGraph();
        long delay = (long) graph.getRetryBaseDelayMs() << Math.min(20, Math.max(0, attempt - 1));
        delay = Math.min(delay, graph.getRetryMaxDelayMs());
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    static String encodeForm(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            joiner.add(
                URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8)
            );
        }
        return joiner.toString();
    }
}
