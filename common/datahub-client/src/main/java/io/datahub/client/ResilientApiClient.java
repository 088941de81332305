package io.datahub.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datahub.cache.CacheAccessException;
import io.datahub.client.auth.Token;
import io.datahub.client.auth.TokenManager;
import io.datahub.client.metrics.ClientMetrics;
import io.datahub.client.query.QueryBuilder;
import io.datahub.client.query.TimeWindow;
import io.datahub.client.transport.HttpTransport;
import io.datahub.client.transport.HttpTransport.HttpCallResult;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches JSON resources with bearer authentication and falls back to the last known-good
 * response on any failure.
 * <p>
 * One fetch runs as a bounded loop: obtain a token (refreshing once when none is cached), call the
 * resource, then either return the live payload, refresh and retry after 401/403, or serve the
 * cached body. Callers only see "no data" when nothing usable is cached.
 * <p>
 * The auth retry budget belongs to the client, not to a single fetch: consecutive 401/403
 * responses count across fetches and only a successful call resets them.
 */
public class ResilientApiClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientApiClient.class);

    public static final int DEFAULT_MAX_AUTH_RETRIES = 5;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);

    private final String apiBaseUrl;
    private final TokenManager tokens;
    private final HttpTransport transport;
    private final ResponseStore responses;
    private final QueryBuilder queries;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;
    private final int maxAuthRetries;
    private final RetryCounter authRetries;
    private final ClientMetrics metrics;

    public ResilientApiClient(String apiBaseUrl,
                              TokenManager tokens,
                              HttpTransport transport,
                              ResponseStore responses,
                              QueryBuilder queries,
                              ObjectMapper mapper) {
        this(apiBaseUrl, tokens, transport, responses, queries, mapper,
            DEFAULT_REQUEST_TIMEOUT, DEFAULT_MAX_AUTH_RETRIES, ClientMetrics.noop());
    }

    public ResilientApiClient(String apiBaseUrl,
                              TokenManager tokens,
                              HttpTransport transport,
                              ResponseStore responses,
                              QueryBuilder queries,
                              ObjectMapper mapper,
                              Duration requestTimeout,
                              int maxAuthRetries,
                              ClientMetrics metrics) {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
            throw new IllegalArgumentException("apiBaseUrl must not be null or blank");
        }
        this.apiBaseUrl = apiBaseUrl.trim();
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.responses = Objects.requireNonNull(responses, "responses");
        this.queries = Objects.requireNonNull(queries, "queries");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (maxAuthRetries < 0) {
            throw new IllegalArgumentException("maxAuthRetries must not be negative");
        }
        this.requestTimeout = requestTimeout;
        this.maxAuthRetries = maxAuthRetries;
        this.authRetries = new RetryCounter(maxAuthRetries);
        this.metrics = metrics == null ? ClientMetrics.noop() : metrics;
    }

    /**
     * Convenience form of {@link #fetch(FetchRequest)}.
     *
     * @param interval ISO-8601 length of the window ending now; {@code null} means {@code P2D}
     * @return the transformed payload, or empty when neither the API nor the cache has data
     */
    public Optional<JsonNode> fetch(String resourcePath,
                                    String cacheKey,
                                    List<String> idFilters,
                                    String interval,
                                    PayloadTransform transform) {
        TimeWindow window = TimeWindow.trailing(interval == null ? FetchRequest.DEFAULT_INTERVAL : interval);
        return fetch(new FetchRequest(resourcePath, cacheKey, idFilters, window, transform)).asOptional();
    }

    public FetchResult fetch(FetchRequest request) {
        Objects.requireNonNull(request, "request");
        FetchResult result = execute(request);
        metrics.fetchCompleted(result.source().name(),
            result.failure() == null ? null : result.failure().name());
        return result;
    }

    private FetchResult execute(FetchRequest request) {
        String url = queries.url(apiBaseUrl, request.resourcePath(), request.idFilters(), request.window());
        boolean refreshedForMissingToken = false;

        while (true) {
            Optional<Token> token = tokens.currentToken();
            if (token.isEmpty()) {
                if (refreshedForMissingToken) {
                    log.warn("No token available for {} after refresh", tokens.username());
                    return fallback(request, FetchFailure.AUTH);
                }
                tokens.refresh();
                refreshedForMissingToken = true;
                continue;
            }

            log.debug("Calling URL: {}", url);
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("Authorization", "Bearer " + token.get().value());
            headers.put("Accept", "application/json");
            HttpCallResult result = transport.get(url, headers, requestTimeout);

            if (result.isTransportFailure()) {
                log.warn("API call to {} failed: {}", url, result.error());
                return fallback(request, FetchFailure.TRANSPORT);
            }

            int status = result.statusCode();
            if (status == 200) {
                Optional<JsonNode> payload = decode(result.body());
                if (payload.isEmpty()) {
                    log.warn("Empty payload received from {}", url);
                    return fallback(request, FetchFailure.EMPTY_PAYLOAD);
                }
                store(request.cacheKey(), result.body());
                authRetries.reset();
                return FetchResult.live(request.transform().apply(payload.get()));
            }

            if (status == 401 || status == 403) {
                if (authRetries.tryIncrement()) {
                    log.debug("API call to {} rejected with {}, refreshing token (attempt {})",
                        url, status, authRetries.count());
                    tokens.refresh();
                    continue;
                }
                log.warn("API call to {} rejected with {}, auth retry limit of {} reached",
                    url, status, maxAuthRetries);
                return fallback(request, FetchFailure.AUTH);
            }

            log.warn("API call to {} failed with status {}", url, status);
            return fallback(request, FetchFailure.UPSTREAM);
        }
    }

    private void store(String cacheKey, String body) {
        try {
            responses.save(cacheKey, body);
        } catch (CacheAccessException e) {
            log.warn("Could not cache response under {}", cacheKey, e);
        }
    }

    private FetchResult fallback(FetchRequest request, FetchFailure failure) {
        Optional<JsonNode> cached = responses.lastGood(request.cacheKey()).flatMap(this::decode);
        if (cached.isEmpty()) {
            log.error("API call for {} failed ({}) and no cached state found", request.cacheKey(), failure);
            return FetchResult.unavailable(failure);
        }
        log.debug("Serving cached state for {} after {}", request.cacheKey(), failure);
        return FetchResult.cached(request.transform().apply(cached.get()), failure);
    }

    private Optional<JsonNode> decode(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (Exception e) {
            log.debug("Body is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
        return isEmpty(node) ? Optional.empty() : Optional.of(node);
    }

    /**
     * Null, JSON null, empty containers, empty or {@code "0"} strings, {@code false} and zero.
     */
    static boolean isEmpty(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return true;
        }
        if (node.isContainerNode()) {
            return node.size() == 0;
        }
        if (node.isTextual()) {
            String text = node.asText();
            return text.isEmpty() || "0".equals(text);
        }
        if (node.isBoolean()) {
            return !node.asBoolean();
        }
        if (node.isNumber()) {
            return node.decimalValue().signum() == 0;
        }
        return false;
    }
}
