package io.datahub.client.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datahub.cache.CacheAccessException;
import io.datahub.client.metrics.ClientMetrics;
import io.datahub.client.metrics.ClientMetrics.RefreshStatus;
import io.datahub.client.transport.HttpTransport;
import io.datahub.client.transport.HttpTransport.HttpCallResult;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the credentials and the cached bearer token for one user.
 * <p>
 * Refresh is reactive only: the token's expiry is never checked before a call. A new token is
 * requested when the cache has none or when the upstream rejects the current one. Concurrent
 * refreshes are tolerated, the last stored token wins.
 */
public class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    static final long DEFAULT_EXPIRES_IN_SECONDS = 300;

    private final Credentials credentials;
    private final TokenEndpoint endpoint;
    private final HttpTransport transport;
    private final TokenStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ClientMetrics metrics;

    public TokenManager(Credentials credentials,
                        TokenEndpoint endpoint,
                        HttpTransport transport,
                        TokenStore store,
                        ObjectMapper mapper,
                        Clock clock,
                        ClientMetrics metrics) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.store = Objects.requireNonNull(store, "store");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics == null ? ClientMetrics.noop() : metrics;
    }

    public String username() {
        return credentials.username();
    }

    /**
     * Returns the cached token, or empty when none is cached and a refresh is due.
     */
    public Optional<Token> currentToken() {
        Optional<Token> token = store.find(credentials.username());
        if (token.isPresent()) {
            log.debug("Token (from cache): {}", token.get().preview());
        } else {
            log.debug("No token in cache for {}", credentials.username());
        }
        return token;
    }

    /**
     * Requests a new token and stores it. Never throws: failures are logged and leave the cached
     * token untouched.
     */
    public void refresh() {
        log.debug("Refreshing API token for {}", credentials.username());

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", endpoint.grantType());
        form.put("client_id", endpoint.clientId());
        form.put("username", credentials.username());
        form.put("password", credentials.password());

        HttpCallResult result = transport.post(
            endpoint.url(),
            Map.of("Content-Type", "application/x-www-form-urlencoded"),
            form
        );

        if (result.isTransportFailure()) {
            log.error("Token endpoint unreachable: {}", result.error());
            metrics.tokenRefresh(RefreshStatus.ERROR);
            return;
        }
        if (result.statusCode() != 200) {
            log.warn("Token API call failed: {}", result.statusCode());
            if (!result.body().isBlank()) {
                log.warn(result.body());
            }
            metrics.tokenRefresh(RefreshStatus.REJECTED);
            return;
        }

        Optional<Token> token = parse(result.body());
        if (token.isEmpty()) {
            metrics.tokenRefresh(RefreshStatus.REJECTED);
            return;
        }

        try {
            store.save(credentials.username(), token.get());
        } catch (CacheAccessException e) {
            log.error("Failed to cache token for {}", credentials.username(), e);
            metrics.tokenRefresh(RefreshStatus.ERROR);
            return;
        }
        log.debug("Got a new token: {}", token.get().preview());
        log.debug("This new token expires at {}", token.get().expiresAt());
        metrics.tokenRefresh(RefreshStatus.SUCCESS);
    }

    private Optional<Token> parse(String body) {
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (Exception e) {
            log.warn("Token response is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
        JsonNode accessToken = node == null ? null : node.get("access_token");
        if (accessToken == null || !accessToken.isTextual() || accessToken.asText().isBlank()) {
            log.warn("Token response missing access_token");
            return Optional.empty();
        }
        Instant issuedAt = clock.instant();
        return Optional.of(new Token(accessToken.asText(), issuedAt, expiresAt(issuedAt, node.get("expires_in"))));
    }

    private static Instant expiresAt(Instant issuedAt, JsonNode expiresIn) {
        long seconds = expiresIn(expiresIn);
        try {
            return issuedAt.plusSeconds(seconds);
        } catch (ArithmeticException | DateTimeException e) {
            log.warn("Token expires_in {} out of range, using {}s", seconds, DEFAULT_EXPIRES_IN_SECONDS);
            return issuedAt.plusSeconds(DEFAULT_EXPIRES_IN_SECONDS);
        }
    }

    private static long expiresIn(JsonNode value) {
        if (value != null && value.isNumber()) {
            return value.canConvertToLong() ? value.asLong() : Long.MAX_VALUE;
        }
        if (value != null && value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException ignored) {
                // fall through to the default lifetime
            }
        }
        return DEFAULT_EXPIRES_IN_SECONDS;
    }
}
