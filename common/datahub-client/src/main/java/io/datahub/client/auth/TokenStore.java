package io.datahub.client.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datahub.cache.KeyValueCache;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token namespace of the shared cache.
 * <p>
 * Layout per username:
 * <ul>
 *   <li>{@code token__<username>}: the raw access token</li>
 *   <li>{@code token_expires__<username>}: {@code {"issuedAt": ..., "expiresAt": ...}} as ISO-8601 instants</li>
 * </ul>
 */
public class TokenStore {

    private static final Logger log = LoggerFactory.getLogger(TokenStore.class);

    static final String TOKEN_PREFIX = "token__";
    static final String EXPIRY_PREFIX = "token_expires__";

    private final KeyValueCache cache;
    private final ObjectMapper mapper;
    private final Duration retention;

    public TokenStore(KeyValueCache cache, ObjectMapper mapper, Duration retention) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.retention = Objects.requireNonNull(retention, "retention");
    }

    /**
     * Whether {@code key} belongs to the token namespace.
     */
    public static boolean isTokenKey(String key) {
        return key != null && (key.startsWith(TOKEN_PREFIX) || key.startsWith(EXPIRY_PREFIX));
    }

    public Optional<Token> find(String username) {
        Optional<String> value = cache.get(TOKEN_PREFIX + username).filter(v -> !v.isBlank());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Instant issuedAt = null;
        Instant expiresAt = null;
        Optional<String> expiry = cache.get(EXPIRY_PREFIX + username);
        if (expiry.isPresent()) {
            try {
                JsonNode node = mapper.readTree(expiry.get());
                issuedAt = instant(node, "issuedAt");
                expiresAt = instant(node, "expiresAt");
            } catch (Exception e) {
                log.debug("Ignoring unreadable token expiry for {}: {}", username, e.getMessage());
            }
        }
        return Optional.of(new Token(value.get(), issuedAt, expiresAt));
    }

    /**
     * Writes the expiry entry first, then the token. When the first write fails nothing changes;
     * when only the second fails the previous token is kept next to the new expiry. Expiry is
     * informational only, so that mismatch is tolerated.
     *
     * @throws io.datahub.cache.CacheAccessException if the cache rejects a write
     */
    public void save(String username, Token token) {
        Objects.requireNonNull(token, "token");
        ObjectNode expiry = mapper.createObjectNode();
        if (token.issuedAt() != null) {
            expiry.put("issuedAt", token.issuedAt().toString());
        }
        if (token.expiresAt() != null) {
            expiry.put("expiresAt", token.expiresAt().toString());
        }
        cache.put(EXPIRY_PREFIX + username, expiry.toString(), retention);
        cache.put(TOKEN_PREFIX + username, token.value(), retention);
    }

    private static Instant instant(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
