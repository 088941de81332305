package io.datahub.client.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Bearer token issued by the token endpoint.
 * <p>
 * {@code issuedAt} and {@code expiresAt} are {@code null} when the expiry entry of a cached token
 * has already been evicted; the value alone is still sent upstream.
 */
public record Token(String value, Instant issuedAt, Instant expiresAt) {

    private static final int PREVIEW_LENGTH = 20;

    public Token {
        Objects.requireNonNull(value, "value");
    }

    public boolean isUsableAt(Instant now) {
        return expiresAt != null && now.isBefore(expiresAt);
    }

    /**
     * Leading characters of the token, safe to log.
     */
    public String preview() {
        return value.length() <= PREVIEW_LENGTH ? value : value.substring(0, PREVIEW_LENGTH) + "...";
    }

    @Override
    public String toString() {
        return "Token[value=" + preview() + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
