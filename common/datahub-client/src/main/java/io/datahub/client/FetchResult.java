package io.datahub.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one fetch. {@code failure} is {@code null} for live payloads; {@code payload} is
 * {@code null} only when the source is {@link Source#UNAVAILABLE}.
 */
public record FetchResult(JsonNode payload, Source source, FetchFailure failure) {

    public enum Source {
        LIVE,
        CACHE,
        UNAVAILABLE
    }

    public FetchResult {
        Objects.requireNonNull(source, "source");
        if (source == Source.UNAVAILABLE) {
            if (payload != null) {
                throw new IllegalArgumentException("unavailable result must not carry a payload");
            }
        } else {
            Objects.requireNonNull(payload, "payload");
        }
        if (source == Source.LIVE && failure != null) {
            throw new IllegalArgumentException("live result must not carry a failure");
        }
        if (source != Source.LIVE) {
            Objects.requireNonNull(failure, "failure");
        }
    }

    public static FetchResult live(JsonNode payload) {
        return new FetchResult(payload, Source.LIVE, null);
    }

    public static FetchResult cached(JsonNode payload, FetchFailure failure) {
        return new FetchResult(payload, Source.CACHE, failure);
    }

    public static FetchResult unavailable(FetchFailure failure) {
        return new FetchResult(null, Source.UNAVAILABLE, failure);
    }

    public boolean isAvailable() {
        return source != Source.UNAVAILABLE;
    }

    public Optional<JsonNode> asOptional() {
        return Optional.ofNullable(payload);
    }
}
