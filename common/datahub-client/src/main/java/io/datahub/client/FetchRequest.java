package io.datahub.client;

import io.datahub.client.query.TimeWindow;
import java.util.List;
import java.util.Objects;

/**
 * Everything needed to fetch one resource and to find its last known-good copy.
 *
 * @param resourcePath path appended to the API base URL, for example {@code /1234}
 * @param cacheKey key the raw body is stored under after a successful fetch
 * @param idFilters query fragments placed before the time window, for example {@code id=42}
 */
public record FetchRequest(String resourcePath,
                           String cacheKey,
                           List<String> idFilters,
                           TimeWindow window,
                           PayloadTransform transform) {

    public static final String DEFAULT_INTERVAL = "P2D";

    public FetchRequest {
        Objects.requireNonNull(resourcePath, "resourcePath");
        cacheKey = ResponseStore.requireResponseKey(cacheKey);
        idFilters = idFilters == null ? List.of() : List.copyOf(idFilters);
        window = window == null ? TimeWindow.trailing(DEFAULT_INTERVAL) : window;
        transform = transform == null ? PayloadTransform.identity() : transform;
    }

    public static FetchRequest of(String resourcePath, String cacheKey) {
        return new FetchRequest(resourcePath, cacheKey, List.of(), null, null);
    }

    public FetchRequest withIdFilters(List<String> idFilters) {
        return new FetchRequest(resourcePath, cacheKey, idFilters, window, transform);
    }

    public FetchRequest withInterval(String interval) {
        return withWindow(TimeWindow.trailing(interval));
    }

    public FetchRequest withWindow(TimeWindow window) {
        return new FetchRequest(resourcePath, cacheKey, idFilters, window, transform);
    }

    public FetchRequest withTransform(PayloadTransform transform) {
        return new FetchRequest(resourcePath, cacheKey, idFilters, window, transform);
    }
}
