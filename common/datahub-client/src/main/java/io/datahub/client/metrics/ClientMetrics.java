package io.datahub.client.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.util.Locale;
import java.util.Objects;

/**
 * Counters for fetch outcomes and token refreshes.
 */
public final class ClientMetrics {

    public static final String FETCH_COUNTER = "datahub_client_fetch_total";
    public static final String REFRESH_COUNTER = "datahub_client_token_refresh_total";

    public enum RefreshStatus {
        SUCCESS,
        REJECTED,
        ERROR
    }

    private final MeterRegistry registry;

    public ClientMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Metrics that go nowhere: an empty composite registry ignores every increment.
     */
    public static ClientMetrics noop() {
        return new ClientMetrics(new CompositeMeterRegistry());
    }

    public void fetchCompleted(String source, String failure) {
        registry.counter(FETCH_COUNTER,
            "source", tag(source),
            "failure", failure == null ? "none" : tag(failure)
        ).increment();
    }

    public void tokenRefresh(RefreshStatus status) {
        registry.counter(REFRESH_COUNTER, "status", tag(status.name())).increment();
    }

    private static String tag(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
