package io.datahub.client.query;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds resource URLs and their query strings. Timestamps are always rendered in UTC.
 */
public class QueryBuilder {

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final ZoneId dayZone;

    public QueryBuilder(Clock clock) {
        this(clock, ZoneOffset.UTC);
    }

    /**
     * @param dayZone zone whose midnight starts a {@link TimeWindow.Kind#SINCE_MIDNIGHT} window
     */
    public QueryBuilder(Clock clock, ZoneId dayZone) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.dayZone = Objects.requireNonNull(dayZone, "dayZone");
    }

    /**
     * {@code start=<timestamp>&end=<timestamp>} for the window, ending now.
     */
    public String windowParameters(TimeWindow window) {
        Objects.requireNonNull(window, "window");
        Instant end = clock.instant();
        Instant start;
        if (window.kind() == TimeWindow.Kind.SINCE_MIDNIGHT) {
            start = LocalDate.ofInstant(end, dayZone).atStartOfDay(dayZone).toInstant();
        } else {
            start = end.atZone(ZoneOffset.UTC)
                .minus(window.period())
                .minus(window.duration())
                .toInstant();
        }
        return window.startParam() + "=" + TIMESTAMP_FORMAT.format(start)
            + "&" + window.endParam() + "=" + TIMESTAMP_FORMAT.format(end);
    }

    /**
     * Identifier filters, URL-encoded, followed by the window parameters.
     */
    public String query(List<String> idFilters, TimeWindow window) {
        StringJoiner joiner = new StringJoiner("&");
        if (idFilters != null) {
            for (String filter : idFilters) {
                if (filter != null && !filter.isBlank()) {
                    joiner.add(encodeFilter(filter.trim()));
                }
            }
        }
        joiner.add(windowParameters(window));
        return joiner.toString();
    }

    /**
     * URL-encodes the name and value of a {@code name=value} filter.
     */
    static String encodeFilter(String filter) {
        int eq = filter.indexOf('=');
        if (eq < 0) {
            return URLEncoder.encode(filter, StandardCharsets.UTF_8);
        }
        return URLEncoder.encode(filter.substring(0, eq), StandardCharsets.UTF_8)
            + "=" + URLEncoder.encode(filter.substring(eq + 1), StandardCharsets.UTF_8);
    }

    public String url(String baseUrl, String resourcePath, List<String> idFilters, TimeWindow window) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(resourcePath, "resourcePath");
        return baseUrl + resourcePath + "?" + query(idFilters, window);
    }
}
