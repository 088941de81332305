package io.datahub.client.query;

import java.time.Duration;
import java.time.Period;
import java.util.Objects;

/**
 * Time range appended to a resource query, either a trailing interval ending now or the span since
 * midnight.
 */
public record TimeWindow(Kind kind, Period period, Duration duration, String startParam, String endParam) {

    public static final String DEFAULT_START_PARAM = "start";
    public static final String DEFAULT_END_PARAM = "end";

    public enum Kind {
        TRAILING,
        SINCE_MIDNIGHT
    }

    public TimeWindow {
        Objects.requireNonNull(kind, "kind");
        period = period == null ? Period.ZERO : period;
        duration = duration == null ? Duration.ZERO : duration;
        startParam = requireName(startParam, "startParam");
        endParam = requireName(endParam, "endParam");
    }

    /**
     * Window of the given ISO-8601 length ending now, for example {@code P2D}, {@code PT6H} or
     * {@code P1DT12H}.
     *
     * @throws java.time.format.DateTimeParseException if {@code interval} is not a valid descriptor
     */
    public static TimeWindow trailing(String interval) {
        Objects.requireNonNull(interval, "interval");
        String text = interval.trim();
        int t = text.indexOf('T');
        Period period;
        Duration duration;
        if (t < 0) {
            period = Period.parse(text);
            duration = Duration.ZERO;
        } else {
            String datePart = text.substring(0, t);
            period = "P".equals(datePart) ? Period.ZERO : Period.parse(datePart);
            duration = Duration.parse("PT" + text.substring(t + 1));
        }
        return new TimeWindow(Kind.TRAILING, period, duration, DEFAULT_START_PARAM, DEFAULT_END_PARAM);
    }

    public static TimeWindow sinceMidnight() {
        return new TimeWindow(Kind.SINCE_MIDNIGHT, Period.ZERO, Duration.ZERO,
            DEFAULT_START_PARAM, DEFAULT_END_PARAM);
    }

    public TimeWindow withParameterNames(String startParam, String endParam) {
        return new TimeWindow(kind, period, duration, startParam, endParam);
    }

    private static String requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value.trim();
    }
}
