package io.maia.common.util;

import io.maia.common.error.ConfigurationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Parsing and formatting of the timestamps accepted on the command line and sent to the backend.
 * Input is RFC 3339, falling back to the Unix {@code date} format; output is RFC 3339.
 */
public final class Timestamps {

    public static final Duration DEFAULT_RANGE = Duration.ofHours(3);

    // milliseconds from 0001-01-01T00:00:00Z to the Unix epoch
    private static final long YEAR_ONE_OFFSET_MILLIS = 62_135_596_800_000L;

    private static final DateTimeFormatter RFC3339 =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX", Locale.ROOT);
    private static final DateTimeFormatter RFC3339_NANO = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    // Mon Jan 2 15:04:05 MST 2006
    private static final DateTimeFormatter UNIX_DATE =
            DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss zzz yyyy", Locale.US);

    private Timestamps() {
    }

    public static Instant parse(String timestamp) throws ConfigurationException {
        try {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(timestamp, Instant::from);
        } catch (DateTimeParseException e) {
            try {
                return UNIX_DATE.parse(timestamp, Instant::from);
            } catch (DateTimeParseException unixError) {
                throw new ConfigurationException("invalid timestamp (expected RFC3339 or Unix date format): " + timestamp, e);
            }
        }
    }

    /**
     * RFC 3339 with second precision.
     */
    public static String format(Instant instant, ZoneId zone) {
        return RFC3339.format(instant.atZone(zone));
    }

    public static String format(Instant instant) {
        return format(instant, ZoneOffset.UTC);
    }

    /**
     * RFC 3339 with as many fractional digits as needed.
     */
    public static String formatNano(Instant instant, ZoneId zone) {
        return RFC3339_NANO.format(instant.atZone(zone));
    }

    /**
     * Fills in a missing range end with "now" and a missing start with three hours before the end.
     * Supplied bounds are returned untouched.
     */
    public static TimeRange defaultRange(String start, String end, Clock clock) throws ConfigurationException {
        var e = isBlank(end) ? format(clock.instant()) : end;
        var s = isBlank(start) ? format(parse(e).minus(DEFAULT_RANGE)) : start;
        return new TimeRange(s, e);
    }

    /**
     * Rounds down to a multiple of {@code step} counted from 0001-01-01T00:00:00Z, so week steps start on
     * a Monday.
     */
    public static Instant truncate(Instant instant, Duration step) {
        if (step == null || step.isZero() || step.isNegative()) {
            return instant;
        }
        long stepMillis = step.toMillis();
        long millis = instant.toEpochMilli() + YEAR_ONE_OFFSET_MILLIS;
        return Instant.ofEpochMilli(Math.floorDiv(millis, stepMillis) * stepMillis - YEAR_ONE_OFFSET_MILLIS);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public record TimeRange(String start, String end) {
    }
}
