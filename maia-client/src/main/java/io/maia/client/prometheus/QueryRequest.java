package io.maia.client.prometheus;

import io.maia.common.Headers;

import java.time.Duration;

/**
 * One backend operation. Each variant maps onto exactly one HTTP call, see {@link QueryExecutor}.
 * Empty strings and {@code null} durations mean "not given".
 */
public sealed interface QueryRequest {

    String METRIC_NAME_LABEL = "__name__";

    /**
     * The media type asked for in the {@code Accept} header.
     */
    default String accept() {
        return Headers.JSON;
    }

    /**
     * Current values of all series matching the selector, in exposition format.
     */
    record Snapshot(String selector) implements QueryRequest {
        @Override
        public String accept() {
            return Headers.PLAIN_TEXT;
        }
    }

    record InstantQuery(String expression, String time, Duration timeout) implements QueryRequest {
    }

    record RangeQuery(String expression, String start, String end, Duration step, Duration timeout)
            implements QueryRequest {
    }

    record SeriesList(String selector, String start, String end) implements QueryRequest {
    }

    record LabelValues(String labelName) implements QueryRequest {
    }

    record LabelNames(String selector, String start, String end) implements QueryRequest {
    }

    static LabelValues metricNames() {
        return new LabelValues(METRIC_NAME_LABEL);
    }

    /**
     * A range query when either bound is given, otherwise an instant query.
     */
    static QueryRequest query(String expression, String time, String start, String end, Duration step,
                              Duration timeout) {
        if (isSet(start) || isSet(end)) {
            return new RangeQuery(expression, start, end, step, timeout);
        }
        return new InstantQuery(expression, time, timeout);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
