package io.maia.client.prometheus;

import io.maia.common.error.BackendException;
import io.maia.common.error.ConfigurationException;
import io.maia.common.error.MaiaException;
import io.maia.common.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Fills in request defaults and performs the HTTP call for a {@link QueryRequest}.
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final PrometheusClient client;
    private final boolean global;
    private final Clock clock;

    public QueryExecutor(PrometheusClient client, boolean global, Clock clock) {
        this.client = client;
        this.global = global;
        this.clock = clock;
    }

    public QueryExecutor(PrometheusClient client, boolean global) {
        this(client, global, Clock.systemUTC());
    }

    /**
     * Applies the defaults the backend call needs. Series and range queries get a time range ending now and
     * spanning three hours when bounds are missing; a range query without a positive step gets one from
     * {@link StepSizes#select}.
     */
    public QueryRequest resolve(QueryRequest request) throws ConfigurationException {
        if (request instanceof QueryRequest.SeriesList series) {
            var range = Timestamps.defaultRange(series.start(), series.end(), clock);
            return new QueryRequest.SeriesList(series.selector(), range.start(), range.end());
        }
        if (request instanceof QueryRequest.RangeQuery query) {
            var range = Timestamps.defaultRange(query.start(), query.end(), clock);
            var step = query.step();
            if (step == null || step.isZero() || step.isNegative()) {
                step = StepSizes.select(Timestamps.parse(range.start()), Timestamps.parse(range.end()));
                logger.debug("Step size defaults to {}", step);
            }
            return new QueryRequest.RangeQuery(query.expression(), range.start(), range.end(), step, query.timeout());
        }
        return request;
    }

    /**
     * Resolves and sends {@code request}. A non-200 status is turned into an exception and the response
     * is closed; otherwise the caller owns the open response.
     */
    public BackendResponse execute(QueryRequest request) throws MaiaException {
        var response = send(resolve(request));
        try {
            StatusClassifier.check(response, global);
        } catch (BackendException e) {
            response.close();
            throw e;
        }
        return response;
    }

    private BackendResponse send(QueryRequest request) throws MaiaException {
        var accept = request.accept();
        if (request instanceof QueryRequest.Snapshot snapshot) {
            return client.federate(List.of(wrap(snapshot.selector())), accept);
        }
        if (request instanceof QueryRequest.LabelValues labelValues) {
            return client.labelValues(labelValues.labelName(), accept);
        }
        if (request instanceof QueryRequest.SeriesList series) {
            return client.series(List.of(wrap(series.selector())), series.start(), series.end(), accept);
        }
        if (request instanceof QueryRequest.InstantQuery query) {
            return client.query(query.expression(), nullToEmpty(query.time()),
                    StepSizes.encode(query.timeout()), accept);
        }
        if (request instanceof QueryRequest.RangeQuery query) {
            return client.queryRange(query.expression(), query.start(), query.end(),
                    StepSizes.encode(query.step()), StepSizes.encode(query.timeout()), accept);
        }
        if (request instanceof QueryRequest.LabelNames labelNames) {
            var selector = labelNames.selector();
            List<String> match = selector == null || selector.isEmpty() ? List.of() : List.of(wrap(selector));
            return client.labels(nullToEmpty(labelNames.start()), nullToEmpty(labelNames.end()), match, accept);
        }
        throw new IllegalStateException("Unknown request type: " + request.getClass().getName());
    }

    /**
     * Encloses a label selector in braces: {@code job="x"} becomes <code>{job="x"}</code>.
     */
    static String wrap(String selector) {
        return "{" + nullToEmpty(selector) + "}";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * The step carried by a range query, {@code null} for every other request.
     */
    public static Duration effectiveStep(QueryRequest request) {
        return request instanceof QueryRequest.RangeQuery query ? query.step() : null;
    }
}
