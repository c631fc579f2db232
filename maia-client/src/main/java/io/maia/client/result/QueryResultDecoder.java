package io.maia.client.result;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.maia.common.error.ResponseFormatException;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decodes the JSON envelopes of the Prometheus HTTP API into {@link QueryResult}s.
 */
public class QueryResultDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    /**
     * {@code {"data": {"resultType": ..., "result": ...}}} as returned by the query endpoints.
     */
    public QueryResult decodeQuery(byte[] body) throws ResponseFormatException {
        var data = data(body);
        var resultType = data.path("resultType").asText();
        var result = data.path("result");
        switch (resultType) {
            case "scalar":
                return new QueryResult.Scalar(timestamp(result), SampleValues.format(result.path(1).asText()));
            case "string":
                return new QueryResult.Scalar(timestamp(result), result.path(1).asText());
            case "vector": {
                List<QueryResult.Element> elements = new ArrayList<>();
                for (JsonNode element : result) {
                    var value = element.path("value");
                    elements.add(new QueryResult.Element(labels(element.path("metric")), timestamp(value),
                            SampleValues.format(value.path(1).asText())));
                }
                return new QueryResult.Vector(elements);
            }
            case "matrix": {
                List<QueryResult.Series> series = new ArrayList<>();
                for (JsonNode element : result) {
                    List<QueryResult.Sample> samples = new ArrayList<>();
                    for (JsonNode value : element.path("values")) {
                        samples.add(new QueryResult.Sample(timestamp(value),
                                SampleValues.format(value.path(1).asText())));
                    }
                    series.add(new QueryResult.Series(labels(element.path("metric")), samples));
                }
                return new QueryResult.Matrix(series);
            }
            default:
                throw new ResponseFormatException("unknown result type: " + resultType);
        }
    }

    /**
     * {@code {"data": ["a", "b"]}} as returned by the label values and label names endpoints.
     */
    public QueryResult.StringList decodeValues(byte[] body) throws ResponseFormatException {
        var data = data(body);
        List<String> values = new ArrayList<>();
        for (JsonNode value : data) {
            values.add(value.asText());
        }
        return new QueryResult.StringList(values);
    }

    /**
     * {@code {"data": [{"label": "value"}, ...]}} as returned by the series endpoint.
     */
    public QueryResult.LabelSetList decodeLabelSets(byte[] body) throws ResponseFormatException {
        var data = data(body);
        List<Map<String, String>> labelSets = new ArrayList<>();
        for (JsonNode labelSet : data) {
            labelSets.add(labels(labelSet));
        }
        return new QueryResult.LabelSetList(labelSets);
    }

    /**
     * The body as a generic tree of maps, lists and scalars.
     */
    public Object decodeTree(byte[] body) throws ResponseFormatException {
        try {
            return MAPPER.readValue(body, Object.class);
        } catch (IOException e) {
            throw new ResponseFormatException("malformed JSON response: " + e.getMessage(), e);
        }
    }

    private static JsonNode data(byte[] body) throws ResponseFormatException {
        final JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new ResponseFormatException("malformed JSON response: " + e.getMessage(), e);
        }
        if (root == null || !root.has("data")) {
            throw new ResponseFormatException("response carries no data");
        }
        return root.get("data");
    }

    private static Map<String, String> labels(JsonNode metric) {
        Map<String, String> labels = new TreeMap<>();
        metric.fields().forEachRemaining(field -> labels.put(field.getKey(), field.getValue().asText()));
        return labels;
    }

    private static Instant timestamp(JsonNode pair) throws ResponseFormatException {
        var seconds = pair.path(0);
        if (!seconds.isNumber()) {
            throw new ResponseFormatException("invalid sample timestamp: " + seconds);
        }
        return SampleValues.timestamp(seconds.decimalValue());
    }
}
