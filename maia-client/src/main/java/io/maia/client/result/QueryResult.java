package io.maia.client.result;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Decoded backend payload, one variant per result shape. Sample values are kept in their
 * printable form, see {@link SampleValues#format(String)}.
 */
public sealed interface QueryResult {

    record Scalar(Instant timestamp, String value) implements QueryResult {
    }

    record Vector(List<Element> elements) implements QueryResult {
        public Vector {
            elements = List.copyOf(elements);
        }
    }

    record Matrix(List<Series> series) implements QueryResult {
        public Matrix {
            series = List.copyOf(series);
        }
    }

    /**
     * Label values or metric names.
     */
    record StringList(List<String> values) implements QueryResult {
        public StringList {
            values = List.copyOf(values);
        }
    }

    /**
     * Label sets as returned by the series endpoint.
     */
    record LabelSetList(List<Map<String, String>> labelSets) implements QueryResult {
        public LabelSetList {
            labelSets = List.copyOf(labelSets);
        }
    }

    /**
     * Text exposition format as returned by {@code /federate}.
     */
    record RawText(byte[] content) implements QueryResult {
    }

    record Element(Map<String, String> labels, Instant timestamp, String value) {
    }

    record Series(Map<String, String> labels, List<Sample> samples) {
    }

    record Sample(Instant timestamp, String value) {
    }
}
