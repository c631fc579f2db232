package io.maia.client.result;

import io.maia.common.error.ResponseFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryResultDecoderTest {

    private final QueryResultDecoder decoder = new QueryResultDecoder();

    private static byte[] fixture(String name) throws IOException {
        try (InputStream in = QueryResultDecoderTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return in.readAllBytes();
        }
    }

    @Test
    @DisplayName("Should decode a vector with its labels, timestamp and value")
    void vector() throws Exception {
        var result = decoder.decodeQuery(fixture("query2.json"));

        var vector = assertInstanceOf(QueryResult.Vector.class, result);
        assertEquals(2, vector.elements().size());
        var first = vector.elements().get(0);
        assertEquals("monsoon3", first.labels().get("domain"));
        assertEquals(Instant.parse("2019-05-09T12:00:10.724Z"), first.timestamp());
        assertEquals("54975581388800", first.value());
        assertEquals("11240", vector.elements().get(1).value());
    }

    @Test
    @DisplayName("Should decode a matrix with one sample per value pair")
    void matrix() throws Exception {
        var result = decoder.decodeQuery(fixture("query_range_values.json"));

        var matrix = assertInstanceOf(QueryResult.Matrix.class, result);
        var series = matrix.series().get(0);
        assertTrue(series.labels().isEmpty());
        assertEquals(List.of(
                new QueryResult.Sample(Instant.parse("2017-07-13T20:10:30.781Z"), "0"),
                new QueryResult.Sample(Instant.parse("2017-07-13T20:15:30.781Z"), "1")), series.samples());
    }

    @Test
    @DisplayName("Should decode scalar and string results")
    void scalarAndString() throws Exception {
        var scalar = decoder.decodeQuery("{\"data\":{\"resultType\":\"scalar\",\"result\":[1499066783.997,\"1e+06\"]}}"
                .getBytes());
        var string = decoder.decodeQuery("{\"data\":{\"resultType\":\"string\",\"result\":[1499066783,\"hello\"]}}"
                .getBytes());

        assertEquals(new QueryResult.Scalar(Instant.parse("2017-07-03T07:26:23.997Z"), "1000000"), scalar);
        assertEquals(new QueryResult.Scalar(Instant.parse("2017-07-03T07:26:23Z"), "hello"), string);
    }

    @Test
    @DisplayName("Should decode label values and label sets")
    void valuesAndLabelSets() throws Exception {
        assertEquals(List.of("objectstore"), decoder.decodeValues(fixture("label_values.json")).values());

        var labelSets = decoder.decodeLabelSets(fixture("series.json")).labelSets();
        assertEquals(1, labelSets.size());
        assertEquals("swift-proxy-cluster-3", labelSets.get(0).get("kubernetes_name"));
        assertEquals("__name__", labelSets.get(0).keySet().iterator().next());
    }

    @Test
    @DisplayName("Should decode a generic tree for templates")
    @SuppressWarnings("unchecked")
    void tree() throws Exception {
        var tree = (Map<String, Object>) decoder.decodeTree(fixture("label_values.json"));

        assertEquals("success", tree.get("Status"));
        assertEquals(List.of("objectstore"), tree.get("data"));
    }

    @Test
    @DisplayName("Should reject malformed responses")
    void malformed() {
        assertThrows(ResponseFormatException.class, () -> decoder.decodeQuery("not json".getBytes()));
        assertThrows(ResponseFormatException.class, () -> decoder.decodeQuery("{\"status\":\"success\"}".getBytes()));
        assertThrows(ResponseFormatException.class,
                () -> decoder.decodeQuery("{\"data\":{\"resultType\":\"histogram\",\"result\":[]}}".getBytes()));
        assertThrows(ResponseFormatException.class,
                () -> decoder.decodeQuery("{\"data\":{\"resultType\":\"scalar\",\"result\":[\"x\",\"1\"]}}".getBytes()));
    }
}
