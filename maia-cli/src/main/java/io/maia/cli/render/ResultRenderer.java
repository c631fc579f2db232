package io.maia.cli.render;

import io.maia.client.result.QueryResult;
import io.maia.client.result.QueryResultDecoder;
import io.maia.common.Headers;
import io.maia.common.error.MaiaException;
import io.maia.common.error.UnexpectedContentTypeException;
import io.maia.common.error.UnsupportedFormatException;
import io.maia.common.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Formats a backend response according to its content type and a {@link RenderSpec}.
 * The complete output is returned as a string so nothing is printed when rendering fails halfway.
 */
public class ResultRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ResultRenderer.class);

    public static final String TIMESTAMP_COLUMN = "__timestamp__";
    public static final String VALUE_COLUMN = "__value__";

    private final QueryResultDecoder decoder;
    private final TemplateRenderer templateRenderer;

    public ResultRenderer() {
        this(new QueryResultDecoder(), new TemplateRenderer());
    }

    public ResultRenderer(QueryResultDecoder decoder, TemplateRenderer templateRenderer) {
        this.decoder = decoder;
        this.templateRenderer = templateRenderer;
    }

    public String render(ResponseKind kind, String contentType, byte[] body, RenderSpec spec) throws MaiaException {
        if (Headers.isJson(contentType)) {
            return renderJson(kind, body, spec);
        }
        if (Headers.isPlainText(contentType)) {
            if (spec.format() != OutputFormat.VALUE) {
                throw new UnsupportedFormatException(spec.format().cliName());
            }
            return new String(body, StandardCharsets.UTF_8);
        }
        logger.error("Response body: {}", new String(body, StandardCharsets.UTF_8));
        throw new UnexpectedContentTypeException(contentType);
    }

    private String renderJson(ResponseKind kind, byte[] body, RenderSpec spec) throws MaiaException {
        switch (spec.format()) {
            case JSON:
                return unescapeAmpersands(new String(body, StandardCharsets.UTF_8));
            case TEMPLATE:
                return templateRenderer.render(spec.template(), decoder.decodeTree(body));
            case VALUE:
                if (kind == ResponseKind.VALUE_LIST) {
                    var out = new StringBuilder();
                    for (String value : decoder.decodeValues(body).values()) {
                        out.append(value).append('\n');
                    }
                    return out.toString();
                }
                return table(kind, body, spec, false);
            case TABLE:
                if (kind == ResponseKind.VALUE_LIST) {
                    throw new UnsupportedFormatException(spec.format().cliName());
                }
                return table(kind, body, spec, true);
            default:
                throw new UnsupportedFormatException(spec.format().cliName());
        }
    }

    private String table(ResponseKind kind, byte[] body, RenderSpec spec, boolean header) throws MaiaException {
        QueryResult result = kind == ResponseKind.LABEL_SETS
                ? decoder.decodeLabelSets(body)
                : decoder.decodeQuery(body);
        var out = new StringBuilder();
        var table = tabulate(result, spec);
        TablePrinter.print(out, table.columns(), table.rows(), header, spec.separator());
        return out.toString();
    }

    /**
     * Lays out a result as rows keyed by column name.
     */
    static Table tabulate(QueryResult result, RenderSpec spec) {
        List<Map<String, String>> rows = new ArrayList<>();
        List<String> columns = new ArrayList<>();

        if (result instanceof QueryResult.Scalar scalar) {
            columns.add(TIMESTAMP_COLUMN);
            columns.add(VALUE_COLUMN);
            Map<String, String> row = new HashMap<>();
            row.put(TIMESTAMP_COLUMN, Timestamps.formatNano(scalar.timestamp(), spec.zone()));
            row.put(VALUE_COLUMN, scalar.value());
            rows.add(row);
        } else if (result instanceof QueryResult.Vector vector) {
            var labelKeys = new TreeSet<String>();
            for (QueryResult.Element element : vector.elements()) {
                labelKeys.addAll(element.labels().keySet());
                Map<String, String> row = new HashMap<>(element.labels());
                row.put(TIMESTAMP_COLUMN, Timestamps.formatNano(element.timestamp(), spec.zone()));
                row.put(VALUE_COLUMN, element.value());
                rows.add(row);
            }
            columns.addAll(spec.hasColumns() ? spec.columns() : labelKeys);
            columns.add(TIMESTAMP_COLUMN);
            columns.add(VALUE_COLUMN);
        } else if (result instanceof QueryResult.Matrix matrix) {
            var labelKeys = new TreeSet<String>();
            var timeColumns = new TreeSet<String>();
            for (QueryResult.Series series : matrix.series()) {
                labelKeys.addAll(series.labels().keySet());
                Map<String, String> row = new HashMap<>(series.labels());
                for (QueryResult.Sample sample : series.samples()) {
                    var column = Timestamps.format(Timestamps.truncate(sample.timestamp(), spec.step()), spec.zone());
                    timeColumns.add(column);
                    row.put(column, sample.value());
                }
                rows.add(row);
            }
            columns.addAll(spec.hasColumns() ? spec.columns() : labelKeys);
            columns.addAll(timeColumns);
        } else if (result instanceof QueryResult.LabelSetList labelSets) {
            var labelKeys = new TreeSet<String>();
            for (Map<String, String> labelSet : labelSets.labelSets()) {
                labelKeys.addAll(labelSet.keySet());
                rows.add(labelSet);
            }
            columns.addAll(spec.hasColumns() ? spec.columns() : labelKeys);
        } else if (result instanceof QueryResult.StringList values) {
            columns.add(VALUE_COLUMN);
            for (String value : values.values()) {
                rows.add(Map.of(VALUE_COLUMN, value));
            }
        } else {
            throw new IllegalArgumentException("Cannot tabulate " + result.getClass().getSimpleName());
        }
        return new Table(columns, rows);
    }

    static String unescapeAmpersands(String json) {
        return json.replace("\\u0026", "&");
    }

    record Table(List<String> columns, List<Map<String, String>> rows) {
    }
}
