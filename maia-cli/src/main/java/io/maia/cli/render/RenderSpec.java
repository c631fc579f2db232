package io.maia.cli.render;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * How a response is printed.
 *
 * @param columns  explicit table columns, empty to derive them from the result
 * @param template Mustache template, only used with {@link OutputFormat#TEMPLATE}
 * @param step     matrix timestamps are truncated to multiples of it, {@code null} to keep them as is
 */
public record RenderSpec(OutputFormat format, List<String> columns, String separator, String template,
                         ZoneId zone, Duration step) {

    public RenderSpec {
        columns = columns == null ? List.of() : List.copyOf(columns);
        separator = separator == null ? " " : separator;
        zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public RenderSpec withStep(Duration newStep) {
        return new RenderSpec(format, columns, separator, template, zone, newStep);
    }

    public boolean hasColumns() {
        return !columns.isEmpty();
    }
}
