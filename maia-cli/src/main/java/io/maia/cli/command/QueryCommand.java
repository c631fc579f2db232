package io.maia.cli.command;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.ParametersDelegate;
import io.maia.cli.GlobalOptions;
import io.maia.cli.render.OutputFormat;
import io.maia.cli.render.ResponseKind;
import io.maia.client.prometheus.QueryRequest;
import io.maia.common.error.ConfigurationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Instant query by default; a range query as soon as {@code --start} or {@code --end} is given.
 */
@Parameters(commandNames = "query",
        commandDescription = "Perform a PromQL Query against the metrics available for the project/domain in scope")
public class QueryCommand implements MaiaCommand {

    @ParametersDelegate
    private final GlobalOptions options;

    @Parameter(description = "<PromQL Query>")
    private List<String> arguments = new ArrayList<>();

    @Parameter(names = "--time", description = "Instant query: timestamp of measurement (RFC3339 or Unix format; default: now)")
    private String time = "";

    @Parameter(names = "--start", description = "Range query: start timestamp (RFC3339 or Unix format; default: 3h before)")
    private String start = "";

    @Parameter(names = "--end", description = "Range query: end timestamp (RFC3339 or Unix format; default: now)")
    private String end = "";

    @Parameter(names = "--step", converter = DurationConverter.class,
            description = "Range query: step size (e.g. 30s; default: sized to display about 10 values)")
    private Duration step;

    @Parameter(names = "--timeout", converter = DurationConverter.class,
            description = "Timeout for the query (e.g. 10m; default: server setting)")
    private Duration timeout;

    public QueryCommand(GlobalOptions options) {
        this.options = options;
    }

    @Override
    public QueryRequest request() throws ConfigurationException {
        if (arguments.isEmpty()) {
            throw new ConfigurationException("missing argument: PromQL Query");
        }
        return QueryRequest.query(arguments.get(0), time, start, end, step, timeout);
    }

    @Override
    public ResponseKind responseKind() {
        return ResponseKind.QUERY_RESULT;
    }

    @Override
    public OutputFormat defaultFormat() {
        return OutputFormat.JSON;
    }
}
