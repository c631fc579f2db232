package io.maia.cli.command;

import com.beust.jcommander.Parameters;
import com.beust.jcommander.ParametersDelegate;
import io.maia.cli.GlobalOptions;
import io.maia.cli.render.OutputFormat;
import io.maia.cli.render.ResponseKind;
import io.maia.client.prometheus.QueryRequest;

@Parameters(commandNames = "metric-names", commandDescription = "Get list of metric names.")
public class MetricNamesCommand implements MaiaCommand {

    @ParametersDelegate
    private final GlobalOptions options;

    public MetricNamesCommand(GlobalOptions options) {
        this.options = options;
    }

    @Override
    public QueryRequest request() {
        return QueryRequest.metricNames();
    }

    @Override
    public ResponseKind responseKind() {
        return ResponseKind.VALUE_LIST;
    }

    @Override
    public OutputFormat defaultFormat() {
        return OutputFormat.VALUE;
    }
}
