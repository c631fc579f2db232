package io.maia.cli.command;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.ParametersDelegate;
import io.maia.cli.GlobalOptions;
import io.maia.cli.render.OutputFormat;
import io.maia.cli.render.ResponseKind;
import io.maia.client.prometheus.QueryRequest;

@Parameters(commandNames = "series", commandDescription = "List measurement Series for project/domain.")
public class SeriesCommand implements MaiaCommand {

    @ParametersDelegate
    private final GlobalOptions options;

    @Parameter(names = {"--selector", "-l"}, description = "Prometheus label-selector to restrict the amount of metrics")
    private String selector = "";

    @Parameter(names = "--start", description = "Start timestamp (RFC3339 or Unix format; default: 3h before)")
    private String start = "";

    @Parameter(names = "--end", description = "End timestamp (RFC3339 or Unix format; default: now)")
    private String end = "";

    public SeriesCommand(GlobalOptions options) {
        this.options = options;
    }

    @Override
    public QueryRequest request() {
        return new QueryRequest.SeriesList(selector, start, end);
    }

    @Override
    public ResponseKind responseKind() {
        return ResponseKind.LABEL_SETS;
    }

    @Override
    public OutputFormat defaultFormat() {
        return OutputFormat.TABLE;
    }
}
