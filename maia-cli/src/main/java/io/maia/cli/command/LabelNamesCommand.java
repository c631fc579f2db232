package io.maia.cli.command;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.ParametersDelegate;
import io.maia.cli.GlobalOptions;
import io.maia.cli.render.OutputFormat;
import io.maia.cli.render.ResponseKind;
import io.maia.client.prometheus.QueryRequest;

@Parameters(commandNames = "label-names",
        commandDescription = "Get the label names used by the Series of the project/domain.")
public class LabelNamesCommand implements MaiaCommand {

    @ParametersDelegate
    private final GlobalOptions options;

    @Parameter(names = {"--selector", "-l"}, description = "Prometheus label-selector to restrict the Series considered")
    private String selector = "";

    @Parameter(names = "--start", description = "Start timestamp (RFC3339 or Unix format)")
    private String start = "";

    @Parameter(names = "--end", description = "End timestamp (RFC3339 or Unix format)")
    private String end = "";

    public LabelNamesCommand(GlobalOptions options) {
        this.options = options;
    }

    @Override
    public QueryRequest request() {
        return new QueryRequest.LabelNames(selector, start, end);
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
