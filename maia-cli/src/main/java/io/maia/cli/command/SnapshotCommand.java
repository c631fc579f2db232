package io.maia.cli.command;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.ParametersDelegate;
import io.maia.cli.GlobalOptions;
import io.maia.cli.render.OutputFormat;
import io.maia.cli.render.ResponseKind;
import io.maia.client.prometheus.QueryRequest;

@Parameters(commandNames = "snapshot",
        commandDescription = "Get a Snapshot of the actual metric values for a project/domain.")
public class SnapshotCommand implements MaiaCommand {

    @ParametersDelegate
    private final GlobalOptions options;

    @Parameter(names = {"--selector", "-l"}, description = "Prometheus label-selector to restrict the amount of metrics")
    private String selector = "";

    public SnapshotCommand(GlobalOptions options) {
        this.options = options;
    }

    @Override
    public QueryRequest request() {
        return new QueryRequest.Snapshot(selector);
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
