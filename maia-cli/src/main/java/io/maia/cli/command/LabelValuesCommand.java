package io.maia.cli.command;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.ParametersDelegate;
import io.maia.cli.GlobalOptions;
import io.maia.cli.render.OutputFormat;
import io.maia.cli.render.ResponseKind;
import io.maia.client.prometheus.QueryRequest;
import io.maia.common.error.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

@Parameters(commandNames = "label-values", commandDescription = "Get values for given label name.")
public class LabelValuesCommand implements MaiaCommand {

    @ParametersDelegate
    private final GlobalOptions options;

    @Parameter(description = "<label-name>")
    private List<String> arguments = new ArrayList<>();

    public LabelValuesCommand(GlobalOptions options) {
        this.options = options;
    }

    @Override
    public QueryRequest request() throws ConfigurationException {
        if (arguments.isEmpty()) {
            throw new ConfigurationException("missing argument: label-name");
        }
        return new QueryRequest.LabelValues(arguments.get(0));
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
