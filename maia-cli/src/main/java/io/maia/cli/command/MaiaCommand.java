package io.maia.cli.command;

import io.maia.cli.render.OutputFormat;
import io.maia.cli.render.ResponseKind;
import io.maia.client.prometheus.QueryRequest;
import io.maia.common.error.ConfigurationException;

/**
 * A subcommand issuing one backend request. Arguments are validated in {@link #request()}, before any
 * network call.
 */
public interface MaiaCommand {

    QueryRequest request() throws ConfigurationException;

    ResponseKind responseKind();

    OutputFormat defaultFormat();
}
