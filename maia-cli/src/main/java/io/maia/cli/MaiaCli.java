package io.maia.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import io.maia.cli.command.LabelNamesCommand;
import io.maia.cli.command.LabelValuesCommand;
import io.maia.cli.command.MaiaCommand;
import io.maia.cli.command.MetricNamesCommand;
import io.maia.cli.command.QueryCommand;
import io.maia.cli.command.SeriesCommand;
import io.maia.cli.command.SnapshotCommand;
import io.maia.cli.render.ResultRenderer;
import io.maia.client.keystone.KeystoneIdentityProvider;
import io.maia.client.prometheus.QueryExecutor;
import io.maia.common.config.LogbackConfigurator;
import io.maia.common.config.MaiaConfig;
import io.maia.common.error.MaiaException;
import io.maia.common.util.ConfigUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code maia} command line. {@link #run(String[])} returns the process exit status: 0 on success,
 * 1 after printing a single error message to stderr.
 */
public class MaiaCli {

    private static final Logger logger = LoggerFactory.getLogger(MaiaCli.class);

    public static final String PROGRAM_NAME = "maia";

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final CommandContext.IdentityProviderFactory identityProviderFactory;
    private final Clock clock;
    private final ResultRenderer renderer = new ResultRenderer();

    public MaiaCli(Map<String, String> env, PrintStream out, PrintStream err) {
        this(env, out, err, KeystoneIdentityProvider::new, Clock.systemUTC());
    }

    MaiaCli(Map<String, String> env, PrintStream out, PrintStream err,
            CommandContext.IdentityProviderFactory identityProviderFactory, Clock clock) {
        this.env = env;
        this.out = out;
        this.err = err;
        this.identityProviderFactory = identityProviderFactory;
        this.clock = clock;
    }

    public int run(String[] args) {
        var options = new GlobalOptions();
        Map<String, MaiaCommand> commands = new LinkedHashMap<>();
        commands.put("snapshot", new SnapshotCommand(options));
        commands.put("query", new QueryCommand(options));
        commands.put("series", new SeriesCommand(options));
        commands.put("label-values", new LabelValuesCommand(options));
        commands.put("label-names", new LabelNamesCommand(options));
        commands.put("metric-names", new MetricNamesCommand(options));

        var builder = JCommander.newBuilder()
                .programName(PROGRAM_NAME)
                .addObject(options);
        commands.values().forEach(builder::addCommand);
        var commander = builder.build();

        try {
            commander.parse(args);
        } catch (ParameterException e) {
            err.println(e.getMessage());
            return 1;
        }

        if (options.isVersion()) {
            out.println(PROGRAM_NAME + " " + version());
            return 0;
        }
        var commandName = commander.getParsedCommand();
        if (options.isHelp() || commandName == null) {
            var usage = new StringBuilder();
            if (commandName == null) {
                commander.getUsageFormatter().usage(usage);
            } else {
                commander.getUsageFormatter().usage(commandName, usage);
            }
            (options.isHelp() ? out : err).print(usage);
            return options.isHelp() ? 0 : 1;
        }

        options.applyEnvironment(env);
        try {
            var config = MaiaConfig.load(ConfigUtils.fromOverrides(options.configs()));
            LogbackConfigurator.configure(config.getConfig(),
                    LogbackConfigurator.debugRequested(env.get(LogbackConfigurator.DEBUG_ENV)));
            var context = new CommandContext(options, config, identityProviderFactory, clock);
            var output = execute(commands.get(commandName), context);
            out.print(output);
            out.flush();
            return 0;
        } catch (MaiaException e) {
            logger.debug("Command {} failed", commandName, e);
            err.println(e.getMessage());
            return 1;
        }
    }

    /**
     * Runs one command and returns its complete output.
     */
    String execute(MaiaCommand command, CommandContext context) throws MaiaException {
        var request = command.request();
        var spec = context.options().renderSpec(command.defaultFormat(), context.config());

        QueryExecutor executor = context.session().executor(context.clock());
        var resolved = executor.resolve(request);
        // matrix columns are aligned only to a step given on the command line
        try (var response = executor.execute(resolved)) {
            return renderer.render(command.responseKind(), response.contentType(), response.content(),
                    spec.withStep(QueryExecutor.effectiveStep(request)));
        }
    }

    static String version() {
        var version = MaiaCli.class.getPackage().getImplementationVersion();
        return version == null ? "dev" : version;
    }
}
