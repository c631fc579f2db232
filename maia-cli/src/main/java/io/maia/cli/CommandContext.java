package io.maia.cli;

import io.maia.client.HttpClients;
import io.maia.client.auth.CredentialResolver;
import io.maia.client.auth.IdentityProvider;
import io.maia.client.session.BackendSession;
import io.maia.common.config.MaiaConfig;
import io.maia.common.error.ConfigurationException;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * State of one command invocation: parsed options, configuration and the backend session, which is
 * only created when the command first needs it.
 */
public class CommandContext {

    /**
     * Creates the identity provider once the HTTP client is known.
     */
    @FunctionalInterface
    public interface IdentityProviderFactory {
        IdentityProvider create(HttpClient httpClient, MaiaConfig config);
    }

    private final GlobalOptions options;
    private final MaiaConfig config;
    private final IdentityProviderFactory identityProviderFactory;
    private final Clock clock;

    private BackendSession session;

    public CommandContext(GlobalOptions options, MaiaConfig config, IdentityProviderFactory identityProviderFactory,
                          Clock clock) {
        this.options = options;
        this.config = config;
        this.identityProviderFactory = identityProviderFactory;
        this.clock = clock;
    }

    public GlobalOptions options() {
        return options;
    }

    public MaiaConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public BackendSession session() throws ConfigurationException {
        if (session == null) {
            var httpClient = HttpClients.create(config);
            var resolver = new CredentialResolver(identityProviderFactory.create(httpClient, config));
            session = new BackendSession(options.backendSettings(config), options.credentials(), resolver, httpClient);
        }
        return session;
    }
}
