package io.maia.client.session;

import io.maia.client.auth.CredentialResolver;
import io.maia.client.auth.CredentialSet;
import io.maia.client.auth.Session;
import io.maia.client.prometheus.PrometheusClient;
import io.maia.client.prometheus.QueryExecutor;
import io.maia.common.Headers;
import io.maia.common.error.ConfigurationException;
import io.maia.common.error.MaiaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lazily builds the backend client of one command invocation. Authentication happens on the first
 * {@link #get()} and its outcome is reused for the rest of the invocation.
 */
public class BackendSession {

    private static final Logger logger = LoggerFactory.getLogger(BackendSession.class);

    private final BackendSettings settings;
    private final CredentialSet credentials;
    private final CredentialResolver resolver;
    private final HttpClient httpClient;

    private PrometheusClient client;
    private Session session;

    public BackendSession(BackendSettings settings, CredentialSet credentials, CredentialResolver resolver,
                          HttpClient httpClient) {
        this.settings = settings;
        this.credentials = credentials;
        this.resolver = resolver;
        this.httpClient = httpClient;
    }

    public PrometheusClient get() throws MaiaException {
        if (client != null) {
            return client;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        String url;
        if (!settings.prometheusUrl().isEmpty()) {
            url = settings.prometheusUrl();
        } else if (credentials.identityEndpoint() != null && !credentials.identityEndpoint().isEmpty()) {
            session = resolver.resolve(credentials, settings.authType(), settings.maiaUrl());
            logger.debug("Using Maia at {} with {}", session.backendUrl(), session.context());
            headers.put(Headers.HEADER_AUTH_TOKEN, session.token());
            url = session.backendUrl();
        } else {
            throw new ConfigurationException("either --os-auth-url or --prometheus-url need to be specified");
        }
        if (settings.global()) {
            headers.put(Headers.HEADER_GLOBAL_REGION, "true");
        }
        client = new PrometheusClient(httpClient, url, headers, settings.federateUrl(), settings.requestTimeout());
        return client;
    }

    public QueryExecutor executor(Clock clock) throws MaiaException {
        return new QueryExecutor(get(), settings.global(), clock);
    }

    /**
     * The authenticated session, {@code null} before {@link #get()} or when talking to Prometheus directly.
     */
    public Session session() {
        return session;
    }
}
