package io.maia.cli;

import com.beust.jcommander.Parameter;
import io.maia.cli.render.OutputFormat;
import io.maia.cli.render.RenderSpec;
import io.maia.client.auth.AuthScope;
import io.maia.client.auth.CredentialSet;
import io.maia.client.session.BackendSettings;
import io.maia.common.config.MaiaConfig;
import io.maia.common.error.ConfigurationException;
import io.maia.common.error.UnsupportedFormatException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Options shared by all commands. They are accepted before and after the command name.
 * Unset OpenStack and Maia options fall back to their environment variables, which are read after
 * parsing so secrets never show up as defaults in the usage text.
 */
public class GlobalOptions {

    @Parameter(names = "--os-auth-url", description = "OpenStack Authentication URL (OS_AUTH_URL)")
    String osAuthUrl;

    @Parameter(names = "--os-username", description = "OpenStack Username (OS_USERNAME)")
    String osUsername;

    @Parameter(names = "--os-user-id", description = "OpenStack User ID (OS_USER_ID)")
    String osUserId;

    @Parameter(names = "--os-password", description = "OpenStack Password (OS_PASSWORD)")
    String osPassword;

    @Parameter(names = "--os-user-domain-name", description = "OpenStack User's domain name (OS_USER_DOMAIN_NAME)")
    String osUserDomainName;

    @Parameter(names = "--os-user-domain-id", description = "OpenStack User's domain ID (OS_USER_DOMAIN_ID)")
    String osUserDomainId;

    @Parameter(names = "--os-project-name", description = "OpenStack Project name to scope to (OS_PROJECT_NAME)")
    String osProjectName;

    @Parameter(names = "--os-project-id", description = "OpenStack Project ID to scope to (OS_PROJECT_ID)")
    String osProjectId;

    @Parameter(names = "--os-project-domain-name",
            description = "OpenStack Project's domain name (OS_PROJECT_DOMAIN_NAME)")
    String osProjectDomainName;

    @Parameter(names = "--os-domain-name", description = "OpenStack domain name to scope to (OS_DOMAIN_NAME)")
    String osDomainName;

    @Parameter(names = "--os-domain-id", description = "OpenStack domain ID to scope to (OS_DOMAIN_ID)")
    String osDomainId;

    @Parameter(names = "--os-token", description = "OpenStack keystone token (OS_TOKEN)")
    String osToken;

    @Parameter(names = "--os-auth-type",
            description = "OpenStack authentication type: password, token or v3applicationcredential (OS_AUTH_TYPE)")
    String osAuthType;

    @Parameter(names = "--os-application-credential-name",
            description = "OpenStack application credential name (OS_APPLICATION_CREDENTIAL_NAME)")
    String osApplicationCredentialName;

    @Parameter(names = "--os-application-credential-id",
            description = "OpenStack application credential id (OS_APPLICATION_CREDENTIAL_ID)")
    String osApplicationCredentialId;

    @Parameter(names = "--os-application-credential-secret",
            description = "OpenStack application credential secret (OS_APPLICATION_CREDENTIAL_SECRET)")
    String osApplicationCredentialSecret;

    @Parameter(names = {"--format", "-f"}, description = "Output format: table, json, template or value")
    String format;

    @Parameter(names = {"--columns", "-c"}, description = "Comma-separated list of columns to print")
    String columns;

    @Parameter(names = "--separator", description = "Column separator (default <space>)")
    String separator = " ";

    @Parameter(names = "--template", description = "Mustache template applied to the JSON response (--format template)")
    String template;

    @Parameter(names = "--maia-url", description = "URL of the Maia service, overrides the service catalog (MAIA_URL)")
    String maiaUrl;

    @Parameter(names = "--prometheus-url",
            description = "URL of a Prometheus server to query without authentication (MAIA_PROMETHEUS_URL)")
    String prometheusUrl;

    @Parameter(names = "--global", description = "Query the global backend region")
    boolean global;

    @Parameter(names = "--conf", description = "Configuration override as key=value, may be repeated")
    List<String> configs = new ArrayList<>();

    @Parameter(names = {"--help", "-h"}, help = true, description = "Show usage")
    boolean help;

    @Parameter(names = "--version", description = "Show version")
    boolean version;

    /**
     * Fills every unset option that has an environment variable.
     */
    public void applyEnvironment(Map<String, String> env) {
        osAuthUrl = orEnv(osAuthUrl, env, "OS_AUTH_URL");
        osUsername = orEnv(osUsername, env, "OS_USERNAME");
        osUserId = orEnv(osUserId, env, "OS_USER_ID");
        osPassword = orEnv(osPassword, env, "OS_PASSWORD");
        osUserDomainName = orEnv(osUserDomainName, env, "OS_USER_DOMAIN_NAME");
        osUserDomainId = orEnv(osUserDomainId, env, "OS_USER_DOMAIN_ID");
        osProjectName = orEnv(osProjectName, env, "OS_PROJECT_NAME");
        osProjectId = orEnv(osProjectId, env, "OS_PROJECT_ID");
        osProjectDomainName = orEnv(osProjectDomainName, env, "OS_PROJECT_DOMAIN_NAME");
        osDomainName = orEnv(osDomainName, env, "OS_DOMAIN_NAME");
        osDomainId = orEnv(osDomainId, env, "OS_DOMAIN_ID");
        osToken = orEnv(osToken, env, "OS_TOKEN");
        osAuthType = orEnv(osAuthType, env, "OS_AUTH_TYPE");
        osApplicationCredentialName = orEnv(osApplicationCredentialName, env, "OS_APPLICATION_CREDENTIAL_NAME");
        osApplicationCredentialId = orEnv(osApplicationCredentialId, env, "OS_APPLICATION_CREDENTIAL_ID");
        osApplicationCredentialSecret = orEnv(osApplicationCredentialSecret, env, "OS_APPLICATION_CREDENTIAL_SECRET");
        maiaUrl = orEnv(maiaUrl, env, "MAIA_URL");
        prometheusUrl = orEnv(prometheusUrl, env, "MAIA_PROMETHEUS_URL");
    }

    public CredentialSet credentials() {
        // --os-domain-name takes precedence over --os-project-domain-name
        var scopeDomainName = isSet(osDomainName) ? osDomainName : osProjectDomainName;
        return CredentialSet.builder()
                .identityEndpoint(osAuthUrl)
                .username(osUsername)
                .userId(osUserId)
                .password(osPassword)
                .domainName(osUserDomainName)
                .domainId(osUserDomainId)
                .tokenId(osToken)
                .applicationCredentialName(osApplicationCredentialName)
                .applicationCredentialId(osApplicationCredentialId)
                .applicationCredentialSecret(osApplicationCredentialSecret)
                .scope(new AuthScope(osProjectId, osProjectName, osDomainId, scopeDomainName))
                .build();
    }

    public BackendSettings backendSettings(MaiaConfig config) {
        return new BackendSettings(prometheusUrl, maiaUrl, osAuthType, global, config.getFederateUrl(),
                Duration.ofMillis(config.getRequestTimeoutMs()));
    }

    /**
     * Validates the output options up front so a bad {@code --format} never reaches the network.
     */
    public RenderSpec renderSpec(OutputFormat defaultFormat, MaiaConfig config)
            throws UnsupportedFormatException, ConfigurationException {
        var outputFormat = isSet(format) ? OutputFormat.parse(format) : defaultFormat;
        if (outputFormat == OutputFormat.TEMPLATE && !isSet(template)) {
            throw new ConfigurationException("missing --template parameter");
        }
        List<String> columnList = isSet(columns) ? Arrays.asList(columns.split(",")) : List.of();
        return new RenderSpec(outputFormat, columnList, separator, template, config.getTimeZone(), null);
    }

    public List<String> configs() {
        return configs;
    }

    public boolean isHelp() {
        return help;
    }

    public boolean isVersion() {
        return version;
    }

    private static String orEnv(String value, Map<String, String> env, String name) {
        if (value != null) {
            return value;
        }
        var fromEnv = env.get(name);
        return isSet(fromEnv) ? fromEnv : null;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
