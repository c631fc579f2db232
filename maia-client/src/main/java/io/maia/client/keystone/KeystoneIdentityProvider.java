package io.maia.client.keystone;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.maia.client.auth.AuthContext;
import io.maia.client.auth.AuthResult;
import io.maia.client.auth.AuthScope;
import io.maia.client.auth.CredentialSet;
import io.maia.client.auth.IdentityProvider;
import io.maia.common.Headers;
import io.maia.common.config.MaiaConfig;
import io.maia.common.error.AuthenticationException;
import io.maia.common.error.ConfigurationException;
import io.maia.common.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keystone v3 password, token and application credential authentication ({@code POST /v3/auth/tokens}).
 * The Maia endpoint is looked up in the service catalog of the issued token.
 */
public class KeystoneIdentityProvider implements IdentityProvider {

    private static final Logger logger = LoggerFactory.getLogger(KeystoneIdentityProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String TOKENS_PATH = "/auth/tokens";

    private final HttpClient client;
    private final String serviceType;
    private final String endpointInterface;
    private final String region;
    private final Duration timeout;

    public KeystoneIdentityProvider(HttpClient client, MaiaConfig config) {
        this(client, config.getKeystoneServiceType(), config.getKeystoneInterface(), config.getKeystoneRegion(),
                Duration.ofMillis(config.getRequestTimeoutMs()));
    }

    public KeystoneIdentityProvider(HttpClient client, String serviceType, String endpointInterface, String region,
                                    Duration timeout) {
        this.client = client;
        this.serviceType = serviceType;
        this.endpointInterface = endpointInterface;
        this.region = region;
        this.timeout = timeout;
    }

    @Override
    public AuthResult authenticate(CredentialSet credentials)
            throws AuthenticationException, TransportException, ConfigurationException {
        var uri = tokensUri(credentials.identityEndpoint());
        final byte[] body;
        try {
            body = MAPPER.writeValueAsBytes(authRequest(credentials));
        } catch (IOException e) {
            throw new ConfigurationException("could not encode authentication request: " + e.getMessage(), e);
        }

        var builder = HttpRequest.newBuilder()
                .uri(uri)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .header(Headers.HEADER_CONTENT_TYPE, Headers.JSON)
                .header(Headers.HEADER_ACCEPT, Headers.JSON);
        if (!timeout.isZero()) {
            builder.timeout(timeout);
        }

        logger.debug("Authenticating against {}", uri);
        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("could not reach Keystone at " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while authenticating against " + uri, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new AuthenticationException("authentication failed (HTTP " + status + "): "
                    + errorMessage(response.body()), status);
        }
        var token = response.headers().firstValue(Headers.HEADER_SUBJECT_TOKEN)
                .orElseThrow(() -> new AuthenticationException("Keystone response carries no "
                        + Headers.HEADER_SUBJECT_TOKEN + " header", status));

        final JsonNode tokenBody;
        try {
            tokenBody = MAPPER.readTree(response.body()).path("token");
        } catch (IOException e) {
            throw new AuthenticationException("malformed Keystone token response: " + e.getMessage(), status);
        }
        var context = toContext(token, tokenBody, credentials);
        return new AuthResult(context, findEndpoint(tokenBody.path("catalog")));
    }

    static URI tokensUri(String identityEndpoint) throws ConfigurationException {
        if (identityEndpoint == null || identityEndpoint.isBlank()) {
            throw new ConfigurationException("you must specify --os-auth-url");
        }
        var base = identityEndpoint.endsWith("/")
                ? identityEndpoint.substring(0, identityEndpoint.length() - 1)
                : identityEndpoint;
        if (!base.endsWith("/v3")) {
            base = base + "/v3";
        }
        try {
            var uri = URI.create(base + TOKENS_PATH);
            if (uri.getHost() == null) {
                throw new ConfigurationException("invalid URL: " + identityEndpoint);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid URL: " + identityEndpoint, e);
        }
    }

    static ObjectNode authRequest(CredentialSet credentials) throws ConfigurationException {
        var root = MAPPER.createObjectNode();
        var auth = root.putObject("auth");
        var identity = auth.putObject("identity");
        var methods = identity.putArray("methods");

        if (credentials.hasToken()) {
            methods.add("token");
            identity.putObject("token").put("id", credentials.tokenId());
        } else if (credentials.hasApplicationCredentialSecret()) {
            methods.add("application_credential");
            var applicationCredential = identity.putObject("application_credential");
            if (credentials.hasApplicationCredentialId()) {
                applicationCredential.put("id", credentials.applicationCredentialId());
            } else {
                applicationCredential.put("name", credentials.applicationCredentialName());
                applicationCredential.set("user", user(credentials));
            }
            applicationCredential.put("secret", credentials.applicationCredentialSecret());
        } else {
            methods.add("password");
            var user = user(credentials);
            user.put("password", credentials.password());
            identity.putObject("password").set("user", user);
        }

        var scope = scope(credentials.scope());
        if (scope != null) {
            auth.set("scope", scope);
        }
        return root;
    }

    private static ObjectNode user(CredentialSet credentials) {
        var user = MAPPER.createObjectNode();
        if (credentials.hasUserId()) {
            user.put("id", credentials.userId());
            return user;
        }
        user.put("name", credentials.username());
        if (credentials.hasDomainId()) {
            user.putObject("domain").put("id", credentials.domainId());
        } else if (credentials.hasDomainName()) {
            user.putObject("domain").put("name", credentials.domainName());
        }
        return user;
    }

    private static ObjectNode scope(AuthScope scope) throws ConfigurationException {
        if (scope == null || scope.isEmpty()) {
            return null;
        }
        var node = MAPPER.createObjectNode();
        if (isSet(scope.projectName())) {
            var project = node.putObject("project").put("name", scope.projectName());
            if (isSet(scope.domainId())) {
                project.putObject("domain").put("id", scope.domainId());
            } else if (isSet(scope.domainName())) {
                project.putObject("domain").put("name", scope.domainName());
            } else {
                throw new ConfigurationException("you must specify --os-project-domain-name or --os-domain-id"
                        + " together with --os-project-name");
            }
        } else if (isSet(scope.projectId())) {
            node.putObject("project").put("id", scope.projectId());
        } else if (isSet(scope.domainId())) {
            node.putObject("domain").put("id", scope.domainId());
        } else {
            node.putObject("domain").put("name", scope.domainName());
        }
        return node;
    }

    private static AuthContext toContext(String token, JsonNode tokenBody, CredentialSet credentials) {
        Map<String, String> auth = new HashMap<>();
        auth.put(AuthContext.TOKEN, token);
        putText(auth, AuthContext.USER_ID, tokenBody.path("user").path("id"));
        putText(auth, AuthContext.USER_NAME, tokenBody.path("user").path("name"));
        putText(auth, "user_domain_id", tokenBody.path("user").path("domain").path("id"));
        putText(auth, AuthContext.PROJECT_ID, tokenBody.path("project").path("id"));
        putText(auth, "project_name", tokenBody.path("project").path("name"));
        putText(auth, "project_domain_id", tokenBody.path("project").path("domain").path("id"));
        putText(auth, AuthContext.DOMAIN_ID, tokenBody.path("domain").path("id"));
        putText(auth, "domain_name", tokenBody.path("domain").path("name"));

        Map<String, String> request = new HashMap<>();
        putIfSet(request, "username", credentials.username());
        putIfSet(request, "user_id", credentials.userId());
        putIfSet(request, "user_domain_name", credentials.domainName());
        putIfSet(request, "user_domain_id", credentials.domainId());
        putIfSet(request, "application_credential_id", credentials.applicationCredentialId());
        putIfSet(request, "application_credential_name", credentials.applicationCredentialName());
        if (credentials.scope() != null) {
            putIfSet(request, "project_id", credentials.scope().projectId());
            putIfSet(request, "project_name", credentials.scope().projectName());
            putIfSet(request, "domain_id", credentials.scope().domainId());
            putIfSet(request, "domain_name", credentials.scope().domainName());
        }

        List<String> roles = new ArrayList<>();
        tokenBody.path("roles").forEach(role -> roles.add(role.path("name").asText()));
        return new AuthContext(auth, request, roles);
    }

    private String findEndpoint(JsonNode catalog) {
        for (JsonNode service : catalog) {
            if (!serviceType.equals(service.path("type").asText())) {
                continue;
            }
            for (JsonNode endpoint : service.path("endpoints")) {
                if (!endpointInterface.equals(endpoint.path("interface").asText())) {
                    continue;
                }
                if (isSet(region) && !region.equals(endpoint.path("region_id").asText())
                        && !region.equals(endpoint.path("region").asText())) {
                    continue;
                }
                return endpoint.path("url").asText();
            }
        }
        logger.warn("No {} endpoint of type '{}' in the service catalog", endpointInterface, serviceType);
        return null;
    }

    private static String errorMessage(String body) {
        try {
            var message = MAPPER.readTree(body).path("error").path("message");
            if (message.isTextual()) {
                return message.asText();
            }
        } catch (IOException e) {
            logger.debug("Keystone error body is not JSON: {}", e.getMessage());
        }
        return body;
    }

    private static void putText(Map<String, String> map, String key, JsonNode node) {
        if (node.isTextual()) {
            map.put(key, node.asText());
        }
    }

    private static void putIfSet(Map<String, String> map, String key, String value) {
        if (isSet(value)) {
            map.put(key, value);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
