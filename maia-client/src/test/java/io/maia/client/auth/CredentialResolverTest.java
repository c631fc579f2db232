package io.maia.client.auth;

import io.maia.common.error.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CredentialResolverTest {

    private static final String AUTH_URL = "http://keystone.example.com:5000/v3";
    private static final AuthScope PROJECT_SCOPE = new AuthScope("12345", null, null, null);

    /**
     * Records what reaches the identity provider and answers with a fixed token and catalog endpoint.
     */
    private static class RecordingProvider implements IdentityProvider {
        final List<CredentialSet> calls = new ArrayList<>();
        String endpoint = "http://localhost:9091";

        @Override
        public AuthResult authenticate(CredentialSet credentials) {
            calls.add(credentials);
            var context = new AuthContext(Map.of(AuthContext.TOKEN, "issued-token", AuthContext.PROJECT_ID, "12345"),
                    Map.of(), List.of("monitoring_viewer"));
            return new AuthResult(context, endpoint);
        }
    }

    private static CredentialSet credentials(String token, String username, String userId, String password,
                                             String appCredId, String appCredName, String appCredSecret) {
        return CredentialSet.builder()
                .identityEndpoint(AUTH_URL)
                .tokenId(token)
                .username(username)
                .userId(userId)
                .password(password)
                .applicationCredentialId(appCredId)
                .applicationCredentialName(appCredName)
                .applicationCredentialSecret(appCredSecret)
                .scope(PROJECT_SCOPE)
                .build();
    }

    static Stream<Arguments> schemes() {
        return Stream.of(
                Arguments.of("password with auth type", "", "password", "", "testid", "testwd", "", "", "", false),
                Arguments.of("password without auth type", "", "", "testname", "", "testwd", "", "", "", false),
                Arguments.of("username and user id", "", "password", "testname", "testid", "testwd", "", "", "", true),
                Arguments.of("token with password leftovers", "ABC", "token", "testname", "testid", "testwd", "", "", "", false),
                Arguments.of("token without auth type", "ABC", "", "testname", "testid", "testwd", "", "", "", true),
                Arguments.of("app credential id with secret", "", "v3applicationcredential", "", "", "", "testappcredid", "", "testappcredsecret", false),
                Arguments.of("app credential name with username", "", "v3applicationcredential", "testname", "", "", "", "testappcredname", "testappcredsecret", false),
                Arguments.of("app credential name without username", "", "v3applicationcredential", "", "", "", "", "testappcredname", "testappcredsecret", true),
                Arguments.of("app credential name with username and user id", "", "v3applicationcredential", "testname", "testid", "", "", "testappcredname", "testappcredsecret", true),
                Arguments.of("token with username and user id", "ABC", "token", "testname", "testid", "", "", "", "", false),
                Arguments.of("app credential id without secret", "", "v3applicationcredential", "testname", "", "", "testappcredid", "", "", true));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("schemes")
    @DisplayName("Should accept or reject each scheme before contacting the identity provider")
    void resolveSchemes(String name, String token, String authType, String username, String userId, String password,
                        String appCredId, String appCredName, String appCredSecret, boolean expectError) throws Exception {
        var provider = new RecordingProvider();
        var resolver = new CredentialResolver(provider);
        var input = credentials(token, username, userId, password, appCredId, appCredName, appCredSecret);

        if (expectError) {
            assertThrows(ConfigurationException.class, () -> resolver.resolve(input, authType, ""));
            assertTrue(provider.calls.isEmpty(), "identity provider must not be called");
        } else {
            var session = resolver.resolve(input, authType, "");
            assertEquals("issued-token", session.token());
            assertEquals("http://localhost:9091", session.backendUrl());
            assertEquals(1, provider.calls.size());
        }
    }

    @Test
    @DisplayName("Should skip authentication when token and Maia URL are known")
    void fastPath() throws Exception {
        var provider = new RecordingProvider();
        var session = new CredentialResolver(provider).resolve(
                credentials("ABC", "", "", "", "", "", ""), "", "https://maia.example.com");

        assertEquals("ABC", session.token());
        assertEquals("https://maia.example.com", session.backendUrl());
        assertTrue(provider.calls.isEmpty());
    }

    @Test
    @DisplayName("Should prefer an explicit Maia URL over the catalog endpoint")
    void explicitUrlWins() throws Exception {
        var provider = new RecordingProvider();
        var session = new CredentialResolver(provider).resolve(
                credentials(null, "testname", null, "testwd", null, null, null), "password", "https://maia.example.com");

        assertEquals("https://maia.example.com", session.backendUrl());
        assertEquals("issued-token", session.token());
    }

    @Test
    @DisplayName("Should fail when the catalog has no Maia endpoint and none is configured")
    void noEndpoint() {
        var provider = new RecordingProvider();
        provider.endpoint = null;
        var resolver = new CredentialResolver(provider);

        var e = assertThrows(ConfigurationException.class, () -> resolver.resolve(
                credentials(null, "testname", null, "testwd", null, null, null), "password", ""));
        assertTrue(e.getMessage().contains("--maia-url"));
    }

    @Test
    @DisplayName("Should reject unknown authentication types")
    void unknownAuthType() {
        var resolver = new CredentialResolver(new RecordingProvider());
        assertThrows(ConfigurationException.class, () -> resolver.resolve(
                credentials(null, "testname", null, "testwd", null, null, null), "kerberos", ""));
    }

    @Test
    @DisplayName("Password scheme drops token and application credential fields")
    void normalizePassword() throws Exception {
        var normalized = CredentialResolver.normalize(
                credentials("ABC", "testname", null, "testwd", "id", "name", "secret"), AuthType.PASSWORD);

        assertEquals("testname", normalized.username());
        assertEquals("testwd", normalized.password());
        assertNull(normalized.tokenId());
        assertNull(normalized.applicationCredentialId());
        assertNull(normalized.applicationCredentialName());
        assertNull(normalized.applicationCredentialSecret());
        assertEquals(PROJECT_SCOPE, normalized.scope());
    }

    @Test
    @DisplayName("Token scheme keeps only token and scope")
    void normalizeToken() throws Exception {
        var input = credentials("ABC", "testname", "testid", "testwd", null, null, null).toBuilder()
                .domainName("Default")
                .build();
        var normalized = CredentialResolver.normalize(input, AuthType.TOKEN);

        assertEquals("ABC", normalized.tokenId());
        assertNull(normalized.username());
        assertNull(normalized.userId());
        assertNull(normalized.password());
        assertNull(normalized.domainName());
        assertEquals(PROJECT_SCOPE, normalized.scope());
    }

    @Test
    @DisplayName("Application credential scheme drops password, token and scope")
    void normalizeApplicationCredential() throws Exception {
        var normalized = CredentialResolver.normalize(
                credentials("ABC", "testname", null, "testwd", null, "name", "secret"), AuthType.APPLICATION_CREDENTIAL);

        assertEquals("testname", normalized.username());
        assertEquals("name", normalized.applicationCredentialName());
        assertNull(normalized.password());
        assertNull(normalized.tokenId());
        assertNull(normalized.scope());
    }

    @Test
    @DisplayName("Application credential id drops the user identity")
    void normalizeApplicationCredentialId() throws Exception {
        var input = credentials(null, "testname", "testid", null, "appid", null, "secret").toBuilder()
                .domainId("default")
                .build();
        var normalized = CredentialResolver.normalize(input, AuthType.APPLICATION_CREDENTIAL);

        assertNull(normalized.username());
        assertNull(normalized.userId());
        assertNull(normalized.domainId());
        assertEquals("appid", normalized.applicationCredentialId());
    }

    @Test
    @DisplayName("Should name the missing flag")
    void missingFlags() {
        var e = assertThrows(ConfigurationException.class, () -> CredentialResolver.normalize(
                credentials(null, "testname", null, null, null, null, null), AuthType.PASSWORD));
        assertEquals("you must specify --os-password", e.getMessage());

        e = assertThrows(ConfigurationException.class, () -> CredentialResolver.normalize(
                credentials(null, null, null, "testwd", null, null, null), AuthType.PASSWORD));
        assertEquals("you must specify --os-username or --os-user-id", e.getMessage());

        e = assertThrows(ConfigurationException.class, () -> CredentialResolver.normalize(
                credentials(null, "testname", null, "testwd", null, null, null), AuthType.TOKEN));
        assertEquals("you must specify --os-token", e.getMessage());

        e = assertThrows(ConfigurationException.class, () -> CredentialResolver.normalize(
                credentials(null, "testname", null, null, "appid", null, null), AuthType.APPLICATION_CREDENTIAL));
        assertEquals("you must specify --os-application-credential-secret", e.getMessage());
    }

    @Test
    @DisplayName("Should reject ambiguous user domains")
    void ambiguousDomains() {
        var both = credentials(null, "testname", null, "testwd", null, null, null).toBuilder()
                .domainId("default")
                .domainName("Default")
                .build();
        var e = assertThrows(ConfigurationException.class, () -> CredentialResolver.normalize(both, AuthType.PASSWORD));
        assertTrue(e.getMessage().startsWith("use either --os-user-domain-id or --os-user-domain-name"));

        var userIdWithDomain = credentials(null, null, "testid", "testwd", null, null, null).toBuilder()
                .domainName("Default")
                .build();
        e = assertThrows(ConfigurationException.class,
                () -> CredentialResolver.normalize(userIdWithDomain, AuthType.PASSWORD));
        assertTrue(e.getMessage().contains("since the user ID implies the domain"));
    }

    @Test
    @DisplayName("Should reject both user domain flags with an application credential name")
    void ambiguousDomainsWithApplicationCredential() {
        var provider = new RecordingProvider();
        var input = credentials(null, "testname", null, null, null, "testappcredname", "testappcredsecret")
                .toBuilder()
                .domainId("default")
                .domainName("Default")
                .build();

        var e = assertThrows(ConfigurationException.class,
                () -> new CredentialResolver(provider).resolve(input, "v3applicationcredential", ""));
        assertTrue(e.getMessage().startsWith("use either --os-user-domain-id or --os-user-domain-name"));
        assertTrue(provider.calls.isEmpty(), "identity provider must not be called");
    }

    @Test
    @DisplayName("Should reject a user id with a user domain under an application credential name")
    void userIdWithDomainAndApplicationCredential() {
        var provider = new RecordingProvider();
        var input = credentials(null, null, "testid", null, null, "testappcredname", "testappcredsecret")
                .toBuilder()
                .domainName("Default")
                .build();

        assertThrows(ConfigurationException.class,
                () -> new CredentialResolver(provider).resolve(input, "v3applicationcredential", ""));
        assertTrue(provider.calls.isEmpty(), "identity provider must not be called");
    }

    @Test
    @DisplayName("Should mask secrets in toString")
    void masksSecrets() {
        var text = credentials("ABC", "testname", null, "testwd", null, null, "secret").toString();
        assertFalse(text.contains("testwd"));
        assertFalse(text.contains("ABC"));
        assertFalse(text.contains("secret"));
        assertTrue(text.contains("testname"));
    }
}
