package io.maia.client.auth;

import io.maia.common.error.ConfigurationException;
import io.maia.common.error.MaiaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the credential flags of one invocation into an authenticated {@link Session}.
 *
 * Only the fields of the selected scheme are forwarded to the identity provider; everything else is
 * cleared so that leftovers from the environment (e.g. an {@code OS_PASSWORD} next to a token) do not
 * confuse Keystone. All validation happens before the identity provider is contacted.
 */
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final IdentityProvider identityProvider;

    public CredentialResolver(IdentityProvider identityProvider) {
        this.identityProvider = identityProvider;
    }

    /**
     * @param credentials raw credentials collected from flags and environment
     * @param authType    value of {@code --os-auth-type}, may be empty
     * @param backendUrl  explicitly configured Maia URL, may be empty
     */
    public Session resolve(CredentialSet credentials, String authType, String backendUrl) throws MaiaException {
        if (credentials.hasToken() && CredentialSet.isSet(backendUrl)) {
            log.debug("Token and Maia URL given, skipping authentication");
            return new Session(credentials.tokenId(), backendUrl, AuthContext.empty());
        }

        var normalized = normalize(credentials, selectAuthType(authType));
        var result = identityProvider.authenticate(normalized);
        var context = result.context();
        var url = CredentialSet.isSet(backendUrl) ? backendUrl : result.endpoint();
        if (!CredentialSet.isSet(url)) {
            throw new ConfigurationException("no Maia endpoint found in the service catalog, specify --maia-url");
        }
        log.debug("Authenticated: {}", context);
        return new Session(context.token(), url, context);
    }

    static AuthType selectAuthType(String authType) throws ConfigurationException {
        if (authType == null || authType.isBlank()) {
            log.info("Authentication type defaults to {}", AuthType.PASSWORD);
            return AuthType.PASSWORD;
        }
        return AuthType.fromCliName(authType);
    }

    /**
     * Validates the fields required by {@code type} and clears the fields of all other schemes.
     */
    public static CredentialSet normalize(CredentialSet credentials, AuthType type) throws ConfigurationException {
        var builder = credentials.toBuilder();
        switch (type) {
            case PASSWORD -> {
                if (!credentials.hasPassword()) {
                    throw new ConfigurationException("you must specify --os-password");
                }
                if (!credentials.hasUsername() && !credentials.hasUserId()) {
                    throw new ConfigurationException("you must specify --os-username or --os-user-id");
                }
                builder.tokenId(null)
                        .applicationCredentialId(null)
                        .applicationCredentialName(null)
                        .applicationCredentialSecret(null);
            }
            case TOKEN -> {
                if (!credentials.hasToken()) {
                    throw new ConfigurationException("you must specify --os-token");
                }
                // the scope stays to permit rescoping
                builder.password(null)
                        .userId(null)
                        .username(null)
                        .domainId(null)
                        .domainName(null)
                        .applicationCredentialId(null)
                        .applicationCredentialName(null)
                        .applicationCredentialSecret(null);
            }
            case APPLICATION_CREDENTIAL -> {
                if (!credentials.hasApplicationCredentialSecret()) {
                    throw new ConfigurationException("you must specify --os-application-credential-secret");
                }
                if (credentials.hasApplicationCredentialName()
                        && !credentials.hasUsername() && !credentials.hasUserId()) {
                    throw new ConfigurationException("you must specify --os-username or --os-user-id when using"
                            + " --os-application-credential-name");
                }
                if (credentials.hasApplicationCredentialId()) {
                    builder.userId(null)
                            .username(null)
                            .domainId(null)
                            .domainName(null);
                }
                // application credentials carry their own scope
                builder.password(null)
                        .tokenId(null)
                        .scope(null);
            }
        }
        var normalized = builder.build();
        checkAmbiguities(normalized);
        return normalized;
    }

    private static void checkAmbiguities(CredentialSet credentials) throws ConfigurationException {
        if (credentials.hasUserId() && credentials.hasUsername()) {
            throw new ConfigurationException("use either --os-user-id or --os-username but not both");
        }
        if (credentials.hasDomainId() && credentials.hasDomainName()) {
            throw new ConfigurationException("use either --os-user-domain-id or --os-user-domain-name but not both");
        }
        if (credentials.hasUserId() && (credentials.hasDomainId() || credentials.hasDomainName())) {
            throw new ConfigurationException("do not specify --os-user-domain-id or --os-user-domain-name"
                    + " when using --os-user-id since the user ID implies the domain");
        }
    }
}
