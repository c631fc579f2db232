package io.maia.client.auth;

import io.maia.common.error.AuthenticationException;
import io.maia.common.error.ConfigurationException;
import io.maia.common.error.TransportException;

/**
 * Authenticates normalized credentials against an identity service.
 */
@FunctionalInterface
public interface IdentityProvider {

    AuthResult authenticate(CredentialSet credentials)
            throws AuthenticationException, TransportException, ConfigurationException;
}
