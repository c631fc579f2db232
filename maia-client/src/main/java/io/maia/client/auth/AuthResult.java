package io.maia.client.auth;

/**
 * Outcome of a successful authentication: the policy context (which carries the token) and the
 * metrics endpoint found in the service catalog, if any.
 */
public record AuthResult(AuthContext context, String endpoint) {
}
