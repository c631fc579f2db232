package io.maia.client.auth;

/**
 * Project or domain a token gets scoped to. A project given by name needs a domain to qualify it.
 */
public record AuthScope(String projectId, String projectName, String domainId, String domainName) {

    public boolean isEmpty() {
        return !CredentialSet.isSet(projectId) && !CredentialSet.isSet(projectName)
                && !CredentialSet.isSet(domainId) && !CredentialSet.isSet(domainName);
    }
}
