package io.maia.client.auth;

import java.util.Objects;

/**
 * Raw or normalized Keystone credentials. Instances are immutable; use {@link #toBuilder()} to derive
 * a modified copy. A {@code null} scope means the request is unscoped.
 */
public final class CredentialSet {

    private final String identityEndpoint;
    private final String username;
    private final String userId;
    private final String password;
    private final String domainId;
    private final String domainName;
    private final String tokenId;
    private final String applicationCredentialId;
    private final String applicationCredentialName;
    private final String applicationCredentialSecret;
    private final AuthScope scope;

    private CredentialSet(Builder builder) {
        this.identityEndpoint = builder.identityEndpoint;
        this.username = builder.username;
        this.userId = builder.userId;
        this.password = builder.password;
        this.domainId = builder.domainId;
        this.domainName = builder.domainName;
        this.tokenId = builder.tokenId;
        this.applicationCredentialId = builder.applicationCredentialId;
        this.applicationCredentialName = builder.applicationCredentialName;
        this.applicationCredentialSecret = builder.applicationCredentialSecret;
        this.scope = builder.scope;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .identityEndpoint(identityEndpoint)
                .username(username)
                .userId(userId)
                .password(password)
                .domainId(domainId)
                .domainName(domainName)
                .tokenId(tokenId)
                .applicationCredentialId(applicationCredentialId)
                .applicationCredentialName(applicationCredentialName)
                .applicationCredentialSecret(applicationCredentialSecret)
                .scope(scope);
    }

    static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }

    public String identityEndpoint() {
        return identityEndpoint;
    }

    public String username() {
        return username;
    }

    public String userId() {
        return userId;
    }

    public String password() {
        return password;
    }

    public String domainId() {
        return domainId;
    }

    public String domainName() {
        return domainName;
    }

    public String tokenId() {
        return tokenId;
    }

    public String applicationCredentialId() {
        return applicationCredentialId;
    }

    public String applicationCredentialName() {
        return applicationCredentialName;
    }

    public String applicationCredentialSecret() {
        return applicationCredentialSecret;
    }

    public AuthScope scope() {
        return scope;
    }

    public boolean hasUsername() {
        return isSet(username);
    }

    public boolean hasUserId() {
        return isSet(userId);
    }

    public boolean hasPassword() {
        return isSet(password);
    }

    public boolean hasDomainId() {
        return isSet(domainId);
    }

    public boolean hasDomainName() {
        return isSet(domainName);
    }

    public boolean hasToken() {
        return isSet(tokenId);
    }

    public boolean hasApplicationCredentialId() {
        return isSet(applicationCredentialId);
    }

    public boolean hasApplicationCredentialName() {
        return isSet(applicationCredentialName);
    }

    public boolean hasApplicationCredentialSecret() {
        return isSet(applicationCredentialSecret);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CredentialSet that = (CredentialSet) o;
        return Objects.equals(identityEndpoint, that.identityEndpoint) &&
               Objects.equals(username, that.username) &&
               Objects.equals(userId, that.userId) &&
               Objects.equals(password, that.password) &&
               Objects.equals(domainId, that.domainId) &&
               Objects.equals(domainName, that.domainName) &&
               Objects.equals(tokenId, that.tokenId) &&
               Objects.equals(applicationCredentialId, that.applicationCredentialId) &&
               Objects.equals(applicationCredentialName, that.applicationCredentialName) &&
               Objects.equals(applicationCredentialSecret, that.applicationCredentialSecret) &&
               Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityEndpoint, username, userId, password, domainId, domainName, tokenId,
                applicationCredentialId, applicationCredentialName, applicationCredentialSecret, scope);
    }

    @Override
    public String toString() {
        return "CredentialSet[identityEndpoint=" + identityEndpoint +
               ", username=" + username +
               ", userId=" + userId +
               ", password=" + mask(password) +
               ", domainId=" + domainId +
               ", domainName=" + domainName +
               ", tokenId=" + mask(tokenId) +
               ", applicationCredentialId=" + applicationCredentialId +
               ", applicationCredentialName=" + applicationCredentialName +
               ", applicationCredentialSecret=" + mask(applicationCredentialSecret) +
               ", scope=" + scope + "]";
    }

    private static String mask(String secret) {
        return isSet(secret) ? "***" : secret;
    }

    public static final class Builder {
        private String identityEndpoint;
        private String username;
        private String userId;
        private String password;
        private String domainId;
        private String domainName;
        private String tokenId;
        private String applicationCredentialId;
        private String applicationCredentialName;
        private String applicationCredentialSecret;
        private AuthScope scope;

        private Builder() {
        }

        public Builder identityEndpoint(String identityEndpoint) {
            this.identityEndpoint = identityEndpoint;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder domainId(String domainId) {
            this.domainId = domainId;
            return this;
        }

        public Builder domainName(String domainName) {
            this.domainName = domainName;
            return this;
        }

        public Builder tokenId(String tokenId) {
            this.tokenId = tokenId;
            return this;
        }

        public Builder applicationCredentialId(String applicationCredentialId) {
            this.applicationCredentialId = applicationCredentialId;
            return this;
        }

        public Builder applicationCredentialName(String applicationCredentialName) {
            this.applicationCredentialName = applicationCredentialName;
            return this;
        }

        public Builder applicationCredentialSecret(String applicationCredentialSecret) {
            this.applicationCredentialSecret = applicationCredentialSecret;
            return this;
        }

        public Builder scope(AuthScope scope) {
            this.scope = scope;
            return this;
        }

        public CredentialSet build() {
            return new CredentialSet(this);
        }
    }
}
