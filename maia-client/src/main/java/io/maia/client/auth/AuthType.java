package io.maia.client.auth;

import io.maia.common.error.ConfigurationException;

import java.util.Locale;

/**
 * Credential schemes accepted by {@code --os-auth-type}, spelled the way OpenStack clients spell them.
 */
public enum AuthType {
    PASSWORD("password"),
    TOKEN("token"),
    APPLICATION_CREDENTIAL("v3applicationcredential");

    private final String cliName;

    AuthType(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    public static AuthType fromCliName(String name) throws ConfigurationException {
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AuthType type : values()) {
            if (type.cliName.equals(normalized)) {
                return type;
            }
        }
        throw new ConfigurationException("unsupported --os-auth-type: " + name
                + " (use 'password', 'token' or 'v3applicationcredential')");
    }

    @Override
    public String toString() {
        return cliName;
    }
}
