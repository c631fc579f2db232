package io.maia.common.error;

/**
 * Missing, ambiguous or malformed command line / configuration input.
 * Always raised before any network call is made.
 */
public class ConfigurationException extends MaiaException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
