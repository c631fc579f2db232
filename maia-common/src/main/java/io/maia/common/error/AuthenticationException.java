package io.maia.common.error;

/**
 * The identity provider rejected the supplied credentials.
 */
public class AuthenticationException extends MaiaException {

    private final int statusCode;

    public AuthenticationException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
