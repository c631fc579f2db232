package io.maia.common.error;

/**
 * The metrics backend answered with a non-success HTTP status.
 */
public class BackendException extends MaiaException {

    private final int statusCode;

    public BackendException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
