package io.maia.common.error;

/**
 * A successful backend response whose body does not have the expected JSON shape.
 */
public class ResponseFormatException extends MaiaException {

    public ResponseFormatException(String message) {
        super(message);
    }

    public ResponseFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
