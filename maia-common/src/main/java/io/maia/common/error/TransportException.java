package io.maia.common.error;

/**
 * Network or I/O failure while talking to the identity provider or the metrics backend.
 */
public class TransportException extends MaiaException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
