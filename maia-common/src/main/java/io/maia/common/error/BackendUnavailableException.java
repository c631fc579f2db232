package io.maia.common.error;

/**
 * HTTP 503 from the metrics backend. {@link #isGlobal()} tells whether the request
 * targeted the global backend.
 */
public class BackendUnavailableException extends BackendException {

    private final boolean global;

    public BackendUnavailableException(String message, boolean global) {
        super(message, 503);
        this.global = global;
    }

    public BackendUnavailableException(String message, boolean global, Throwable cause) {
        super(message, 503, cause);
        this.global = global;
    }

    public boolean isGlobal() {
        return global;
    }
}
