package io.maia.common.error;

/**
 * Base type of every failure a Maia command can report. Commands let these propagate
 * and the command line turns the first one into a single message on stderr.
 */
public class MaiaException extends Exception {

    public MaiaException(String message) {
        super(message);
    }

    public MaiaException(String message, Throwable cause) {
        super(message, cause);
    }
}
