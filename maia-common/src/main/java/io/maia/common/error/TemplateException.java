package io.maia.common.error;

/**
 * The user supplied output template could not be compiled, or the response could not be bound to it.
 */
public class TemplateException extends MaiaException {

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
