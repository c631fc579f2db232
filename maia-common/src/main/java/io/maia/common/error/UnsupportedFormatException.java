package io.maia.common.error;

public class UnsupportedFormatException extends MaiaException {

    public UnsupportedFormatException(String format) {
        super("unsupported --format value for this command: " + format);
    }
}
