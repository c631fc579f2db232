package io.maia.cli.render;

import io.maia.common.error.UnsupportedFormatException;

import java.util.Locale;

public enum OutputFormat {
    VALUE,
    JSON,
    TABLE,
    TEMPLATE;

    /**
     * Case-insensitive lookup of a {@code --format} value.
     */
    public static OutputFormat parse(String name) throws UnsupportedFormatException {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedFormatException(name);
        }
    }

    public String cliName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
