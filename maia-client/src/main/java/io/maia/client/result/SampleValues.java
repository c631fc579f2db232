package io.maia.client.result;

import io.maia.common.error.ResponseFormatException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Conversions for the {@code [<unix seconds>, "<value>"]} pairs of the Prometheus API.
 */
public final class SampleValues {

    private SampleValues() {
    }

    /**
     * Fractional Unix seconds to an instant with millisecond precision; further digits are dropped.
     */
    public static Instant timestamp(BigDecimal seconds) {
        long millis = seconds.movePointRight(3).setScale(0, RoundingMode.DOWN).longValueExact();
        return Instant.ofEpochMilli(millis);
    }

    /**
     * Prints a sample value without exponent or trailing zeros, e.g. {@code 1e+06} as {@code 1000000}.
     * Non-finite values print as {@code NaN}, {@code +Inf} and {@code -Inf}.
     */
    public static String format(String raw) throws ResponseFormatException {
        if ("+Inf".equals(raw) || "Inf".equals(raw)) {
            return "+Inf";
        }
        if ("-Inf".equals(raw)) {
            return "-Inf";
        }
        final double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ResponseFormatException("invalid sample value: " + raw, e);
        }
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        if (value == 0) {
            return "0";
        }
        return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
    }
}
