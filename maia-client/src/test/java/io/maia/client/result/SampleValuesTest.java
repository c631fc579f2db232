package io.maia.client.result;

import io.maia.common.error.ResponseFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SampleValuesTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "0, 0",
            "-0, 0",
            "1, 1",
            "11240, 11240",
            "5.4975581388800e+13, 54975581388800",
            "1e+06, 1000000",
            "0.5, 0.5",
            "2.50, 2.5",
            "-3.25, -3.25",
            "NaN, NaN",
            "+Inf, +Inf",
            "Inf, +Inf",
            "-Inf, -Inf"
    })
    @DisplayName("Should print sample values in plain notation")
    void format(String raw, String expected) throws Exception {
        assertEquals(expected, SampleValues.format(raw));
    }

    @Test
    @DisplayName("Should reject values that are not numbers")
    void invalidValue() {
        assertThrows(ResponseFormatException.class, () -> SampleValues.format("fast"));
    }

    @Test
    @DisplayName("Should keep millisecond precision of timestamps")
    void timestamp() {
        assertEquals(Instant.parse("2017-07-03T07:26:23.997Z"), SampleValues.timestamp(new BigDecimal("1499066783.997")));
        assertEquals(Instant.parse("2017-07-03T07:26:23.997Z"),
                SampleValues.timestamp(new BigDecimal("1499066783.9979")));
        assertEquals(Instant.parse("2017-07-03T07:26:23Z"), SampleValues.timestamp(new BigDecimal("1499066783")));
    }
}
