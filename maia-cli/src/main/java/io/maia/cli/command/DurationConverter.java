package io.maia.cli.command;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import io.maia.common.error.ConfigurationException;
import io.maia.common.util.ConfigUtils;

import java.time.Duration;

/**
 * Converts {@code --step} and {@code --timeout} values such as {@code 30s} or {@code 10m}.
 */
public class DurationConverter implements IStringConverter<Duration> {

    @Override
    public Duration convert(String value) {
        try {
            return ConfigUtils.parseDuration(value);
        } catch (ConfigurationException e) {
            throw new ParameterException(e.getMessage(), e);
        }
    }
}
