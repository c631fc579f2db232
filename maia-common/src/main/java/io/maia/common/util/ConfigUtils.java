package io.maia.common.util;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import io.maia.common.error.ConfigurationException;

import java.time.Duration;
import java.util.List;

public class ConfigUtils {

    public static final String DURATION_KEY = "duration";

    private ConfigUtils() {
    }

    /**
     * Joins repeated {@code --conf key=value} arguments into a single HOCON document.
     */
    public static Config fromOverrides(List<String> configs) throws ConfigurationException {
        var buffer = new StringBuilder();
        if (configs != null) {
            configs.forEach(c -> {
                buffer.append(c);
                buffer.append("\n");
            });
        }
        try {
            return ConfigFactory.parseString(buffer.toString());
        } catch (ConfigException e) {
            throw new ConfigurationException("invalid --conf value: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a duration with HOCON syntax, e.g. {@code 30s}, {@code 10m}, {@code 2h} or {@code 1d}.
     */
    public static Duration parseDuration(String value) throws ConfigurationException {
        try {
            return ConfigFactory.empty()
                    .withValue(DURATION_KEY, ConfigValueFactory.fromAnyRef(value))
                    .getDuration(DURATION_KEY);
        } catch (ConfigException e) {
            throw new ConfigurationException("invalid duration: " + value, e);
        }
    }
}
