package io.maia.common.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.maia.common.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Typed access to the {@code maia} section of the HOCON configuration.
 *
 * Configuration is layered (later sources override earlier):
 * 1. reference.conf / application.conf from the classpath
 * 2. {@code --conf key=value} overrides from the command line
 * 3. System properties
 *
 * Example:
 * <pre>
 * maia {
 *     federate-url = "https://federation.example.com"
 *     proxy = "http://proxy.example.com:3128"
 *     insecure = false
 *     time-zone = "Europe/Berlin"
 *     keystone {
 *         service-type = "metrics"
 *         interface = "public"
 *         region = "eu-de-1"
 *     }
 *     http {
 *         connect-timeout-ms = 10000
 *         request-timeout-ms = 0
 *     }
 * }
 * </pre>
 */
public class MaiaConfig {

    private static final Logger log = LoggerFactory.getLogger(MaiaConfig.class);
    private static final String CONFIG_PREFIX = "maia";

    private final Config config;

    /**
     * Load configuration with command line overrides layered on top of the classpath defaults.
     *
     * @param overrides config parsed from {@code --conf} arguments
     */
    public static MaiaConfig load(Config overrides) {
        Config classpathConfig = ConfigFactory.load();
        var config = ConfigFactory.systemProperties()
                .withFallback(overrides)
                .withFallback(classpathConfig)
                .resolve();
        log.debug("Configuration loaded successfully");
        return new MaiaConfig(config);
    }

    /**
     * Wrap an already resolved config. Useful for testing.
     */
    public static MaiaConfig of(Config config) {
        return new MaiaConfig(config);
    }

    private MaiaConfig(Config config) {
        this.config = config;
    }

    public Config getConfig() {
        return config;
    }

    public String getFederateUrl() {
        return getString("federate-url", "");
    }

    public String getProxy() {
        return getString("proxy", "");
    }

    /**
     * Accepts {@code true} as well as the {@code 1} used by the MAIA_INSECURE environment variable.
     */
    public boolean isInsecure() {
        var value = getString("insecure", "false").trim();
        return "1".equals(value) || Boolean.parseBoolean(value);
    }

    public ZoneId getTimeZone() throws ConfigurationException {
        var zone = getString("time-zone", "");
        if (zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("invalid time zone: " + zone, e);
        }
    }

    public String getKeystoneServiceType() {
        return getString("keystone.service-type", "metrics");
    }

    public String getKeystoneInterface() {
        return getString("keystone.interface", "public");
    }

    public String getKeystoneRegion() {
        return getString("keystone.region", "");
    }

    public int getConnectTimeoutMs() {
        return getInt("http.connect-timeout-ms", 10000);
    }

    /**
     * Zero means no client side request timeout; the backend query timeout still applies.
     */
    public int getRequestTimeoutMs() {
        return getInt("http.request-timeout-ms", 0);
    }

    private String getString(String path, String defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        try {
            if (config.hasPath(fullPath)) {
                return config.getString(fullPath);
            }
        } catch (Exception e) {
            log.debug("Error reading config path {}: {}", fullPath, e.getMessage());
        }
        return defaultValue;
    }

    private int getInt(String path, int defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        try {
            if (config.hasPath(fullPath)) {
                return config.getInt(fullPath);
            }
        } catch (Exception e) {
            log.debug("Error reading config path {}: {}", fullPath, e.getMessage());
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "MaiaConfig{" +
                "federateUrl='" + getFederateUrl() + '\'' +
                ", proxy='" + getProxy() + '\'' +
                ", insecure=" + isInsecure() +
                ", keystoneServiceType='" + getKeystoneServiceType() + '\'' +
                ", keystoneInterface='" + getKeystoneInterface() + '\'' +
                ", connectTimeoutMs=" + getConnectTimeoutMs() +
                '}';
    }
}
