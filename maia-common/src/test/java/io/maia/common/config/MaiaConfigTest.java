package io.maia.common.config;

import com.typesafe.config.ConfigFactory;
import io.maia.common.error.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class MaiaConfigTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should load defaults from reference.conf")
    void defaults() throws Exception {
        var config = MaiaConfig.load(ConfigFactory.empty());

        assertEquals("metrics", config.getKeystoneServiceType());
        assertEquals("public", config.getKeystoneInterface());
        assertEquals(10000, config.getConnectTimeoutMs());
        assertEquals(0, config.getRequestTimeoutMs());
        assertEquals(ZoneId.systemDefault(), config.getTimeZone());
    }

    @Test
    @DisplayName("Should let command line overrides win over the classpath")
    void overrides() throws Exception {
        var overrides = ConfigFactory.parseString("""
                maia {
                    federate-url = "http://federation:9090"
                    time-zone = "UTC"
                    keystone.region = "staging"
                    http.connect-timeout-ms = 500
                }
                """);
        var config = MaiaConfig.load(overrides);

        assertEquals("http://federation:9090", config.getFederateUrl());
        assertEquals(ZoneId.of("UTC"), config.getTimeZone());
        assertEquals("staging", config.getKeystoneRegion());
        assertEquals(500, config.getConnectTimeoutMs());
    }

    @Test
    @DisplayName("Should accept 1 and true for the insecure switch")
    void insecure() {
        assertTrue(MaiaConfig.of(ConfigFactory.parseString("maia.insecure = \"1\"")).isInsecure());
        assertTrue(MaiaConfig.of(ConfigFactory.parseString("maia.insecure = true")).isInsecure());
        assertFalse(MaiaConfig.of(ConfigFactory.parseString("maia.insecure = false")).isInsecure());
        assertFalse(MaiaConfig.of(ConfigFactory.empty()).isInsecure());
    }

    @Test
    @DisplayName("Should reject unknown time zones")
    void invalidTimeZone() {
        var config = MaiaConfig.of(ConfigFactory.parseString("maia.time-zone = \"Mars/Olympus\""));
        var e = assertThrows(ConfigurationException.class, config::getTimeZone);
        assertTrue(e.getMessage().contains("Mars/Olympus"));
    }
}
