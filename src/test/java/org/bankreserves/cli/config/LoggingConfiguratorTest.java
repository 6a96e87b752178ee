package org.bankreserves.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String SIMULATION_LOGGER = "org.bankreserves.runtime.Simulation";
    private static final String BATCH_LOGGER = "org.bankreserves.batch.BatchRunner";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(SIMULATION_LOGGER).setLevel(null);
        context.getLogger(BATCH_LOGGER).setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_withJsonFormat_shouldSelectJsonAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "json"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT_JSON", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals("STDOUT_JSON", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_withLevels_shouldApplyDefaultAndSpecificLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.bankreserves.runtime.Simulation" = "DEBUG"
                "org.bankreserves.batch.BatchRunner" = "LOUD"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(SIMULATION_LOGGER).getLevel());
        // Unknown level names are ignored
        assertNull(context.getLogger(BATCH_LOGGER).getLevel());
    }

    @Test
    void configure_isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.bankreserves.runtime.Simulation\" = \"DEBUG\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.bankreserves.runtime.Simulation\" = \"ERROR\" }"));

        assertEquals(Level.DEBUG, context.getLogger(SIMULATION_LOGGER).getLevel());

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.bankreserves.runtime.Simulation\" = \"ERROR\" }"));

        assertEquals(Level.ERROR, context.getLogger(SIMULATION_LOGGER).getLevel());
    }

    @Test
    void appenderFor_shouldFallBackToPlain() {
        assertEquals("STDOUT", LoggingConfigurator.appenderFor("XML"));
        assertEquals("STDOUT_JSON", LoggingConfigurator.appenderFor("JSON"));
    }
}
