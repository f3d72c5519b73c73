package org.pragmatica.ddmm.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LoggingConfiguratorTest {
    private static final String[] TOUCHED = {Logger.ROOT_LOGGER_NAME, "org.pragmatica.ddmm", "org.pragmatica.ddmm.build"};

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Level[] saved = new Level[TOUCHED.length];

    @BeforeEach
    void saveLevels() {
        for (int i = 0; i < TOUCHED.length; i++ ) {
            saved[i] = context.getLogger(TOUCHED[i])
                              .getLevel();
        }
    }

    @AfterEach
    void restoreLevels() {
        for (int i = 0; i < TOUCHED.length; i++ ) {
            context.getLogger(TOUCHED[i])
                   .setLevel(saved[i]);
        }
    }

    @Test
    void configure_appliesDefaultAndPerLoggerLevels() {
        var config = ConfigFactory.parseString("""
                                               logging {
                                                 default-level = "ERROR"
                                                 levels { "org.pragmatica.ddmm.build" = "DEBUG" }
                                               }
                                               """);

        LoggingConfigurator.configure(config, false);

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME)
                                         .getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.pragmatica.ddmm.build")
                                         .getLevel());
    }

    @Test
    void configure_verbose_forcesDebug() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.pragmatica.ddmm\" = \"WARN\" }"),
                                      true);

        assertEquals(Level.DEBUG, context.getLogger("org.pragmatica.ddmm")
                                         .getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_leavesLevels() {
        var before = context.getLogger(Logger.ROOT_LOGGER_NAME)
                            .getLevel();

        LoggingConfigurator.configure(ConfigFactory.empty(), false);

        assertEquals(before, context.getLogger(Logger.ROOT_LOGGER_NAME)
                                    .getLevel());
    }
}
