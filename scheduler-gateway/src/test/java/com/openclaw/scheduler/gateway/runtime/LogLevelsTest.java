package com.openclaw.scheduler.gateway.runtime;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.openclaw.scheduler.common.config.SchedulerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelsTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(LogLevels.ROOT_PACKAGE);

    @AfterEach
    void reset() {
        logger.setLevel(null);
    }

    private static SchedulerConfig.LoggingConfig level(String value) {
        SchedulerConfig.LoggingConfig config = new SchedulerConfig.LoggingConfig();
        config.setLevel(value);
        return config;
    }

    @Test
    void appliesConfiguredLevel() {
        assertEquals(Level.DEBUG, LogLevels.apply(level("debug")));
        assertEquals(Level.DEBUG, logger.getLevel());
    }

    @Test
    void unknownOrMissingLevelFallsBackToInfo() {
        assertEquals(Level.INFO, LogLevels.apply(level("chatty")));
        assertEquals(Level.INFO, LogLevels.apply(null));
        assertEquals(Level.INFO, logger.getLevel());
    }
}
