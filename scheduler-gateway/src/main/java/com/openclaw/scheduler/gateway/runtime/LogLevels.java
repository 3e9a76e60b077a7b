package com.openclaw.scheduler.gateway.runtime;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.openclaw.scheduler.common.config.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code logging.level} from the config file to the scheduler's
 * logger hierarchy.
 */
@Slf4j
public final class LogLevels {

    static final String ROOT_PACKAGE = "com.openclaw.scheduler";

    private LogLevels() {
    }

    /**
     * @return the level applied, or null when the binding is not Logback
     */
    public static Level apply(SchedulerConfig.LoggingConfig config) {
        String raw = config != null && config.getLevel() != null ? config.getLevel() : "info";
        if (!(LoggerFactory.getLogger(ROOT_PACKAGE) instanceof Logger logger)) {
            log.debug("logging: binding is not logback, ignoring level {}", raw);
            return null;
        }
        Level level = Level.toLevel(raw.trim(), Level.INFO);
        logger.setLevel(level);
        log.debug("logging: {} level set to {}", ROOT_PACKAGE, level);
        return level;
    }
}
