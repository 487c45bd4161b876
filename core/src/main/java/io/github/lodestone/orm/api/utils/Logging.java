package io.github.lodestone.orm.api.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Library-wide logging switches.
 *
 * <p>{@link #ENABLED} turns on informational output such as executed statements and schema
 * derivation. {@link #DEEP} additionally turns on per-row and per-parameter tracing.
 * Warnings and errors are always forwarded.</p>
 */
public final class Logging {
    private static final Logger LOGGER = LoggerFactory.getLogger("Lodestone");

    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private Logging() {}

    public static void info(Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) {
            LOGGER.info(message.get());
        }
    }

    public static void info(String message) {
        if (ENABLED) {
            LOGGER.info(message);
        }
    }

    public static void deepInfo(Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isDebugEnabled()) {
            LOGGER.debug(message.get());
        }
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }

    public static void error(String message) {
        LOGGER.error(message);
    }

    public static void error(String message, Throwable cause) {
        LOGGER.error(message, cause);
    }
}
