package com.example.arithmetic.util;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An SLF4J logger that only builds its messages when the level is enabled.
 */
public final class LazyLogger {
    private final Logger logger;

    public LazyLogger(Class<?> owner) {
        logger = LoggerFactory.getLogger(owner);
    }

    public void debug(Supplier<String> message) {
        if (logger.isDebugEnabled()) {
            logger.debug(message.get());
        }
    }
}
