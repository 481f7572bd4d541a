package com.decora.utils.retry.event;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

public final class LoggingRetryListener implements RetryListener {
    private final Logger logger;
    private final Level level;

    public LoggingRetryListener(Logger logger, Level level) {
        Validate.notNull(logger, "Logger cannot be null");
        Validate.notNull(level, "Log level cannot be null");
        this.logger = logger;
        this.level = level;
    }

    public static LoggingRetryListener of(Class<?> owner) {
        return new LoggingRetryListener(LoggerFactory.getLogger(owner), Level.WARN);
    }

    @Override
    public void onRetry(int attempt, Throwable failure) {
        logger.atLevel(level)
                .setCause(failure)
                .log("Attempt {} failed with {}: {}", attempt, failure.getClass().getSimpleName(), failure.getMessage());
    }
}
