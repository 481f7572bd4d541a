package com.decora.utils.retry.event;

import com.decora.utils.retry.RetryExecutor;
import com.decora.utils.retry.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

class LoggingRetryListenerTest {

    @Test
    void logsRetriedFailuresWithoutChangingTheOutcome() {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger seen = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(3)
                .onRetry(LoggingRetryListener.of(LoggingRetryListenerTest.class))
                .onRetry((attempt, failure) -> seen.incrementAndGet())
                .build();

        String result = RetryExecutor.builder().sleeper(d -> {}).build().supply(() -> {
            if (calls.incrementAndGet() < 3)
                throw new IllegalStateException("attempt " + calls.get());
            return "ok";
        }, policy);

        assertThat(result).isEqualTo("ok");
        assertThat(seen).hasValue(2);
    }

    @Test
    void requiresLoggerAndLevel() {
        assertThatNullPointerException().isThrownBy(() -> new LoggingRetryListener(null, Level.INFO));
        assertThatNullPointerException().isThrownBy(() ->
                new LoggingRetryListener(LoggerFactory.getLogger(getClass()), null));
    }
}
