package com.decora.utils.retry.event;

import org.apache.commons.lang3.Validate;

/**
 * Observes failed attempts that are about to be retried.
 * <p>
 * Called after a retryable failure and before the executor waits for the next attempt. It is
 * never called for the failure that ends the retry loop. Exceptions thrown from a listener are
 * not caught: they abandon the loop and reach the caller.
 */
@FunctionalInterface
public interface RetryListener {
    // attempt is 1-based
    void onRetry(int attempt, Throwable failure);

    default RetryListener andThen(RetryListener next) {
        Validate.notNull(next, "Listener to append cannot be null");
        return (attempt, failure) -> {
            onRetry(attempt, failure);
            next.onRetry(attempt, failure);
        };
    }
}
