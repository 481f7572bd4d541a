package com.decora.utils.retry;

import lombok.Getter;

@Getter
public final class RetryInterruptedException extends RuntimeException {
    private final int completedAttempts;

    RetryInterruptedException(int completedAttempts, InterruptedException cause, Throwable lastFailure) {
        super("Retry was interrupted after " + completedAttempts + " attempt(s)", cause);
        this.completedAttempts = completedAttempts;
        if (lastFailure != null)
            addSuppressed(lastFailure);
    }
}
