package com.decora.utils.retry;

import com.decora.utils.retry.event.RetryListener;
import org.apache.commons.lang3.Validate;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

public record RetryPolicy(int maxAttempts, Predicate<Throwable> retryableClassifier,
                          Duration initialDelay, double backoffMultiplier, Duration maxDelay,
                          Duration jitter, RetryListener onRetry) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(30);
    public static final RetryPolicy DEFAULT = new RetryPolicy();

    public RetryPolicy {
        Validate.isTrue(maxAttempts >= 1, "Max attempts should be at least 1, was %d", maxAttempts);
        Validate.notNull(retryableClassifier, "Retryable classifier cannot be null");
        requireNonNegative(initialDelay, "Initial delay");
        Validate.isTrue(backoffMultiplier >= 0 && Double.isFinite(backoffMultiplier),
                "Backoff multiplier should be a non-negative finite number, was %s", backoffMultiplier);
        requireNonNegative(maxDelay, "Max delay");
        requireNonNegative(jitter, "Jitter");
    }

    private RetryPolicy() {
        this(DEFAULT_MAX_ATTEMPTS, t -> true, Duration.ZERO, 1, DEFAULT_MAX_DELAY, Duration.ZERO, null);
    }

    private static void requireNonNegative(Duration duration, String name) {
        Validate.notNull(duration, "%s cannot be null", name);
        Validate.isTrue(!duration.isNegative(), "%s should not be negative, was %s", name, duration);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }

    public boolean isRetryable(Throwable t) {
        return retryableClassifier.test(t);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public record Builder(RetryPolicy policy) {
        public Builder() {
            this(DEFAULT);
        }

        public Builder {
            Validate.notNull(policy, "Policy cannot be null");
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts == policy.maxAttempts)
                return this;
            return new Builder(new RetryPolicy(maxAttempts, policy.retryableClassifier, policy.initialDelay,
                    policy.backoffMultiplier, policy.maxDelay, policy.jitter, policy.onRetry));
        }

        public Builder retryIf(Predicate<Throwable> classifier) {
            return new Builder(new RetryPolicy(policy.maxAttempts, classifier, policy.initialDelay,
                    policy.backoffMultiplier, policy.maxDelay, policy.jitter, policy.onRetry));
        }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            Validate.notEmpty(types, "At least one retryable type is required");
            Validate.noNullElements(types, "Retryable types cannot contain null");
            List<Class<? extends Throwable>> retryable = List.copyOf(Arrays.asList(types));
            return retryIf(t -> retryable.stream().anyMatch(type -> type.isInstance(t)));
        }

        public Builder initialDelay(Duration initialDelay) {
            return new Builder(new RetryPolicy(policy.maxAttempts, policy.retryableClassifier, initialDelay,
                    policy.backoffMultiplier, policy.maxDelay, policy.jitter, policy.onRetry));
        }

        public Builder initialDelay(long value, TimeUnit unit) {
            return initialDelay(toDuration(value, unit));
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            return new Builder(new RetryPolicy(policy.maxAttempts, policy.retryableClassifier, policy.initialDelay,
                    backoffMultiplier, policy.maxDelay, policy.jitter, policy.onRetry));
        }

        public Builder maxDelay(Duration maxDelay) {
            return new Builder(new RetryPolicy(policy.maxAttempts, policy.retryableClassifier, policy.initialDelay,
                    policy.backoffMultiplier, maxDelay, policy.jitter, policy.onRetry));
        }

        public Builder maxDelay(long value, TimeUnit unit) {
            return maxDelay(toDuration(value, unit));
        }

        public Builder jitter(Duration jitter) {
            return new Builder(new RetryPolicy(policy.maxAttempts, policy.retryableClassifier, policy.initialDelay,
                    policy.backoffMultiplier, policy.maxDelay, jitter, policy.onRetry));
        }

        public Builder jitter(long value, TimeUnit unit) {
            return jitter(toDuration(value, unit));
        }

        public Builder onRetry(RetryListener listener) {
            if (listener == null)
                return this;
            RetryListener combined = policy.onRetry == null ? listener : policy.onRetry.andThen(listener);
            return new Builder(new RetryPolicy(policy.maxAttempts, policy.retryableClassifier, policy.initialDelay,
                    policy.backoffMultiplier, policy.maxDelay, policy.jitter, combined));
        }

        public Builder clearListeners() {
            if (policy.onRetry == null)
                return this;
            return new Builder(new RetryPolicy(policy.maxAttempts, policy.retryableClassifier, policy.initialDelay,
                    policy.backoffMultiplier, policy.maxDelay, policy.jitter, null));
        }

        public RetryPolicy build() {
            return policy;
        }

        private static Duration toDuration(long value, TimeUnit unit) {
            Validate.notNull(unit, "Time unit cannot be null");
            return Duration.of(value, unit.toChronoUnit());
        }
    }
}
