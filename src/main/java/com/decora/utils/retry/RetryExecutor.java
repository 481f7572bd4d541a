package com.decora.utils.retry;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

@Slf4j
public final class RetryExecutor {
    private static final RetryExecutor DEFAULT = builder().build();
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final Sleeper sleeper;
    private final Supplier<RandomGenerator> random;

    private RetryExecutor(Sleeper sleeper, Supplier<RandomGenerator> random) {
        this.sleeper = sleeper;
        this.random = random;
    }

    public static RetryExecutor withDefaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public <T, X extends Exception> T run(RetryableOperation<T, X> operation, RetryPolicy policy) throws X {
        Validate.notNull(operation, "Operation cannot be null");
        Validate.notNull(policy, "Retry policy cannot be null");
        Validate.isTrue(policy.maxAttempts() >= 1, "Max attempts should be at least 1, was %d", policy.maxAttempts());
        return new RetryingContext<>(operation, policy).call();
    }

    public <T> T supply(Supplier<T> supplier, RetryPolicy policy) {
        Validate.notNull(supplier, "Supplier cannot be null");
        return run(supplier::get, policy);
    }

    public void execute(Runnable runnable, RetryPolicy policy) {
        Validate.notNull(runnable, "Runnable cannot be null");
        run(() -> {
            runnable.run();
            return null;
        }, policy);
    }

    public <T, X extends Exception> RetryableOperation<T, X> decorate(RetryableOperation<T, X> operation, RetryPolicy policy) {
        Validate.notNull(operation, "Operation cannot be null");
        Validate.notNull(policy, "Retry policy cannot be null");
        return () -> run(operation, policy);
    }

    public <T> Callable<T> decorateCallable(Callable<T> callable, RetryPolicy policy) {
        Validate.notNull(callable, "Callable cannot be null");
        Validate.notNull(policy, "Retry policy cannot be null");
        return () -> run(callable::call, policy);
    }

    public <T> Supplier<T> decorateSupplier(Supplier<T> supplier, RetryPolicy policy) {
        Validate.notNull(supplier, "Supplier cannot be null");
        Validate.notNull(policy, "Retry policy cannot be null");
        return () -> supply(supplier, policy);
    }

    public Runnable decorateRunnable(Runnable runnable, RetryPolicy policy) {
        Validate.notNull(runnable, "Runnable cannot be null");
        Validate.notNull(policy, "Retry policy cannot be null");
        return () -> execute(runnable, policy);
    }

    public Duration computeDelay(Duration currentDelay, RetryPolicy policy) {
        Validate.notNull(currentDelay, "Current delay cannot be null");
        Validate.isTrue(!currentDelay.isNegative(), "Current delay should not be negative, was %s", currentDelay);
        Validate.notNull(policy, "Retry policy cannot be null");
        return Duration.ofNanos(computeDelayNanos(toNanos(currentDelay), policy));
    }

    private long computeDelayNanos(long currentDelay, RetryPolicy policy) {
        long jitterBound = toNanos(policy.jitter());
        long jitter = jitterBound > 0 ? random.get().nextLong(jitterBound) : 0;
        long delay = currentDelay > Long.MAX_VALUE - jitter ? Long.MAX_VALUE : currentDelay + jitter;
        return Math.min(delay, toNanos(policy.maxDelay()));
    }

    private static long toNanos(Duration duration) {
        return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }

    private final class RetryingContext<T, X extends Exception> {
        private final RetryableOperation<T, X> operation;
        private final RetryPolicy policy;
        private int attempt = 1;
        private long currentDelay;

        private RetryingContext(RetryableOperation<T, X> operation, RetryPolicy policy) {
            this.operation = operation;
            this.policy = policy;
            this.currentDelay = toNanos(policy.initialDelay());
        }

        @SuppressWarnings("unchecked")
        private T call() throws X {
            for (; ; attempt++) {
                try {
                    return operation.call();
                } catch (Exception e) {
                    if (!shouldRetry(e))
                        throw (X) e;
                    prepareNextAttempt(e);
                }
            }
        }

        private boolean shouldRetry(Exception e) {
            if (e instanceof InterruptedException) {
                // the thrower cleared the flag
                Thread.currentThread().interrupt();
                log.debug("Attempt {} was interrupted, not retrying", attempt);
                return false;
            }
            if (attempt >= policy.maxAttempts()) {
                log.debug("Giving up after {} attempt(s): {}", attempt, e.toString());
                return false;
            }
            if (!policy.isRetryable(e)) {
                log.debug("Attempt {} failed with non-retryable {}", attempt, e.toString());
                return false;
            }
            return true;
        }

        private void prepareNextAttempt(Exception e) {
            if (policy.onRetry() != null)
                policy.onRetry().onRetry(attempt, e);
            long delay = computeDelayNanos(currentDelay, policy);
            log.debug("Attempt {}/{} failed with {}, retrying in {} ms",
                    attempt, policy.maxAttempts(), e.toString(), delay / 1_000_000);
            try {
                sleeper.sleep(Duration.ofNanos(delay));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting to retry after attempt {}", attempt);
                throw new RetryInterruptedException(attempt, ie, e);
            }
            currentDelay = (long) Math.min((double) Long.MAX_VALUE, currentDelay * policy.backoffMultiplier());
        }
    }

    public record Builder(Sleeper sleeper, Supplier<RandomGenerator> random) {
        public Builder() {
            this(Sleeper.THREAD, ThreadLocalRandom::current);
        }

        public Builder {
            Validate.notNull(sleeper, "Sleeper cannot be null");
            Validate.notNull(random, "Random source cannot be null");
        }

        public Builder sleeper(Sleeper sleeper) {
            return new Builder(sleeper, random);
        }

        public Builder random(RandomGenerator generator) {
            Validate.notNull(generator, "Random generator cannot be null");
            return new Builder(sleeper, () -> generator);
        }

        public Builder random(long seed) {
            return random(new Random(seed));
        }

        public RetryExecutor build() {
            return new RetryExecutor(sleeper, random);
        }
    }
}
