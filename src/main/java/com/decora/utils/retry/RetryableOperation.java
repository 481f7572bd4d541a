package com.decora.utils.retry;

@FunctionalInterface
public interface RetryableOperation<T, X extends Exception> {
    T call() throws X;
}
