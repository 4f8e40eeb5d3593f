package com.relaytide.retry;

/**
 * Notified before each retry wait. Implementations are for logging/metrics only;
 * the executor swallows anything they throw so the retry loop keeps going.
 */
@FunctionalInterface
public interface RetryObserver {

    void onRetry(Throwable error, int attempt, long delayMs);
}
