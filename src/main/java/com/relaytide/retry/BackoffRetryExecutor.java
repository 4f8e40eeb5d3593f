package com.relaytide.retry;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs an operation, retrying classified-transient failures with exponential backoff.
 *
 * FLOW:
 *   call() ──ok──→ return
 *     │
 *   failure ── not retryable? ──→ rethrow immediately
 *     │
 *   retries left? ── no ──→ rethrow last failure
 *     │
 *   delay would cross the deadline? ──→ DeadlineExceededException
 *     │
 *   observer.onRetry(error, n, delay) → wait(delay) → call() again
 *
 * Given a policy with maxRetries = N, the operation runs at most N + 1 times.
 *
 * On shutdown the wait is cut short and RetryAbortedException is thrown: an
 * attempt already in progress finishes, but no new attempt starts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackoffRetryExecutor {

    private final Clock clock;
    private final CountDownLatch shutdown = new CountDownLatch(1);

    public <T> T execute(String operation, RetryPolicy policy, Supplier<T> call) {
        return execute(operation, policy, new LoggingRetryObserver(operation), null, call);
    }

    public <T> T execute(String operation, RetryPolicy policy, Instant deadline, Supplier<T> call) {
        return execute(operation, policy, new LoggingRetryObserver(operation), deadline, call);
    }

    /**
     * @param deadline absolute time after which no new wait may start; null = unbounded
     */
    public <T> T execute(String operation, RetryPolicy policy, RetryObserver observer,
                         Instant deadline, Supplier<T> call) {
        int retry = 0;
        while (true) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!policy.isRetryable(e)) {
                    throw e;
                }
                if (retry >= policy.getMaxRetries()) {
                    log.warn("[{}] Giving up after {} attempt(s): {}", operation, retry + 1, e.getMessage());
                    throw e;
                }
                retry++;
                long delayMs = policy.delayForRetry(retry);

                if (deadline != null && clock.instant().plusMillis(delayMs).isAfter(deadline)) {
                    throw new DeadlineExceededException(operation, e);
                }

                notifyObserver(observer, e, retry, delayMs);
                waitBeforeRetry(operation, retry, delayMs, e);
            }
        }
    }

    /**
     * Stops all pending and future retries. Called by the container on shutdown.
     */
    @PreDestroy
    public void stopRetrying() {
        shutdown.countDown();
    }

    public boolean isStopping() {
        return shutdown.getCount() == 0;
    }

    private void notifyObserver(RetryObserver observer, Throwable error, int attempt, long delayMs) {
        if (observer == null) {
            return;
        }
        try {
            observer.onRetry(error, attempt, delayMs);
        } catch (RuntimeException observerError) {
            log.debug("Retry observer failed on attempt {}: {}", attempt, observerError.getMessage());
        }
    }

    private void waitBeforeRetry(String operation, int attempt, long delayMs, Throwable lastError) {
        try {
            // await returns true only when the shutdown latch has been released
            if (shutdown.await(delayMs, TimeUnit.MILLISECONDS)) {
                throw new RetryAbortedException(operation, attempt, lastError);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RetryAbortedException(operation, attempt, lastError);
        }
    }
}
