package com.relaytide.retry;

import com.relaytide.config.RelaytideProperties;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Predicate;

/**
 * How many times to retry, how long to wait, and which failures qualify.
 *
 * Delay before retry n (1-indexed) = min(maxDelayMs, initialDelayMs × multiplier^(n-1)).
 * No jitter: the schedule is deterministic so callers can reason about the
 * worst-case time a call may block (sum of all delays plus maxRetries + 1 attempts).
 */
@Getter
public class RetryPolicy {

    private final int maxRetries;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final Predicate<Throwable> retryable;

    @Builder
    private RetryPolicy(int maxRetries, long initialDelayMs, long maxDelayMs,
                        double multiplier, Predicate<Throwable> retryable) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must be >= 0, got: " + initialDelayMs);
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= initialDelayMs, got: " + maxDelayMs);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        this.maxRetries = maxRetries;
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.retryable = retryable != null ? retryable : error -> false;
    }

    public static RetryPolicy from(RelaytideProperties.Retry config, Predicate<Throwable> retryable) {
        return RetryPolicy.builder()
                .maxRetries(config.getMaxRetries())
                .initialDelayMs(config.getInitialDelayMs())
                .maxDelayMs(config.getMaxDelayMs())
                .multiplier(config.getMultiplier())
                .retryable(retryable)
                .build();
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    /**
     * @param retryNumber 1 for the first retry, 2 for the second, ...
     * @return delay in milliseconds, never above maxDelayMs
     */
    public long delayForRetry(int retryNumber) {
        if (retryNumber <= 0) {
            return 0L;
        }
        double raw = initialDelayMs * Math.pow(multiplier, retryNumber - 1);
        if (Double.isInfinite(raw) || raw >= maxDelayMs) {
            return maxDelayMs;
        }
        return (long) raw;
    }
}
