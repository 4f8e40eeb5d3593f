package com.relaytide.retry;

import lombok.Getter;

/**
 * Raised when the process is shutting down between attempts. The in-flight
 * attempt was allowed to finish; no further attempts were made.
 */
@Getter
public class RetryAbortedException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public RetryAbortedException(String operation, int attempts, Throwable lastError) {
        super("Retries aborted for " + operation + " after " + attempts + " attempt(s)", lastError);
        this.operation = operation;
        this.attempts = attempts;
    }
}
