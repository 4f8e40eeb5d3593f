package com.relaytide.retry;

import lombok.Getter;

/**
 * The per-notification time budget ran out. Never retried: the attempt that hit
 * it ends as FAILED with code TIMEOUT.
 */
@Getter
public class DeadlineExceededException extends RuntimeException {

    private final String operation;

    public DeadlineExceededException(String operation, Throwable lastError) {
        super("Deadline exceeded during " + operation, lastError);
        this.operation = operation;
    }

    public DeadlineExceededException(String operation) {
        super("Deadline exceeded during " + operation);
        this.operation = operation;
    }
}
