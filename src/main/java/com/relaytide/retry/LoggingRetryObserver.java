package com.relaytide.retry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Default observer: one WARN line per retry, tagged with the operation name.
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingRetryObserver implements RetryObserver {

    private final String operation;

    @Override
    public void onRetry(Throwable error, int attempt, long delayMs) {
        log.warn("[{}] Retry attempt {} after {}ms due to: {}",
                operation, attempt, delayMs, error.getMessage());
    }
}
