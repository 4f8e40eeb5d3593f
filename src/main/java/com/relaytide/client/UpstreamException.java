package com.relaytide.client;

import lombok.Getter;

/**
 * Root of every failure the provider clients raise. Classification happens once,
 * in UpstreamErrorClassifier; callers switch on the subtype, never on status codes.
 *
 *   RetryableUpstreamException     → 429, 5xx, 403 quota, network I/O
 *   UpstreamAuthorizationException → 401, 403 permission, no usable credential
 *   CursorExpiredException         → history/sync cursor no longer recognized
 *   FatalUpstreamException         → everything else (404, other 4xx, bad payloads)
 */
@Getter
public abstract class UpstreamException extends RuntimeException {

    private final String operation;
    // HTTP status, or 0 when the request never got a response
    private final int status;

    protected UpstreamException(String operation, int status, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.status = status;
    }
}
