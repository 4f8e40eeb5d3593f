package com.relaytide.client;

public class RetryableUpstreamException extends UpstreamException {

    public RetryableUpstreamException(String operation, int status, String message, Throwable cause) {
        super(operation, status, message, cause);
    }
}
