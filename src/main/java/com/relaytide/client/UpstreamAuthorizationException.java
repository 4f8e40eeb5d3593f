package com.relaytide.client;

public class UpstreamAuthorizationException extends UpstreamException {

    public UpstreamAuthorizationException(String operation, int status, String message, Throwable cause) {
        super(operation, status, message, cause);
    }

    public UpstreamAuthorizationException(String operation, String message) {
        super(operation, 0, message, null);
    }
}
