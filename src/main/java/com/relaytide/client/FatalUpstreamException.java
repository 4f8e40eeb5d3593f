package com.relaytide.client;

public class FatalUpstreamException extends UpstreamException {

    public FatalUpstreamException(String operation, int status, String message, Throwable cause) {
        super(operation, status, message, cause);
    }

    public FatalUpstreamException(String operation, String message) {
        super(operation, 0, message, null);
    }
}
