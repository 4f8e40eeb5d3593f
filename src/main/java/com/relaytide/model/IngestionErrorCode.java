package com.relaytide.model;

/**
 * Why an ingestion ended in FAILED. Downstream tooling keys off these:
 * CURSOR_EXPIRED needs a full resync, AUTHORIZATION_FAILED needs the user to
 * reconnect, the rest are "try again later".
 */
public enum IngestionErrorCode {
    CURSOR_EXPIRED,
    AUTHORIZATION_FAILED,
    UPSTREAM_UNAVAILABLE,
    TIMEOUT,
    INTERNAL_ERROR
}
