package com.relaytide.client;

import lombok.Getter;

/**
 * The provider no longer recognizes the cursor. Retrying with the same cursor
 * cannot succeed; the account needs a full resync.
 */
@Getter
public class CursorExpiredException extends UpstreamException {

    private final String cursor;

    public CursorExpiredException(String operation, int status, String cursor, Throwable cause) {
        super(operation, status, "Cursor " + cursor + " is no longer valid", cause);
        this.cursor = cursor;
    }
}
