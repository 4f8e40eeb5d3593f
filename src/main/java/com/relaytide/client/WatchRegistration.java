package com.relaytide.client;

import lombok.*;

import java.time.Instant;

/**
 * What the provider returned when a push subscription was created.
 * initialCursor is Gmail's historyId at watch time; Calendar has none.
 */
@Getter @AllArgsConstructor @Builder
@ToString
public class WatchRegistration {

    private final String channelId;
    private final String resourceId;
    private final String initialCursor;
    private final Instant expiresAt;
}
