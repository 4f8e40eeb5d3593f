package com.relaytide.dto;

import lombok.*;

/**
 * Calendar channel notification. Google sends these fields as X-Goog-* headers
 * with an empty body; the JSON form is accepted too and headers win when both are present.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CalendarPushNotification {
    private String channelId;
    private String resourceId;
    private String resourceUri;
    private String resourceState;
    private String channelExpiration;
    private String changed;
    private String messageNumber;
    private String channelToken;
}
