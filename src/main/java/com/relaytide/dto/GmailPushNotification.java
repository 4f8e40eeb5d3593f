package com.relaytide.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * Cloud Pub/Sub push envelope for Gmail.
 *
 * {
 *   "message": {
 *     "data": "eyJlbWFpbEFkZHJlc3MiOiAidXNlckBleGFtcGxlLmNvbSIsICJoaXN0b3J5SWQiOiAiMTIzNCJ9",
 *     "messageId": "2070443601311540",
 *     "publishTime": "2024-05-01T10:00:00Z"
 *   },
 *   "subscription": "projects/p/subscriptions/gmail-push"
 * }
 *
 * data is base64 of {"emailAddress": ..., "historyId": ...}.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GmailPushNotification {

    @NotNull(message = "message is required")
    @Valid
    private Message message;

    private String subscription;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
    public static class Message {

        @NotBlank(message = "message.data is required")
        private String data;

        private String messageId;
        private String publishTime;
    }
}
