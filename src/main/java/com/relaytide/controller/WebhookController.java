package com.relaytide.controller;

import com.relaytide.dto.CalendarPushNotification;
import com.relaytide.dto.GmailPushNotification;
import com.relaytide.dto.WebhookResponse;
import com.relaytide.service.WebhookIntakeService;
import com.relaytide.service.WebhookVerifier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Provider push endpoints.
 *
 * POST /api/webhooks/gmail?token=...
 * { "message": { "data": "<base64 {emailAddress, historyId}>", "messageId": "..." }, "subscription": "..." }
 *
 * POST /api/webhooks/calendar
 * X-Goog-Channel-ID, X-Goog-Resource-ID, X-Goog-Resource-State, X-Goog-Channel-Token, ...
 *
 * Well-formed, authenticated requests always get 200, whatever the ingestion outcome.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookIntakeService intakeService;
    private final WebhookVerifier webhookVerifier;

    @PostMapping("/gmail")
    public ResponseEntity<WebhookResponse> gmail(@RequestParam(value = "token", required = false) String token,
                                                 @Valid @RequestBody GmailPushNotification notification) {
        webhookVerifier.verifyMailToken(token);
        return ResponseEntity.ok(intakeService.handleGmail(notification));
    }

    @PostMapping("/calendar")
    public ResponseEntity<WebhookResponse> calendar(
            @RequestHeader(value = "X-Goog-Channel-ID", required = false) String channelId,
            @RequestHeader(value = "X-Goog-Resource-ID", required = false) String resourceId,
            @RequestHeader(value = "X-Goog-Resource-State", required = false) String resourceState,
            @RequestHeader(value = "X-Goog-Resource-URI", required = false) String resourceUri,
            @RequestHeader(value = "X-Goog-Channel-Expiration", required = false) String channelExpiration,
            @RequestHeader(value = "X-Goog-Changed", required = false) String changed,
            @RequestHeader(value = "X-Goog-Message-Number", required = false) String messageNumber,
            @RequestHeader(value = "X-Goog-Channel-Token", required = false) String channelToken,
            @RequestBody(required = false) CalendarPushNotification body) {

        CalendarPushNotification fromBody = body != null ? body : new CalendarPushNotification();
        CalendarPushNotification notification = CalendarPushNotification.builder()
                .channelId(firstNonBlank(channelId, fromBody.getChannelId()))
                .resourceId(firstNonBlank(resourceId, fromBody.getResourceId()))
                .resourceState(firstNonBlank(resourceState, fromBody.getResourceState()))
                .resourceUri(firstNonBlank(resourceUri, fromBody.getResourceUri()))
                .channelExpiration(firstNonBlank(channelExpiration, fromBody.getChannelExpiration()))
                .changed(firstNonBlank(changed, fromBody.getChanged()))
                .messageNumber(firstNonBlank(messageNumber, fromBody.getMessageNumber()))
                .channelToken(firstNonBlank(channelToken, fromBody.getChannelToken()))
                .build();

        return ResponseEntity.ok(intakeService.handleCalendar(notification));
    }

    private static String firstNonBlank(String header, String bodyValue) {
        return header != null && !header.isBlank() ? header : bodyValue;
    }
}
