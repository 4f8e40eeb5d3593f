package com.relaytide.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaytide.dto.CalendarPushNotification;
import com.relaytide.dto.GmailPushNotification;
import com.relaytide.dto.WebhookResponse;
import com.relaytide.model.ProviderCredential;
import com.relaytide.model.WatchChannel;
import com.relaytide.repository.ProviderCredentialRepository;
import com.relaytide.repository.WatchChannelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Turns raw provider pushes into routed InboundNotifications.
 *
 *   Gmail    → base64 message.data → {emailAddress, historyId} → account by mailbox
 *   Calendar → channel id → active WatchChannel → account (token checked)
 *
 * Malformed input raises MalformedNotificationException (400). A push that
 * cannot be routed is acknowledged without processing so the provider stops redelivering it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIntakeService {

    private final IngestionOrchestrator orchestrator;
    private final ProviderCredentialRepository credentialRepository;
    private final WatchChannelRepository watchChannelRepository;
    private final WebhookVerifier webhookVerifier;
    private final ObjectMapper objectMapper;

    public WebhookResponse handleGmail(GmailPushNotification push) {
        JsonNode data = decodeMessageData(push.getMessage().getData());
        String emailAddress = data.path("emailAddress").asText(null);
        String historyId = data.path("historyId").asText(null);
        if (emailAddress == null || emailAddress.isBlank() || historyId == null || historyId.isBlank()) {
            throw new MalformedNotificationException("Notification data must carry emailAddress and historyId");
        }

        Optional<ProviderCredential> credential =
                credentialRepository.findFirstByProviderEmailIgnoreCaseAndConnectedTrue(emailAddress);
        if (credential.isEmpty()) {
            log.warn("Gmail push for unknown mailbox {}, acknowledging without processing", emailAddress);
            return WebhookResponse.notProcessed("No connected account for " + emailAddress);
        }

        MailNotification notification = MailNotification.builder()
                .accountId(credential.get().getAccountId())
                .payload(toJson(push))
                .emailAddress(emailAddress)
                .historyId(historyId)
                .pubsubMessageId(push.getMessage().getMessageId())
                .build();
        return WebhookResponse.from(orchestrator.ingest(notification));
    }

    public WebhookResponse handleCalendar(CalendarPushNotification push) {
        if (isBlank(push.getChannelId()) || isBlank(push.getResourceId()) || isBlank(push.getResourceState())) {
            throw new MalformedNotificationException("Calendar notification needs channelId, resourceId and resourceState");
        }

        Optional<WatchChannel> channel = watchChannelRepository.findFirstByChannelIdAndActiveTrue(push.getChannelId());
        if (channel.isEmpty()) {
            log.warn("Calendar push on unknown channel {}, acknowledging without processing", push.getChannelId());
            return WebhookResponse.notProcessed("Unknown channel " + push.getChannelId());
        }
        webhookVerifier.verifyChannelToken(channel.get(), push.getChannelToken());

        CalendarNotification notification = CalendarNotification.builder()
                .accountId(channel.get().getAccountId())
                .payload(toJson(withoutToken(push)))
                .channelId(push.getChannelId())
                .resourceId(push.getResourceId())
                .resourceState(push.getResourceState())
                .resourceUri(push.getResourceUri())
                .messageNumber(push.getMessageNumber())
                .changed(push.getChanged())
                .build();
        return WebhookResponse.from(orchestrator.ingest(notification));
    }

    private JsonNode decodeMessageData(String data) {
        try {
            byte[] decoded = Base64.getDecoder().decode(data.trim());
            return objectMapper.readTree(new String(decoded, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new MalformedNotificationException("message.data is not base64-encoded JSON", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MalformedNotificationException("Notification cannot be serialized", e);
        }
    }

    private static CalendarPushNotification withoutToken(CalendarPushNotification push) {
        return CalendarPushNotification.builder()
                .channelId(push.getChannelId())
                .resourceId(push.getResourceId())
                .resourceUri(push.getResourceUri())
                .resourceState(push.getResourceState())
                .channelExpiration(push.getChannelExpiration())
                .changed(push.getChanged())
                .messageNumber(push.getMessageNumber())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
