package com.relaytide.service;

import com.relaytide.model.IngestionSource;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * Calendar web_hook push. resourceState is "sync" for the handshake sent right
 * after a channel is created, "exists" / "not_exists" for real changes.
 */
@Getter
@ToString(exclude = "payload")
public class CalendarNotification extends InboundNotification {

    private final String channelId;
    private final String resourceId;
    private final String resourceState;
    private final String resourceUri;
    // X-Goog-Message-Number, increasing per channel; null when the provider omitted it
    private final String messageNumber;
    private final String changed;

    @Builder
    public CalendarNotification(String accountId, String payload, String channelId, String resourceId,
                                String resourceState, String resourceUri, String messageNumber, String changed) {
        super(accountId, payload);
        this.channelId = channelId;
        this.resourceId = resourceId;
        this.resourceState = resourceState;
        this.resourceUri = resourceUri;
        this.messageNumber = messageNumber;
        this.changed = changed;
    }

    @Override
    public IngestionSource source() {
        return IngestionSource.CALENDAR_PUSH;
    }

    @Override
    public String eventKind() {
        return "calendar_" + (resourceState != null ? resourceState.toLowerCase(Locale.ROOT) : "update");
    }

    /**
     * resourceId is constant for the life of a channel, so the message number is
     * what tells two deliveries apart.
     */
    @Override
    public String externalKey() {
        if (messageNumber == null || messageNumber.isBlank()) {
            return resourceId;
        }
        return resourceId + "#" + messageNumber;
    }

    @Override
    public boolean isHandshake() {
        return "sync".equalsIgnoreCase(resourceState);
    }
}
