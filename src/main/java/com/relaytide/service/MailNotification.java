package com.relaytide.service;

import com.relaytide.model.IngestionSource;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Gmail Pub/Sub push: mailbox {@code emailAddress} changed as of {@code historyId}.
 */
@Getter
@ToString(exclude = "payload")
public class MailNotification extends InboundNotification {

    private final String emailAddress;
    private final String historyId;
    private final String pubsubMessageId;

    @Builder
    public MailNotification(String accountId, String payload, String emailAddress,
                            String historyId, String pubsubMessageId) {
        super(accountId, payload);
        this.emailAddress = emailAddress;
        this.historyId = historyId;
        this.pubsubMessageId = pubsubMessageId;
    }

    @Override
    public IngestionSource source() {
        return IngestionSource.MAIL_PUSH;
    }

    @Override
    public String eventKind() {
        return "new_mail";
    }

    @Override
    public String externalKey() {
        return historyId;
    }
}
