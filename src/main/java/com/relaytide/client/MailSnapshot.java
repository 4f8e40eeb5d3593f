package com.relaytide.client;

import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * Metadata of one mail message, already translated from the provider's
 * header list into parsed addresses.
 */
@Getter @AllArgsConstructor @Builder
@ToString
public class MailSnapshot {

    private final String messageId;
    private final String threadId;
    private final ContactAddress sender;
    @Builder.Default
    private final List<ContactAddress> recipients = List.of();
    private final String subject;
    private final String snippet;
    @Builder.Default
    private final List<String> labelIds = List.of();
    private final Instant receivedAt;
}
