package com.relaytide.service;

import com.relaytide.model.InteractionDirection;
import com.relaytide.model.InteractionKind;
import lombok.*;

import java.time.Instant;

/**
 * What an extraction handler observed about one contact occurrence.
 * (sourceSystem, sourceId) identifies it within the account.
 */
@Getter @AllArgsConstructor @Builder
@ToString
public class InteractionData {

    private final InteractionKind kind;
    private final InteractionDirection direction;
    private final String subject;
    private final String summary;
    private final String sourceSystem;
    private final String sourceId;
    private final Instant occurredAt;
    private final boolean actionRequired;
}
