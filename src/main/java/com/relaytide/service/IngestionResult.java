package com.relaytide.service;

import lombok.*;

/**
 * Counts written onto an IngestionRecord when it reaches COMPLETED or FAILED.
 *
 * entitiesCreated   → new InteractionRecords
 * entitiesUpdated   → already-known identities that gained an interaction
 * identitiesCreated → identities first seen in this ingestion
 * itemsSkipped      → messages/attendees whose processing failed and was contained
 */
@Getter @AllArgsConstructor @Builder
@ToString @EqualsAndHashCode
public class IngestionResult {

    private final int entitiesCreated;
    private final int entitiesUpdated;
    private final int identitiesCreated;
    private final int itemsSkipped;

    public static IngestionResult empty() {
        return new IngestionResult(0, 0, 0, 0);
    }
}
