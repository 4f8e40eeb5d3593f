package com.relaytide.service;

import lombok.Getter;
import lombok.Setter;

/**
 * Running tally for one ingestion. Handlers update it item by item, so the
 * counts reached before a batch-aborting failure still end up on the FAILED record.
 */
@Getter
public class IngestionProgress {

    private int entitiesCreated;
    private int entitiesUpdated;
    private int identitiesCreated;
    private int itemsSkipped;

    // Cursor to persist once the ingestion completes; null leaves the stored one alone
    @Setter
    private String nextCursor;

    public void recordOutcome(boolean identityCreated, boolean interactionCreated) {
        if (identityCreated) {
            identitiesCreated++;
        }
        if (!interactionCreated) {
            return;
        }
        entitiesCreated++;
        if (!identityCreated) {
            entitiesUpdated++;
        }
    }

    public void recordSkipped() {
        itemsSkipped++;
    }

    public IngestionResult toResult() {
        return IngestionResult.builder()
                .entitiesCreated(entitiesCreated)
                .entitiesUpdated(entitiesUpdated)
                .identitiesCreated(identitiesCreated)
                .itemsSkipped(itemsSkipped)
                .build();
    }
}
