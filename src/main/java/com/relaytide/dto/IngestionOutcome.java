package com.relaytide.dto;

import com.relaytide.model.IngestionErrorCode;
import com.relaytide.model.IngestionState;
import com.relaytide.service.IngestionResult;
import lombok.*;

import java.util.UUID;

/**
 * Result of one orchestrator invocation, handed back to the webhook.
 * success is true for COMPLETED and DUPLICATE; FAILED carries errorCode + error.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IngestionOutcome {
    private boolean success;
    private UUID ingestionRecordId;
    private IngestionState state;
    private int entitiesCreated;
    private int entitiesUpdated;
    private int itemsSkipped;
    private boolean duplicate;
    private UUID duplicateOf;
    private IngestionErrorCode errorCode;
    private String error;

    public static IngestionOutcome completed(UUID recordId, IngestionResult result) {
        return IngestionOutcome.builder()
                .success(true)
                .ingestionRecordId(recordId)
                .state(IngestionState.COMPLETED)
                .entitiesCreated(result.getEntitiesCreated())
                .entitiesUpdated(result.getEntitiesUpdated())
                .itemsSkipped(result.getItemsSkipped())
                .build();
    }

    public static IngestionOutcome duplicate(UUID recordId, UUID duplicateOf) {
        return IngestionOutcome.builder()
                .success(true)
                .ingestionRecordId(recordId)
                .state(IngestionState.DUPLICATE)
                .duplicate(true)
                .duplicateOf(duplicateOf)
                .build();
    }

    public static IngestionOutcome failed(UUID recordId, IngestionErrorCode code, String error,
                                          IngestionResult partial) {
        return IngestionOutcome.builder()
                .success(false)
                .ingestionRecordId(recordId)
                .state(IngestionState.FAILED)
                .entitiesCreated(partial.getEntitiesCreated())
                .entitiesUpdated(partial.getEntitiesUpdated())
                .itemsSkipped(partial.getItemsSkipped())
                .errorCode(code)
                .error(error)
                .build();
    }

    // Shutdown interrupted the attempt; the record stays PROCESSING for the stale sweep
    public static IngestionOutcome interrupted(UUID recordId, String error) {
        return IngestionOutcome.builder()
                .success(false)
                .ingestionRecordId(recordId)
                .state(IngestionState.PROCESSING)
                .error(error)
                .build();
    }

    // Work was applied but the COMPLETED transition was not stored
    public static IngestionOutcome unrecorded(UUID recordId, IngestionResult result, String error) {
        return IngestionOutcome.builder()
                .success(false)
                .ingestionRecordId(recordId)
                .state(IngestionState.PROCESSING)
                .entitiesCreated(result.getEntitiesCreated())
                .entitiesUpdated(result.getEntitiesUpdated())
                .itemsSkipped(result.getItemsSkipped())
                .error(error)
                .build();
    }
}
