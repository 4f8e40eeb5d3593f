package com.relaytide.service;

import com.relaytide.model.IngestionState;
import lombok.Getter;

import java.util.UUID;

@Getter
public class IllegalStateTransitionException extends RuntimeException {

    private final UUID recordId;
    private final IngestionState from;
    private final IngestionState to;

    public IllegalStateTransitionException(UUID recordId, IngestionState from, IngestionState to) {
        super("Ingestion record " + recordId + " cannot move from " + from + " to " + to);
        this.recordId = recordId;
        this.from = from;
        this.to = to;
    }

    public IllegalStateTransitionException(UUID recordId, IngestionState to, String reason) {
        super("Ingestion record " + recordId + " cannot move to " + to + ": " + reason);
        this.recordId = recordId;
        this.from = null;
        this.to = to;
    }
}
