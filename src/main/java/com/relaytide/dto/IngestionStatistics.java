package com.relaytide.dto;

import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IngestionStatistics {
    private String accountId;
    private Instant since;
    private long total;
    // RECEIVED + PROCESSING
    private long pending;
    private long completed;
    private long failed;
    private long duplicate;
    private long entitiesCreated;
    private long entitiesUpdated;
}
