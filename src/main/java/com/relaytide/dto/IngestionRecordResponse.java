package com.relaytide.dto;

import com.relaytide.model.IngestionErrorCode;
import com.relaytide.model.IngestionRecord;
import com.relaytide.model.IngestionSource;
import com.relaytide.model.IngestionState;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IngestionRecordResponse {
    private UUID id;
    private String accountId;
    private IngestionSource source;
    private String eventKind;
    private String externalKey;
    private IngestionState state;
    private Integer entitiesCreated;
    private Integer entitiesUpdated;
    private Integer identitiesCreated;
    private Integer itemsSkipped;
    private IngestionErrorCode errorCode;
    private String errorDetail;
    private UUID duplicateOf;
    private Instant receivedAt;
    private Instant startedAt;
    private Instant completedAt;

    public static IngestionRecordResponse from(IngestionRecord record) {
        return IngestionRecordResponse.builder()
                .id(record.getId())
                .accountId(record.getAccountId())
                .source(record.getSource())
                .eventKind(record.getEventKind())
                .externalKey(record.getExternalKey())
                .state(record.getState())
                .entitiesCreated(record.getEntitiesCreated())
                .entitiesUpdated(record.getEntitiesUpdated())
                .identitiesCreated(record.getIdentitiesCreated())
                .itemsSkipped(record.getItemsSkipped())
                .errorCode(record.getErrorCode())
                .errorDetail(record.getErrorDetail())
                .duplicateOf(record.getDuplicateOf())
                .receivedAt(record.getReceivedAt())
                .startedAt(record.getStartedAt())
                .completedAt(record.getCompletedAt())
                .build();
    }
}
