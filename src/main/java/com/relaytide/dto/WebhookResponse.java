package com.relaytide.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.UUID;

/**
 * Body returned to the provider. Always sent with 200 once the request was
 * well-formed and authenticated, even when the ingestion itself failed.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookResponse {
    private boolean received;
    private boolean processed;
    private UUID ingestionRecordId;
    private Integer entitiesCreated;
    private Integer entitiesUpdated;
    private Boolean duplicate;
    private String error;

    public static WebhookResponse from(IngestionOutcome outcome) {
        return WebhookResponse.builder()
                .received(true)
                .processed(outcome.isSuccess())
                .ingestionRecordId(outcome.getIngestionRecordId())
                .entitiesCreated(outcome.getEntitiesCreated())
                .entitiesUpdated(outcome.getEntitiesUpdated())
                .duplicate(outcome.isDuplicate())
                .error(outcome.getError())
                .build();
    }

    public static WebhookResponse notProcessed(String reason) {
        return WebhookResponse.builder()
                .received(true)
                .processed(false)
                .error(reason)
                .build();
    }
}
