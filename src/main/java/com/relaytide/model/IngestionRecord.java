package com.relaytide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per inbound push notification, created at receipt and terminated
 * within the same ingestion attempt.
 *
 * externalKey is the provider cursor/resource id (Gmail historyId, Calendar
 * resourceId + message number). It is only unique within (accountId, source),
 * and only the record that owns the matching IngestionClaim may ever reach COMPLETED.
 */
@Entity
@Table(name = "ingestion_records", indexes = {
    @Index(name = "idx_ingestion_account_state", columnList = "account_id, state"),
    @Index(name = "idx_ingestion_dedup_key", columnList = "account_id, source, external_key")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IngestionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private long version;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IngestionSource source;

    @Column(name = "event_kind", nullable = false)
    private String eventKind;

    @Column(name = "external_key", nullable = false)
    private String externalKey;

    // Raw notification as received, kept for replay and debugging
    @Column(columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private IngestionState state = IngestionState.RECEIVED;

    @Column(name = "entities_created")
    private Integer entitiesCreated;

    @Column(name = "entities_updated")
    private Integer entitiesUpdated;

    @Column(name = "identities_created")
    private Integer identitiesCreated;

    @Column(name = "items_skipped")
    private Integer itemsSkipped;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code")
    private IngestionErrorCode errorCode;

    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    // Set when DUPLICATE: the record that owns the dedup key
    @Column(name = "duplicate_of")
    private UUID duplicateOf;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
