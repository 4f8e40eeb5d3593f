package com.relaytide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One observed contact occurrence (a received mail, a meeting attendance).
 *
 * (accountId, sourceSystem, sourceId) is unique, which backstops the ledger:
 * replaying the same upstream message never writes a second row.
 */
@Entity
@Table(name = "interaction_records", uniqueConstraints = {
    @UniqueConstraint(name = "uq_interaction_source",
            columnNames = {"account_id", "source_system", "source_id"})
}, indexes = {
    @Index(name = "idx_interaction_identity", columnList = "identity_id")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class InteractionRecord {

    @Id
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "identity_id", nullable = false)
    private UUID identityId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InteractionKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InteractionDirection direction;

    private String subject;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "source_system", nullable = false)
    private String sourceSystem;

    @Column(name = "source_id", nullable = false)
    private String sourceId;

    @Column(name = "action_required", nullable = false)
    private boolean actionRequired;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
