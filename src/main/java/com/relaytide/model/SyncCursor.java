package com.relaytide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Last successfully processed provider cursor per (accountId, source).
 * Read at the start of an ingestion, written only after it completes.
 */
@Entity
@Table(name = "sync_cursors", uniqueConstraints = {
    @UniqueConstraint(name = "uq_sync_cursor", columnNames = {"account_id", "source"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SyncCursor {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IngestionSource source;

    @Column(nullable = false)
    private String cursor;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
