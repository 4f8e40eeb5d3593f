package com.relaytide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Ownership of a dedup key. The primary key is (accountId, source, externalKey),
 * so exactly one IngestionRecord can ever win the insert; every other record
 * with the same key terminates as DUPLICATE.
 */
@Entity
@Table(name = "ingestion_claims")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IngestionClaim {

    @EmbeddedId
    private IngestionClaimKey key;

    @Column(name = "record_id", nullable = false)
    private UUID recordId;

    @Column(name = "claimed_at", nullable = false)
    private Instant claimedAt;
}
