package com.relaytide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A deduplicated external contact, created lazily on the first observed interaction.
 *
 * email is stored lowercased; (accountId, email) is unique.
 * totalInteractionCount only grows and lastContactAt only moves forward.
 */
@Entity
@Table(name = "identities", uniqueConstraints = {
    @UniqueConstraint(name = "uq_identity_account_email", columnNames = {"account_id", "email"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Identity {

    @Id
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(nullable = false)
    private String email;

    @Column(name = "display_name")
    private String displayName;

    @Column(nullable = false)
    private String classification;

    @Column(name = "last_contact_at")
    private Instant lastContactAt;

    @Column(name = "total_interaction_count", nullable = false)
    private long totalInteractionCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
