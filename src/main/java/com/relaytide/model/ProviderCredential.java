package com.relaytide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored OAuth credential for one account's provider connection.
 * providerEmail is the connected mailbox; Gmail notifications are routed by it.
 */
@Entity
@Table(name = "provider_credentials", uniqueConstraints = {
    @UniqueConstraint(name = "uq_credential_account", columnNames = {"account_id"})
}, indexes = {
    @Index(name = "idx_credential_email", columnList = "provider_email")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProviderCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "provider_email", nullable = false)
    private String providerEmail;

    @Column(name = "access_token", nullable = false, columnDefinition = "TEXT")
    private String accessToken;

    @Column(name = "refresh_token", columnDefinition = "TEXT")
    private String refreshToken;

    @Column(name = "access_token_expires_at", nullable = false)
    private Instant accessTokenExpiresAt;

    @Column(nullable = false)
    @Builder.Default
    private boolean connected = true;

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
