package com.relaytide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A push subscription registered with the provider.
 *
 * For CALENDAR_PUSH, channelId/resourceId/token come back on every notification
 * and are how an inbound request is routed to its account. For MAIL_PUSH the
 * channelId is the Pub/Sub topic and routing goes through the mailbox address.
 * The caller renews before expiresAt.
 */
@Entity
@Table(name = "watch_channels", indexes = {
    @Index(name = "idx_watch_channel_id", columnList = "channel_id"),
    @Index(name = "idx_watch_account_source", columnList = "account_id, source")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WatchChannel {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IngestionSource source;

    @Column(name = "channel_id", nullable = false)
    private String channelId;

    @Column(name = "resource_id")
    private String resourceId;

    private String token;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
