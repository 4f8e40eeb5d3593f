package com.relaytide.dto;

import com.relaytide.model.IngestionSource;
import com.relaytide.model.WatchChannel;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WatchResponse {
    private UUID id;
    private String accountId;
    private IngestionSource source;
    private String channelId;
    private String resourceId;
    private Instant expiresAt;
    private boolean active;

    public static WatchResponse from(WatchChannel channel) {
        return WatchResponse.builder()
                .id(channel.getId())
                .accountId(channel.getAccountId())
                .source(channel.getSource())
                .channelId(channel.getChannelId())
                .resourceId(channel.getResourceId())
                .expiresAt(channel.getExpiresAt())
                .active(channel.isActive())
                .build();
    }
}
