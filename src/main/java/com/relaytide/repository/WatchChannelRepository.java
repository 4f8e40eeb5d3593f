package com.relaytide.repository;

import com.relaytide.model.IngestionSource;
import com.relaytide.model.WatchChannel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WatchChannelRepository extends JpaRepository<WatchChannel, UUID> {

    // Used by the calendar webhook: X-Goog-Channel-ID → account
    Optional<WatchChannel> findFirstByChannelIdAndActiveTrue(String channelId);

    List<WatchChannel> findByAccountIdAndSourceAndActiveTrue(String accountId, IngestionSource source);
}
