package com.relaytide.service;

import com.relaytide.client.AccessCredential;
import com.relaytide.client.PushSubscriptionClient;
import com.relaytide.client.UpstreamAuthorizationException;
import com.relaytide.client.WatchRegistration;
import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.IngestionSource;
import com.relaytide.model.WatchChannel;
import com.relaytide.repository.WatchChannelRepository;
import com.relaytide.retry.BackoffRetryExecutor;
import com.relaytide.retry.RetryPolicy;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Registers and unregisters push subscriptions with the provider.
 *
 * startWatch replaces any active channel for (account, source) locally; the
 * provider keeps delivering on an old calendar channel until it expires, and
 * those deliveries are dropped at routing. Renewal before expiresAt is the caller's job.
 */
@Service
@Slf4j
public class WatchService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final CredentialProvider credentialProvider;
    private final WatchChannelRepository watchChannelRepository;
    private final SyncCursorService syncCursorService;
    private final BackoffRetryExecutor retryExecutor;
    private final RetryPolicy upstreamRetryPolicy;
    private final RelaytideProperties properties;
    private final Clock clock;
    private final Map<IngestionSource, PushSubscriptionClient> clients = new EnumMap<>(IngestionSource.class);

    public WatchService(CredentialProvider credentialProvider,
                        WatchChannelRepository watchChannelRepository,
                        SyncCursorService syncCursorService,
                        BackoffRetryExecutor retryExecutor,
                        RetryPolicy upstreamRetryPolicy,
                        RelaytideProperties properties,
                        Clock clock,
                        List<PushSubscriptionClient> subscriptionClients) {
        this.credentialProvider = credentialProvider;
        this.watchChannelRepository = watchChannelRepository;
        this.syncCursorService = syncCursorService;
        this.retryExecutor = retryExecutor;
        this.upstreamRetryPolicy = upstreamRetryPolicy;
        this.properties = properties;
        this.clock = clock;
        for (PushSubscriptionClient client : subscriptionClients) {
            clients.put(client.source(), client);
        }
    }

    public WatchChannel startWatch(String accountId, IngestionSource source) {
        AccessCredential credential = requireCredential(accountId);
        PushSubscriptionClient client = clientFor(source);
        String channelId = UUID.randomUUID().toString();
        String token = source == IngestionSource.CALENDAR_PUSH ? newToken() : null;

        WatchRegistration registration = retryExecutor.execute("watch.start." + source, upstreamRetryPolicy,
                deadline(), () -> client.startWatch(credential, channelId, token));

        for (WatchChannel previous : watchChannelRepository.findByAccountIdAndSourceAndActiveTrue(accountId, source)) {
            previous.setActive(false);
            watchChannelRepository.save(previous);
        }

        WatchChannel channel = watchChannelRepository.save(WatchChannel.builder()
                .accountId(accountId)
                .source(source)
                .channelId(registration.getChannelId())
                .resourceId(registration.getResourceId())
                .token(token)
                .expiresAt(registration.getExpiresAt())
                .createdAt(clock.instant())
                .build());

        if (registration.getInitialCursor() != null
                && syncCursorService.lastCursor(accountId, source).isEmpty()) {
            syncCursorService.advance(accountId, source, registration.getInitialCursor());
        }

        log.info("Watch started: account={}, source={}, channel={}, expiresAt={}",
                accountId, source, channel.getChannelId(), channel.getExpiresAt());
        return channel;
    }

    /**
     * @return number of channels stopped
     */
    public int stopWatch(String accountId, IngestionSource source) {
        List<WatchChannel> active = watchChannelRepository.findByAccountIdAndSourceAndActiveTrue(accountId, source);
        if (active.isEmpty()) {
            throw new EntityNotFoundException("No active " + source + " watch for account " + accountId);
        }
        AccessCredential credential = requireCredential(accountId);
        PushSubscriptionClient client = clientFor(source);

        for (WatchChannel channel : active) {
            retryExecutor.execute("watch.stop." + source, upstreamRetryPolicy, deadline(), () -> {
                client.stopWatch(credential, channel.getChannelId(), channel.getResourceId());
                return null;
            });
            channel.setActive(false);
            watchChannelRepository.save(channel);
            log.info("Watch stopped: account={}, source={}, channel={}", accountId, source, channel.getChannelId());
        }
        return active.size();
    }

    private AccessCredential requireCredential(String accountId) {
        return credentialProvider.credentialFor(accountId)
                .orElseThrow(() -> new UpstreamAuthorizationException("watch",
                        "No valid provider credential for account " + accountId));
    }

    private PushSubscriptionClient clientFor(IngestionSource source) {
        PushSubscriptionClient client = clients.get(source);
        if (client == null) {
            throw new IllegalStateException("No subscription client registered for " + source);
        }
        return client;
    }

    private Instant deadline() {
        return clock.instant().plus(properties.getIngestion().getTimeout());
    }

    private static String newToken() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
