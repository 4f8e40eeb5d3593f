package com.relaytide.service;

import com.relaytide.client.AccessCredential;
import com.relaytide.client.CursorExpiredException;
import com.relaytide.client.RetryableUpstreamException;
import com.relaytide.client.UpstreamAuthorizationException;
import com.relaytide.config.RelaytideProperties;
import com.relaytide.dto.IngestionOutcome;
import com.relaytide.model.IngestionErrorCode;
import com.relaytide.model.IngestionRecord;
import com.relaytide.model.IngestionSource;
import com.relaytide.retry.DeadlineExceededException;
import com.relaytide.retry.RetryAbortedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for one inbound notification.
 *
 * FLOW:
 *   1. recordReceived                    → RECEIVED
 *   2. claim the dedup key               → lost: DUPLICATE, stop
 *   3. markProcessing                    → PROCESSING
 *   4. handshake?                        → COMPLETED with zero counts, no upstream call
 *   5. credential for the account        → none: FAILED (AUTHORIZATION_FAILED)
 *   6. source handler, bounded by the ingestion timeout
 *   7. markCompleted, then advance the stored cursor (not advanced if markCompleted fails)
 *
 * The dedup claim happens before any identity or interaction is touched.
 * Failures never escape as exceptions: each one maps to a FAILED record with an
 * IngestionErrorCode. Shutdown, and a failure to record COMPLETED, leave the
 * record in PROCESSING for the stale sweep instead.
 */
@Service
@Slf4j
public class IngestionOrchestrator {

    private final IngestionLedger ledger;
    private final CredentialProvider credentialProvider;
    private final SyncCursorService syncCursorService;
    private final IngestionAlertPublisher alertPublisher;
    private final RelaytideProperties properties;
    private final Clock clock;
    private final Map<IngestionSource, SourceIngestionHandler<?>> handlers = new EnumMap<>(IngestionSource.class);

    public IngestionOrchestrator(IngestionLedger ledger,
                                 CredentialProvider credentialProvider,
                                 SyncCursorService syncCursorService,
                                 IngestionAlertPublisher alertPublisher,
                                 RelaytideProperties properties,
                                 Clock clock,
                                 List<SourceIngestionHandler<?>> sourceHandlers) {
        this.ledger = ledger;
        this.credentialProvider = credentialProvider;
        this.syncCursorService = syncCursorService;
        this.alertPublisher = alertPublisher;
        this.properties = properties;
        this.clock = clock;
        for (SourceIngestionHandler<?> handler : sourceHandlers) {
            handlers.put(handler.source(), handler);
        }
    }

    public IngestionOutcome ingest(InboundNotification notification) {
        String accountId = notification.getAccountId();
        IngestionSource source = notification.source();
        log.info("Ingesting notification: account={}, source={}, kind={}, key={}",
                accountId, source, notification.eventKind(), notification.externalKey());

        IngestionRecord record = ledger.recordReceived(accountId, source, notification.eventKind(),
                notification.externalKey(), notification.getPayload());
        UUID recordId = record.getId();

        // Step 1: dedup before any mutation
        if (!ledger.claim(record)) {
            UUID owner = ledger.findExisting(accountId, source, notification.externalKey())
                    .map(IngestionRecord::getId)
                    .orElse(null);
            ledger.markDuplicate(recordId, owner);
            log.info("Duplicate notification: record={}, duplicateOf={}, key={}",
                    recordId, owner, notification.externalKey());
            return IngestionOutcome.duplicate(recordId, owner);
        }

        ledger.markProcessing(recordId);

        // Step 2: subscription handshakes carry no changes
        if (notification.isHandshake()) {
            if (!complete(recordId, accountId, IngestionResult.empty())) {
                return IngestionOutcome.unrecorded(recordId, IngestionResult.empty(), "completion not recorded");
            }
            log.info("Handshake acknowledged: record={}, account={}", recordId, accountId);
            return IngestionOutcome.completed(recordId, IngestionResult.empty());
        }

        // Step 3: fetch and reconcile
        Instant deadline = clock.instant().plus(properties.getIngestion().getTimeout());
        IngestionProgress progress = new IngestionProgress();
        try {
            AccessCredential credential = credentialProvider.credentialFor(accountId)
                    .orElseThrow(() -> new UpstreamAuthorizationException("credential",
                            "No valid provider credential for account " + accountId));
            dispatch(handlerFor(source), notification, credential, deadline, progress);
        } catch (CursorExpiredException e) {
            alertPublisher.publishResyncRequired(accountId, source, e.getCursor(), recordId);
            return fail(recordId, IngestionErrorCode.CURSOR_EXPIRED, e, progress);
        } catch (UpstreamAuthorizationException e) {
            alertPublisher.publishReauthRequired(accountId, source, e.getMessage(), recordId);
            return fail(recordId, IngestionErrorCode.AUTHORIZATION_FAILED, e, progress);
        } catch (DeadlineExceededException e) {
            return fail(recordId, IngestionErrorCode.TIMEOUT, e, progress);
        } catch (RetryableUpstreamException e) {
            return fail(recordId, IngestionErrorCode.UPSTREAM_UNAVAILABLE, e, progress);
        } catch (RetryAbortedException e) {
            log.warn("Ingestion interrupted by shutdown, left in PROCESSING: record={}, account={}",
                    recordId, accountId);
            return IngestionOutcome.interrupted(recordId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Ingestion failed unexpectedly: record={}, account={}", recordId, accountId, e);
            return fail(recordId, IngestionErrorCode.INTERNAL_ERROR, e, progress);
        }

        // Step 4: complete, then move the cursor
        IngestionResult result = progress.toResult();
        if (!complete(recordId, accountId, result)) {
            return IngestionOutcome.unrecorded(recordId, result, "completion not recorded");
        }
        log.info("Ingestion completed: record={}, account={}, created={}, updated={}, skipped={}",
                recordId, accountId, result.getEntitiesCreated(), result.getEntitiesUpdated(),
                result.getItemsSkipped());

        if (progress.getNextCursor() != null) {
            try {
                syncCursorService.advance(accountId, source, progress.getNextCursor());
            } catch (RuntimeException e) {
                log.error("Failed to advance cursor for account {} ({}); next ingestion restarts from the old one",
                        accountId, source, e);
            }
        }
        return IngestionOutcome.completed(recordId, result);
    }

    // The cursor stays put when the COMPLETED transition is lost; the stale sweep reports the record
    private boolean complete(UUID recordId, String accountId, IngestionResult result) {
        try {
            ledger.markCompleted(recordId, result);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to mark record {} COMPLETED for account {}; left in PROCESSING",
                    recordId, accountId, e);
            return false;
        }
    }

    private SourceIngestionHandler<?> handlerFor(IngestionSource source) {
        SourceIngestionHandler<?> handler = handlers.get(source);
        if (handler == null) {
            throw new IllegalStateException("No ingestion handler registered for " + source);
        }
        return handler;
    }

    private <N extends InboundNotification> void dispatch(SourceIngestionHandler<N> handler,
                                                          InboundNotification notification,
                                                          AccessCredential credential,
                                                          Instant deadline,
                                                          IngestionProgress progress) {
        handler.ingest(handler.notificationType().cast(notification), credential, deadline, progress);
    }

    private IngestionOutcome fail(UUID recordId, IngestionErrorCode code, RuntimeException error,
                                  IngestionProgress progress) {
        IngestionResult partial = progress.toResult();
        ledger.markFailed(recordId, code, error.getMessage(), partial);
        log.warn("Ingestion failed: record={}, code={}, error={}", recordId, code, error.getMessage());
        return IngestionOutcome.failed(recordId, code, error.getMessage(), partial);
    }
}
