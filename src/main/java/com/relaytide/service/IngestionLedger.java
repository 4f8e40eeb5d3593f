package com.relaytide.service;

import com.relaytide.config.RelaytideProperties;
import com.relaytide.dto.IngestionStatistics;
import com.relaytide.model.IngestionClaim;
import com.relaytide.model.IngestionClaimKey;
import com.relaytide.model.IngestionErrorCode;
import com.relaytide.model.IngestionRecord;
import com.relaytide.model.IngestionSource;
import com.relaytide.model.IngestionState;
import com.relaytide.repository.IngestionClaimRepository;
import com.relaytide.repository.IngestionRecordRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of every inbound notification and its state machine.
 *
 * FLOW (per notification):
 *   recordReceived ──→ claim ── lost ──→ markDuplicate(owner)
 *                        │
 *                       won ──→ markProcessing ──→ markCompleted | markFailed
 *
 * Every method runs in its own transaction so each step is durable before the
 * next upstream call. Transitions load the row, check the state machine and save
 * under @Version, so two writers on the same record cannot both win.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionLedger {

    private static final int MAX_DETAIL_LENGTH = 4000;

    private final IngestionRecordRepository recordRepository;
    private final IngestionClaimRepository claimRepository;
    private final RelaytideProperties properties;
    private final Clock clock;

    @Transactional
    public IngestionRecord recordReceived(String accountId, IngestionSource source, String eventKind,
                                          String externalKey, String payload) {
        IngestionRecord record = IngestionRecord.builder()
                .accountId(accountId)
                .source(source)
                .eventKind(eventKind)
                .externalKey(externalKey)
                .payload(payload)
                .state(IngestionState.RECEIVED)
                .receivedAt(clock.instant())
                .build();
        IngestionRecord saved = recordRepository.save(record);
        log.debug("Ingestion received: id={}, account={}, source={}, key={}",
                saved.getId(), accountId, source, externalKey);
        return saved;
    }

    /**
     * Tries to take ownership of the record's (accountId, source, externalKey).
     * Atomic against concurrent deliveries: exactly one record per key gets true.
     */
    @Transactional
    public boolean claim(IngestionRecord record) {
        int inserted = claimRepository.claimIfAbsent(record.getAccountId(), record.getSource().name(),
                record.getExternalKey(), record.getId(), clock.instant());
        return inserted == 1;
    }

    /**
     * The record that owns the dedup key, if any has claimed it.
     */
    @Transactional(readOnly = true)
    public Optional<IngestionRecord> findExisting(String accountId, IngestionSource source, String externalKey) {
        return claimRepository.findById(new IngestionClaimKey(accountId, source.name(), externalKey))
                .map(IngestionClaim::getRecordId)
                .flatMap(recordRepository::findById);
    }

    @Transactional
    public IngestionRecord markProcessing(UUID recordId) {
        IngestionRecord record = transition(recordId, IngestionState.PROCESSING);
        record.setStartedAt(clock.instant());
        return recordRepository.save(record);
    }

    @Transactional
    public IngestionRecord markCompleted(UUID recordId, IngestionResult result) {
        IngestionRecord record = transition(recordId, IngestionState.COMPLETED);
        if (!ownsClaim(record)) {
            throw new IllegalStateTransitionException(recordId, IngestionState.COMPLETED,
                    "record does not own key " + record.getExternalKey());
        }
        applyResult(record, result);
        record.setCompletedAt(clock.instant());
        return recordRepository.save(record);
    }

    @Transactional
    public IngestionRecord markFailed(UUID recordId, IngestionErrorCode code, String detail,
                                      IngestionResult partial) {
        IngestionRecord record = transition(recordId, IngestionState.FAILED);
        applyResult(record, partial != null ? partial : IngestionResult.empty());
        record.setErrorCode(code);
        record.setErrorDetail(truncate(detail));
        record.setCompletedAt(clock.instant());
        return recordRepository.save(record);
    }

    @Transactional
    public IngestionRecord markDuplicate(UUID recordId, UUID duplicateOf) {
        IngestionRecord record = transition(recordId, IngestionState.DUPLICATE);
        record.setDuplicateOf(duplicateOf);
        record.setCompletedAt(clock.instant());
        return recordRepository.save(record);
    }

    @Transactional(readOnly = true)
    public IngestionRecord get(UUID recordId) {
        return recordRepository.findById(recordId)
                .orElseThrow(() -> new EntityNotFoundException("Ingestion record not found: " + recordId));
    }

    @Transactional(readOnly = true)
    public List<IngestionRecord> findByAccount(String accountId, IngestionState state, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        if (state == null) {
            return recordRepository.findByAccountIdOrderByReceivedAtDesc(accountId, page);
        }
        return recordRepository.findByAccountIdAndStateOrderByReceivedAtDesc(accountId, state, page);
    }

    /**
     * PROCESSING records started before now - threshold. PROCESSING is not terminal;
     * a supervisor may reclaim these.
     */
    @Transactional(readOnly = true)
    public List<IngestionRecord> findStaleProcessing(Duration threshold) {
        return recordRepository.findByStateAndStartedAtBefore(IngestionState.PROCESSING,
                clock.instant().minus(threshold));
    }

    @Transactional(readOnly = true)
    public IngestionStatistics statistics(String accountId, int hoursBack) {
        Instant since = clock.instant().minus(Duration.ofHours(hoursBack));
        List<IngestionRecord> records = recordRepository.findByAccountIdAndReceivedAtGreaterThanEqual(accountId, since);

        IngestionStatistics stats = IngestionStatistics.builder()
                .accountId(accountId)
                .since(since)
                .total(records.size())
                .build();
        for (IngestionRecord r : records) {
            switch (r.getState()) {
                case RECEIVED, PROCESSING -> stats.setPending(stats.getPending() + 1);
                case COMPLETED -> stats.setCompleted(stats.getCompleted() + 1);
                case FAILED -> stats.setFailed(stats.getFailed() + 1);
                case DUPLICATE -> stats.setDuplicate(stats.getDuplicate() + 1);
            }
            stats.setEntitiesCreated(stats.getEntitiesCreated() + valueOf(r.getEntitiesCreated()));
            stats.setEntitiesUpdated(stats.getEntitiesUpdated() + valueOf(r.getEntitiesUpdated()));
        }
        return stats;
    }

    /**
     * Deletes terminal records older than daysToKeep. PROCESSING and RECEIVED rows are never purged.
     * Dedup claims are kept for at least relaytide.ingestion.claim-retention, longer than the
     * provider redelivers a message, so a late redelivery still finds its key.
     */
    @Transactional
    public int purge(String accountId, int daysToKeep) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(daysToKeep));
        Instant claimCutoff = now.minus(properties.getIngestion().getClaimRetention());
        if (cutoff.isBefore(claimCutoff)) {
            claimCutoff = cutoff;
        }
        int deleted = recordRepository.deleteByAccountIdAndReceivedAtBeforeAndStateIn(accountId, cutoff,
                IngestionState.terminalStates());
        int claims = claimRepository.deleteByAccountIdAndClaimedAtBefore(accountId, claimCutoff);
        log.info("Purged ingestion history: account={}, records={}, claims={}, recordsOlderThan={}, claimsOlderThan={}",
                accountId, deleted, claims, cutoff, claimCutoff);
        return deleted;
    }

    private IngestionRecord transition(UUID recordId, IngestionState target) {
        IngestionRecord record = get(recordId);
        IngestionState current = record.getState();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateTransitionException(recordId, current, target);
        }
        record.setState(target);
        return record;
    }

    private boolean ownsClaim(IngestionRecord record) {
        IngestionClaimKey key = new IngestionClaimKey(record.getAccountId(), record.getSource().name(),
                record.getExternalKey());
        return claimRepository.findById(key)
                .map(claim -> Objects.equals(claim.getRecordId(), record.getId()))
                .orElse(false);
    }

    private static void applyResult(IngestionRecord record, IngestionResult result) {
        record.setEntitiesCreated(result.getEntitiesCreated());
        record.setEntitiesUpdated(result.getEntitiesUpdated());
        record.setIdentitiesCreated(result.getIdentitiesCreated());
        record.setItemsSkipped(result.getItemsSkipped());
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL_LENGTH);
    }

    private static long valueOf(Integer count) {
        return count != null ? count : 0L;
    }
}
