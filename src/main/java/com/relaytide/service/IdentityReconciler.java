package com.relaytide.service;

import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.Identity;
import com.relaytide.model.InteractionRecord;
import com.relaytide.repository.IdentityRepository;
import com.relaytide.repository.InteractionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Maps external contacts onto durable local identities.
 *
 * FLOW:
 *   resolveOrCreate(account, email)
 *     → INSERT identity ON CONFLICT DO NOTHING   (1 row = we created it)
 *     → SELECT by (account, lowercase email)     (sees our row or the concurrent winner's)
 *
 *   recordInteraction(identity, data)
 *     → INSERT interaction ON CONFLICT DO NOTHING
 *     → 1 row: bump count, advance lastContactAt (single UPDATE)
 *     → 0 rows: replay, return the existing interaction unchanged
 *
 * Both are safe to call concurrently and repeatedly for the same input.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityReconciler {

    private final IdentityRepository identityRepository;
    private final InteractionRecordRepository interactionRepository;
    private final RelaytideProperties properties;
    private final Clock clock;

    @Transactional
    public ResolvedIdentity resolveOrCreate(String accountId, String email, String displayNameHint) {
        String normalized = normalize(email);
        String displayName = displayNameHint != null && !displayNameHint.isBlank() ? displayNameHint.trim() : null;
        Instant now = clock.instant();

        Identity candidate = Identity.builder()
                .id(UUID.randomUUID())
                .accountId(accountId)
                .email(normalized)
                .displayName(displayName)
                .classification(properties.getIngestion().getDefaultClassification())
                .createdAt(now)
                .updatedAt(now)
                .build();
        boolean created = identityRepository.insertIfAbsent(candidate) == 1;

        if (!created && displayName != null) {
            identityRepository.fillMissingDisplayName(lookup(accountId, normalized).getId(), displayName, now);
        }

        Identity identity = lookup(accountId, normalized);
        if (created) {
            log.info("Identity created: account={}, email={}, id={}", accountId, normalized, identity.getId());
        }
        return new ResolvedIdentity(identity, created);
    }

    @Transactional
    public RecordedInteraction recordInteraction(Identity identity, InteractionData data) {
        Instant now = clock.instant();
        InteractionRecord candidate = InteractionRecord.builder()
                .id(UUID.randomUUID())
                .accountId(identity.getAccountId())
                .identityId(identity.getId())
                .kind(data.getKind())
                .direction(data.getDirection())
                .subject(data.getSubject())
                .summary(data.getSummary())
                .sourceSystem(data.getSourceSystem())
                .sourceId(data.getSourceId())
                .actionRequired(data.isActionRequired())
                .occurredAt(data.getOccurredAt() != null ? data.getOccurredAt() : now)
                .createdAt(now)
                .build();

        boolean created = interactionRepository.insertIfAbsent(candidate) == 1;
        if (created) {
            identityRepository.recordContact(identity.getId(), candidate.getOccurredAt(), now);
        } else {
            log.debug("Interaction already recorded: account={}, source={}/{}",
                    identity.getAccountId(), data.getSourceSystem(), data.getSourceId());
        }

        InteractionRecord record = interactionRepository
                .findByAccountIdAndSourceSystemAndSourceId(identity.getAccountId(),
                        data.getSourceSystem(), data.getSourceId())
                .orElseThrow(() -> new IllegalStateException("Interaction vanished after insert: "
                        + data.getSourceSystem() + "/" + data.getSourceId()));
        return new RecordedInteraction(record, created);
    }

    static String normalize(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private Identity lookup(String accountId, String email) {
        return identityRepository.findByAccountIdAndEmail(accountId, email)
                .orElseThrow(() -> new IllegalStateException("Identity vanished after upsert: " + email));
    }
}
