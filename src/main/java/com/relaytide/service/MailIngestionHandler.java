package com.relaytide.service;

import com.relaytide.client.AccessCredential;
import com.relaytide.client.ChangeRecord;
import com.relaytide.client.ChangeSet;
import com.relaytide.client.ContactAddress;
import com.relaytide.client.MailSnapshot;
import com.relaytide.client.ResilientEventSource;
import com.relaytide.model.IngestionSource;
import com.relaytide.model.InteractionDirection;
import com.relaytide.model.InteractionKind;
import com.relaytide.retry.DeadlineExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Mail extraction.
 *
 * FLOW:
 *   1. start from the stored cursor (or the notification's historyId on first contact)
 *   2. list added messages since then
 *   3. per message: fetch metadata → parse sender → resolveOrCreate → recordInteraction
 *   4. next cursor = history response's historyId
 *
 * Mail sent by the account owner is ignored; a message whose fetch or
 * reconciliation fails is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MailIngestionHandler implements SourceIngestionHandler<MailNotification> {

    static final String SOURCE_SYSTEM = "gmail";
    static final String NO_SUBJECT = "(No Subject)";

    private final ResilientEventSource<MailSnapshot> mailEventSource;
    private final IdentityReconciler identityReconciler;
    private final SyncCursorService syncCursorService;
    private final InteractionSignalClassifier signalClassifier;
    private final Clock clock;

    @Override
    public IngestionSource source() {
        return IngestionSource.MAIL_PUSH;
    }

    @Override
    public Class<MailNotification> notificationType() {
        return MailNotification.class;
    }

    @Override
    public void ingest(MailNotification notification, AccessCredential credential, Instant deadline,
                       IngestionProgress progress) {
        String accountId = notification.getAccountId();
        String startCursor = syncCursorService.lastCursor(accountId, IngestionSource.MAIL_PUSH)
                .orElse(notification.getHistoryId());

        ChangeSet<MailSnapshot> changes = mailEventSource.fetchIncrementalChanges(credential, startCursor, deadline);
        log.info("Mail changes for account {}: {} message(s) since history {}",
                accountId, changes.getChanges().size(), startCursor);

        for (ChangeRecord<MailSnapshot> change : changes.getChanges()) {
            if (clock.instant().isAfter(deadline)) {
                throw new DeadlineExceededException("mail.ingest");
            }
            try {
                MailSnapshot mail = change.isHydrated()
                        ? change.getSnapshot()
                        : mailEventSource.fetchEntityDetail(credential, change.getExternalId(), deadline);
                reconcile(mail, credential, progress);
            } catch (RuntimeException e) {
                if (SourceIngestionHandler.abortsBatch(e)) {
                    throw e;
                }
                log.warn("Skipping message {} for account {}: {}", change.getExternalId(), accountId, e.getMessage());
                progress.recordSkipped();
            }
        }

        progress.setNextCursor(changes.getNextCursor() != null ? changes.getNextCursor() : notification.getHistoryId());
    }

    private void reconcile(MailSnapshot mail, AccessCredential credential, IngestionProgress progress) {
        ContactAddress sender = mail.getSender();
        if (sender == null) {
            log.debug("Message {} has no parseable sender, ignoring", mail.getMessageId());
            return;
        }
        if (sender.getEmail().equalsIgnoreCase(credential.getAccountEmail())) {
            log.debug("Message {} sent by the account owner, ignoring", mail.getMessageId());
            return;
        }

        ResolvedIdentity resolved = identityReconciler.resolveOrCreate(
                credential.getAccountId(), sender.getEmail(), sender.getDisplayName());

        InteractionData data = InteractionData.builder()
                .kind(InteractionKind.MAIL)
                .direction(InteractionDirection.INBOUND)
                .subject(mail.getSubject() != null && !mail.getSubject().isBlank() ? mail.getSubject() : NO_SUBJECT)
                .summary(mail.getSnippet())
                .sourceSystem(SOURCE_SYSTEM)
                .sourceId(mail.getMessageId())
                .occurredAt(mail.getReceivedAt() != null ? mail.getReceivedAt() : clock.instant())
                .actionRequired(signalClassifier.isActionRequired(mail, credential))
                .build();

        RecordedInteraction recorded = identityReconciler.recordInteraction(resolved.getIdentity(), data);
        progress.recordOutcome(resolved.isCreated(), recorded.isCreated());
    }
}
