package com.relaytide.service;

import com.relaytide.client.AccessCredential;
import com.relaytide.client.ChangeRecord;
import com.relaytide.client.ChangeSet;
import com.relaytide.client.MeetingAttendee;
import com.relaytide.client.MeetingSnapshot;
import com.relaytide.client.ResilientEventSource;
import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.IngestionSource;
import com.relaytide.model.InteractionDirection;
import com.relaytide.model.InteractionKind;
import com.relaytide.retry.DeadlineExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Calendar extraction.
 *
 * FLOW:
 *   1. updatedMin = later of (stored cursor, now - calendar-window)
 *   2. list events updated since then
 *   3. per event, per attendee other than the owner: resolveOrCreate → recordInteraction
 *   4. next cursor = the time the listing was taken, or where a truncated listing stopped
 *
 * One interaction per (event, attendee). Cancelled events are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CalendarIngestionHandler implements SourceIngestionHandler<CalendarNotification> {

    static final String SOURCE_SYSTEM = "google_calendar";
    static final String NO_TITLE = "(No Title)";

    private final ResilientEventSource<MeetingSnapshot> calendarEventSource;
    private final IdentityReconciler identityReconciler;
    private final SyncCursorService syncCursorService;
    private final InteractionSignalClassifier signalClassifier;
    private final RelaytideProperties properties;
    private final Clock clock;

    @Override
    public IngestionSource source() {
        return IngestionSource.CALENDAR_PUSH;
    }

    @Override
    public Class<CalendarNotification> notificationType() {
        return CalendarNotification.class;
    }

    @Override
    public void ingest(CalendarNotification notification, AccessCredential credential, Instant deadline,
                       IngestionProgress progress) {
        String accountId = notification.getAccountId();
        Instant listedAt = clock.instant();
        Instant updatedMin = windowStart(accountId, listedAt);

        ChangeSet<MeetingSnapshot> changes = calendarEventSource.fetchIncrementalChanges(
                credential, updatedMin.toString(), deadline);
        log.info("Calendar changes for account {}: {} event(s) updated since {}",
                accountId, changes.getChanges().size(), updatedMin);

        for (ChangeRecord<MeetingSnapshot> change : changes.getChanges()) {
            MeetingSnapshot meeting;
            try {
                meeting = change.isHydrated()
                        ? change.getSnapshot()
                        : calendarEventSource.fetchEntityDetail(credential, change.getExternalId(), deadline);
            } catch (RuntimeException e) {
                if (SourceIngestionHandler.abortsBatch(e)) {
                    throw e;
                }
                log.warn("Skipping event {} for account {}: {}", change.getExternalId(), accountId, e.getMessage());
                progress.recordSkipped();
                continue;
            }
            if (meeting.isCancelled()) {
                continue;
            }
            for (MeetingAttendee attendee : meeting.getAttendees()) {
                if (clock.instant().isAfter(deadline)) {
                    throw new DeadlineExceededException("calendar.ingest");
                }
                if (isOwner(attendee, credential)) {
                    continue;
                }
                try {
                    reconcile(meeting, attendee, credential, progress);
                } catch (RuntimeException e) {
                    if (SourceIngestionHandler.abortsBatch(e)) {
                        throw e;
                    }
                    log.warn("Skipping attendee {} of event {}: {}",
                            attendee.getEmail(), meeting.getEventId(), e.getMessage());
                    progress.recordSkipped();
                }
            }
        }

        progress.setNextCursor(changes.getNextCursor() != null ? changes.getNextCursor() : listedAt.toString());
    }

    private Instant windowStart(String accountId, Instant now) {
        Instant windowStart = now.minus(properties.getIngestion().getCalendarWindow());
        return syncCursorService.lastCursor(accountId, IngestionSource.CALENDAR_PUSH)
                .map(cursor -> parseCursor(accountId, cursor))
                .filter(stored -> stored != null && stored.isAfter(windowStart))
                .orElse(windowStart);
    }

    private Instant parseCursor(String accountId, String cursor) {
        try {
            return Instant.parse(cursor);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unreadable calendar cursor for account {}: {}", accountId, cursor);
            return null;
        }
    }

    private boolean isOwner(MeetingAttendee attendee, AccessCredential credential) {
        return attendee.isSelf()
                || attendee.getEmail() == null
                || attendee.getEmail().equalsIgnoreCase(credential.getAccountEmail());
    }

    private void reconcile(MeetingSnapshot meeting, MeetingAttendee attendee, AccessCredential credential,
                           IngestionProgress progress) {
        ResolvedIdentity resolved = identityReconciler.resolveOrCreate(
                credential.getAccountId(), attendee.getEmail(), attendee.getDisplayName());

        InteractionData data = InteractionData.builder()
                .kind(InteractionKind.MEETING)
                .direction(meeting.isOrganizedBySelf() ? InteractionDirection.OUTBOUND : InteractionDirection.INBOUND)
                .subject(meeting.getTitle() != null && !meeting.getTitle().isBlank() ? meeting.getTitle() : NO_TITLE)
                .summary(meeting.getDescription())
                .sourceSystem(SOURCE_SYSTEM)
                .sourceId(meeting.getEventId() + ":" + IdentityReconciler.normalize(attendee.getEmail()))
                .occurredAt(meeting.getStartsAt() != null ? meeting.getStartsAt() : clock.instant())
                .actionRequired(signalClassifier.isActionRequired(meeting, credential))
                .build();

        RecordedInteraction recorded = identityReconciler.recordInteraction(resolved.getIdentity(), data);
        progress.recordOutcome(resolved.isCreated(), recorded.isCreated());
    }
}
