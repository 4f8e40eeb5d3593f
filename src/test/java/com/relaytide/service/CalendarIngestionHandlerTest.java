package com.relaytide.service;

import com.relaytide.client.AccessCredential;
import com.relaytide.client.ChangeRecord;
import com.relaytide.client.ChangeSet;
import com.relaytide.client.MeetingAttendee;
import com.relaytide.client.MeetingSnapshot;
import com.relaytide.client.ResilientEventSource;
import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.Identity;
import com.relaytide.model.IngestionSource;
import com.relaytide.model.InteractionDirection;
import com.relaytide.model.InteractionKind;
import com.relaytide.model.InteractionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CalendarIngestionHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant STARTS = Instant.parse("2024-05-02T13:00:00Z");

    @Mock private ResilientEventSource<MeetingSnapshot> calendarSource;
    @Mock private IdentityReconciler identityReconciler;
    @Mock private SyncCursorService syncCursorService;
    @Mock private InteractionSignalClassifier signalClassifier;

    private CalendarIngestionHandler handler;
    private final AccessCredential credential = new AccessCredential("acct-1", "owner@example.com", "token-1");
    private final Instant deadline = NOW.plusSeconds(60);
    private final CalendarNotification notification = CalendarNotification.builder()
            .accountId("acct-1").channelId("chan-1").resourceId("res-1").resourceState("exists").build();

    @BeforeEach
    void setUp() {
        handler = new CalendarIngestionHandler(calendarSource, identityReconciler, syncCursorService,
                signalClassifier, new RelaytideProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static MeetingSnapshot meeting(String id, String status, boolean organizedBySelf,
                                           MeetingAttendee... attendees) {
        return MeetingSnapshot.builder()
                .eventId(id)
                .status(status)
                .title(null)
                .startsAt(STARTS)
                .organizedBySelf(organizedBySelf)
                .attendees(List.of(attendees))
                .build();
    }

    private static MeetingAttendee attendee(String email, boolean self) {
        return MeetingAttendee.builder().email(email).self(self).build();
    }

    private void listing(MeetingSnapshot... meetings) {
        List<ChangeRecord<MeetingSnapshot>> changes = new ArrayList<>();
        for (MeetingSnapshot m : meetings) {
            changes.add(new ChangeRecord<>(m.getEventId(), m));
        }
        when(calendarSource.fetchIncrementalChanges(eq(credential), anyString(), eq(deadline)))
                .thenReturn(new ChangeSet<>(changes, null));
    }

    private void reconcilerAnswers(boolean identityCreated) {
        when(identityReconciler.resolveOrCreate(eq("acct-1"), anyString(), any())).thenAnswer(inv ->
                new ResolvedIdentity(Identity.builder().id(UUID.randomUUID()).accountId("acct-1")
                        .email(inv.getArgument(1)).build(), identityCreated));
        when(identityReconciler.recordInteraction(any(), any()))
                .thenAnswer(inv -> new RecordedInteraction(new InteractionRecord(), true));
    }

    @Test
    @DisplayName("One interaction per non-owner attendee, keyed by event and attendee")
    void attendees_eachGetAnInteraction() {
        listing(meeting("e1", "confirmed", true,
                attendee("owner@example.com", true),
                attendee("ann@example.com", false),
                attendee("Bob@Example.com", false)));
        reconcilerAnswers(false);
        IngestionProgress progress = new IngestionProgress();

        handler.ingest(notification, credential, deadline, progress);

        ArgumentCaptor<InteractionData> data = ArgumentCaptor.forClass(InteractionData.class);
        verify(identityReconciler, times(2)).recordInteraction(any(), data.capture());
        InteractionData ann = data.getAllValues().get(0);
        assertEquals(InteractionKind.MEETING, ann.getKind());
        assertEquals(InteractionDirection.OUTBOUND, ann.getDirection());
        assertEquals("(No Title)", ann.getSubject());
        assertEquals("e1:ann@example.com", ann.getSourceId());
        assertEquals(STARTS, ann.getOccurredAt());
        assertEquals("e1:bob@example.com", data.getAllValues().get(1).getSourceId());

        assertEquals(2, progress.getEntitiesCreated());
        assertEquals(2, progress.getEntitiesUpdated());
        assertEquals(NOW.toString(), progress.getNextCursor());
    }

    @Test
    @DisplayName("Owner address is skipped even without the self flag; cancelled events are ignored")
    void ownerAndCancelled_areIgnored() {
        listing(meeting("e1", "confirmed", false, attendee("OWNER@example.com", false)),
                meeting("e2", "cancelled", false, attendee("ann@example.com", false)));
        IngestionProgress progress = new IngestionProgress();

        handler.ingest(notification, credential, deadline, progress);

        verifyNoInteractions(identityReconciler);
        assertEquals(0, progress.getItemsSkipped());
    }

    @Test
    @DisplayName("A failing attendee is skipped and the rest of the batch continues")
    void attendeeFailure_isContained() {
        listing(meeting("e1", "confirmed", false,
                attendee("ann@example.com", false),
                attendee("bob@example.com", false)));
        when(identityReconciler.resolveOrCreate("acct-1", "ann@example.com", null))
                .thenThrow(new DataIntegrityViolationException("constraint"));
        when(identityReconciler.resolveOrCreate("acct-1", "bob@example.com", null))
                .thenReturn(new ResolvedIdentity(Identity.builder().id(UUID.randomUUID()).build(), true));
        when(identityReconciler.recordInteraction(any(), any()))
                .thenReturn(new RecordedInteraction(new InteractionRecord(), true));
        IngestionProgress progress = new IngestionProgress();

        handler.ingest(notification, credential, deadline, progress);

        assertEquals(1, progress.getItemsSkipped());
        assertEquals(1, progress.getEntitiesCreated());
        assertEquals(1, progress.getIdentitiesCreated());
    }

    @Test
    @DisplayName("A truncated listing stores where it stopped instead of the listing time")
    void truncatedListing_cursorStopsAtLastSeen() {
        when(calendarSource.fetchIncrementalChanges(eq(credential), anyString(), eq(deadline)))
                .thenReturn(new ChangeSet<>(List.of(), "2024-05-01T09:15:00Z"));
        IngestionProgress progress = new IngestionProgress();

        handler.ingest(notification, credential, deadline, progress);

        assertEquals("2024-05-01T09:15:00Z", progress.getNextCursor());
    }

    @Test
    @DisplayName("A stored cursor inside the window narrows updatedMin")
    void storedCursor_insideWindow_isUsed() {
        when(syncCursorService.lastCursor("acct-1", IngestionSource.CALENDAR_PUSH))
                .thenReturn(Optional.of("2024-05-01T09:45:00Z"));
        when(calendarSource.fetchIncrementalChanges(credential, "2024-05-01T09:45:00Z", deadline))
                .thenReturn(new ChangeSet<>(List.of(), null));

        handler.ingest(notification, credential, deadline, new IngestionProgress());

        verify(calendarSource).fetchIncrementalChanges(credential, "2024-05-01T09:45:00Z", deadline);
    }

    @Test
    @DisplayName("A stored cursor older than the window is clamped to now - window")
    void storedCursor_olderThanWindow_isClamped() {
        when(syncCursorService.lastCursor("acct-1", IngestionSource.CALENDAR_PUSH))
                .thenReturn(Optional.of("2024-04-20T00:00:00Z"));
        when(calendarSource.fetchIncrementalChanges(credential, "2024-05-01T09:00:00Z", deadline))
                .thenReturn(new ChangeSet<>(List.of(), null));

        handler.ingest(notification, credential, deadline, new IngestionProgress());

        verify(calendarSource).fetchIncrementalChanges(credential, "2024-05-01T09:00:00Z", deadline);
    }
}
