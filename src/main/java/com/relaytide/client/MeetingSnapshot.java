package com.relaytide.client;

import lombok.*;

import java.time.Instant;
import java.util.List;

@Getter @AllArgsConstructor @Builder
@ToString
public class MeetingSnapshot {

    private final String eventId;
    private final String status;
    private final String title;
    private final String description;
    // null when the event has neither start.dateTime nor start.date
    private final Instant startsAt;
    private final boolean organizedBySelf;
    @Builder.Default
    private final List<MeetingAttendee> attendees = List.of();

    public boolean isCancelled() {
        return "cancelled".equalsIgnoreCase(status);
    }
}
