package com.relaytide.client;

import lombok.*;

@Getter @AllArgsConstructor @Builder
@ToString
public class MeetingAttendee {

    private final String email;
    private final String displayName;
    // true for the calendar owner's own attendee entry
    private final boolean self;
}
