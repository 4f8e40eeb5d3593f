package com.relaytide.client;

import lombok.*;

/**
 * One entry from an incremental change listing.
 *
 * snapshot is filled in when the listing already returned full content
 * (Calendar events.list); otherwise it is null and the caller hydrates it
 * with fetchEntityDetail (Gmail history only returns message ids).
 */
@Getter @AllArgsConstructor @Builder
@ToString
public class ChangeRecord<T> {

    private final String externalId;
    private final T snapshot;

    public boolean isHydrated() {
        return snapshot != null;
    }
}
