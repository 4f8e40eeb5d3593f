package com.relaytide.client;

import lombok.*;

import java.util.List;

/**
 * Result of fetchIncrementalChanges: the changes plus the cursor to resume from
 * next time (null when the provider does not return one).
 */
@Getter @AllArgsConstructor @Builder
public class ChangeSet<T> {

    @Builder.Default
    private final List<ChangeRecord<T>> changes = List.of();
    private final String nextCursor;
}
