package com.relaytide.client;

import com.relaytide.model.IngestionSource;

/**
 * Read-only view of one upstream provider feed.
 *
 * Implementations do the raw HTTP call and translate the provider payload into
 * snapshots; they never retry. Callers go through ResilientEventSource.
 *
 * @param <T> snapshot type produced for one entity
 */
public interface RemoteEventSource<T> {

    IngestionSource source();

    /**
     * @throws CursorExpiredException when the provider no longer recognizes {@code cursor}
     */
    ChangeSet<T> fetchIncrementalChanges(AccessCredential credential, String cursor);

    T fetchEntityDetail(AccessCredential credential, String externalId);
}
