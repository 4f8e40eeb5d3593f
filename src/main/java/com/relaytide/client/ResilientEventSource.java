package com.relaytide.client;

import com.relaytide.model.IngestionSource;
import com.relaytide.retry.BackoffRetryExecutor;
import com.relaytide.retry.RetryPolicy;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * The only way the pipeline talks to a RemoteEventSource: every call runs
 * through the BackoffRetryExecutor with the upstream policy and the caller's deadline.
 */
@RequiredArgsConstructor
public class ResilientEventSource<T> {

    private final RemoteEventSource<T> delegate;
    private final BackoffRetryExecutor retryExecutor;
    private final RetryPolicy policy;

    public IngestionSource source() {
        return delegate.source();
    }

    public ChangeSet<T> fetchIncrementalChanges(AccessCredential credential, String cursor, Instant deadline) {
        return retryExecutor.execute(operation("history"), policy, deadline,
                () -> delegate.fetchIncrementalChanges(credential, cursor));
    }

    public T fetchEntityDetail(AccessCredential credential, String externalId, Instant deadline) {
        return retryExecutor.execute(operation("detail"), policy, deadline,
                () -> delegate.fetchEntityDetail(credential, externalId));
    }

    private String operation(String call) {
        return delegate.source().name().toLowerCase(Locale.ROOT) + "." + call;
    }
}
