package com.relaytide.service;

import com.relaytide.client.AccessCredential;
import com.relaytide.client.CursorExpiredException;
import com.relaytide.client.UpstreamAuthorizationException;
import com.relaytide.model.IngestionSource;
import com.relaytide.retry.DeadlineExceededException;
import com.relaytide.retry.RetryAbortedException;

import java.time.Instant;

/**
 * Source-specific extraction: fetch what changed, reconcile it, tally the outcome.
 *
 * Per-item failures are contained and counted as skipped. Anything that makes
 * the rest of the batch pointless ({@link #abortsBatch}) propagates to the orchestrator.
 */
public interface SourceIngestionHandler<N extends InboundNotification> {

    IngestionSource source();

    Class<N> notificationType();

    void ingest(N notification, AccessCredential credential, Instant deadline, IngestionProgress progress);

    static boolean abortsBatch(RuntimeException error) {
        return error instanceof CursorExpiredException
                || error instanceof UpstreamAuthorizationException
                || error instanceof DeadlineExceededException
                || error instanceof RetryAbortedException;
    }
}
