package com.relaytide.service;

import com.relaytide.model.IngestionSource;
import lombok.Getter;

/**
 * A push notification already routed to an account, decided once at the webhook.
 * One subclass per source; the orchestrator dispatches on {@link #source()}.
 */
@Getter
public abstract class InboundNotification {

    private final String accountId;
    // raw request body as received, stored on the ledger record
    private final String payload;

    protected InboundNotification(String accountId, String payload) {
        this.accountId = accountId;
        this.payload = payload;
    }

    public abstract IngestionSource source();

    public abstract String eventKind();

    /**
     * Dedup key, unique only within (accountId, source).
     */
    public abstract String externalKey();

    /**
     * True for notifications that only acknowledge a subscription and carry no changes.
     */
    public boolean isHandshake() {
        return false;
    }
}
