package com.relaytide.client;

import com.relaytide.model.IngestionSource;

/**
 * Registers/unregisters this service as a push subscriber with the provider.
 */
public interface PushSubscriptionClient {

    IngestionSource source();

    /**
     * @param channelId locally generated channel id (ignored by providers that assign their own)
     * @param token     secret echoed back on every notification (ignored where unsupported)
     */
    WatchRegistration startWatch(AccessCredential credential, String channelId, String token);

    void stopWatch(AccessCredential credential, String channelId, String resourceId);
}
