package com.relaytide.service;

import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.WatchChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebhookVerifierTest {

    private final RelaytideProperties properties = new RelaytideProperties();
    private final WebhookVerifier verifier = new WebhookVerifier(properties);

    @Test
    @DisplayName("Mail token check is off until a token is configured")
    void mailToken_unconfigured_accepted() {
        assertDoesNotThrow(() -> verifier.verifyMailToken(null));
    }

    @Test
    @DisplayName("Configured mail token must match exactly")
    void mailToken_configured() {
        properties.getWebhook().setMailVerificationToken("s3cret");

        assertDoesNotThrow(() -> verifier.verifyMailToken("s3cret"));
        assertThrows(WebhookVerificationException.class, () -> verifier.verifyMailToken("wrong"));
        assertThrows(WebhookVerificationException.class, () -> verifier.verifyMailToken(null));
    }

    @Test
    @DisplayName("Channel token must echo the one issued at watch time")
    void channelToken() {
        WatchChannel channel = WatchChannel.builder().channelId("chan-1").token("issued").build();

        assertDoesNotThrow(() -> verifier.verifyChannelToken(channel, "issued"));
        assertThrows(WebhookVerificationException.class, () -> verifier.verifyChannelToken(channel, "other"));
        assertThrows(WebhookVerificationException.class, () -> verifier.verifyChannelToken(channel, null));
    }
}
