package com.relaytide.service;

import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.WatchChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared secrets attached to provider push requests.
 * Comparisons are constant-time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookVerifier {

    private final RelaytideProperties properties;

    /**
     * Pub/Sub push: the ?token= query parameter on the push endpoint.
     * A blank configured token disables the check.
     */
    public void verifyMailToken(String provided) {
        String expected = properties.getWebhook().getMailVerificationToken();
        if (expected == null || expected.isBlank()) {
            return;
        }
        if (!matches(expected, provided)) {
            log.warn("Rejected Gmail push with invalid verification token");
            throw new WebhookVerificationException("Invalid verification token");
        }
    }

    /**
     * Calendar push: X-Goog-Channel-Token must echo the token issued at startWatch.
     */
    public void verifyChannelToken(WatchChannel channel, String provided) {
        if (channel.getToken() == null) {
            return;
        }
        if (!matches(channel.getToken(), provided)) {
            log.warn("Rejected calendar push for channel {}: token mismatch", channel.getChannelId());
            throw new WebhookVerificationException("Invalid channel token");
        }
    }

    private static boolean matches(String expected, String provided) {
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
