package com.relaytide.retry;

import com.relaytide.config.RelaytideProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.builder()
            .maxRetries(5)
            .initialDelayMs(1000)
            .maxDelayMs(10000)
            .multiplier(2.0)
            .retryable(e -> true)
            .build();

    @Test
    @DisplayName("Delay doubles per retry and is capped at maxDelay")
    void delayForRetry_followsExponentialScheduleWithCap() {
        assertEquals(1000, policy.delayForRetry(1));
        assertEquals(2000, policy.delayForRetry(2));
        assertEquals(4000, policy.delayForRetry(3));
        assertEquals(8000, policy.delayForRetry(4));
        assertEquals(10000, policy.delayForRetry(5));
        assertEquals(10000, policy.delayForRetry(60));
    }

    @Test
    @DisplayName("Huge retry numbers do not overflow past maxDelay")
    void delayForRetry_largeRetryNumber_staysAtCap() {
        assertEquals(10000, policy.delayForRetry(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Defaults come from relaytide.retry")
    void from_usesConfiguredValues() {
        RetryPolicy configured = RetryPolicy.from(new RelaytideProperties.Retry(), e -> false);

        assertEquals(3, configured.getMaxRetries());
        assertEquals(1000, configured.getInitialDelayMs());
        assertEquals(10000, configured.getMaxDelayMs());
        assertEquals(2.0, configured.getMultiplier());
        assertFalse(configured.isRetryable(new RuntimeException()));
    }

    @Test
    @DisplayName("Invalid settings are rejected at construction")
    void invalidSettings_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.builder().maxRetries(-1).initialDelayMs(1).maxDelayMs(1).multiplier(1).build());
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.builder().maxRetries(1).initialDelayMs(100).maxDelayMs(10).multiplier(1).build());
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.builder().maxRetries(1).initialDelayMs(1).maxDelayMs(10).multiplier(0.5).build());
    }
}
