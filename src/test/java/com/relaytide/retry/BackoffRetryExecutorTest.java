package com.relaytide.retry;

import com.relaytide.client.RetryableUpstreamException;
import com.relaytide.client.UpstreamErrorClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackoffRetryExecutor.
 *
 * Delays are kept in single-digit milliseconds so the real waits stay short;
 * the schedule itself is read back through the observer.
 */
class BackoffRetryExecutorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final UpstreamErrorClassifier classifier = new UpstreamErrorClassifier();

    private BackoffRetryExecutor executor;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        executor = new BackoffRetryExecutor(clock);
        policy = RetryPolicy.builder()
                .maxRetries(3)
                .initialDelayMs(1)
                .maxDelayMs(3)
                .multiplier(2.0)
                .retryable(e -> e instanceof RetryableUpstreamException)
                .build();
    }

    @Test
    @DisplayName("Always-retryable failure runs maxRetries + 1 times with the exponential delays")
    void alwaysRetryable_shouldRunMaxRetriesPlusOneTimes() {
        AtomicInteger calls = new AtomicInteger();
        List<Long> delays = new ArrayList<>();
        List<Integer> attempts = new ArrayList<>();
        RetryableUpstreamException failure = new RetryableUpstreamException("op", 503, "unavailable", null);

        RetryableUpstreamException thrown = assertThrows(RetryableUpstreamException.class,
                () -> executor.execute("op", policy, (error, attempt, delayMs) -> {
                    attempts.add(attempt);
                    delays.add(delayMs);
                }, null, () -> {
                    calls.incrementAndGet();
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertEquals(4, calls.get());
        assertEquals(List.of(1, 2, 3), attempts);
        // min(3, 1 * 2^(n-1)) → 1, 2, 3
        assertEquals(List.of(1L, 2L, 3L), delays);
    }

    @Test
    @DisplayName("Non-quota 403 is not retried")
    void forbidden_shouldRunOnce() {
        AtomicInteger calls = new AtomicInteger();
        HttpClientErrorException forbidden = HttpClientErrorException.create(HttpStatus.FORBIDDEN, "Forbidden",
                HttpHeaders.EMPTY, "{\"error\":{\"message\":\"Insufficient Permission\"}}".getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8);

        assertThrows(RuntimeException.class, () -> executor.execute("op", policy, () -> {
            calls.incrementAndGet();
            throw classifier.classify("op", forbidden);
        }));

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Returns the result once a retry succeeds")
    void transientThenSuccess_shouldReturnResult() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", policy, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new RetryableUpstreamException("op", 429, "slow down", null);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("A throwing observer does not stop the retry loop")
    void throwingObserver_shouldBeIgnored() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", policy, (error, attempt, delayMs) -> {
            throw new IllegalStateException("observer broke");
        }, null, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new RetryableUpstreamException("op", 500, "boom", null);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("A delay that would cross the deadline ends the call with DeadlineExceededException")
    void delayPastDeadline_shouldThrowDeadlineExceeded() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy slow = RetryPolicy.builder()
                .maxRetries(3).initialDelayMs(1000).maxDelayMs(1000).multiplier(1.0)
                .retryable(e -> true)
                .build();

        DeadlineExceededException thrown = assertThrows(DeadlineExceededException.class,
                () -> executor.execute("op", slow, NOW.plusMillis(500), () -> {
                    calls.incrementAndGet();
                    throw new RetryableUpstreamException("op", 503, "unavailable", null);
                }));

        assertEquals(1, calls.get());
        assertInstanceOf(RetryableUpstreamException.class, thrown.getCause());
    }

    @Test
    @DisplayName("After shutdown no new attempt starts")
    void stopping_shouldAbortBeforeNextAttempt() {
        AtomicInteger calls = new AtomicInteger();
        executor.stopRetrying();

        RetryAbortedException thrown = assertThrows(RetryAbortedException.class,
                () -> executor.execute("op", policy, () -> {
                    calls.incrementAndGet();
                    throw new RetryableUpstreamException("op", 503, "unavailable", null);
                }));

        assertTrue(executor.isStopping());
        assertEquals(1, calls.get());
        assertEquals(1, thrown.getAttempts());
    }
}
