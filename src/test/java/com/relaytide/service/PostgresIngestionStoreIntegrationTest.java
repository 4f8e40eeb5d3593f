package com.relaytide.service;

import com.relaytide.config.RelaytideProperties;
import com.relaytide.model.Identity;
import com.relaytide.model.IngestionRecord;
import com.relaytide.model.IngestionSource;
import com.relaytide.model.InteractionDirection;
import com.relaytide.model.InteractionKind;
import com.relaytide.repository.IdentityRepository;
import com.relaytide.repository.IngestionClaimRepository;
import com.relaytide.repository.IngestionRecordRepository;
import com.relaytide.repository.InteractionRecordRepository;
import com.relaytide.repository.SyncCursorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the native ON CONFLICT statements and the conditional updates against a
 * real PostgreSQL. Each service call commits on its own, so racing threads see
 * each other's rows the way concurrent webhook deliveries do.
 */
@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=create-drop")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
@Import({IngestionLedger.class, IdentityReconciler.class, SyncCursorService.class,
        PostgresIngestionStoreIntegrationTest.FixedClockConfig.class})
class PostgresIngestionStoreIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String ACCOUNT = "acct-1";

    @Container
    @ServiceConnection
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("relaytide_test");

    @TestConfiguration
    @EnableConfigurationProperties(RelaytideProperties.class)
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired private IngestionLedger ledger;
    @Autowired private IdentityReconciler reconciler;
    @Autowired private SyncCursorService syncCursorService;
    @Autowired private IngestionRecordRepository recordRepository;
    @Autowired private IngestionClaimRepository claimRepository;
    @Autowired private IdentityRepository identityRepository;
    @Autowired private InteractionRecordRepository interactionRepository;
    @Autowired private SyncCursorRepository syncCursorRepository;

    @BeforeEach
    void truncate() {
        interactionRepository.deleteAllInBatch();
        identityRepository.deleteAllInBatch();
        claimRepository.deleteAllInBatch();
        recordRepository.deleteAllInBatch();
        syncCursorRepository.deleteAllInBatch();
    }

    @Test
    @DisplayName("Concurrent deliveries of one dedup key: exactly one claim wins")
    void concurrentClaims_exactlyOneWins() throws Exception {
        List<Callable<Boolean>> claims = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            IngestionRecord record = ledger.recordReceived(ACCOUNT, IngestionSource.MAIL_PUSH,
                    "mail.history", "500", "{}");
            claims.add(() -> ledger.claim(record));
        }

        List<Boolean> results = runConcurrently(claims);

        assertEquals(1, results.stream().filter(Boolean::booleanValue).count());
        assertEquals(1, claimRepository.count());
        Optional<IngestionRecord> owner = ledger.findExisting(ACCOUNT, IngestionSource.MAIL_PUSH, "500");
        assertTrue(owner.isPresent());
    }

    @Test
    @DisplayName("Concurrent resolveOrCreate for differently-cased emails creates one identity")
    void concurrentResolve_singleIdentity() throws Exception {
        List<Callable<ResolvedIdentity>> calls = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String email = i % 2 == 0 ? "A@x.com" : "a@x.com";
            calls.add(() -> reconciler.resolveOrCreate(ACCOUNT, email, "Ann"));
        }

        List<ResolvedIdentity> results = runConcurrently(calls);

        assertEquals(1, identityRepository.count());
        assertEquals(1, results.stream().filter(ResolvedIdentity::isCreated).count());
        UUID id = results.get(0).getIdentity().getId();
        for (ResolvedIdentity result : results) {
            assertEquals(id, result.getIdentity().getId());
            assertEquals("a@x.com", result.getIdentity().getEmail());
        }
    }

    @Test
    @DisplayName("Replaying an interaction keeps one row and counts the contact once")
    void replayedInteraction_countedOnce() {
        Identity identity = reconciler.resolveOrCreate(ACCOUNT, "jane@example.com", "Jane").getIdentity();
        InteractionData data = mail("m1", NOW.minusSeconds(600));

        RecordedInteraction first = reconciler.recordInteraction(identity, data);
        RecordedInteraction replay = reconciler.recordInteraction(identity, data);

        assertTrue(first.isCreated());
        assertFalse(replay.isCreated());
        assertEquals(first.getRecord().getId(), replay.getRecord().getId());
        assertEquals(1, interactionRepository.count());
        Identity stored = identityRepository.findById(identity.getId()).orElseThrow();
        assertEquals(1, stored.getTotalInteractionCount());
        assertEquals(NOW.minusSeconds(600), stored.getLastContactAt());
    }

    @Test
    @DisplayName("An older interaction is counted but does not move lastContactAt back")
    void olderInteraction_keepsLastContact() {
        Identity identity = reconciler.resolveOrCreate(ACCOUNT, "jane@example.com", "Jane").getIdentity();

        reconciler.recordInteraction(identity, mail("m2", NOW.minusSeconds(60)));
        reconciler.recordInteraction(identity, mail("m1", NOW.minusSeconds(3600)));

        Identity stored = identityRepository.findById(identity.getId()).orElseThrow();
        assertEquals(2, stored.getTotalInteractionCount());
        assertEquals(NOW.minusSeconds(60), stored.getLastContactAt());
    }

    @Test
    @DisplayName("Mail cursor only moves to a larger historyId")
    void mailCursor_neverMovesBackward() {
        syncCursorService.advance(ACCOUNT, IngestionSource.MAIL_PUSH, "500");
        syncCursorService.advance(ACCOUNT, IngestionSource.MAIL_PUSH, "480");
        assertEquals(Optional.of("500"), syncCursorService.lastCursor(ACCOUNT, IngestionSource.MAIL_PUSH));

        // numeric, not lexical: "1000" > "999"
        syncCursorService.advance(ACCOUNT, IngestionSource.MAIL_PUSH, "999");
        syncCursorService.advance(ACCOUNT, IngestionSource.MAIL_PUSH, "1000");
        assertEquals(Optional.of("1000"), syncCursorService.lastCursor(ACCOUNT, IngestionSource.MAIL_PUSH));
    }

    @Test
    @DisplayName("Calendar cursor only moves to a later instant")
    void calendarCursor_neverMovesBackward() {
        syncCursorService.advance(ACCOUNT, IngestionSource.CALENDAR_PUSH, "2024-05-01T09:30:00Z");
        syncCursorService.advance(ACCOUNT, IngestionSource.CALENDAR_PUSH, "2024-05-01T09:15:00.249Z");

        assertEquals(Optional.of("2024-05-01T09:30:00Z"),
                syncCursorService.lastCursor(ACCOUNT, IngestionSource.CALENDAR_PUSH));
        assertEquals(1, syncCursorRepository.count());
    }

    private static InteractionData mail(String messageId, Instant occurredAt) {
        return InteractionData.builder()
                .kind(InteractionKind.MAIL)
                .direction(InteractionDirection.INBOUND)
                .subject("Hello " + messageId)
                .summary("Mail " + messageId)
                .sourceSystem("gmail")
                .sourceId(messageId)
                .occurredAt(occurredAt)
                .build();
    }

    // Releases every task at once so they hit the database together
    private static <T> List<T> runConcurrently(List<Callable<T>> tasks) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
