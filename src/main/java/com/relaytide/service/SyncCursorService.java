package com.relaytide.service;

import com.relaytide.model.IngestionSource;
import com.relaytide.model.SyncCursor;
import com.relaytide.repository.SyncCursorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Last successfully processed provider cursor per (accountId, source).
 * Read when an ingestion starts, advanced only after it completes.
 * A cursor never moves backward: a late completion carrying an older cursor
 * leaves the stored one in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncCursorService {

    private final SyncCursorRepository syncCursorRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<String> lastCursor(String accountId, IngestionSource source) {
        return syncCursorRepository.findByAccountIdAndSource(accountId, source)
                .map(SyncCursor::getCursor);
    }

    @Transactional
    public void advance(String accountId, IngestionSource source, String cursor) {
        int written = switch (source) {
            case MAIL_PUSH -> syncCursorRepository.advanceNumeric(
                    UUID.randomUUID(), accountId, source.name(), cursor, clock.instant());
            case CALENDAR_PUSH -> syncCursorRepository.advanceTimestamp(
                    UUID.randomUUID(), accountId, source.name(), cursor, clock.instant());
        };
        if (written == 0) {
            log.info("Cursor not advanced, stored one is newer: account={}, source={}, offered={}",
                    accountId, source, cursor);
            return;
        }
        log.debug("Cursor advanced: account={}, source={}, cursor={}", accountId, source, cursor);
    }
}
