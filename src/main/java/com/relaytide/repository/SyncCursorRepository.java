package com.relaytide.repository;

import com.relaytide.model.IngestionSource;
import com.relaytide.model.SyncCursor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface SyncCursorRepository extends JpaRepository<SyncCursor, UUID> {

    Optional<SyncCursor> findByAccountIdAndSource(String accountId, IngestionSource source);

    // Gmail historyIds are numeric and only move forward
    @Modifying(clearAutomatically = true)
    @Query(value = "INSERT INTO sync_cursors (id, account_id, source, cursor, updated_at) "
            + "VALUES (:id, :accountId, :source, :cursor, :updatedAt) "
            + "ON CONFLICT (account_id, source) DO UPDATE "
            + "SET cursor = EXCLUDED.cursor, updated_at = EXCLUDED.updated_at "
            + "WHERE CAST(EXCLUDED.cursor AS NUMERIC) > CAST(sync_cursors.cursor AS NUMERIC)",
            nativeQuery = true)
    int advanceNumeric(@Param("id") UUID id,
                       @Param("accountId") String accountId,
                       @Param("source") String source,
                       @Param("cursor") String cursor,
                       @Param("updatedAt") Instant updatedAt);

    // Calendar cursors are ISO-8601 instants
    @Modifying(clearAutomatically = true)
    @Query(value = "INSERT INTO sync_cursors (id, account_id, source, cursor, updated_at) "
            + "VALUES (:id, :accountId, :source, :cursor, :updatedAt) "
            + "ON CONFLICT (account_id, source) DO UPDATE "
            + "SET cursor = EXCLUDED.cursor, updated_at = EXCLUDED.updated_at "
            + "WHERE CAST(EXCLUDED.cursor AS TIMESTAMPTZ) > CAST(sync_cursors.cursor AS TIMESTAMPTZ)",
            nativeQuery = true)
    int advanceTimestamp(@Param("id") UUID id,
                         @Param("accountId") String accountId,
                         @Param("source") String source,
                         @Param("cursor") String cursor,
                         @Param("updatedAt") Instant updatedAt);
}
