package com.relaytide.repository;

import com.relaytide.model.IngestionClaim;
import com.relaytide.model.IngestionClaimKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.UUID;

/**
 * Atomic dedup-key ownership.
 *
 * claimIfAbsent(...) = INSERT ... ON CONFLICT DO NOTHING
 *   → 1 if this record now owns the key, 0 if another record got there first.
 * A read-then-insert here would let two concurrent deliveries both win.
 */
public interface IngestionClaimRepository extends JpaRepository<IngestionClaim, IngestionClaimKey> {

    @Modifying
    @Query(value = "INSERT INTO ingestion_claims (account_id, source, external_key, record_id, claimed_at) "
            + "VALUES (:accountId, :source, :externalKey, :recordId, :claimedAt) "
            + "ON CONFLICT (account_id, source, external_key) DO NOTHING",
            nativeQuery = true)
    int claimIfAbsent(@Param("accountId") String accountId,
                      @Param("source") String source,
                      @Param("externalKey") String externalKey,
                      @Param("recordId") UUID recordId,
                      @Param("claimedAt") Instant claimedAt);

    @Modifying
    @Query("DELETE FROM IngestionClaim c WHERE c.key.accountId = :accountId AND c.claimedAt < :cutoff")
    int deleteByAccountIdAndClaimedAtBefore(@Param("accountId") String accountId,
                                            @Param("cutoff") Instant cutoff);
}
