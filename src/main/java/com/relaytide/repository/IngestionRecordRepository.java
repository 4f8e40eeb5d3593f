package com.relaytide.repository;

import com.relaytide.model.IngestionRecord;
import com.relaytide.model.IngestionState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Database access for the ingestion ledger.
 *
 * State transitions go through IngestionLedger (load, validate, save with
 * @Version); this interface only reads and purges.
 */
public interface IngestionRecordRepository extends JpaRepository<IngestionRecord, UUID> {

    List<IngestionRecord> findByAccountIdOrderByReceivedAtDesc(String accountId, Pageable pageable);

    List<IngestionRecord> findByAccountIdAndStateOrderByReceivedAtDesc(
            String accountId, IngestionState state, Pageable pageable);

    List<IngestionRecord> findByAccountIdAndReceivedAtGreaterThanEqual(String accountId, Instant since);

    // Used by the stale sweep: PROCESSING rows nobody finished
    List<IngestionRecord> findByStateAndStartedAtBefore(IngestionState state, Instant startedBefore);

    @Modifying
    @Query("DELETE FROM IngestionRecord r WHERE r.accountId = :accountId "
            + "AND r.receivedAt < :cutoff AND r.state IN :states")
    int deleteByAccountIdAndReceivedAtBeforeAndStateIn(@Param("accountId") String accountId,
                                                       @Param("cutoff") Instant cutoff,
                                                       @Param("states") Collection<IngestionState> states);
}
