package com.relaytide.repository;

import com.relaytide.model.InteractionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface InteractionRecordRepository extends JpaRepository<InteractionRecord, UUID> {

    Optional<InteractionRecord> findByAccountIdAndSourceSystemAndSourceId(
            String accountId, String sourceSystem, String sourceId);

    // 1 → inserted, 0 → a row for (accountId, sourceSystem, sourceId) already existed
    @Modifying(clearAutomatically = true)
    @Query(value = "INSERT INTO interaction_records (id, account_id, identity_id, kind, direction, subject, "
            + "summary, source_system, source_id, action_required, occurred_at, created_at) "
            + "VALUES (:#{#r.id}, :#{#r.accountId}, :#{#r.identityId}, :#{#r.kind.name()}, "
            + ":#{#r.direction.name()}, :#{#r.subject}, :#{#r.summary}, :#{#r.sourceSystem}, "
            + ":#{#r.sourceId}, :#{#r.actionRequired}, :#{#r.occurredAt}, :#{#r.createdAt}) "
            + "ON CONFLICT (account_id, source_system, source_id) DO NOTHING",
            nativeQuery = true)
    int insertIfAbsent(@Param("r") InteractionRecord record);
}
