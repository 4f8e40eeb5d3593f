package com.relaytide.repository;

import com.relaytide.model.Identity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Identity store. Creation and statistics updates are single statements so
 * concurrent ingestions for the same contact never race:
 *
 *   insertIfAbsent   → INSERT ... ON CONFLICT (account_id, email) DO NOTHING
 *   recordContact    → count + 1, lastContactAt = max(current, occurredAt)
 */
public interface IdentityRepository extends JpaRepository<Identity, UUID> {

    Optional<Identity> findByAccountIdAndEmail(String accountId, String email);

    @Modifying(clearAutomatically = true)
    @Query(value = "INSERT INTO identities (id, account_id, email, display_name, classification, "
            + "total_interaction_count, created_at, updated_at) "
            + "VALUES (:#{#i.id}, :#{#i.accountId}, :#{#i.email}, :#{#i.displayName}, :#{#i.classification}, "
            + "0, :#{#i.createdAt}, :#{#i.updatedAt}) "
            + "ON CONFLICT (account_id, email) DO NOTHING",
            nativeQuery = true)
    int insertIfAbsent(@Param("i") Identity identity);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Identity i SET i.displayName = :displayName, i.updatedAt = :now "
            + "WHERE i.id = :id AND i.displayName IS NULL")
    int fillMissingDisplayName(@Param("id") UUID id,
                               @Param("displayName") String displayName,
                               @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Identity i SET i.totalInteractionCount = i.totalInteractionCount + 1, "
            + "i.lastContactAt = CASE WHEN i.lastContactAt IS NULL OR i.lastContactAt < :occurredAt "
            + "THEN :occurredAt ELSE i.lastContactAt END, "
            + "i.updatedAt = :now WHERE i.id = :id")
    int recordContact(@Param("id") UUID id,
                      @Param("occurredAt") Instant occurredAt,
                      @Param("now") Instant now);
}
