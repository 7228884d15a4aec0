package com.avocado.bonus_ledger.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Claims a batch of pending events in write order. SKIP LOCKED keeps two publisher
     * instances from sending the same event.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL
        ORDER BY sequence_number
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> claimPending(@Param("limit") int limit);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
        String aggregateType, String aggregateId);

    @Modifying
    @Query("""
        UPDATE OutboxEventEntity e
        SET e.publishedAt = :publishedAt, e.lastError = NULL
        WHERE e.id = :id AND e.publishedAt IS NULL
        """)
    int markPublished(@Param("id") UUID id, @Param("publishedAt") Instant publishedAt);

    @Modifying
    @Query("""
        UPDATE OutboxEventEntity e
        SET e.retryCount = e.retryCount + 1, e.lastError = :error
        WHERE e.id = :id AND e.publishedAt IS NULL
        """)
    int recordSendFailure(@Param("id") UUID id, @Param("error") String error);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countPending();

    long countByPublishedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestPendingCreatedAt();
}
