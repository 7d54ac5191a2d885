package com.postq;

import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface ScheduledMessageRepository extends JpaRepository<ScheduledMessage, UUID> {

    /**
     * Number of messages currently in one lifecycle status.
     */
    interface StatusCount {
        MessageStatus getStatus();

        Long getMessageCount();
    }

    @Query("""
            SELECT m FROM ScheduledMessage m
            WHERE m.enabled = true
              AND m.nextRunAt IS NOT NULL
              AND m.nextRunAt <= :now
              AND (m.endAt IS NULL OR m.nextRunAt <= m.endAt)
              AND (m.lockedUntil IS NULL OR m.lockedUntil < :now)
            ORDER BY m.nextRunAt ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<ScheduledMessage> findDue(@Param("now") OffsetDateTime now, Pageable pageable);

    @Modifying
    @Query("""
            UPDATE ScheduledMessage m
            SET m.lockedBy = :holder,
                m.lockedUntil = :leaseUntil,
                m.status = :running,
                m.updatedAt = :now
            WHERE m.id = :id
              AND m.enabled = true
              AND m.nextRunAt IS NOT NULL
              AND m.nextRunAt <= :now
              AND (m.lockedUntil IS NULL OR m.lockedUntil < :now)
            """)
    int claimDue(
            @Param("id") UUID id,
            @Param("holder") String holder,
            @Param("leaseUntil") OffsetDateTime leaseUntil,
            @Param("running") MessageStatus running,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE ScheduledMessage m
            SET m.lockedBy = :holder,
                m.lockedUntil = :leaseUntil,
                m.status = :running,
                m.updatedAt = :now
            WHERE m.id = :id
              AND (m.lockedUntil IS NULL OR m.lockedUntil < :now)
            """)
    int claimUnconditionally(
            @Param("id") UUID id,
            @Param("holder") String holder,
            @Param("leaseUntil") OffsetDateTime leaseUntil,
            @Param("running") MessageStatus running,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE ScheduledMessage m
            SET m.lockedUntil = :leaseUntil
            WHERE m.id = :id
              AND m.lockedBy = :holder
            """)
    int renewLease(@Param("id") UUID id, @Param("holder") String holder,
            @Param("leaseUntil") OffsetDateTime leaseUntil);

    @Modifying
    @Query("""
            UPDATE ScheduledMessage m
            SET m.lockedBy = NULL,
                m.lockedUntil = NULL,
                m.status = :status,
                m.updatedAt = :now
            WHERE m.id = :id
              AND m.lockedBy = :holder
            """)
    int releaseLease(
            @Param("id") UUID id,
            @Param("holder") String holder,
            @Param("status") MessageStatus status,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE ScheduledMessage m
            SET m.status = :status,
                m.lastOutcome = :lastOutcome,
                m.nextRunAt = :nextRunAt,
                m.lastRunAt = :lastRunAt,
                m.lastError = :lastError,
                m.lockedBy = NULL,
                m.lockedUntil = NULL,
                m.updatedAt = :now
            WHERE m.id = :id
              AND m.lockedBy = :holder
            """)
    int completeExecution(
            @Param("id") UUID id,
            @Param("holder") String holder,
            @Param("status") MessageStatus status,
            @Param("lastOutcome") MessageStatus lastOutcome,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("lastRunAt") OffsetDateTime lastRunAt,
            @Param("lastError") String lastError,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE ScheduledMessage m
            SET m.status = :status,
                m.lastOutcome = :lastOutcome,
                m.enabled = false,
                m.nextRunAt = :nextRunAt,
                m.lastRunAt = :lastRunAt,
                m.lastError = :lastError,
                m.lockedBy = NULL,
                m.lockedUntil = NULL,
                m.updatedAt = :now
            WHERE m.id = :id
              AND m.lockedBy = :holder
            """)
    int completeExecutionAndDisable(
            @Param("id") UUID id,
            @Param("holder") String holder,
            @Param("status") MessageStatus status,
            @Param("lastOutcome") MessageStatus lastOutcome,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("lastRunAt") OffsetDateTime lastRunAt,
            @Param("lastError") String lastError,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("""
            UPDATE ScheduledMessage m
            SET m.enabled = :enabled,
                m.updatedAt = :now
            WHERE m.id = :id
            """)
    int updateEnabled(@Param("id") UUID id, @Param("enabled") boolean enabled, @Param("now") OffsetDateTime now);

    @Query("""
            SELECT m.status AS status, COUNT(m) AS messageCount
            FROM ScheduledMessage m
            GROUP BY m.status
            """)
    List<StatusCount> countByStatus();
}
