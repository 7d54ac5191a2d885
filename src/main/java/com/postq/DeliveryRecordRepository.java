package com.postq;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DeliveryRecordRepository extends JpaRepository<DeliveryRecord, UUID> {

    Optional<DeliveryRecord> findByMessageIdAndExecutionIdAndTargetId(UUID messageId, String executionId,
            String targetId);

    List<DeliveryRecord> findByMessageIdOrderByRecordedAtDesc(UUID messageId, Pageable pageable);

    @Modifying
    @Transactional
    int deleteByRecordedAtBefore(OffsetDateTime recordedAt);
}
