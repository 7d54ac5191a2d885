package com.postq.internal;

import com.postq.DeliveryRecord;
import com.postq.DeliveryRecordRepository;
import com.postq.DeliveryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps one delivery record per (message, execution, target).
 */
@Component
public class DeliveryLedger {

    private static final Logger log = LoggerFactory.getLogger(DeliveryLedger.class);

    private final DeliveryRecordRepository repository;

    public DeliveryLedger(DeliveryRecordRepository repository) {
        this.repository = repository;
    }

    public Optional<DeliveryRecord> find(UUID messageId, String executionId, String targetId) {
        try {
            return repository.findByMessageIdAndExecutionIdAndTargetId(messageId, executionId, targetId);
        } catch (DataAccessException e) {
            throw new StoreIOException("Failed to read delivery record of message " + messageId + " for target "
                    + targetId, e);
        }
    }

    /**
     * Stores the outcome for a target. If another execution path recorded the
     * same triple first, that record wins and is returned.
     */
    public DeliveryRecord record(UUID messageId, String executionId, String targetId, DeliveryStatus status,
            int attempts, List<String> transportMessageIds, String error) {
        DeliveryRecord record = new DeliveryRecord(UUID.randomUUID(), messageId, executionId, targetId, status,
                attempts, transportMessageIds, error, OffsetDateTime.now());
        try {
            return repository.saveAndFlush(record);
        } catch (DataIntegrityViolationException duplicate) {
            log.debug("Delivery of message {} execution {} to {} was already recorded", messageId, executionId,
                    targetId);
            return find(messageId, executionId, targetId).orElseThrow(() -> new StoreIOException(
                    "Delivery record of message " + messageId + " for target " + targetId
                            + " conflicted but could not be read back",
                    duplicate));
        } catch (DataAccessException e) {
            throw new StoreIOException("Failed to record delivery of message " + messageId + " to " + targetId, e);
        }
    }
}
