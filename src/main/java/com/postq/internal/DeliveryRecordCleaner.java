package com.postq.internal;

import com.postq.DeliveryRecordRepository;
import com.postq.config.PostQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;

@Component
@ConditionalOnProperty(prefix = "postq.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DeliveryRecordCleaner {

    private static final Logger log = LoggerFactory.getLogger(DeliveryRecordCleaner.class);
    private final DeliveryRecordRepository deliveryRecordRepository;
    private final PostQProperties properties;

    public DeliveryRecordCleaner(DeliveryRecordRepository deliveryRecordRepository, PostQProperties properties) {
        this.deliveryRecordRepository = deliveryRecordRepository;
        this.properties = properties;
    }

    // Run cleaner every hour
    @Scheduled(fixedDelay = 3600000, initialDelay = 60000)
    public void cleanup() {
        String retentionValue = properties.getScheduler().getDeleteDeliveriesAfter();
        if (retentionValue == null || retentionValue.isBlank()) {
            return;
        }
        log.debug("Running PostQ delivery record cleanup...");

        try {
            Duration retention = Durations.parse(retentionValue);
            OffsetDateTime threshold = OffsetDateTime.now().minus(retention);
            int deleted = deliveryRecordRepository.deleteByRecordedAtBefore(threshold);
            if (deleted > 0) {
                log.info("Cleaned up {} delivery records older than {}", deleted, retention);
            }
        } catch (Exception e) {
            log.error("Failed to clean up delivery records: {}", e.getMessage());
        }
    }
}
