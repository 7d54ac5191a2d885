package com.postq.internal;

import com.postq.DeliveryStatus;
import com.postq.MessageStatus;
import com.postq.ScheduledMessageRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class PostQMetrics {

    private static final Logger log = LoggerFactory.getLogger(PostQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final ScheduledMessageRepository messageRepository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();
    private final Map<DeliveryStatus, Counter> deliveryCounters = new EnumMap<>(DeliveryStatus.class);

    private volatile Map<MessageStatus, Long> cachedSnapshot = Map.of();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    public PostQMetrics(ScheduledMessageRepository messageRepository, MeterRegistry meterRegistry) {
        this.messageRepository = messageRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering PostQ meters...");

        for (MessageStatus status : MessageStatus.values()) {
            Gauge.builder("postq.messages.count", this, metrics -> metrics.countFor(status))
                    .description("Number of scheduled messages")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }

        Gauge.builder("postq.messages.total", this, PostQMetrics::totalCount)
                .description("Total number of scheduled messages in the database")
                .register(meterRegistry);

        for (DeliveryStatus status : DeliveryStatus.values()) {
            deliveryCounters.put(status, Counter.builder("postq.deliveries")
                    .description("Recorded deliveries to targets")
                    .tag("status", status.name())
                    .register(meterRegistry));
        }
    }

    public void recordDelivery(DeliveryStatus status) {
        Counter counter = deliveryCounters.get(status);
        if (counter != null) {
            counter.increment();
        }
    }

    private double countFor(MessageStatus status) {
        return getSnapshot().getOrDefault(status, 0L);
    }

    private double totalCount() {
        return getSnapshot().values().stream().mapToLong(Long::longValue).sum();
    }

    private Map<MessageStatus, Long> getSnapshot() {
        long now = System.nanoTime();
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedSnapshot;
        }
    }

    private Map<MessageStatus, Long> loadSnapshot() {
        try {
            Map<MessageStatus, Long> counts = new EnumMap<>(MessageStatus.class);
            for (ScheduledMessageRepository.StatusCount row : messageRepository.countByStatus()) {
                if (row.getStatus() != null) {
                    counts.put(row.getStatus(), row.getMessageCount() == null ? 0L : row.getMessageCount());
                }
            }
            return counts;
        } catch (Exception e) {
            log.trace("Failed to query message counts for metrics: {}", e.getMessage());
            return Map.of();
        }
    }
}
