package com.postq.internal;

import com.postq.ScheduledMessage;
import com.postq.config.PostQProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Finds due messages and hands them to the {@link MessageExecutor}. The poll
 * itself never sends anything.
 */
@Component
@ConditionalOnProperty(prefix = "postq.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MessagePoller {

    private static final Logger log = LoggerFactory.getLogger(MessagePoller.class);

    private final MessageStore store;
    private final MessageExecutor executor;
    private final FatalErrorHandler fatalErrorHandler;
    private final int batchSize;
    private final int maxConsecutiveStoreFailures;

    private final AtomicBoolean pollInProgress = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicInteger consecutiveStoreFailures = new AtomicInteger();

    public MessagePoller(
            MessageStore store,
            MessageExecutor executor,
            FatalErrorHandler fatalErrorHandler,
            PostQProperties properties) {
        this.store = store;
        this.executor = executor;
        this.fatalErrorHandler = fatalErrorHandler;
        this.batchSize = Math.max(1, properties.getScheduler().getBatchSize());
        this.maxConsecutiveStoreFailures = Math.max(1, properties.getScheduler().getMaxConsecutiveStoreFailures());
    }

    @PostConstruct
    public void init() {
        log.info("PostQ poller initialized on {} with batch size {}", executor.getNodeId(), batchSize);
    }

    @Scheduled(fixedDelayString = "${postq.scheduler.poll-interval-in-seconds:5}000")
    public void poll() {
        if (stopped.get() || !pollInProgress.compareAndSet(false, true)) {
            return;
        }
        try {
            pollOnce();
        } finally {
            pollInProgress.set(false);
        }
    }

    /**
     * Returns the number of messages handed to the executor.
     */
    int pollOnce() {
        int availableSlots = executor.availableSlots();
        if (availableSlots <= 0) {
            log.debug("All job slots busy, skipping poll");
            return 0;
        }

        List<ScheduledMessage> due;
        try {
            due = store.fetchDue(OffsetDateTime.now(), Math.min(batchSize, availableSlots));
            consecutiveStoreFailures.set(0);
        } catch (StoreIOException e) {
            onStoreFailure(e);
            return 0;
        }

        for (ScheduledMessage message : due) {
            executor.submit(message.getId(), ClaimMode.SCHEDULED).whenComplete((report, error) -> {
                if (error != null) {
                    log.warn("Execution of message {} was not started: {}", message.getId(), error.getMessage());
                }
            });
        }
        if (!due.isEmpty()) {
            log.debug("Handed {} due messages to the executor", due.size());
        }
        return due.size();
    }

    private void onStoreFailure(StoreIOException e) {
        int failures = consecutiveStoreFailures.incrementAndGet();
        log.warn("Failed to fetch due messages ({} of {} consecutive failures): {}", failures,
                maxConsecutiveStoreFailures, e.getMessage());
        if (failures >= maxConsecutiveStoreFailures && stopped.compareAndSet(false, true)) {
            fatalErrorHandler.onFatalError(
                    "Message store unreachable for " + failures + " consecutive polls", e);
        }
    }

    boolean isStopped() {
        return stopped.get();
    }

    @PreDestroy
    void stop() {
        stopped.set(true);
        executor.beginShutdown();
    }
}
