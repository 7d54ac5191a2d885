package com.postq.internal;

import com.postq.DeliveryRecord;
import com.postq.DeliveryStatus;
import com.postq.MessageTransport;
import com.postq.PermanentDeliveryException;
import com.postq.RenderedContent;
import com.postq.ScheduledMessage;
import com.postq.SendResult;
import com.postq.TransientDeliveryException;
import com.postq.config.PostQProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends one execution of a message to each resolved target, at most once per
 * target. Every target is looked up in the {@link DeliveryLedger} first so a
 * replayed execution skips the targets it already reached.
 */
@Component
public class DispatchEngine {

    private static final Logger log = LoggerFactory.getLogger(DispatchEngine.class);

    private final DeliveryLedger ledger;
    private final MessageTransport transport;
    private final ContentRenderer renderer;
    private final ObjectProvider<PostQMetrics> metrics;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double backoffMultiplier;
    private final Duration shutdownGracePeriod;
    private final SendThrottle throttle;
    private final ThreadPoolExecutor deliveryExecutor;
    private final AtomicBoolean acceptingSends = new AtomicBoolean(true);
    private final AtomicLong shutdownDeadlineNanos = new AtomicLong();

    public DispatchEngine(
            DeliveryLedger ledger,
            MessageTransport transport,
            ContentRenderer renderer,
            ObjectProvider<PostQMetrics> metrics,
            PostQProperties properties) {
        this.ledger = ledger;
        this.transport = transport;
        this.renderer = renderer;
        this.metrics = metrics;

        PostQProperties.Delivery delivery = properties.getDelivery();
        this.maxAttempts = Math.max(1, delivery.getMaxAttempts());
        this.initialBackoffMs = Math.max(0, delivery.getInitialBackoffMs());
        this.backoffMultiplier = Math.max(1.0, delivery.getBackoffMultiplier());
        this.shutdownGracePeriod = Durations.parse(properties.getScheduler().getShutdownGracePeriod());
        this.throttle = new SendThrottle(delivery.getMinDelayBetweenSendsMs());

        int concurrency = Math.max(1, delivery.getConcurrency());
        this.deliveryExecutor = new ThreadPoolExecutor(
                concurrency,
                concurrency,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new CustomizableThreadFactory("postq-delivery-"));
    }

    public DispatchOutcome dispatch(ScheduledMessage message, String executionId, Set<String> targets) {
        if (targets.isEmpty()) {
            log.info("Message {} execution {} resolved no targets", message.getId(), executionId);
            return DispatchOutcome.noTargets();
        }

        RenderedContent content = renderer.render(message);
        List<CompletableFuture<TargetResult>> pending = new ArrayList<>(targets.size());
        for (String targetId : targets) {
            pending.add(submit(message.getId(), executionId, targetId, content));
        }

        Map<String, DeliveryStatus> deliveries = new LinkedHashMap<>();
        Set<String> incomplete = new LinkedHashSet<>();
        Set<String> replayed = new LinkedHashSet<>();
        for (CompletableFuture<TargetResult> future : pending) {
            TargetResult result = future.join();
            if (result.status() != null) {
                deliveries.put(result.targetId(), result.status());
            }
            if (!result.recorded()) {
                incomplete.add(result.targetId());
            }
            if (result.replayed()) {
                replayed.add(result.targetId());
            }
        }

        DispatchOutcome outcome = DispatchOutcome.aggregate(deliveries, incomplete, replayed);
        log.info("Message {} execution {} finished as {}: {} sent, {} failed, {} incomplete", message.getId(),
                executionId, outcome.status(), outcome.sentCount(), outcome.failedCount(), incomplete.size());
        return outcome;
    }

    private CompletableFuture<TargetResult> submit(UUID messageId, String executionId, String targetId,
            RenderedContent content) {
        try {
            return CompletableFuture.supplyAsync(() -> deliverToTarget(messageId, executionId, targetId, content),
                    deliveryExecutor);
        } catch (RejectedExecutionException shuttingDown) {
            log.debug("Delivery executor rejected message {} target {}", messageId, targetId);
            return CompletableFuture.completedFuture(TargetResult.abandoned(targetId));
        }
    }

    private TargetResult deliverToTarget(UUID messageId, String executionId, String targetId,
            RenderedContent content) {
        if (!acceptingSends.get()) {
            return TargetResult.abandoned(targetId);
        }

        try {
            Optional<DeliveryRecord> existing = ledger.find(messageId, executionId, targetId);
            if (existing.isPresent()) {
                log.debug("Message {} execution {} already delivered to {} as {}", messageId, executionId, targetId,
                        existing.get().getStatus());
                return TargetResult.replayed(targetId, existing.get().getStatus());
            }
        } catch (StoreIOException e) {
            log.warn("Could not check ledger for message {} target {}: {}", messageId, targetId, e.getMessage());
            return TargetResult.abandoned(targetId);
        }

        Attempt attempt;
        try {
            attempt = sendWithRetry(messageId, targetId, content);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TargetResult.abandoned(targetId);
        }
        if (attempt == null) {
            return TargetResult.abandoned(targetId);
        }

        try {
            DeliveryRecord record = ledger.record(messageId, executionId, targetId, attempt.status(),
                    attempt.attempts(), attempt.transportMessageIds(), attempt.error());
            metrics.ifAvailable(m -> m.recordDelivery(record.getStatus()));
            return TargetResult.delivered(targetId, record.getStatus());
        } catch (StoreIOException e) {
            log.error("Delivered message {} to {} as {} but failed to record it", messageId, targetId,
                    attempt.status(), e);
            return TargetResult.unrecorded(targetId, attempt.status());
        }
    }

    /**
     * Returns {@code null} when shutdown began before a retry could start.
     */
    private Attempt sendWithRetry(UUID messageId, String targetId, RenderedContent content)
            throws InterruptedException {
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1 && !acceptingSends.get()) {
                return null;
            }
            throttle.acquire();
            SendResult result = send(content, targetId);
            switch (result.outcome()) {
                case SENT -> {
                    return new Attempt(DeliveryStatus.SENT, attempt, result.transportMessageIds(), null);
                }
                case PERMANENT_FAILURE -> {
                    log.warn("Message {} permanently rejected by {}: {}", messageId, targetId, result.error());
                    return new Attempt(DeliveryStatus.FAILED_PERMANENT, attempt, List.of(), result.error());
                }
                case TRANSIENT_FAILURE -> {
                    lastError = result.error();
                    if (attempt < maxAttempts) {
                        long delayMs = backoffMs(attempt, result.retryAfter());
                        log.debug("Attempt {} of message {} to {} failed ({}), retrying in {} ms", attempt,
                                messageId, targetId, lastError, delayMs);
                        TimeUnit.MILLISECONDS.sleep(delayMs);
                    }
                }
            }
        }
        log.warn("Message {} to {} failed after {} attempts: {}", messageId, targetId, maxAttempts, lastError);
        return new Attempt(DeliveryStatus.FAILED_TRANSIENT, maxAttempts, List.of(), lastError);
    }

    private SendResult send(RenderedContent content, String targetId) throws InterruptedException {
        try {
            SendResult result = transport.send(content, targetId);
            return result == null ? SendResult.transientFailure("Transport returned no result") : result;
        } catch (PermanentDeliveryException e) {
            return SendResult.permanentFailure(e.getMessage());
        } catch (TransientDeliveryException e) {
            return SendResult.transientFailure(e.getMessage(), e.getRetryAfter());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.debug("Transport threw {} for target {}", e.getClass().getName(), targetId, e);
            return SendResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    long backoffMs(int attempt, Duration retryAfter) {
        long delayMs = (long) (initialBackoffMs * Math.pow(backoffMultiplier, attempt - 1));
        if (retryAfter != null && retryAfter.toMillis() > delayMs) {
            return retryAfter.toMillis();
        }
        return delayMs;
    }

    /**
     * Stops starting new sends. Sends already running are allowed to finish
     * within the grace period, counted from the first call.
     */
    public void beginShutdown() {
        shutdownDeadlineNanos.compareAndSet(0L, System.nanoTime() + shutdownGracePeriod.toNanos());
        if (acceptingSends.compareAndSet(true, false)) {
            log.info("Dispatch engine stopped accepting new sends");
        }
    }

    @PreDestroy
    void shutdownExecutor() {
        beginShutdown();
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(remainingGrace().toNanos(), TimeUnit.NANOSECONDS)) {
                log.warn("Deliveries still running after {}, interrupting", shutdownGracePeriod);
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deliveryExecutor.shutdownNow();
        }
    }

    Duration remainingGrace() {
        long deadline = shutdownDeadlineNanos.get();
        if (deadline == 0L) {
            return shutdownGracePeriod;
        }
        return Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
    }

    private record Attempt(DeliveryStatus status, int attempts, List<String> transportMessageIds, String error) {
    }

    private record TargetResult(String targetId, DeliveryStatus status, boolean recorded, boolean replayed) {

        static TargetResult delivered(String targetId, DeliveryStatus status) {
            return new TargetResult(targetId, status, true, false);
        }

        static TargetResult replayed(String targetId, DeliveryStatus status) {
            return new TargetResult(targetId, status, true, true);
        }

        static TargetResult unrecorded(String targetId, DeliveryStatus status) {
            return new TargetResult(targetId, status, false, false);
        }

        static TargetResult abandoned(String targetId) {
            return new TargetResult(targetId, null, false, false);
        }
    }
}
