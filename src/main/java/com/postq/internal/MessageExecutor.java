package com.postq.internal;

import com.postq.MessageStatus;
import com.postq.ScheduledMessage;
import com.postq.TargetResolver;
import com.postq.config.PostQProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs executions of scheduled messages on a bounded job pool. One execution
 * claims the message, resolves its targets, dispatches, and then either stores
 * the reconciled state or releases the claim for a replay.
 */
@Component
public class MessageExecutor {

    private static final Logger log = LoggerFactory.getLogger(MessageExecutor.class);

    private final MessageStore store;
    private final TargetResolver targetResolver;
    private final DispatchEngine dispatchEngine;
    private final LifecycleReconciler reconciler;
    private final Duration leaseDuration;
    private final Duration shutdownGracePeriod;
    private final int jobConcurrency;
    private final ThreadPoolExecutor jobExecutor;
    private final ScheduledExecutorService leaseRenewer;
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicLong shutdownDeadlineNanos = new AtomicLong();

    private final String nodeId = "node-" + UUID.randomUUID();

    public MessageExecutor(
            MessageStore store,
            TargetResolver targetResolver,
            DispatchEngine dispatchEngine,
            LifecycleReconciler reconciler,
            PostQProperties properties) {
        this.store = store;
        this.targetResolver = targetResolver;
        this.dispatchEngine = dispatchEngine;
        this.reconciler = reconciler;
        this.leaseDuration = Durations.parse(properties.getScheduler().getLeaseDuration());
        this.shutdownGracePeriod = Durations.parse(properties.getScheduler().getShutdownGracePeriod());
        this.jobConcurrency = Math.max(1, properties.getScheduler().getJobConcurrency());

        this.jobExecutor = new ThreadPoolExecutor(
                jobConcurrency,
                jobConcurrency,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new CustomizableThreadFactory("postq-job-"));
        CustomizableThreadFactory renewerThreads = new CustomizableThreadFactory("postq-lease-");
        renewerThreads.setDaemon(true);
        this.leaseRenewer = Executors.newSingleThreadScheduledExecutor(renewerThreads);
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * Job pool slots that are neither running nor queued.
     */
    public int availableSlots() {
        int inFlight = jobExecutor.getActiveCount() + jobExecutor.getQueue().size();
        return jobConcurrency - inFlight;
    }

    public CompletableFuture<ExecutionReport> submit(UUID messageId, ClaimMode mode) {
        if (stopping.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("PostQ is shutting down"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> execute(messageId, mode), jobExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("PostQ is shutting down", e));
        }
    }

    public ExecutionReport execute(UUID messageId, ClaimMode mode) {
        MessageStatus statusBeforeClaim;
        try {
            Optional<ScheduledMessage> snapshot = store.load(messageId);
            if (snapshot.isEmpty()) {
                log.debug("Message {} no longer exists", messageId);
                return ExecutionReport.notFound(messageId);
            }
            statusBeforeClaim = restorableStatus(snapshot.get().getStatus());
        } catch (StoreIOException e) {
            log.warn("Could not load message {}: {}", messageId, e.getMessage());
            return ExecutionReport.storeFailure(messageId, null, e.getMessage());
        }

        OffsetDateTime claimedAt = OffsetDateTime.now();
        ClaimResult claim;
        try {
            claim = store.claim(messageId, nodeId, claimedAt, claimedAt.plus(leaseDuration), mode);
        } catch (StoreIOException e) {
            log.warn("Could not claim message {}: {}", messageId, e.getMessage());
            return ExecutionReport.storeFailure(messageId, null, e.getMessage());
        }
        if (claim == ClaimResult.ALREADY_CLAIMED) {
            log.debug("Message {} is claimed elsewhere or no longer due, skipping", messageId);
            return ExecutionReport.skipped(messageId);
        }

        ScheduledMessage message;
        try {
            message = store.load(messageId).orElse(null);
        } catch (StoreIOException e) {
            log.warn("Claimed message {} but could not reload it: {}", messageId, e.getMessage());
            return ExecutionReport.storeFailure(messageId, null, e.getMessage());
        }
        if (message == null) {
            log.debug("Message {} was deleted after being claimed", messageId);
            return ExecutionReport.notFound(messageId);
        }

        OffsetDateTime slot = mode == ClaimMode.SCHEDULED && message.getNextRunAt() != null
                ? message.getNextRunAt()
                : claimedAt;
        String executionId = mode == ClaimMode.SCHEDULED
                ? "scheduled:" + slot.toInstant()
                : "manual:" + UUID.randomUUID();
        log.debug("Claimed message {} for execution {} on {}", messageId, executionId, nodeId);

        return runClaimed(message, executionId, slot, statusBeforeClaim);
    }

    private ExecutionReport runClaimed(ScheduledMessage message, String executionId, OffsetDateTime slot,
            MessageStatus statusBeforeClaim) {
        UUID messageId = message.getId();
        ScheduledFuture<?> renewal = scheduleLeaseRenewal(messageId);
        DispatchOutcome outcome;
        try {
            Set<String> targets = targetResolver.resolve(message);
            outcome = dispatchEngine.dispatch(message, executionId, targets);
        } catch (StoreIOException e) {
            log.warn("Store failure while dispatching message {} execution {}: {}", messageId, executionId,
                    e.getMessage());
            releaseQuietly(messageId, statusBeforeClaim);
            return ExecutionReport.storeFailure(messageId, executionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while dispatching message {} execution {}", messageId, executionId, e);
            releaseQuietly(messageId, statusBeforeClaim);
            return new ExecutionReport(messageId, executionId, ExecutionReport.Disposition.FAILED, null, null,
                    e.getMessage());
        } finally {
            renewal.cancel(false);
        }

        if (!outcome.isComplete()) {
            log.info("Message {} execution {} left {} targets without an outcome, releasing it for a replay",
                    messageId, executionId, outcome.incompleteTargets().size());
            releaseQuietly(messageId, statusBeforeClaim);
            return new ExecutionReport(messageId, executionId, ExecutionReport.Disposition.INCOMPLETE, null,
                    outcome, null);
        }

        Reconciliation reconciliation = reconciler.reconcile(message, outcome, slot, OffsetDateTime.now());
        try {
            if (!store.persistResult(messageId, nodeId, reconciliation)) {
                log.warn("Lease on message {} was lost before execution {} could be stored", messageId,
                        executionId);
                return new ExecutionReport(messageId, executionId, ExecutionReport.Disposition.LEASE_LOST, null,
                        outcome, null);
            }
        } catch (StoreIOException e) {
            log.warn("Could not store result of message {} execution {}: {}", messageId, executionId,
                    e.getMessage());
            return ExecutionReport.storeFailure(messageId, executionId, e.getMessage());
        }

        log.info("Message {} execution {} completed as {}, next run {}", messageId, executionId,
                reconciliation.status(), reconciliation.nextRunAt());
        return new ExecutionReport(messageId, executionId, ExecutionReport.Disposition.COMPLETED,
                reconciliation.status(), outcome, reconciliation.lastError());
    }

    private ScheduledFuture<?> scheduleLeaseRenewal(UUID messageId) {
        long periodMs = Math.max(1, leaseDuration.toMillis() / 3);
        return leaseRenewer.scheduleAtFixedRate(() -> renewLease(messageId), periodMs, periodMs,
                TimeUnit.MILLISECONDS);
    }

    private void renewLease(UUID messageId) {
        try {
            if (!store.renew(messageId, nodeId, OffsetDateTime.now().plus(leaseDuration))) {
                log.warn("Lease on message {} is no longer held by {}", messageId, nodeId);
            }
        } catch (StoreIOException e) {
            log.warn("Could not renew lease on message {}: {}", messageId, e.getMessage());
        }
    }

    private void releaseQuietly(UUID messageId, MessageStatus restoreStatus) {
        try {
            store.release(messageId, nodeId, restoreStatus);
        } catch (StoreIOException e) {
            log.warn("Could not release message {}, its lease will expire: {}", messageId, e.getMessage());
        }
    }

    private MessageStatus restorableStatus(MessageStatus status) {
        // A RUNNING snapshot belongs to an expired lease.
        return status == null || status == MessageStatus.RUNNING ? MessageStatus.SCHEDULED : status;
    }

    /**
     * Stops accepting executions and tells the dispatch engine to stop starting
     * sends. Running executions finish or release their claim within one grace
     * period, shared with the dispatch engine.
     */
    public void beginShutdown() {
        shutdownDeadlineNanos.compareAndSet(0L, System.nanoTime() + shutdownGracePeriod.toNanos());
        if (stopping.compareAndSet(false, true)) {
            log.info("Message executor on {} is shutting down", nodeId);
            dispatchEngine.beginShutdown();
            jobExecutor.shutdown();
        }
    }

    @PreDestroy
    void shutdownExecutor() {
        beginShutdown();
        try {
            long remaining = Math.max(0L, shutdownDeadlineNanos.get() - System.nanoTime());
            if (!jobExecutor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                log.warn("Executions still running after {}, interrupting", shutdownGracePeriod);
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobExecutor.shutdownNow();
        } finally {
            leaseRenewer.shutdownNow();
        }
    }
}
