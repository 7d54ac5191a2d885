package com.postq.internal;

import com.postq.MessageStatus;
import com.postq.ScheduledMessage;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence operations the scheduler relies on. Every mutation is a single
 * conditional update; callers never read-then-write. Implementations report
 * storage failures as {@link StoreIOException}.
 */
public interface MessageStore {

    /**
     * Enabled messages due at {@code now} that nobody holds a live lease on,
     * oldest first.
     */
    List<ScheduledMessage> fetchDue(OffsetDateTime now, int limit);

    ClaimResult claim(UUID id, String holder, OffsetDateTime now, OffsetDateTime leaseUntil, ClaimMode mode);

    Optional<ScheduledMessage> load(UUID id);

    /**
     * Extends the lease. Returns {@code false} when {@code holder} no longer owns it.
     */
    boolean renew(UUID id, String holder, OffsetDateTime leaseUntil);

    /**
     * Drops the lease without recording an outcome.
     */
    void release(UUID id, String holder, MessageStatus restoreStatus);

    /**
     * Stores the outcome of an execution and drops the lease. Returns
     * {@code false} when {@code holder} no longer owns the lease.
     */
    boolean persistResult(UUID id, String holder, Reconciliation reconciliation);
}
