package com.postq.internal;

import com.postq.MessageStatus;
import com.postq.ScheduledMessage;
import com.postq.ScheduledMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

@Component
public class JpaMessageStore implements MessageStore {

    private static final Logger log = LoggerFactory.getLogger(JpaMessageStore.class);

    private final ScheduledMessageRepository repository;
    private final TransactionTemplate transactionTemplate;

    public JpaMessageStore(ScheduledMessageRepository repository, TransactionTemplate transactionTemplate) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public List<ScheduledMessage> fetchDue(OffsetDateTime now, int limit) {
        return storeCall("fetch due messages",
                () -> repository.findDue(now, PageRequest.of(0, Math.max(1, limit))));
    }

    @Override
    public ClaimResult claim(UUID id, String holder, OffsetDateTime now, OffsetDateTime leaseUntil, ClaimMode mode) {
        Integer updated = storeCall("claim message " + id, () -> transactionTemplate.execute(status -> switch (mode) {
            case SCHEDULED -> repository.claimDue(id, holder, leaseUntil, MessageStatus.RUNNING, now);
            case MANUAL -> repository.claimUnconditionally(id, holder, leaseUntil, MessageStatus.RUNNING, now);
        }));
        return toAffectedRows(updated) > 0 ? ClaimResult.CLAIMED : ClaimResult.ALREADY_CLAIMED;
    }

    @Override
    public Optional<ScheduledMessage> load(UUID id) {
        return storeCall("load message " + id, () -> repository.findById(id));
    }

    @Override
    public boolean renew(UUID id, String holder, OffsetDateTime leaseUntil) {
        Integer updated = storeCall("renew lease of message " + id,
                () -> transactionTemplate.execute(status -> repository.renewLease(id, holder, leaseUntil)));
        return toAffectedRows(updated) > 0;
    }

    @Override
    public void release(UUID id, String holder, MessageStatus restoreStatus) {
        Integer updated = storeCall("release message " + id, () -> transactionTemplate
                .execute(status -> repository.releaseLease(id, holder, restoreStatus, OffsetDateTime.now())));
        if (toAffectedRows(updated) == 0) {
            log.debug("Lease on message {} was no longer held by {} at release", id, holder);
        }
    }

    @Override
    public boolean persistResult(UUID id, String holder, Reconciliation reconciliation) {
        OffsetDateTime now = OffsetDateTime.now();
        Integer updated = storeCall("persist result of message " + id, () -> transactionTemplate.execute(status -> {
            if (reconciliation.disable()) {
                return repository.completeExecutionAndDisable(id, holder, reconciliation.status(),
                        reconciliation.lastOutcome(), reconciliation.nextRunAt(), reconciliation.lastRunAt(),
                        reconciliation.lastError(), now);
            }
            return repository.completeExecution(id, holder, reconciliation.status(), reconciliation.lastOutcome(),
                    reconciliation.nextRunAt(), reconciliation.lastRunAt(), reconciliation.lastError(), now);
        }));
        return toAffectedRows(updated) > 0;
    }

    private <T> T storeCall(String description, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StoreIOException("Failed to " + description, e);
        }
    }

    private int toAffectedRows(Integer updatedRows) {
        return updatedRows == null ? 0 : updatedRows;
    }
}
