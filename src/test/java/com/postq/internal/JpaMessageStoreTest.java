package com.postq.internal;

import com.postq.MessageStatus;
import com.postq.ScheduledMessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JpaMessageStoreTest {

    private static final UUID ID = UUID.randomUUID();

    private ScheduledMessageRepository repository;
    private JpaMessageStore store;

    @BeforeEach
    void setUp() {
        repository = mock(ScheduledMessageRepository.class);
        PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        store = new JpaMessageStore(repository, new TransactionTemplate(transactionManager));
    }

    @Test
    void shouldClaimDueMessagesConditionally() {
        OffsetDateTime now = OffsetDateTime.now();
        when(repository.claimDue(eq(ID), eq("node-a"), any(), eq(MessageStatus.RUNNING), eq(now))).thenReturn(1);

        ClaimResult result = store.claim(ID, "node-a", now, now.plusMinutes(10), ClaimMode.SCHEDULED);

        assertThat(result).isEqualTo(ClaimResult.CLAIMED);
        verify(repository, never()).claimUnconditionally(any(), anyString(), any(), any(), any());
    }

    @Test
    void shouldReportAlreadyClaimedWhenNoRowWasUpdated() {
        OffsetDateTime now = OffsetDateTime.now();
        when(repository.claimUnconditionally(eq(ID), eq("node-a"), any(), eq(MessageStatus.RUNNING), eq(now)))
                .thenReturn(0);

        assertThat(store.claim(ID, "node-a", now, now.plusMinutes(10), ClaimMode.MANUAL))
                .isEqualTo(ClaimResult.ALREADY_CLAIMED);
    }

    @Test
    void shouldDisableWhenTheReconciliationSaysSo() {
        OffsetDateTime now = OffsetDateTime.now();
        Reconciliation done = new Reconciliation(MessageStatus.DONE, MessageStatus.SENT, true, null, now, null);
        when(repository.completeExecutionAndDisable(eq(ID), eq("node-a"), eq(MessageStatus.DONE),
                eq(MessageStatus.SENT), any(), eq(now), any(), any())).thenReturn(1);

        assertThat(store.persistResult(ID, "node-a", done)).isTrue();
        verify(repository, never()).completeExecution(any(), anyString(), any(), any(), any(), any(), any(), any());
    }

    @Test
    void shouldReportALostLeaseWhenTheResultWasNotStored() {
        OffsetDateTime now = OffsetDateTime.now();
        Reconciliation next = new Reconciliation(MessageStatus.SCHEDULED, MessageStatus.SENT, false,
                now.plusDays(1), now, null);
        when(repository.completeExecution(eq(ID), eq("node-a"), eq(MessageStatus.SCHEDULED), eq(MessageStatus.SENT),
                any(), eq(now), any(), any())).thenReturn(0);

        assertThat(store.persistResult(ID, "node-a", next)).isFalse();
    }

    @Test
    void shouldTranslateDataAccessFailures() {
        when(repository.renewLease(eq(ID), eq("node-a"), any())).thenThrow(new CannotAcquireLockException("locked"));

        assertThatThrownBy(() -> store.renew(ID, "node-a", OffsetDateTime.now().plusMinutes(10)))
                .isInstanceOf(StoreIOException.class)
                .hasMessageContaining("renew lease of message " + ID);
    }
}
