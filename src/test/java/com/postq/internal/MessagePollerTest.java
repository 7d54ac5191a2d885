package com.postq.internal;

import com.postq.ScheduledMessage;
import com.postq.config.PostQProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MessagePollerTest {

    private MessageStore store;
    private MessageExecutor executor;
    private FatalErrorHandler fatalErrorHandler;
    private MessagePoller poller;

    @BeforeEach
    void setUp() {
        store = mock(MessageStore.class);
        executor = mock(MessageExecutor.class);
        fatalErrorHandler = mock(FatalErrorHandler.class);

        PostQProperties properties = new PostQProperties();
        properties.getScheduler().setBatchSize(10);
        properties.getScheduler().setMaxConsecutiveStoreFailures(3);
        poller = new MessagePoller(store, executor, fatalErrorHandler, properties);

        when(executor.availableSlots()).thenReturn(4);
        when(executor.submit(any(UUID.class), any(ClaimMode.class)))
                .thenReturn(CompletableFuture.completedFuture(null));
    }

    @Test
    void shouldHandDueMessagesToTheExecutor() {
        ScheduledMessage first = new ScheduledMessage(UUID.randomUUID(), "One", null);
        ScheduledMessage second = new ScheduledMessage(UUID.randomUUID(), "Two", null);
        when(store.fetchDue(any(OffsetDateTime.class), anyInt())).thenReturn(List.of(first, second));

        poller.poll();

        verify(executor).submit(first.getId(), ClaimMode.SCHEDULED);
        verify(executor).submit(second.getId(), ClaimMode.SCHEDULED);
    }

    @Test
    void shouldBoundTheFetchByFreeJobSlots() {
        when(store.fetchDue(any(OffsetDateTime.class), anyInt())).thenReturn(List.of());

        poller.poll();

        verify(store).fetchDue(any(OffsetDateTime.class), eq(4));
    }

    @Test
    void shouldBoundTheFetchByBatchSize() {
        when(executor.availableSlots()).thenReturn(50);
        when(store.fetchDue(any(OffsetDateTime.class), anyInt())).thenReturn(List.of());

        poller.poll();

        verify(store).fetchDue(any(OffsetDateTime.class), eq(10));
    }

    @Test
    void shouldSkipPollingWhenEveryJobSlotIsBusy() {
        when(executor.availableSlots()).thenReturn(0);

        assertEquals(0, poller.pollOnce());

        verify(store, never()).fetchDue(any(), anyInt());
    }

    @Test
    void shouldInvokeFatalHandlerAfterConsecutiveStoreFailures() {
        StoreIOException failure = new StoreIOException("connection refused", null);
        when(store.fetchDue(any(OffsetDateTime.class), anyInt())).thenThrow(failure);

        poller.poll();
        poller.poll();
        verify(fatalErrorHandler, never()).onFatalError(any(), any());

        poller.poll();
        poller.poll();

        verify(fatalErrorHandler, times(1)).onFatalError(any(), eq(failure));
        assertTrue(poller.isStopped());
        verify(store, times(3)).fetchDue(any(), anyInt());
    }

    @Test
    void shouldResetTheFailureCountAfterASuccessfulFetch() {
        StoreIOException failure = new StoreIOException("connection refused", null);
        when(store.fetchDue(any(OffsetDateTime.class), anyInt()))
                .thenThrow(failure)
                .thenThrow(failure)
                .thenReturn(List.of())
                .thenThrow(failure)
                .thenThrow(failure);

        for (int i = 0; i < 5; i++) {
            poller.poll();
        }

        verify(fatalErrorHandler, never()).onFatalError(any(), any());
        assertFalse(poller.isStopped());
    }

    @Test
    void shouldStopPollingAndShutDownTheExecutorOnStop() {
        poller.stop();
        poller.poll();

        verify(executor).beginShutdown();
        verify(store, never()).fetchDue(any(), anyInt());
    }
}
