package com.postq.internal;

import com.postq.DeliveryStatus;
import com.postq.MessageStatus;
import com.postq.ScheduledMessageRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PostQMetricsTest {

    private ScheduledMessageRepository messageRepository;
    private MeterRegistry meterRegistry;
    private PostQMetrics postQMetrics;

    @BeforeEach
    void setUp() {
        messageRepository = mock(ScheduledMessageRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        postQMetrics = new PostQMetrics(messageRepository, meterRegistry);
    }

    @Test
    void shouldRegisterGaugesForMessageStatuses() {
        List<ScheduledMessageRepository.StatusCount> rows = List.of(
                count(MessageStatus.SCHEDULED, 12L),
                count(MessageStatus.RUNNING, 1L),
                count(MessageStatus.DONE, 40L));
        when(messageRepository.countByStatus()).thenReturn(rows);

        postQMetrics.registerMetrics();

        Gauge scheduledGauge = meterRegistry.find("postq.messages.count").tag("status", "SCHEDULED").gauge();
        assertThat(scheduledGauge).isNotNull();
        assertThat(scheduledGauge.value()).isEqualTo(12.0);

        Gauge endedGauge = meterRegistry.find("postq.messages.count").tag("status", "ENDED").gauge();
        assertThat(endedGauge).isNotNull();
        assertThat(endedGauge.value()).isEqualTo(0.0);

        Gauge totalGauge = meterRegistry.find("postq.messages.total").gauge();
        assertThat(totalGauge).isNotNull();
        assertThat(totalGauge.value()).isEqualTo(53.0);

        verify(messageRepository, times(1)).countByStatus();
    }

    @Test
    void shouldReportZeroWhenCountsCannotBeLoaded() {
        when(messageRepository.countByStatus()).thenThrow(new IllegalStateException("database down"));

        postQMetrics.registerMetrics();

        assertThat(meterRegistry.find("postq.messages.total").gauge().value()).isEqualTo(0.0);
    }

    @Test
    void shouldCountDeliveriesByStatus() {
        postQMetrics.registerMetrics();

        postQMetrics.recordDelivery(DeliveryStatus.SENT);
        postQMetrics.recordDelivery(DeliveryStatus.SENT);
        postQMetrics.recordDelivery(DeliveryStatus.FAILED_PERMANENT);

        Counter sent = meterRegistry.find("postq.deliveries").tag("status", "SENT").counter();
        Counter permanent = meterRegistry.find("postq.deliveries").tag("status", "FAILED_PERMANENT").counter();
        assertThat(sent).isNotNull();
        assertThat(sent.count()).isEqualTo(2.0);
        assertThat(permanent.count()).isEqualTo(1.0);
    }

    private ScheduledMessageRepository.StatusCount count(MessageStatus status, long messages) {
        ScheduledMessageRepository.StatusCount row = mock(ScheduledMessageRepository.StatusCount.class);
        when(row.getStatus()).thenReturn(status);
        when(row.getMessageCount()).thenReturn(messages);
        return row;
    }
}
