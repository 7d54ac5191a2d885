package com.postq;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one execution of a message for one target. The
 * (message, execution, target) triple is unique, which is what makes a replayed
 * execution skip targets it already handled.
 */
@Entity
@Table(name = "postq_deliveries", uniqueConstraints = @UniqueConstraint(name = "uq_postq_deliveries_execution_target",
        columnNames = { "message_id", "execution_id", "target_id" }))
public class DeliveryRecord {

    @Id
    private UUID id;

    @Column(name = "message_id", nullable = false)
    private UUID messageId;

    @Column(name = "execution_id", nullable = false)
    private String executionId;

    @Column(name = "target_id", nullable = false)
    private String targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private DeliveryStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "transport_message_ids", columnDefinition = "jsonb")
    private List<String> transportMessageIds = new ArrayList<>();

    @Column(name = "error", columnDefinition = "text")
    private String error;

    @Column(name = "recorded_at", nullable = false)
    private OffsetDateTime recordedAt;

    public DeliveryRecord() {
    }

    public DeliveryRecord(UUID id, UUID messageId, String executionId, String targetId, DeliveryStatus status,
            int attempts, List<String> transportMessageIds, String error, OffsetDateTime recordedAt) {
        this.id = id;
        this.messageId = messageId;
        this.executionId = executionId;
        this.targetId = targetId;
        this.status = status;
        this.attempts = attempts;
        this.transportMessageIds = transportMessageIds == null ? new ArrayList<>() : new ArrayList<>(transportMessageIds);
        this.error = error;
        this.recordedAt = recordedAt;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getMessageId() {
        return messageId;
    }

    public void setMessageId(UUID messageId) {
        this.messageId = messageId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public void setExecutionId(String executionId) {
        this.executionId = executionId;
    }

    public String getTargetId() {
        return targetId;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    public DeliveryStatus getStatus() {
        return status;
    }

    public void setStatus(DeliveryStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public List<String> getTransportMessageIds() {
        return transportMessageIds;
    }

    public void setTransportMessageIds(List<String> transportMessageIds) {
        this.transportMessageIds = transportMessageIds;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public OffsetDateTime getRecordedAt() {
        return recordedAt;
    }

    public void setRecordedAt(OffsetDateTime recordedAt) {
        this.recordedAt = recordedAt;
    }
}
