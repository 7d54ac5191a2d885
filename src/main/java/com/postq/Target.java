package com.postq;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

/**
 * A delivery destination known to the system. Rows are maintained by whatever
 * discovers targets on the messaging platform; PostQ only reads them.
 */
@Entity
@Table(name = "postq_targets")
public class Target {

    @Id
    @Column(name = "target_id")
    private String targetId;

    @Column(name = "title")
    private String title;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "last_seen_at")
    private OffsetDateTime lastSeenAt;

    public Target() {
    }

    public Target(String targetId, String title, boolean active) {
        this.targetId = targetId;
        this.title = title;
        this.active = active;
    }

    public String getTargetId() {
        return targetId;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public OffsetDateTime getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(OffsetDateTime lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }
}
