package com.library.circulation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import java.time.Instant;

/**
 * Shared superclass for the mutable circulation entities (books, copies, students,
 * borrow records).
 *
 * <p>{@code created_at} is written once on insert; {@code updated_at} is refreshed by
 * {@link #onUpdate()} on every dirty flush. These are row-maintenance timestamps only.
 * Business instants such as {@code borrow_date} or {@code blacklist_until} live on the
 * concrete entities and come from the injected {@link java.time.Clock}.
 *
 * <p>{@link AdminAction} does not extend this class; audit rows are never updated.
 */
@MappedSuperclass
public abstract class BaseEntity {

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected BaseEntity() {}

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
