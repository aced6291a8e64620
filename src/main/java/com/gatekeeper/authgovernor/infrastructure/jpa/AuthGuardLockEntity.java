package com.gatekeeper.authgovernor.infrastructure.jpa;

import jakarta.persistence.*;

import java.time.OffsetDateTime;

/**
 * Control row locked with SELECT ... FOR UPDATE to serialize work on one key.
 */
@Entity
@Table(name = "auth_guard_locks")
public class AuthGuardLockEntity {

    @Id
    @Column(name = "lock_key", length = 64)
    private String lockKey;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public AuthGuardLockEntity() {}

    public AuthGuardLockEntity(String lockKey, OffsetDateTime createdAt) {
        this.lockKey = lockKey;
        this.createdAt = createdAt;
    }

    public String getLockKey() { return lockKey; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
}
