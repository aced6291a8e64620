// ==============================================================================
// UserEntity.java - Account with device cap and password reset state
// File: src/main/java/com/gatekeeper/authgovernor/infrastructure/jpa/UserEntity.java
// ==============================================================================

package com.gatekeeper.authgovernor.infrastructure.jpa;

import com.gatekeeper.authgovernor.domain.UserType;
import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "users")
public class UserEntity {

    @Id
    private UUID id;

    @Column(name = "phone_number", nullable = false, unique = true, length = 20)
    private String phoneNumber;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "full_name", length = 150)
    private String fullName;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_type", nullable = false, length = 20)
    private UserType userType = UserType.STUDENT;

    @Column(name = "max_allowed_devices", nullable = false)
    private int maxAllowedDevices = 2;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_roles", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "role", nullable = false, length = 32)
    private Set<String> roles = new HashSet<>();

    // ===============================================================================
    // PASSWORD RESET
    // ===============================================================================

    @Column(name = "reset_code_hash", length = 100)
    private String resetCodeHash;

    @Column(name = "reset_code_issued_at")
    private OffsetDateTime resetCodeIssuedAt;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getPhoneNumber() { return phoneNumber; }
    public void setPhoneNumber(String phoneNumber) { this.phoneNumber = phoneNumber; }

    public String getPasswordHash() { return passwordHash; }
    public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }

    public String getFullName() { return fullName; }
    public void setFullName(String fullName) { this.fullName = fullName; }

    public UserType getUserType() { return userType; }
    public void setUserType(UserType userType) { this.userType = userType; }

    public int getMaxAllowedDevices() { return maxAllowedDevices; }
    public void setMaxAllowedDevices(int maxAllowedDevices) { this.maxAllowedDevices = maxAllowedDevices; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public Set<String> getRoles() { return roles; }
    public void setRoles(Set<String> roles) { this.roles = roles; }

    public String getResetCodeHash() { return resetCodeHash; }
    public void setResetCodeHash(String resetCodeHash) { this.resetCodeHash = resetCodeHash; }

    public OffsetDateTime getResetCodeIssuedAt() { return resetCodeIssuedAt; }
    public void setResetCodeIssuedAt(OffsetDateTime resetCodeIssuedAt) { this.resetCodeIssuedAt = resetCodeIssuedAt; }

    public void clearResetCode() {
        this.resetCodeHash = null;
        this.resetCodeIssuedAt = null;
    }

    @Override
    public String toString() {
        return "UserEntity{" +
                "id=" + id +
                ", userType=" + userType +
                ", maxAllowedDevices=" + maxAllowedDevices +
                ", roles=" + roles +
                ", createdAt=" + createdAt +
                '}';
    }
}
