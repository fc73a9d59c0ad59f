package com.salonhub.authservice.models;

import com.salonhub.authservice.permissions.TenantOwned;
import com.salonhub.authservice.tenancy.TenantContext;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A login identity. Email is unique per tenant only; a null tenant marks a super-admin.
 * failedLoginCount and lockedUntil are written exclusively by the lockout tracker's atomic update.
 */
@Entity
@Table(name = "app_users",
        uniqueConstraints = @UniqueConstraint(name = "uk_app_users_email_tenant", columnNames = {"email", "tenant_id"}),
        indexes = {
                @Index(name = "idx_app_users_tenant", columnList = "tenant_id"),
                @Index(name = "idx_app_users_email", columnList = "email")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAccount implements TenantOwned {

    public enum Status {
        ACTIVE,
        SUSPENDED,
        PENDING
    }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Email
    @Column(name = "email", nullable = false, length = 100)
    private String email;

    @ToString.Exclude
    @Column(name = "password_hash", nullable = false, length = 256)
    private String passwordHash;

    @Pattern(regexp = TenantContext.TENANT_ID_REGEX, message = "Invalid tenant id format")
    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private Role role;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "app_user_additional_permissions", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "permission", nullable = false, length = 128)
    private Set<String> additionalPermissions = new HashSet<>();

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status = Status.ACTIVE;

    @Builder.Default
    @Column(name = "failed_login_count", nullable = false)
    private int failedLoginCount = 0;

    @Column(name = "locked_until")
    private LocalDateTime lockedUntil;

    @Column(name = "last_login")
    private LocalDateTime lastLogin;

    @Builder.Default
    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isSuperAdmin() {
        return tenantId == null;
    }

    public boolean canAuthenticate() {
        return !deleted && status == Status.ACTIVE;
    }
}
