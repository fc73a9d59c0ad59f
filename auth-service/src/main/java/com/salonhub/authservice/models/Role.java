package com.salonhub.authservice.models;

import com.salonhub.authservice.permissions.TenantOwned;
import com.salonhub.authservice.tenancy.TenantContext;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "roles",
        uniqueConstraints = @UniqueConstraint(name = "uk_roles_name_tenant", columnNames = {"name", "tenant_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Role implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotBlank(message = "Role name is required")
    @Column(nullable = false, length = 64)
    private String name;

    // null = system-wide role (super-admin, tenant-admin template)
    @Pattern(regexp = TenantContext.TENANT_ID_REGEX, message = "Invalid tenant id format")
    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "role_permissions", joinColumns = @JoinColumn(name = "role_id"))
    @Column(name = "permission", nullable = false, length = 128)
    private Set<String> permissions = new HashSet<>();

    @Builder.Default
    @Column(name = "is_system", nullable = false)
    private boolean system = false;
}
