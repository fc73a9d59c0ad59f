package com.salonhub.authservice.dto.roles;

import com.salonhub.authservice.models.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoleResponse {

    private UUID id;

    private String name;

    private String tenantId;

    private boolean system;

    private List<String> permissions;

    public static RoleResponse from(Role role) {
        return RoleResponse.builder()
                .id(role.getId())
                .name(role.getName())
                .tenantId(role.getTenantId())
                .system(role.isSystem())
                .permissions(role.getPermissions().stream().sorted().toList())
                .build();
    }
}
