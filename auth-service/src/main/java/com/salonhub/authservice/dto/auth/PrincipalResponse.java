package com.salonhub.authservice.dto.auth;

import com.salonhub.authservice.security.AuthenticatedPrincipal;
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
public class PrincipalResponse {

    private UUID userId;

    private String email;

    // null for super-admins
    private String tenantId;

    private UUID roleId;

    private List<String> permissions;

    public static PrincipalResponse from(AuthenticatedPrincipal principal) {
        return PrincipalResponse.builder()
                .userId(principal.getUserId())
                .email(principal.getEmail())
                .tenantId(principal.getTenantId())
                .roleId(principal.getRoleId())
                .permissions(principal.getPermissions().stream().sorted().toList())
                .build();
    }
}
