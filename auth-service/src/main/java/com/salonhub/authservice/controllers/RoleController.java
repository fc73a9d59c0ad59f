package com.salonhub.authservice.controllers;

import com.salonhub.authservice.dto.roles.RoleResponse;
import com.salonhub.authservice.dto.roles.UpdateRolePermissionsRequest;
import com.salonhub.authservice.security.AuthenticatedPrincipal;
import com.salonhub.authservice.services.RolePermissionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/roles")
@RequiredArgsConstructor
public class RoleController {

    private final RolePermissionService rolePermissionService;

    /**
     * Roles the caller can see: system roles plus their own tenant's, or all of them for a super-admin.
     */
    @GetMapping
    public ResponseEntity<List<RoleResponse>> listRoles(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        List<RoleResponse> roles = rolePermissionService.findVisibleRoles(principal).stream()
                .map(RoleResponse::from)
                .toList();
        return ResponseEntity.ok(roles);
    }

    @PutMapping("/{roleId}/permissions")
    public ResponseEntity<RoleResponse> replacePermissions(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                           @PathVariable UUID roleId,
                                                           @RequestBody @Valid UpdateRolePermissionsRequest request) {
        return ResponseEntity.ok(RoleResponse.from(
                rolePermissionService.replacePermissions(principal, roleId, request.getPermissions())));
    }
}
