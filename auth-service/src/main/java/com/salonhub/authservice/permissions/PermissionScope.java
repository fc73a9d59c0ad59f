package com.salonhub.authservice.permissions;

import java.util.Optional;

public enum PermissionScope {
    /** Cross-tenant access. */
    ALL("all"),
    /** Access restricted to the caller's own tenant. */
    OWN("own");

    private final String suffix;

    PermissionScope(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    static Optional<PermissionScope> fromSuffix(String suffix) {
        for (PermissionScope scope : values()) {
            if (scope.suffix.equals(suffix)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
