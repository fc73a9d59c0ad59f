package com.salonhub.authservice.permissions;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable set of parsed permissions held by a principal. Strings that fail to parse are dropped.
 */
@Slf4j
public final class PermissionSet {

    private static final PermissionSet EMPTY = new PermissionSet(Set.of());

    private final Set<Permission> permissions;

    private PermissionSet(Set<Permission> permissions) {
        this.permissions = permissions;
    }

    public static PermissionSet empty() {
        return EMPTY;
    }

    public static PermissionSet parse(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Set<Permission> parsed = new LinkedHashSet<>();
        for (String value : values) {
            Permission.parse(value).ifPresentOrElse(parsed::add,
                    () -> log.warn("Ignoring malformed permission string: {}", value));
        }
        return new PermissionSet(Collections.unmodifiableSet(parsed));
    }

    public boolean contains(Permission permission) {
        return permissions.contains(permission);
    }

    public boolean contains(String value) {
        return Permission.parse(value).map(permissions::contains).orElse(false);
    }

    public boolean grants(String resource, String action, PermissionScope scope) {
        return permissions.contains(Permission.of(resource, action, scope));
    }

    public boolean containsAny(Collection<String> values) {
        return values.stream().anyMatch(this::contains);
    }

    public boolean containsAll(Collection<String> values) {
        return values.stream().allMatch(this::contains);
    }

    public Set<Permission> asSet() {
        return permissions;
    }

    public boolean isEmpty() {
        return permissions.isEmpty();
    }

    @Override
    public String toString() {
        return permissions.toString();
    }
}
