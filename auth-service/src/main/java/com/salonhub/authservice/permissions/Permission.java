package com.salonhub.authservice.permissions;

import lombok.Value;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsed form of a {@code <resource>:<action>[:<qualifier>]} permission string.
 *
 * <p>Only the qualifiers {@code all} and {@code own} carry a {@link PermissionScope}. Other
 * qualifiers ({@code roles:create:system}, {@code impersonate:any}) are legal but unscoped, and
 * never pass an entity-level check.
 */
@Value
public class Permission {

    private static final Pattern SEGMENT = Pattern.compile("[a-z][a-z0-9_-]*");

    String resource;
    String action;
    // third segment, null when absent
    String qualifier;

    public Permission(String resource, String action, String qualifier) {
        this.resource = Objects.requireNonNull(resource, "resource");
        this.action = Objects.requireNonNull(action, "action");
        this.qualifier = qualifier;
    }

    public static Permission of(String resource, String action, PermissionScope scope) {
        return new Permission(resource, action, scope == null ? null : scope.suffix());
    }

    /**
     * Parses a permission string.
     *
     * @return the permission, or empty if the string is malformed
     */
    public static Optional<Permission> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String[] parts = value.trim().split(":", -1);
        if (parts.length < 2 || parts.length > 3) {
            return Optional.empty();
        }
        for (String part : parts) {
            if (!SEGMENT.matcher(part).matches()) {
                return Optional.empty();
            }
        }
        return Optional.of(new Permission(parts[0], parts[1], parts.length == 3 ? parts[2] : null));
    }

    /**
     * Parses a permission string, rejecting malformed input.
     *
     * @throws IllegalArgumentException if the string is not a valid permission
     */
    public static Permission parseStrict(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Malformed permission: " + value));
    }

    /**
     * @return {@link PermissionScope#ALL}, {@link PermissionScope#OWN}, or {@code null} when the
     *         qualifier is absent or not a recognised scope
     */
    public PermissionScope scope() {
        return qualifier == null ? null : PermissionScope.fromSuffix(qualifier).orElse(null);
    }

    public boolean hasScope() {
        return scope() != null;
    }

    public boolean appliesTo(String resource, String action) {
        return this.resource.equals(resource) && this.action.equals(action);
    }

    @Override
    public String toString() {
        return qualifier == null ? resource + ":" + action : resource + ":" + action + ":" + qualifier;
    }
}
