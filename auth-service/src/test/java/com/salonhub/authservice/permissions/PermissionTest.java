package com.salonhub.authservice.permissions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Permission strings")
class PermissionTest {

    @Nested
    @DisplayName("parse()")
    class Parse {

        @Test
        @DisplayName("reads resource, action and scope")
        void scoped() {
            Permission permission = Permission.parseStrict("users:read:own");

            assertThat(permission.getResource()).isEqualTo("users");
            assertThat(permission.getAction()).isEqualTo("read");
            assertThat(permission.scope()).isEqualTo(PermissionScope.OWN);
            assertThat(permission.toString()).isEqualTo("users:read:own");
        }

        @Test
        @DisplayName("two segments are a scope-agnostic permission")
        void unscoped() {
            Permission permission = Permission.parseStrict("audit:export");

            assertThat(permission.getQualifier()).isNull();
            assertThat(permission.scope()).isNull();
            assertThat(permission.hasScope()).isFalse();
        }

        @Test
        @DisplayName("other qualifiers are legal but carry no scope")
        void otherQualifier() {
            Permission permission = Permission.parseStrict("roles:create:system");

            assertThat(permission.getQualifier()).isEqualTo("system");
            assertThat(permission.scope()).isNull();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "users", "users:", ":read", "users:read:own:extra", "Users:read", "users read"})
        @DisplayName("malformed strings are rejected")
        void malformed(String value) {
            assertThat(Permission.parse(value)).isEmpty();
            assertThatThrownBy(() -> Permission.parseStrict(value)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("null is rejected")
        void nullValue() {
            assertThat(Permission.parse(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("PermissionSet")
    class Sets {

        @Test
        @DisplayName("drops malformed entries and keeps the rest")
        void dropsMalformed() {
            PermissionSet set = PermissionSet.parse(List.of("users:read:own", "not a permission", "roles:update:all"));

            assertThat(set.asSet()).containsExactlyInAnyOrder(
                    Permission.parseStrict("users:read:own"),
                    Permission.parseStrict("roles:update:all"));
        }

        @Test
        @DisplayName("grants() matches resource, action and scope exactly")
        void grants() {
            PermissionSet set = PermissionSet.parse(List.of("users:read:own"));

            assertThat(set.grants("users", "read", PermissionScope.OWN)).isTrue();
            assertThat(set.grants("users", "read", PermissionScope.ALL)).isFalse();
            assertThat(set.grants("users", "update", PermissionScope.OWN)).isFalse();
        }

        @Test
        @DisplayName("any/all checks")
        void anyAll() {
            PermissionSet set = PermissionSet.parse(List.of("users:read:own", "roles:read:own"));

            assertThat(set.containsAny(List.of("users:delete:own", "roles:read:own"))).isTrue();
            assertThat(set.containsAll(List.of("users:read:own", "roles:read:own"))).isTrue();
            assertThat(set.containsAll(List.of("users:read:own", "users:delete:own"))).isFalse();
        }

        @Test
        @DisplayName("null and empty input give the empty set")
        void empty() {
            assertThat(PermissionSet.parse(null).isEmpty()).isTrue();
            assertThat(PermissionSet.parse(List.of()).isEmpty()).isTrue();
        }
    }
}
