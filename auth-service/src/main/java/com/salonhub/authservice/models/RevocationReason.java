package com.salonhub.authservice.models;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;

public enum RevocationReason {
    ROTATED("rotated"),
    REUSE_DETECTED("reuse-detected"),
    LOGOUT("logout"),
    REVOKE_ALL("revoke-all");

    private final String value;

    RevocationReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RevocationReason fromValue(String value) {
        return Arrays.stream(values())
                .filter(reason -> reason.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown revocation reason: " + value));
    }

    /**
     * Persists the lowercase wire value ("rotated", "reuse-detected", ...) rather than the constant name.
     */
    @Converter
    public static class JpaConverter implements AttributeConverter<RevocationReason, String> {

        @Override
        public String convertToDatabaseColumn(RevocationReason attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public RevocationReason convertToEntityAttribute(String dbData) {
            return dbData == null ? null : fromValue(dbData);
        }
    }
}
