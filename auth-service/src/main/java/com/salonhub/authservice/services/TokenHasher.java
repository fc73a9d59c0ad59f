package com.salonhub.authservice.services;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Digest under which refresh tokens are stored and looked up. The raw value never reaches the database,
 * and a lookup is an exact match on the 64-character lowercase hex form.
 */
@Component
public class TokenHasher {

    private static final String ALGORITHM = "SHA-256";

    public String digest(String rawToken) {
        Objects.requireNonNull(rawToken, "rawToken");
        return HexFormat.of().formatHex(newDigest().digest(rawToken.getBytes(StandardCharsets.UTF_8)));
    }

    // MessageDigest is not thread-safe, so each call gets its own
    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
