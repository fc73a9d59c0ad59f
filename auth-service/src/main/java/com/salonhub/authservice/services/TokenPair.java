package com.salonhub.authservice.services;

import lombok.ToString;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A freshly issued credential pair. The refresh token value exists only here and in the client's hands.
 */
@Value
public class TokenPair {

    @ToString.Exclude
    String accessToken;

    @ToString.Exclude
    String refreshToken;

    // access-token lifetime in seconds
    long expiresIn;

    LocalDateTime refreshTokenExpiresAt;
}
