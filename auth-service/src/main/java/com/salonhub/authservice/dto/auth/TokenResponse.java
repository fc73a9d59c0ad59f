package com.salonhub.authservice.dto.auth;

import com.salonhub.authservice.services.TokenPair;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    private String accessToken;

    private String refreshToken;

    @Builder.Default
    private String tokenType = "Bearer";

    // seconds
    private long expiresIn;

    public static TokenResponse from(TokenPair pair) {
        return TokenResponse.builder()
                .accessToken(pair.getAccessToken())
                .refreshToken(pair.getRefreshToken())
                .expiresIn(pair.getExpiresIn())
                .build();
    }
}
