package com.salonhub.authservice.configurations;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class JwtConfig {

    private final AuthProperties authProperties;

    /**
     * RSA key pair for access-token signatures. Falls back to an ephemeral pair when no PEM files are
     * configured, which invalidates every outstanding access token on restart.
     */
    @Bean
    public KeyPair jwtSigningKeyPair() {
        Resource publicKeyResource = authProperties.getJwt().getPublicKey();
        Resource privateKeyResource = authProperties.getJwt().getPrivateKey();
        try {
            if (publicKeyResource != null && privateKeyResource != null
                    && publicKeyResource.exists() && privateKeyResource.exists()) {
                log.info("Loading JWT signing keys from {}", publicKeyResource.getDescription());
                return new KeyPair(readPublicKey(publicKeyResource), readPrivateKey(privateKeyResource));
            }

            log.warn("No JWT key files configured, generating an ephemeral RSA key pair");
            KeyPairGenerator keyPairGenerator = KeyPairGenerator.getInstance("RSA");
            keyPairGenerator.initialize(2048);
            return keyPairGenerator.generateKeyPair();
        } catch (Exception e) {
            throw new IllegalStateException("Unable to load RSA key pair", e);
        }
    }

    @Bean
    public JWKSource<SecurityContext> jwkSource(KeyPair jwtSigningKeyPair) {
        JWK jwk = new RSAKey.Builder((RSAPublicKey) jwtSigningKeyPair.getPublic())
                .privateKey((RSAPrivateKey) jwtSigningKeyPair.getPrivate())
                .build();
        return new ImmutableJWKSet<>(new JWKSet(jwk));
    }

    @Bean
    public JwtEncoder jwtEncoder(JWKSource<SecurityContext> jwkSource) {
        return new NimbusJwtEncoder(jwkSource);
    }

    /**
     * Verifies signature, issuer and expiry. Expiry is judged against the application clock with no
     * skew allowance, since issuer and verifier are the same process.
     */
    @Bean
    public JwtDecoder jwtDecoder(KeyPair jwtSigningKeyPair, Clock clock) {
        NimbusJwtDecoder decoder = NimbusJwtDecoder
                .withPublicKey((RSAPublicKey) jwtSigningKeyPair.getPublic())
                .build();

        JwtTimestampValidator timestampValidator = new JwtTimestampValidator(Duration.ZERO);
        timestampValidator.setClock(clock);
        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
                timestampValidator,
                new JwtIssuerValidator(authProperties.getJwt().getIssuer())));
        return decoder;
    }

    private RSAPublicKey readPublicKey(Resource resource) throws Exception {
        byte[] keyBytes = readPem(resource, "PUBLIC KEY");
        return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(keyBytes));
    }

    private RSAPrivateKey readPrivateKey(Resource resource) throws Exception {
        byte[] keyBytes = readPem(resource, "PRIVATE KEY");
        return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(keyBytes));
    }

    private byte[] readPem(Resource resource, String label) throws Exception {
        try (InputStream is = resource.getInputStream()) {
            String key = new String(is.readAllBytes(), StandardCharsets.UTF_8)
                    .replace("-----BEGIN " + label + "-----", "")
                    .replace("-----END " + label + "-----", "")
                    .replaceAll("\\s", "");
            return Base64.getDecoder().decode(key);
        }
    }
}
