package com.salonhub.authservice.services.userlogin;

import com.salonhub.authservice.exceptions.InvalidTokenException;
import com.salonhub.authservice.exceptions.TokenExpiredException;
import com.salonhub.authservice.exceptions.TokenReuseDetectedException;
import com.salonhub.authservice.models.RefreshToken;
import com.salonhub.authservice.models.RevocationReason;
import com.salonhub.authservice.models.Role;
import com.salonhub.authservice.models.SecurityEvent;
import com.salonhub.authservice.models.UserAccount;
import com.salonhub.authservice.services.ClientContext;
import com.salonhub.authservice.services.TokenHasher;
import com.salonhub.authservice.services.TokenIssuer;
import com.salonhub.authservice.services.TokenPair;
import com.salonhub.authservice.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenRotationEngine against the database")
class TokenRotationEngineIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private TokenRotationEngine rotationEngine;

    @Autowired
    private TokenIssuer tokenIssuer;

    @Autowired
    private TokenHasher tokenHasher;

    private final ClientContext laptop = new ClientContext("198.51.100.4", "Firefox on laptop");
    private final ClientContext attacker = new ClientContext("203.0.113.66", "curl/8.0");

    private UserAccount user;

    @BeforeEach
    void createUser() {
        Role role = createRole("stylist", "t1", false, "users:read:own");
        user = createUser("ana@salon.test", "t1", role);
    }

    private RefreshToken row(String refreshToken) {
        return refreshTokenRepository.findByTokenHash(tokenHasher.digest(refreshToken)).orElseThrow();
    }

    @Nested
    @DisplayName("single rotation")
    class SingleRotation {

        @Test
        @DisplayName("revokes the old row as rotated and stores one new active row")
        void rotates() {
            TokenPair original = tokenIssuer.issue(user, laptop);

            TokenPair rotated = rotationEngine.rotate(original.getRefreshToken(), laptop);

            assertThat(rotated.getRefreshToken()).isNotEqualTo(original.getRefreshToken());
            RefreshToken old = row(original.getRefreshToken());
            assertThat(old.isRevoked()).isTrue();
            assertThat(old.getRevokedReason()).isEqualTo(RevocationReason.ROTATED);
            assertThat(old.getRevokedAt()).isEqualTo(now());
            assertThat(row(rotated.getRefreshToken()).isRevoked()).isFalse();
            assertThat(refreshTokenRepository.countByUser_IdAndRevokedFalse(user.getId())).isEqualTo(1);
        }

        @Test
        @DisplayName("carries device info and IP address from the old row, not from the caller")
        void copiesDeviceInfo() {
            TokenPair original = tokenIssuer.issue(user, laptop);

            TokenPair rotated = rotationEngine.rotate(original.getRefreshToken(), attacker);

            RefreshToken next = row(rotated.getRefreshToken());
            assertThat(next.getDeviceInfo()).isEqualTo("Firefox on laptop");
            assertThat(next.getIpAddress()).isEqualTo("198.51.100.4");
        }

        @Test
        @DisplayName("unknown token is invalid")
        void unknownToken() {
            assertThatThrownBy(() -> rotationEngine.rotate("not-a-token", laptop))
                    .isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> rotationEngine.rotate(" ", laptop))
                    .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("expired token fails without being revoked")
        void expired() {
            TokenPair original = tokenIssuer.issue(user, laptop);
            clock.advance(Duration.ofDays(8));

            assertThatThrownBy(() -> rotationEngine.rotate(original.getRefreshToken(), laptop))
                    .isInstanceOf(TokenExpiredException.class);

            assertThat(row(original.getRefreshToken()).isRevoked()).isFalse();
        }

        @Test
        @DisplayName("owner that was deleted or suspended cannot rotate")
        void inactiveOwner() {
            TokenPair first = tokenIssuer.issue(user, laptop);
            TokenPair second = tokenIssuer.issue(user, laptop);

            UserAccount suspended = reload(user);
            suspended.setStatus(UserAccount.Status.SUSPENDED);
            userAccountRepository.save(suspended);
            assertThatThrownBy(() -> rotationEngine.rotate(first.getRefreshToken(), laptop))
                    .isInstanceOf(InvalidTokenException.class);

            UserAccount deleted = reload(user);
            deleted.setStatus(UserAccount.Status.ACTIVE);
            deleted.setDeleted(true);
            deleted.setDeletedAt(now());
            userAccountRepository.save(deleted);
            assertThatThrownBy(() -> rotationEngine.rotate(second.getRefreshToken(), laptop))
                    .isInstanceOf(InvalidTokenException.class);

            assertThat(row(first.getRefreshToken()).isRevoked()).isFalse();
        }
    }

    @Nested
    @DisplayName("reuse detection")
    class ReuseDetection {

        @Test
        @DisplayName("presenting a rotated token revokes every session of the owner")
        void replayAfterRotation() {
            TokenPair original = tokenIssuer.issue(user, laptop);
            TokenPair otherDevice = tokenIssuer.issue(user, new ClientContext("192.0.2.1", "Phone"));
            TokenPair rotated = rotationEngine.rotate(original.getRefreshToken(), laptop);

            assertThatThrownBy(() -> rotationEngine.rotate(original.getRefreshToken(), attacker))
                    .isInstanceOf(TokenReuseDetectedException.class);

            assertThat(refreshTokenRepository.countByUser_IdAndRevokedFalse(user.getId())).isZero();
            assertThat(row(rotated.getRefreshToken()).getRevokedReason()).isEqualTo(RevocationReason.REUSE_DETECTED);
            assertThat(row(otherDevice.getRefreshToken()).getRevokedReason()).isEqualTo(RevocationReason.REUSE_DETECTED);
            // the first revocation is never overwritten
            assertThat(row(original.getRefreshToken()).getRevokedReason()).isEqualTo(RevocationReason.ROTATED);

            assertThat(securityEventRepository.findByUserIdAndEventType(user.getId(), SecurityEvent.Type.TOKEN_REUSE_DETECTED))
                    .singleElement()
                    .satisfies(event -> assertThat(event.getIpAddress()).isEqualTo("203.0.113.66"));

            assertThatThrownBy(() -> rotationEngine.rotate(rotated.getRefreshToken(), laptop))
                    .isInstanceOf(TokenReuseDetectedException.class);
        }

        @Test
        @DisplayName("concurrent rotations of one token: one wins, the rest are treated as reuse")
        void concurrentRotation() throws Exception {
            TokenPair original = tokenIssuer.issue(user, laptop);
            int threads = 5;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);

            int successes = 0;
            int reuse = 0;
            try {
                List<Future<TokenPair>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    Callable<TokenPair> attempt = () -> {
                        start.await();
                        return rotationEngine.rotate(original.getRefreshToken(), laptop);
                    };
                    results.add(executor.submit(attempt));
                }
                start.countDown();

                for (Future<TokenPair> result : results) {
                    try {
                        result.get(30, TimeUnit.SECONDS);
                        successes++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(TokenReuseDetectedException.class);
                        reuse++;
                    }
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(successes).isEqualTo(1);
            assertThat(reuse).isEqualTo(threads - 1);
            assertThat(row(original.getRefreshToken()).getRevokedReason()).isEqualTo(RevocationReason.ROTATED);
            assertThat(refreshTokenRepository.countByUser_IdAndRevokedFalse(user.getId())).isZero();
        }
    }
}
