package com.salonhub.authservice.services;

import com.salonhub.authservice.models.SecurityEvent;
import com.salonhub.authservice.repository.SecurityEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Writes the security event trail. Each event commits in its own transaction, so a caller that rolls
 * back (or throws after a revoke-all) cannot erase it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityEventService {

    private static final Logger SECURITY_AUDIT = LoggerFactory.getLogger("SECURITY_AUDIT");

    private static final Set<SecurityEvent.Type> INCIDENTS = EnumSet.of(
            SecurityEvent.Type.ACCOUNT_LOCKED,
            SecurityEvent.Type.TOKEN_REUSE_DETECTED,
            SecurityEvent.Type.REVOKE_ALL,
            SecurityEvent.Type.SUPER_ADMIN_CONTEXT);

    private final SecurityEventRepository securityEvents;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(SecurityEvent.Type type, UUID userId, String eventData, ClientContext client) {
        ClientContext origin = client == null ? ClientContext.unknown() : client;

        if (INCIDENTS.contains(type)) {
            SECURITY_AUDIT.warn("{} user={} ip={} detail={}", type, userId, origin.getIpAddress(), eventData);
        }

        SecurityEvent event = SecurityEvent.builder()
                .userId(userId)
                .eventType(type)
                .eventData(eventData)
                .eventTime(LocalDateTime.now(clock))
                .ipAddress(origin.getIpAddress())
                .userAgent(origin.getUserAgent())
                .build();

        try {
            SecurityEvent saved = securityEvents.save(event);
            log.debug("Saved security event {} with id: {}", type, saved.getEventId());
        } catch (DataAccessException e) {
            log.error("Failed to save security event {} for user {}", type, userId, e);
        }
    }
}
