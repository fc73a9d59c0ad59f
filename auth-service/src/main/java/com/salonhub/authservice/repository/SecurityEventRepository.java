package com.salonhub.authservice.repository;

import com.salonhub.authservice.models.SecurityEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SecurityEventRepository extends JpaRepository<SecurityEvent, Long> {

    List<SecurityEvent> findByUserIdOrderByEventTimeDesc(UUID userId);

    List<SecurityEvent> findByUserIdAndEventType(UUID userId, SecurityEvent.Type eventType);
}
