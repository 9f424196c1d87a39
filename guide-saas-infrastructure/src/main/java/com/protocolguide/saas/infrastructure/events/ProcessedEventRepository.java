package com.protocolguide.saas.infrastructure.events;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    Optional<ProcessedEventEntity> findByEventId(String eventId);

    long countByEventId(String eventId);
}
