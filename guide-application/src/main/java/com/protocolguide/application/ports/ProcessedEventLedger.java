package com.protocolguide.application.ports;

import com.protocolguide.saas.domain.model.ProcessedEvent;

import java.util.Optional;

/**
 * Append-only record of billing event ids that reached business logic.
 *
 * Implementations must back {@link #record(ProcessedEvent)} with a store-level unique
 * constraint on the event id. The lookup alone is racy across processes.
 */
public interface ProcessedEventLedger {

    Optional<ProcessedEvent> find(String eventId);

    /**
     * @throws DuplicateEventException if the id is already recorded (including a concurrent insert)
     */
    void record(ProcessedEvent event);
}
