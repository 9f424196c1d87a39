package com.protocolguide.saas.infrastructure.events;

import com.protocolguide.application.ports.DuplicateEventException;
import com.protocolguide.application.ports.ProcessedEventLedger;
import com.protocolguide.application.resilience.GuardedCall;
import com.protocolguide.saas.domain.model.ProcessedEvent;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger backed by the processed_events table.
 *
 * The unique constraint on event_id decides races between deliveries. The insert is
 * flushed immediately so a violation surfaces here and not at commit time.
 */
@Component
public class JpaProcessedEventLedger implements ProcessedEventLedger {

    private final ProcessedEventRepository events;
    private final GuardedCall database;

    public JpaProcessedEventLedger(ProcessedEventRepository events, @Qualifier("databaseGuard") GuardedCall database) {
        this.events = events;
        this.database = database;
    }

    @Override
    public Optional<ProcessedEvent> find(String eventId) {
        return database.call(() -> events.findByEventId(eventId).map(JpaProcessedEventLedger::toModel));
    }

    @Override
    public void record(ProcessedEvent event) {
        ProcessedEventEntity row = new ProcessedEventEntity(
                UUID.randomUUID(),
                event.eventId(),
                event.eventType(),
                event.processedAt(),
                event.payloadJson()
        );
        try {
            database.run(() -> events.saveAndFlush(row));
        } catch (DataIntegrityViolationException e) {
            if (violatesEventIdUniqueness(e)) {
                throw new DuplicateEventException(event.eventId(), e);
            }
            throw e;
        }
    }

    /**
     * Only the event_id unique constraint means "already recorded". Over-length values and
     * other integrity errors are real failures.
     */
    static boolean violatesEventIdUniqueness(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException cve && mentionsEventIdConstraint(cve.getConstraintName())) {
                return true;
            }
            if (mentionsEventIdConstraint(t.getMessage())) return true;
        }
        return false;
    }

    private static boolean mentionsEventIdConstraint(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(ProcessedEventEntity.EVENT_ID_CONSTRAINT);
    }

    private static ProcessedEvent toModel(ProcessedEventEntity e) {
        return new ProcessedEvent(e.getEventId(), e.getEventType(), e.getProcessedAt(), e.getPayloadJson());
    }
}
