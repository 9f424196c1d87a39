package com.protocolguide.saas.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Ledger entry: a billing event id that has reached business logic. Append-only.
 */
public record ProcessedEvent(
        String eventId,
        String eventType,
        Instant processedAt,
        String payloadJson
) {
    public ProcessedEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(processedAt, "processedAt");
    }
}
