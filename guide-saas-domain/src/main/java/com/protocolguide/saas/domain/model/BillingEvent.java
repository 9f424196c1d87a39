package com.protocolguide.saas.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Authenticated billing provider event.
 *
 * @param id          provider-assigned identifier, may be null for malformed deliveries
 * @param type        provider type tag, e.g. "customer.subscription.updated"
 * @param createdAt   provider creation time, may be null
 * @param payload     decoded payload
 * @param rawJson     the verified body, kept for the ledger
 */
public record BillingEvent(
        String id,
        String type,
        Instant createdAt,
        BillingEventPayload payload,
        String rawJson
) {
    public BillingEvent {
        type = type == null || type.isBlank() ? "unknown" : type;
        Objects.requireNonNull(payload, "payload");
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}
