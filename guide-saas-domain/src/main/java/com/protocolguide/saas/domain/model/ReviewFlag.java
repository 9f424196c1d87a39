package com.protocolguide.saas.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Billing item parked for a human to look at (disputes).
 */
public record ReviewFlag(
        UUID id,
        Kind kind,
        String disputeId,
        String billingCustomerId,
        UUID accountId,
        String detail,
        Instant createdAt
) {
    public enum Kind {
        DISPUTE_OPENED,
        DISPUTE_CLOSED
    }
}
