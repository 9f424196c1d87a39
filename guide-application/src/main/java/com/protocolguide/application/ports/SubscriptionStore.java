package com.protocolguide.application.ports;

import com.protocolguide.saas.domain.model.SubscriptionRecord;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage boundary for per-account subscription state. Saves are last-write-wins.
 */
public interface SubscriptionStore {

    Optional<SubscriptionRecord> findByAccountId(UUID accountId);

    Optional<SubscriptionRecord> findByBillingCustomerId(String billingCustomerId);

    SubscriptionRecord save(SubscriptionRecord record);

    /**
     * Creates the FREE / NONE record for a new account. Existing records are returned untouched.
     */
    default SubscriptionRecord provision(UUID accountId, Instant at) {
        return findByAccountId(accountId).orElseGet(() -> save(SubscriptionRecord.initial(accountId, at)));
    }
}
