package com.protocolguide.saas.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Billing state of one account.
 *
 * Created when the account is provisioned (FREE / NONE) and afterwards mutated only
 * in response to verified, previously unseen billing events.
 */
public record SubscriptionRecord(
        UUID accountId,
        String billingCustomerId,
        String billingSubscriptionId,
        SubscriptionStatus status,
        Tier tier,
        Instant periodEnd,
        Instant updatedAt
) {

    public SubscriptionRecord {
        Objects.requireNonNull(accountId, "accountId");
        status = status == null ? SubscriptionStatus.NONE : status;
        tier = tier == null ? Tier.FREE : tier;
    }

    public static SubscriptionRecord initial(UUID accountId, Instant at) {
        return new SubscriptionRecord(accountId, null, null, SubscriptionStatus.NONE, Tier.FREE, null, at);
    }

    public boolean isPro() {
        return tier == Tier.PRO;
    }

    public SubscriptionRecord withCustomer(String customerId, Instant at) {
        return new SubscriptionRecord(accountId, customerId, billingSubscriptionId, status, tier, periodEnd, at);
    }

    public SubscriptionRecord withTier(Tier newTier, Instant at) {
        return new SubscriptionRecord(accountId, billingCustomerId, billingSubscriptionId, status, newTier, periodEnd, at);
    }

    public SubscriptionRecord withSubscription(String subscriptionId, SubscriptionStatus newStatus, Tier newTier,
                                               Instant newPeriodEnd, Instant at) {
        return new SubscriptionRecord(accountId, billingCustomerId, subscriptionId, newStatus, newTier, newPeriodEnd, at);
    }

    /**
     * Subscription ended upstream: back to FREE, status CANCELED, subscription fields cleared.
     */
    public SubscriptionRecord canceled(Instant at) {
        return new SubscriptionRecord(accountId, billingCustomerId, null, SubscriptionStatus.CANCELED, Tier.FREE, null, at);
    }

    /**
     * Upstream customer deleted: every billing field cleared.
     */
    public SubscriptionRecord detached(Instant at) {
        return new SubscriptionRecord(accountId, null, null, SubscriptionStatus.NONE, Tier.FREE, null, at);
    }
}
