package com.protocolguide.application.billing;

import com.protocolguide.application.ports.ReviewQueue;
import com.protocolguide.application.ports.SubscriptionStore;
import com.protocolguide.saas.domain.model.BillingEvent;
import com.protocolguide.saas.domain.model.BillingEventPayload;
import com.protocolguide.saas.domain.model.BillingEventPayload.CheckoutCompleted;
import com.protocolguide.saas.domain.model.BillingEventPayload.CustomerDeleted;
import com.protocolguide.saas.domain.model.BillingEventPayload.DisputeClosed;
import com.protocolguide.saas.domain.model.BillingEventPayload.DisputeOpened;
import com.protocolguide.saas.domain.model.BillingEventPayload.InvoicePaid;
import com.protocolguide.saas.domain.model.BillingEventPayload.InvoicePaymentFailed;
import com.protocolguide.saas.domain.model.BillingEventPayload.SubscriptionChanged;
import com.protocolguide.saas.domain.model.BillingEventPayload.SubscriptionDeleted;
import com.protocolguide.saas.domain.model.BillingEventPayload.Unrecognized;
import com.protocolguide.saas.domain.model.ReviewFlag;
import com.protocolguide.saas.domain.model.SubscriptionRecord;
import com.protocolguide.saas.domain.model.SubscriptionStatus;
import com.protocolguide.saas.domain.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies verified, deduplicated billing events to the stored subscription record.
 *
 * Policy:
 * - only subscription status events downgrade; a failed invoice never does
 * - a paid invoice re-grants PRO for a known account (heals a missed subscription update)
 * - disputes are logged and optionally flagged, the tier is left alone
 * - no local account for a known external id is an expected race: log and return
 */
public final class SubscriptionStateSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionStateSynchronizer.class);

    private final SubscriptionStore subscriptions;
    private final ReviewQueue reviews;
    private final boolean flagDisputes;
    private final Clock clock;

    public SubscriptionStateSynchronizer(SubscriptionStore subscriptions, ReviewQueue reviews,
                                         boolean flagDisputes, Clock clock) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.reviews = Objects.requireNonNull(reviews, "reviews");
        this.flagDisputes = flagDisputes;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SyncEffect apply(BillingEvent event) {
        BillingEventPayload p = event.payload();

        if (p instanceof CheckoutCompleted c) return onCheckoutCompleted(c);
        if (p instanceof SubscriptionChanged s) return onSubscriptionChanged(s);
        if (p instanceof SubscriptionDeleted s) return onSubscriptionDeleted(s);
        if (p instanceof InvoicePaid i) return onInvoicePaid(i);
        if (p instanceof InvoicePaymentFailed i) return onInvoicePaymentFailed(i);
        if (p instanceof DisputeOpened d) return onDisputeOpened(d);
        if (p instanceof DisputeClosed d) return onDisputeClosed(d);
        if (p instanceof CustomerDeleted c) return onCustomerDeleted(c);
        if (p instanceof Unrecognized u) {
            log.info("Unhandled billing event type: {} (id={})", u.type(), event.id());
            return SyncEffect.UNRECOGNIZED;
        }
        throw new IllegalStateException("Unexpected payload: " + p.getClass().getName());
    }

    private SyncEffect onCheckoutCompleted(CheckoutCompleted c) {
        String reference = firstNonBlank(c.clientReferenceId(), c.metadataAccountId());
        if (reference == null) {
            log.error("Checkout session {} carries no account reference", c.sessionId());
            return SyncEffect.ACCOUNT_NOT_FOUND;
        }

        Optional<UUID> accountId = parseUuid(reference);
        if (accountId.isEmpty()) {
            log.error("Checkout session {} has unusable account reference '{}'", c.sessionId(), reference);
            return SyncEffect.ACCOUNT_NOT_FOUND;
        }

        Optional<SubscriptionRecord> current = subscriptions.findByAccountId(accountId.get());
        if (current.isEmpty()) {
            log.warn("Checkout completed for unknown account {}", accountId.get());
            return SyncEffect.ACCOUNT_NOT_FOUND;
        }

        log.info("Checkout completed for account {} (customer {})", accountId.get(), c.billingCustomerId());
        Instant now = clock.instant();
        SubscriptionRecord next = current.get();
        if (c.billingCustomerId() != null) {
            next = next.withCustomer(c.billingCustomerId(), now);
        }
        subscriptions.save(next.withTier(Tier.PRO, now));
        return SyncEffect.UPDATED;
    }

    private SyncEffect onSubscriptionChanged(SubscriptionChanged s) {
        Optional<SubscriptionRecord> current = byCustomer(s.billingCustomerId());
        if (current.isEmpty()) return SyncEffect.ACCOUNT_NOT_FOUND;

        SubscriptionRecord record = current.get();
        Optional<SubscriptionStatus> status = SubscriptionStatus.fromProvider(s.status());
        SubscriptionStatus newStatus;
        Tier tier;
        if (status.isPresent()) {
            newStatus = status.get();
            tier = newStatus.tier();
        } else {
            log.warn("Unknown subscription status '{}' for account {}, keeping {} and granting FREE",
                    s.status(), record.accountId(), record.status());
            newStatus = record.status();
            tier = Tier.FREE;
        }

        log.info("Subscription {} updated for account {}: status={} tier={}",
                s.subscriptionId(), record.accountId(), newStatus.wireValue(), tier.wireValue());
        subscriptions.save(record.withSubscription(s.subscriptionId(), newStatus, tier, s.currentPeriodEnd(),
                clock.instant()));
        return SyncEffect.UPDATED;
    }

    private SyncEffect onSubscriptionDeleted(SubscriptionDeleted s) {
        Optional<SubscriptionRecord> current = byCustomer(s.billingCustomerId());
        if (current.isEmpty()) return SyncEffect.ACCOUNT_NOT_FOUND;

        log.info("Subscription {} deleted for account {}, downgrading to free",
                s.subscriptionId(), current.get().accountId());
        subscriptions.save(current.get().canceled(clock.instant()));
        return SyncEffect.UPDATED;
    }

    private SyncEffect onInvoicePaid(InvoicePaid i) {
        Optional<SubscriptionRecord> current = byCustomer(i.billingCustomerId());
        if (current.isEmpty()) return SyncEffect.ACCOUNT_NOT_FOUND;

        SubscriptionRecord record = current.get();
        if (record.isPro()) {
            log.debug("Payment succeeded for account {}, already pro", record.accountId());
            return SyncEffect.NO_CHANGE;
        }
        log.info("Payment succeeded for account {}, restoring pro", record.accountId());
        subscriptions.save(record.withTier(Tier.PRO, clock.instant()));
        return SyncEffect.UPDATED;
    }

    private SyncEffect onInvoicePaymentFailed(InvoicePaymentFailed i) {
        Optional<SubscriptionRecord> current = byCustomer(i.billingCustomerId());
        if (current.isEmpty()) return SyncEffect.ACCOUNT_NOT_FOUND;

        // The provider retries the charge; a final failure arrives as a subscription status change.
        log.warn("Payment failed for account {} (invoice {}, attempt {})",
                current.get().accountId(), i.invoiceId(), i.attemptCount());
        return SyncEffect.LOGGED_ONLY;
    }

    private SyncEffect onDisputeOpened(DisputeOpened d) {
        log.warn("Dispute {} opened for charge {}: reason={}, status={}",
                d.disputeId(), d.chargeId(), d.reason(), d.status());
        if (d.billingCustomerId() == null) {
            log.warn("Dispute {} has no expanded customer, cannot attribute it to an account", d.disputeId());
        }
        flag(ReviewFlag.Kind.DISPUTE_OPENED, d.disputeId(), d.billingCustomerId(),
                "reason=" + d.reason() + ", status=" + d.status());
        return SyncEffect.LOGGED_ONLY;
    }

    private SyncEffect onDisputeClosed(DisputeClosed d) {
        String outcome = d.status() == null ? "unknown" : d.status();
        switch (outcome) {
            case "lost" -> log.warn("Dispute {} lost, funds returned to customer", d.disputeId());
            case "won" -> log.info("Dispute {} won, funds retained", d.disputeId());
            default -> log.info("Dispute {} closed with status {}", d.disputeId(), outcome);
        }
        flag(ReviewFlag.Kind.DISPUTE_CLOSED, d.disputeId(), d.billingCustomerId(), "status=" + outcome);
        return SyncEffect.LOGGED_ONLY;
    }

    private SyncEffect onCustomerDeleted(CustomerDeleted c) {
        Optional<SubscriptionRecord> current = byCustomer(c.billingCustomerId());
        if (current.isEmpty()) return SyncEffect.ACCOUNT_NOT_FOUND;

        log.info("Customer {} deleted, clearing billing data for account {}",
                c.billingCustomerId(), current.get().accountId());
        subscriptions.save(current.get().detached(clock.instant()));
        return SyncEffect.UPDATED;
    }

    private Optional<SubscriptionRecord> byCustomer(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            log.warn("Billing event without customer id, nothing to update");
            return Optional.empty();
        }
        Optional<SubscriptionRecord> found = subscriptions.findByBillingCustomerId(customerId);
        if (found.isEmpty()) {
            log.warn("No account found for billing customer {}", customerId);
        }
        return found;
    }

    private void flag(ReviewFlag.Kind kind, String disputeId, String customerId, String detail) {
        if (!flagDisputes) return;
        UUID accountId = customerId == null ? null
                : subscriptions.findByBillingCustomerId(customerId).map(SubscriptionRecord::accountId).orElse(null);
        reviews.flag(new ReviewFlag(UUID.randomUUID(), kind, disputeId, customerId, accountId, detail, clock.instant()));
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a.trim();
        if (b != null && !b.isBlank()) return b.trim();
        return null;
    }

    private static Optional<UUID> parseUuid(String v) {
        try {
            return Optional.of(UUID.fromString(v));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
