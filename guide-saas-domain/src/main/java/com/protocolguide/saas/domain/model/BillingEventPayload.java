package com.protocolguide.saas.domain.model;

import java.time.Instant;

/**
 * Closed set of billing payloads we act on, plus {@link Unrecognized} for anything else.
 * Fields the provider omitted are null.
 */
public sealed interface BillingEventPayload {

    String CHECKOUT_COMPLETED = "checkout.session.completed";
    String SUBSCRIPTION_CREATED = "customer.subscription.created";
    String SUBSCRIPTION_UPDATED = "customer.subscription.updated";
    String SUBSCRIPTION_DELETED = "customer.subscription.deleted";
    String INVOICE_PAYMENT_SUCCEEDED = "invoice.payment_succeeded";
    String INVOICE_PAYMENT_FAILED = "invoice.payment_failed";
    String DISPUTE_CREATED = "charge.dispute.created";
    String DISPUTE_CLOSED = "charge.dispute.closed";
    String CUSTOMER_DELETED = "customer.deleted";

    record CheckoutCompleted(
            String sessionId,
            String billingCustomerId,
            String clientReferenceId,
            String metadataAccountId
    ) implements BillingEventPayload {}

    /**
     * Covers both "created" and "updated": the handling is identical.
     */
    record SubscriptionChanged(
            String subscriptionId,
            String billingCustomerId,
            String status,
            Instant currentPeriodEnd
    ) implements BillingEventPayload {}

    record SubscriptionDeleted(
            String subscriptionId,
            String billingCustomerId
    ) implements BillingEventPayload {}

    record InvoicePaid(
            String invoiceId,
            String billingCustomerId
    ) implements BillingEventPayload {}

    record InvoicePaymentFailed(
            String invoiceId,
            String billingCustomerId,
            Integer attemptCount
    ) implements BillingEventPayload {}

    record DisputeOpened(
            String disputeId,
            String chargeId,
            String billingCustomerId,
            String reason,
            String status
    ) implements BillingEventPayload {}

    record DisputeClosed(
            String disputeId,
            String chargeId,
            String billingCustomerId,
            String status
    ) implements BillingEventPayload {}

    record CustomerDeleted(
            String billingCustomerId
    ) implements BillingEventPayload {}

    record Unrecognized(
            String type
    ) implements BillingEventPayload {}
}
