package com.protocolguide.application.billing;

import com.protocolguide.application.ports.BillingGateway;
import com.protocolguide.application.resilience.GuardedCall;
import com.protocolguide.saas.domain.model.BillingInterval;

import java.util.Objects;
import java.util.UUID;

/**
 * Routes every billing API call through the billing breaker.
 * No fallback: an open circuit surfaces as {@link com.protocolguide.application.resilience.CircuitOpenException}.
 */
public final class GuardedBillingGateway implements BillingGateway {

    private final BillingGateway delegate;
    private final GuardedCall guard;

    public GuardedBillingGateway(BillingGateway delegate, GuardedCall guard) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    @Override
    public String createCheckoutSession(UUID accountId, String customerEmail, BillingInterval interval) {
        return guard.call(() -> delegate.createCheckoutSession(accountId, customerEmail, interval));
    }

    @Override
    public String createPortalSession(String billingCustomerId, String returnUrl) {
        return guard.call(() -> delegate.createPortalSession(billingCustomerId, returnUrl));
    }
}
