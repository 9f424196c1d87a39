package com.protocolguide.application.ports;

import com.protocolguide.saas.domain.model.BillingInterval;

import java.util.UUID;

/**
 * Outbound billing provider API. Both calls return a hosted page URL.
 *
 * @see BillingGatewayException
 */
public interface BillingGateway {

    String createCheckoutSession(UUID accountId, String customerEmail, BillingInterval interval);

    String createPortalSession(String billingCustomerId, String returnUrl);
}
