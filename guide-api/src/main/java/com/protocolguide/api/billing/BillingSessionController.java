package com.protocolguide.api.billing;

import com.protocolguide.api.config.GuideBillingProperties;
import com.protocolguide.application.ports.BillingGateway;
import com.protocolguide.application.ports.SubscriptionStore;
import com.protocolguide.saas.domain.model.BillingInterval;
import com.protocolguide.saas.domain.model.SubscriptionRecord;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Hosted checkout / customer portal links for the calling account (JWT subject).
 *
 * An open billing circuit surfaces as 503 + Retry-After via ApiExceptionHandler.
 */
@RestController
@RequestMapping("/api/v1/billing")
public class BillingSessionController {

    private final BillingGateway billing;
    private final SubscriptionStore subscriptions;
    private final GuideBillingProperties props;
    private final Clock clock;

    public BillingSessionController(BillingGateway billing, SubscriptionStore subscriptions,
                                    GuideBillingProperties props, Clock clock) {
        this.billing = billing;
        this.subscriptions = subscriptions;
        this.props = props;
        this.clock = clock;
    }

    @PostMapping("/checkout")
    public Map<String, Object> checkout(@AuthenticationPrincipal Jwt jwt,
                                        @Valid @RequestBody(required = false) CheckoutRequest body) {
        UUID accountId = accountId(jwt);
        BillingInterval interval = BillingInterval.parse(body == null ? null : body.plan());
        String email = body != null && body.email() != null ? body.email() : jwt.getClaimAsString("email");

        // The checkout webhook only updates existing records.
        subscriptions.provision(accountId, clock.instant());

        String url = billing.createCheckoutSession(accountId, email, interval);
        return Map.of("url", url);
    }

    @PostMapping("/portal")
    public Map<String, Object> portal(@AuthenticationPrincipal Jwt jwt) {
        UUID accountId = accountId(jwt);
        String customerId = subscriptions.findByAccountId(accountId)
                .map(SubscriptionRecord::billingCustomerId)
                .orElse(null);
        if (customerId == null) {
            throw new IllegalArgumentException("No billing customer for this account");
        }
        String url = billing.createPortalSession(customerId, props.stripe().portalReturnUrl());
        return Map.of("url", url);
    }

    private static UUID accountId(Jwt jwt) {
        if (jwt == null || jwt.getSubject() == null) {
            throw new IllegalArgumentException("Missing subject");
        }
        return UUID.fromString(jwt.getSubject().trim());
    }
}
