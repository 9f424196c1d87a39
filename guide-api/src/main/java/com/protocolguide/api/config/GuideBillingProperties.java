package com.protocolguide.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Billing provider config.
 *
 * IMPORTANT:
 * - webhookSecret and stripe.apiKey come from env (GUIDE_STRIPE_WEBHOOK_SECRET, GUIDE_STRIPE_API_KEY)
 * - a blank webhook secret rejects every delivery, there is no bypass
 */
@ConfigurationProperties(prefix = "guide.billing")
public record GuideBillingProperties(

    String webhookSecret,

    /**
     * Maximum distance between the signed timestamp and now, either direction.
     */
    @DefaultValue("300s") Duration signatureTolerance,

    @DefaultValue Disputes disputes,

    @DefaultValue Stripe stripe

) {

    public boolean webhookSecretConfigured() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }

    public record Disputes(@DefaultValue("true") boolean flagForReview) {}

    public record Stripe(
        @DefaultValue("https://api.stripe.com") String baseUrl,
        String apiKey,
        String monthlyPriceId,
        String annualPriceId,
        @DefaultValue("http://localhost:8081/billing/success") String successUrl,
        @DefaultValue("http://localhost:8081/billing/cancel") String cancelUrl,
        @DefaultValue("http://localhost:8081/profile") String portalReturnUrl,
        @DefaultValue("7") int trialPeriodDays,
        @DefaultValue("10s") Duration timeout
    ) {}
}
