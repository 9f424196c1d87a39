package com.protocolguide.saas.infrastructure.billing;

/**
 * Connection and catalog settings for the Stripe REST API.
 *
 * @param baseUrl          normally https://api.stripe.com
 * @param trialPeriodDays  0 disables the trial
 */
public record StripeApiSettings(
        String baseUrl,
        String apiKey,
        String monthlyPriceId,
        String annualPriceId,
        String successUrl,
        String cancelUrl,
        int trialPeriodDays
) {

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
