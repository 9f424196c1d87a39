package com.protocolguide.api.wiring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.protocolguide.api.billing.BillingEventDecoder;
import com.protocolguide.api.billing.WebhookAuthenticator;
import com.protocolguide.api.config.GuideBillingProperties;
import com.protocolguide.application.billing.BillingEventProcessor;
import com.protocolguide.application.billing.GuardedBillingGateway;
import com.protocolguide.application.billing.SubscriptionStateSynchronizer;
import com.protocolguide.application.ports.BillingGateway;
import com.protocolguide.application.ports.ProcessedEventLedger;
import com.protocolguide.application.ports.ReviewQueue;
import com.protocolguide.application.ports.SubscriptionStore;
import com.protocolguide.application.resilience.GuardedCall;
import com.protocolguide.saas.infrastructure.billing.StripeApiSettings;
import com.protocolguide.saas.infrastructure.billing.StripeBillingGateway;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BillingWiringConfig {

    @Bean
    public SubscriptionStateSynchronizer subscriptionStateSynchronizer(
            SubscriptionStore subscriptions,
            ReviewQueue reviews,
            GuideBillingProperties props,
            Clock clock
    ) {
        return new SubscriptionStateSynchronizer(subscriptions, reviews, props.disputes().flagForReview(), clock);
    }

    @Bean
    public BillingEventProcessor billingEventProcessor(
            ProcessedEventLedger ledger,
            SubscriptionStateSynchronizer synchronizer,
            Clock clock
    ) {
        return new BillingEventProcessor(ledger, synchronizer, clock);
    }

    @Bean
    public WebhookAuthenticator webhookAuthenticator(ObjectMapper mapper, GuideBillingProperties props, Clock clock) {
        return new WebhookAuthenticator(new BillingEventDecoder(mapper), clock, props.signatureTolerance());
    }

    /**
     * Outbound billing API. Every call goes through the billing breaker.
     */
    @Bean
    public BillingGateway billingGateway(
            ObjectMapper mapper,
            GuideBillingProperties props,
            @Qualifier("billingGuard") GuardedCall billingGuard
    ) {
        GuideBillingProperties.Stripe s = props.stripe();
        OkHttpClient http = new OkHttpClient.Builder()
                .callTimeout(s.timeout())
                .build();
        StripeApiSettings settings = new StripeApiSettings(
                s.baseUrl(),
                s.apiKey(),
                s.monthlyPriceId(),
                s.annualPriceId(),
                s.successUrl(),
                s.cancelUrl(),
                s.trialPeriodDays()
        );
        return new GuardedBillingGateway(new StripeBillingGateway(http, mapper, settings), billingGuard);
    }
}
