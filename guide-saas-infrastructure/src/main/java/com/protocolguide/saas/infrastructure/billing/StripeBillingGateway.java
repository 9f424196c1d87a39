package com.protocolguide.saas.infrastructure.billing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.protocolguide.application.ports.BillingGateway;
import com.protocolguide.application.ports.BillingGatewayException;
import com.protocolguide.saas.domain.model.BillingInterval;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.UUID;

/**
 * Stripe REST adapter: form-encoded POSTs, bearer API key, the hosted page URL read from "url".
 *
 * Provider errors (4xx/5xx, transport) become {@link BillingGatewayException}; the caller's
 * billing breaker counts them.
 */
public class StripeBillingGateway implements BillingGateway {

    private static final Logger log = LoggerFactory.getLogger(StripeBillingGateway.class);

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final StripeApiSettings settings;
    private final HttpUrl baseUrl;

    public StripeBillingGateway(OkHttpClient client, ObjectMapper mapper, StripeApiSettings settings) {
        this.client = client;
        this.mapper = mapper;
        this.settings = settings;
        this.baseUrl = HttpUrl.get(settings.baseUrl());
    }

    @Override
    public String createCheckoutSession(UUID accountId, String customerEmail, BillingInterval interval) {
        String priceId = interval == BillingInterval.ANNUAL ? settings.annualPriceId() : settings.monthlyPriceId();
        if (priceId == null || priceId.isBlank()) {
            throw new IllegalStateException("Price id for " + interval.wireValue() + " plan is not configured");
        }

        String account = accountId.toString();
        FormBody.Builder form = new FormBody.Builder()
                .add("mode", "subscription")
                .add("line_items[0][price]", priceId)
                .add("line_items[0][quantity]", "1")
                .add("success_url", settings.successUrl())
                .add("cancel_url", settings.cancelUrl())
                .add("client_reference_id", account)
                .add("metadata[accountId]", account)
                .add("metadata[plan]", interval.wireValue())
                .add("subscription_data[metadata][accountId]", account)
                .add("allow_promotion_codes", "true");
        if (settings.trialPeriodDays() > 0) {
            form.add("subscription_data[trial_period_days]", Integer.toString(settings.trialPeriodDays()));
        }
        if (customerEmail != null && !customerEmail.isBlank()) {
            form.add("customer_email", customerEmail.trim());
        }

        String url = postForUrl("/v1/checkout/sessions", form.build());
        log.info("Checkout session created for account {} ({})", accountId, interval.wireValue());
        return url;
    }

    @Override
    public String createPortalSession(String billingCustomerId, String returnUrl) {
        if (billingCustomerId == null || billingCustomerId.isBlank()) {
            throw new IllegalArgumentException("Customer id is required to create a portal session");
        }
        FormBody form = new FormBody.Builder()
                .add("customer", billingCustomerId)
                .add("return_url", returnUrl)
                .build();

        String url = postForUrl("/v1/billing_portal/sessions", form);
        log.info("Portal session created for customer {}", billingCustomerId);
        return url;
    }

    private String postForUrl(String path, FormBody form) {
        if (!settings.configured()) {
            throw new IllegalStateException("Stripe API key is not configured");
        }

        Request req = new Request.Builder()
                .url(baseUrl.newBuilder().encodedPath(path).build())
                .header("Authorization", "Bearer " + settings.apiKey())
                .post(form)
                .build();

        try (Response resp = client.newCall(req).execute()) {
            ResponseBody body = resp.body();
            String text = body == null ? "" : body.string();
            if (!resp.isSuccessful()) {
                throw new BillingGatewayException("Stripe " + path + " => HTTP " + resp.code() + ": " + errorMessage(text),
                        resp.code());
            }
            JsonNode url = mapper.readTree(text).get("url");
            if (url == null || !url.isTextual() || url.asText().isBlank()) {
                throw new BillingGatewayException("Stripe " + path + " returned no url", resp.code());
            }
            return url.asText();
        } catch (IOException e) {
            throw new BillingGatewayException("Stripe " + path + " request failed: " + e.getMessage(), e);
        }
    }

    private String errorMessage(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("error").path("message");
            return msg.isTextual() ? msg.asText() : "unknown error";
        } catch (IOException e) {
            return "unreadable error body";
        }
    }
}
