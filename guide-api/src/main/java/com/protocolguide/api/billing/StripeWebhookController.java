package com.protocolguide.api.billing;

import com.protocolguide.api.config.GuideBillingProperties;
import com.protocolguide.api.metrics.BillingMetrics;
import com.protocolguide.application.billing.ProcessingOutcome;
import com.protocolguide.saas.domain.model.BillingEvent;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Stripe webhook endpoint.
 *
 * Responses:
 * - 200 {received:true} or {received:true, skipped:true, reason}
 * - 400 {error} when the delivery cannot be authenticated (provider will not fix it by retrying)
 * - 500 {error} when processing failed; the provider retries and the ledger row was rolled back
 *
 * The body is read as raw bytes: the signature covers the exact bytes sent.
 */
@RestController
@RequestMapping("/api/v1/billing/stripe")
public class StripeWebhookController {

    private static final Logger log = LoggerFactory.getLogger(StripeWebhookController.class);

    public static final String HDR_SIGNATURE = "Stripe-Signature";

    private final WebhookAuthenticator authenticator;
    private final BillingWebhookService service;
    private final GuideBillingProperties props;
    private final BillingMetrics metrics;

    public StripeWebhookController(
            WebhookAuthenticator authenticator,
            BillingWebhookService service,
            GuideBillingProperties props,
            BillingMetrics metrics
    ) {
        this.authenticator = authenticator;
        this.service = service;
        this.props = props;
        this.metrics = metrics;
    }

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> webhook(
            @RequestBody(required = false) byte[] rawBody,
            HttpServletRequest request
    ) {
        if (!props.webhookSecretConfigured()) {
            log.error("Stripe webhook received but GUIDE_STRIPE_WEBHOOK_SECRET is not set");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Webhook secret is not configured"));
        }

        List<String> signatures = Collections.list(request.getHeaders(HDR_SIGNATURE));

        BillingEvent event;
        try {
            event = authenticator.verify(rawBody, signatures, props.webhookSecret());
        } catch (SignatureException e) {
            metrics.incRejected();
            log.warn("Stripe webhook verification failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        log.info("Received billing event {} (id={})", event.type(), event.id());

        ProcessingOutcome outcome;
        try {
            outcome = service.handle(event);
        } catch (RuntimeException e) {
            metrics.incFailed();
            log.error("Billing event {} ({}) handling failed", event.id(), event.type(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Webhook handler failed"));
        }

        if (outcome.skipped()) {
            return ResponseEntity.ok(Map.of(
                    "received", true,
                    "skipped", true,
                    "reason", outcome.reason()
            ));
        }
        return ResponseEntity.ok(Map.of("received", true));
    }
}
