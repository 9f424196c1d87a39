package com.protocolguide.api.billing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Maps a provider event envelope ({id, type, created, data.object}) to {@link BillingEvent}.
 *
 * Missing optional fields become null. References that the provider may send either as an id
 * string or as an expanded object (customer, charge, payment_intent) are both accepted.
 */
public class BillingEventDecoder {

    private final ObjectMapper mapper;

    public BillingEventDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws IOException if the body is not JSON
     * @throws IllegalArgumentException if the body is JSON but not an object
     */
    public BillingEvent decode(byte[] raw) throws IOException {
        JsonNode root = mapper.readTree(raw);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Event payload is not a JSON object");
        }

        String id = readText(root, "id");
        String type = readText(root, "type");
        Instant created = readEpochSeconds(root.get("created"));
        JsonNode obj = root.path("data").path("object");

        return new BillingEvent(id, type, created, payload(type, obj), new String(raw, StandardCharsets.UTF_8));
    }

    private BillingEventPayload payload(String type, JsonNode o) {
        if (type == null) return new Unrecognized("unknown");

        switch (type) {
            case BillingEventPayload.CHECKOUT_COMPLETED: {
                String metaAccount = readText(o, "metadata", "accountId");
                if (metaAccount == null) metaAccount = readText(o, "metadata", "userId");
                return new CheckoutCompleted(readText(o, "id"), ref(o.get("customer")),
                        readText(o, "client_reference_id"), metaAccount);
            }
            case BillingEventPayload.SUBSCRIPTION_CREATED:
            case BillingEventPayload.SUBSCRIPTION_UPDATED: {
                Instant periodEnd = readEpochSeconds(o.get("current_period_end"));
                if (periodEnd == null) {
                    // newer API versions moved the period onto the subscription items
                    periodEnd = readEpochSeconds(o.path("items").path("data").path(0).get("current_period_end"));
                }
                return new SubscriptionChanged(readText(o, "id"), ref(o.get("customer")), readText(o, "status"),
                        periodEnd);
            }
            case BillingEventPayload.SUBSCRIPTION_DELETED:
                return new SubscriptionDeleted(readText(o, "id"), ref(o.get("customer")));
            case BillingEventPayload.INVOICE_PAYMENT_SUCCEEDED:
                return new InvoicePaid(readText(o, "id"), ref(o.get("customer")));
            case BillingEventPayload.INVOICE_PAYMENT_FAILED: {
                JsonNode attempts = o.get("attempt_count");
                return new InvoicePaymentFailed(readText(o, "id"), ref(o.get("customer")),
                        attempts != null && attempts.canConvertToInt() ? attempts.asInt() : null);
            }
            case BillingEventPayload.DISPUTE_CREATED:
                return new DisputeOpened(readText(o, "id"), ref(o.get("charge")), disputeCustomer(o),
                        readText(o, "reason"), readText(o, "status"));
            case BillingEventPayload.DISPUTE_CLOSED:
                return new DisputeClosed(readText(o, "id"), ref(o.get("charge")), disputeCustomer(o),
                        readText(o, "status"));
            case BillingEventPayload.CUSTOMER_DELETED:
                return new CustomerDeleted(readText(o, "id"));
            default:
                return new Unrecognized(type);
        }
    }

    private static String disputeCustomer(JsonNode dispute) {
        JsonNode charge = dispute.get("charge");
        if (charge != null && charge.isObject()) return ref(charge.get("customer"));
        JsonNode intent = dispute.get("payment_intent");
        if (intent != null && intent.isObject()) return ref(intent.get("customer"));
        return null;
    }

    /**
     * Id of a reference that is either "cus_123" or {"id": "cus_123", ...}.
     */
    private static String ref(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isTextual()) return blankToNull(n.asText());
        if (n.isObject()) return readText(n, "id");
        return null;
    }

    private static Instant readEpochSeconds(JsonNode n) {
        if (n == null || !n.canConvertToLong()) return null;
        long v = n.asLong();
        return v > 0 ? Instant.ofEpochSecond(v) : null;
    }

    private static String readText(JsonNode root, String... path) {
        JsonNode n = root;
        for (String p : path) {
            if (n == null) return null;
            n = n.get(p);
        }
        return (n != null && n.isValueNode() && !n.isNull()) ? blankToNull(n.asText()) : null;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
