package com.protocolguide.saas.infrastructure.billing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.protocolguide.application.ports.BillingGatewayException;
import com.protocolguide.saas.domain.model.BillingInterval;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StripeBillingGatewayTest {

    private MockWebServer server;
    private StripeBillingGateway gateway;

    @BeforeEach
    void start() throws Exception {
        server = new MockWebServer();
        server.start();
        gateway = gateway("sk_test_123");
    }

    @AfterEach
    void stop() throws Exception {
        server.shutdown();
    }

    private StripeBillingGateway gateway(String apiKey) {
        StripeApiSettings settings = new StripeApiSettings(
                server.url("/").toString(), apiKey, "price_m", "price_y",
                "https://app.example/billing/success", "https://app.example/billing/cancel", 7);
        return new StripeBillingGateway(new OkHttpClient(), new ObjectMapper(), settings);
    }

    @Test
    void checkoutPostsSubscriptionFormAndReturnsUrl() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"id\":\"cs_1\",\"url\":\"https://checkout.stripe.com/c/cs_1\"}"));
        UUID account = UUID.randomUUID();

        String url = gateway.createCheckoutSession(account, "medic@example.org", BillingInterval.ANNUAL);

        assertThat(url).isEqualTo("https://checkout.stripe.com/c/cs_1");
        RecordedRequest req = server.takeRequest();
        assertThat(req.getPath()).isEqualTo("/v1/checkout/sessions");
        assertThat(req.getHeader("Authorization")).isEqualTo("Bearer sk_test_123");
        String form = URLDecoder.decode(req.getBody().readUtf8(), StandardCharsets.UTF_8);
        assertThat(form)
                .contains("mode=subscription")
                .contains("line_items[0][price]=price_y")
                .contains("client_reference_id=" + account)
                .contains("metadata[accountId]=" + account)
                .contains("subscription_data[trial_period_days]=7")
                .contains("customer_email=medic@example.org");
    }

    @Test
    void portalPostsCustomer() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"url\":\"https://billing.stripe.com/p/session\"}"));

        assertThat(gateway.createPortalSession("cus_1", "https://app.example/profile"))
                .isEqualTo("https://billing.stripe.com/p/session");
        String form = URLDecoder.decode(server.takeRequest().getBody().readUtf8(), StandardCharsets.UTF_8);
        assertThat(form).contains("customer=cus_1").contains("return_url=https://app.example/profile");
    }

    @Test
    void providerErrorCarriesStatusAndMessage() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"error\":{\"message\":\"No such customer: 'cus_x'\"}}"));

        assertThatThrownBy(() -> gateway.createPortalSession("cus_x", "https://app.example/profile"))
                .isInstanceOfSatisfying(BillingGatewayException.class, e -> {
                    assertThat(e.statusCode()).isEqualTo(400);
                    assertThat(e.getMessage()).contains("No such customer");
                });
    }

    @Test
    void missingUrlIsAnError() {
        server.enqueue(new MockResponse().setBody("{\"id\":\"cs_1\"}"));

        assertThatThrownBy(() -> gateway.createCheckoutSession(UUID.randomUUID(), null, BillingInterval.MONTHLY))
                .isInstanceOf(BillingGatewayException.class)
                .hasMessageContaining("no url");
    }

    @Test
    void unconfiguredKeyFailsBeforeAnyRequest() {
        StripeBillingGateway unconfigured = gateway(" ");

        assertThatThrownBy(() -> unconfigured.createPortalSession("cus_1", "https://app.example"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}
