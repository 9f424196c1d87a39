package com.protocolguide.application.billing;

import com.protocolguide.application.ports.BillingGateway;
import com.protocolguide.application.ports.BillingGatewayException;
import com.protocolguide.application.resilience.CircuitBreakerConfig;
import com.protocolguide.application.resilience.CircuitOpenException;
import com.protocolguide.application.resilience.CircuitState;
import com.protocolguide.application.resilience.FailureTracker;
import com.protocolguide.application.resilience.GuardedCall;
import com.protocolguide.saas.domain.model.BillingInterval;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuardedBillingGatewayTest {

    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean failing;

    private final BillingGateway provider = new BillingGateway() {
        @Override
        public String createCheckoutSession(UUID accountId, String customerEmail, BillingInterval interval) {
            calls.incrementAndGet();
            if (failing) throw new BillingGatewayException("provider unavailable", 503);
            return "https://checkout.example/" + accountId;
        }

        @Override
        public String createPortalSession(String billingCustomerId, String returnUrl) {
            calls.incrementAndGet();
            return "https://portal.example/" + billingCustomerId;
        }
    };

    private final GuardedCall guard = new GuardedCall(new FailureTracker(CircuitBreakerConfig.billing()));
    private final GuardedBillingGateway gateway = new GuardedBillingGateway(provider, guard);

    @Test
    void passesThroughWhileClosed() {
        assertThat(gateway.createPortalSession("cus_1", "https://app/return")).isEqualTo("https://portal.example/cus_1");
        assertThat(guard.tracker().getStats().totalSuccesses()).isEqualTo(1);
    }

    @Test
    void opensAfterRepeatedProviderFailuresAndStopsCalling() {
        failing = true;
        UUID account = UUID.randomUUID();
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> gateway.createCheckoutSession(account, null, BillingInterval.MONTHLY))
                    .isInstanceOf(BillingGatewayException.class);
        }

        assertThat(guard.tracker().getState()).isEqualTo(CircuitState.OPEN);
        assertThatThrownBy(() -> gateway.createCheckoutSession(account, null, BillingInterval.MONTHLY))
                .isInstanceOf(CircuitOpenException.class);
        assertThat(calls).hasValue(3);
    }
}
